/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.aff4.pathspec;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.apache.jackrabbit.aff4.api.Urn;
import org.junit.Test;

public class PathSpecUrnMapperTest {

    private static final String CLIENT = "C.1234567812345678";

    private static final String VOLUME = "\\\\.\\Volume{1234}\\";

    @Test
    public void rawDeviceWithFilesystem() {
        PathSpec pathSpec = PathSpec.of(PathSpec.segment(PathType.OS, VOLUME).mountPoint("/c:/").build())
                .append(PathType.TSK, "/windows");
        assertEquals(Urn.parse("aff4:/C.1234567812345678/fs/tsk/\\\\.\\Volume{1234}\\/windows"),
                PathSpecUrnMapper.toUrn(pathSpec, CLIENT));
    }

    @Test
    public void alternateDataStream() {
        PathSpec pathSpec = PathSpec.of(PathSpec.segment(PathType.OS, VOLUME).mountPoint("/c:/").build())
                .append(PathType.TSK, "/Test Directory/notes.txt:ads");
        assertEquals("aff4:/C.1234567812345678/fs/tsk/\\\\.\\Volume{1234}\\/Test Directory/notes.txt:ads",
                PathSpecUrnMapper.toUrn(pathSpec, CLIENT).toString());
    }

    @Test
    public void osPath() {
        PathSpec pathSpec = PathSpec.of(PathType.OS, "/c/bin/bash");
        assertEquals("aff4:/C.1234567812345678/fs/os/c/bin/bash",
                PathSpecUrnMapper.toUrn(pathSpec, Urn.parse(CLIENT)).toString());
    }

    @Test
    public void registryPath() {
        PathSpec pathSpec = PathSpec.of(PathType.REGISTRY, "HKEY_LOCAL_MACHINE/SOFTWARE");
        assertEquals("aff4:/C.1234567812345678/fs/registry/HKEY_LOCAL_MACHINE/SOFTWARE",
                PathSpecUrnMapper.toUrn(pathSpec, CLIENT).toString());
    }

    @Test
    public void mountPointIsStripped() {
        PathSpec pathSpec = PathSpec.of(PathSpec.segment(PathType.OS, "/mnt/data/etc/passwd")
                .mountPoint("/mnt/data").build());
        assertEquals("aff4:/C.1234567812345678/fs/os/etc/passwd",
                PathSpecUrnMapper.toUrn(pathSpec, CLIENT).toString());
    }

    @Test
    public void mountPointEqualToPath() {
        PathSpec pathSpec = PathSpec.of(PathSpec.segment(PathType.OS, "/mnt/data")
                .mountPoint("/mnt/data").build());
        assertEquals("aff4:/C.1234567812345678/fs/os/",
                PathSpecUrnMapper.toUrn(pathSpec, CLIENT).toString());
    }

    @Test
    public void offsetAndStreamName() {
        PathSpec pathSpec = PathSpec.of(PathType.OS, "/dev/sda")
                .append(PathSpec.segment(PathType.TSK, "/file.txt").offset(63 * 512).streamName("Zone.Identifier").build());
        assertEquals("aff4:/C.1234567812345678/fs/tsk/dev/sda/file.txt:63:Zone.Identifier",
                PathSpecUrnMapper.toUrn(pathSpec, CLIENT).toString());
    }

    @Test
    public void repeatedSeparatorsAreKept() {
        PathSpec pathSpec = PathSpec.of(PathType.OS, "//server//share");
        assertEquals("aff4:/C.1234567812345678/fs/os//server//share",
                PathSpecUrnMapper.toUrn(pathSpec, CLIENT).toString());
    }

    @Test
    public void leadingSeparatorIsAbsorbedByJoin() {
        assertEquals(PathSpecUrnMapper.toUrn(PathSpec.of(PathType.OS, "/etc"), CLIENT),
                PathSpecUrnMapper.toUrn(PathSpec.of(PathType.OS, "etc"), CLIENT));
    }

    @Test
    public void offsetIsTruncatedToSectors() {
        PathSpec first = PathSpec.of(PathType.OS, "/dev/sda")
                .append(PathSpec.segment(PathType.TSK, "/file.txt").offset(0L).build());
        PathSpec last = PathSpec.of(PathType.OS, "/dev/sda")
                .append(PathSpec.segment(PathType.TSK, "/file.txt").offset(511L).build());
        assertEquals("aff4:/C.1234567812345678/fs/tsk/dev/sda/file.txt:0",
                PathSpecUrnMapper.toUrn(first, CLIENT).toString());
        assertEquals(PathSpecUrnMapper.toUrn(first, CLIENT), PathSpecUrnMapper.toUrn(last, CLIENT));
    }

    @Test
    public void deterministic() {
        PathSpec a = PathSpec.of(PathType.OS, "/c/windows").append(PathType.TSK, "/system32");
        PathSpec b = PathSpec.of(PathType.OS, "/c/windows").append(PathType.TSK, "/system32");
        assertEquals(PathSpecUrnMapper.toUrn(a, CLIENT), PathSpecUrnMapper.toUrn(b, CLIENT));
        assertNotEquals(PathSpecUrnMapper.toUrn(a, CLIENT),
                PathSpecUrnMapper.toUrn(a, "C.0000000000000000"));
    }

    @Test
    public void tag() {
        assertEquals("os", PathSpecUrnMapper.getTag(PathSpec.of(PathType.OS, "/")));
        assertEquals("tsk", PathSpecUrnMapper.getTag(
                PathSpec.of(PathType.OS, "/dev/sda").append(PathType.TSK, "/")));
        assertEquals("os", PathSpecUrnMapper.getTag(
                PathSpec.of(PathType.OS, "/").append(PathType.REGISTRY, "/")));
        assertEquals("temp", PathSpecUrnMapper.getTag(PathSpec.of(PathType.TMPFILE, "/tmp1")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidClientId() {
        PathSpecUrnMapper.toUrn(PathSpec.of(PathType.OS, "/"), "http://example.com");
    }
}
