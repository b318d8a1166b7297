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
package org.apache.jackrabbit.aff4.api;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class UrnTest {

    @Test
    public void parse() {
        assertEquals("aff4:/C.1234", Urn.parse("C.1234").toString());
        assertEquals(Urn.parse("aff4:/C.1234"), Urn.parse("/C.1234"));
        assertTrue(Urn.parse("aff4:/").isRoot());
        assertEquals(Urn.ROOT, Urn.parse("aff4:/"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void otherScheme() {
        Urn.parse("http://example.com/C.1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void empty() {
        Urn.parse("");
    }

    @Test
    public void caseSensitive() {
        assertFalse(Urn.parse("C.1/fs/os/Bin").equals(Urn.parse("C.1/fs/os/bin")));
    }

    @Test
    public void structure() {
        Urn urn = Urn.parse("C.1234/fs/os/c/bin/bash");
        assertEquals("bash", urn.getName());
        assertEquals(Urn.parse("C.1234/fs/os/c/bin"), urn.getParent());
        assertEquals("C.1234", urn.getRootId());
        assertEquals(6, urn.getDepth());
        assertEquals(ImmutableList.of("C.1234", "fs", "os", "c", "bin", "bash"), urn.getElements());
        assertEquals("fs/os/c/bin/bash", urn.relativeTo(Urn.parse("C.1234")));
        assertTrue(Urn.parse("C.1234").isAncestorOf(urn));
        assertFalse(Urn.parse("C.123").isAncestorOf(urn));
        assertEquals(Urn.ROOT, Urn.parse("C.1234").getParent());
        assertEquals(Urn.ROOT, Urn.ROOT.getParent());
        assertEquals("", Urn.ROOT.getRootId());
    }

    @Test
    public void rawElements() {
        Urn urn = Urn.parse("C.1/fs/tsk").add("\\\\.\\Volume{1234}\\").add("/notes.txt:ads");
        assertEquals("aff4:/C.1/fs/tsk/\\\\.\\Volume{1234}\\/notes.txt:ads", urn.toString());
        assertEquals("notes.txt:ads", urn.getName());
    }

    @Test
    public void json() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Urn urn = Urn.parse("C.1/fs/os");
        assertEquals("\"aff4:/C.1/fs/os\"", mapper.writeValueAsString(urn));
        assertEquals(urn, mapper.readValue("\"aff4:/C.1/fs/os\"", Urn.class));
    }
}
