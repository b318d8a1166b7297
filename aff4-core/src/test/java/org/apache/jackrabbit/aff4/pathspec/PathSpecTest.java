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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

public class PathSpecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void append() {
        PathSpec outer = PathSpec.of(PathType.OS, "/dev/sda");
        PathSpec nested = outer.append(PathType.TSK, "/etc/hosts");
        assertEquals(1, outer.size());
        assertEquals(2, nested.size());
        assertEquals(PathType.OS, nested.first().getPathType());
        assertEquals("/etc/hosts", nested.last().getPath());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeOffset() {
        PathSpec.segment(PathType.OS, "/dev/sda").offset(-1).build();
    }

    @Test
    public void json() throws Exception {
        PathSpec pathSpec = PathSpec.of(PathSpec.segment(PathType.OS, "/dev/sda").mountPoint("/").build())
                .append(PathSpec.segment(PathType.TSK, "/pagefile.sys").offset(1024).build());
        String json = mapper.writeValueAsString(pathSpec);
        assertTrue(json, json.startsWith("[{"));
        assertFalse(json, json.contains("streamName"));
        assertEquals(pathSpec, mapper.readValue(json, PathSpec.class));
    }
}
