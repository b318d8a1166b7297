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

/**
 * How a path segment is interpreted on the client.
 */
public enum PathType {

    /**
     * A path handed to the operating system.
     */
    OS("os"),

    /**
     * A path inside a filesystem image parsed by a low-level filesystem
     * parser.
     */
    TSK("tsk"),

    REGISTRY("registry"),

    MEMORY("memory"),

    TMPFILE("temp");

    private final String tag;

    PathType(String tag) {
        this.tag = tag;
    }

    /**
     * @return the name of the subtree of {@code fs} paths of this type are
     *          mapped to
     */
    public String getTag() {
        return tag;
    }
}
