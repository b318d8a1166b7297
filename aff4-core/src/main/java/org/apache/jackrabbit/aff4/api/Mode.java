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

/**
 * The access mode of an object handle.
 */
public enum Mode {

    /**
     * Attributes can be read, {@code set} fails.
     */
    READ("r"),

    /**
     * Attributes can be read and staged.
     */
    READ_WRITE("rw"),

    /**
     * Attributes can be staged. No snapshot of the stored attributes is
     * loaded, so reads only see values staged or flushed through this
     * handle. Stored history is never erased.
     */
    WRITE("w");

    private final String shortName;

    Mode(String shortName) {
        this.shortName = shortName;
    }

    public boolean isReadable() {
        return this != WRITE;
    }

    public boolean isWritable() {
        return this != READ;
    }

    /**
     * @param shortName one of {@code r}, {@code rw} or {@code w}
     * @return the matching mode
     */
    public static Mode fromString(String shortName) {
        for (Mode m : values()) {
            if (m.shortName.equals(shortName)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown mode: " + shortName);
    }

    @Override
    public String toString() {
        return shortName;
    }
}
