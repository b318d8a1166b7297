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

import static java.lang.String.format;

/**
 * Main exception thrown by the object factory, the objects it hands out and
 * the attribute store, indicating that reading or committing attributes
 * failed. Each exception carries a type (for example {@link #NOT_FOUND})
 * and a type-specific numeric code.
 */
public class Aff4Exception extends Exception {

    /**
     * Source name for exceptions thrown by components in this project.
     */
    public static final String AFF4 = "AFF4";

    /**
     * Type name for opening an object that was never written.
     */
    public static final String NOT_FOUND = "NotFound";

    /**
     * Type name for unknown attributes, values of the wrong type and object
     * kind mismatches.
     */
    public static final String SCHEMA = "Schema";

    /**
     * Type name for failures to determine the state of a content lock.
     */
    public static final String LOCK = "Lock";

    /**
     * Type name for failures of the persistence backend.
     */
    public static final String STORE = "Store";

    private static final long serialVersionUID = -4436813302957340518L;

    private final String source;

    private final String type;

    private final int code;

    public Aff4Exception(
            String source, String type, int code, String message,
            Throwable cause) {
        super(format("%s%s%04d: %s", source, type, code, message), cause);
        this.source = source;
        this.type = type;
        this.code = code;
    }

    public Aff4Exception(
            String type, int code, String message, Throwable cause) {
        this(AFF4, type, code, message, cause);
    }

    public Aff4Exception(String type, int code, String message) {
        this(type, code, message, null);
    }

    /**
     * Checks whether this exception is of the given type.
     *
     * @param type type name
     * @return {@code true} iff this exception is of the given type
     */
    public boolean isOfType(String type) {
        return this.type.equals(type);
    }

    public boolean isNotFound() {
        return isOfType(NOT_FOUND);
    }

    public boolean isSchemaViolation() {
        return isOfType(SCHEMA);
    }

    /**
     * Whether repeating the failed call may succeed. This is the case for
     * backend and lock status failures, which are usually transient. No
     * component of this project retries on its own.
     *
     * @return {@code true} if the operation may be retried
     */
    public boolean isRetryable() {
        return isOfType(STORE) || isOfType(LOCK);
    }

    /**
     * Returns the name of the source of this exception.
     *
     * @return source name
     */
    public String getSource() {
        return source;
    }

    /**
     * Return the name of the type of this exception.
     *
     * @return type name
     */
    public String getType() {
        return type;
    }

    /**
     * Returns the type-specific error code of this exception.
     *
     * @return error code
     */
    public int getCode() {
        return code;
    }
}
