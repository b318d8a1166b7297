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
package org.apache.jackrabbit.aff4.store;

/**
 * Thrown by a {@link DocumentStore} when the backend cannot be reached or an
 * operation fails.
 */
public class DocumentStoreException extends RuntimeException {

    private static final long serialVersionUID = 634546491941234578L;

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(Throwable cause) {
        super(getMessage(cause), cause);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Converts the given {@code Throwable} into a
     * {@code DocumentStoreException}. If the {@code Throwable} is an instance
     * of {@code DocumentStoreException} it is returned as is, otherwise a new
     * {@code DocumentStoreException} is created and the {@code Throwable} is
     * set as its cause.
     *
     * @param t a {@code Throwable}.
     * @return a {@code DocumentStoreException}.
     */
    public static DocumentStoreException convert(Throwable t) {
        if (t instanceof DocumentStoreException) {
            return (DocumentStoreException) t;
        }
        return new DocumentStoreException(t);
    }

    private static String getMessage(Throwable t) {
        return t == null ? null : t.getMessage();
    }
}
