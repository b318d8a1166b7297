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

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The interface for the backend storage for documents.
 * <p>
 * Atomicity is limited to a single document: an implementation must apply
 * the complete update operation to a document or none of it, and a
 * concurrent reader must either see all values of an update operation or
 * none of them. Concurrent update operations on the same document are
 * applied in some serial order chosen by the implementation. When two
 * update operations write the same attribute with the same timestamp, the
 * implementation decides which value is kept.
 * <p>
 * Failures to reach the backend are reported with a
 * {@link DocumentStoreException}.
 */
public interface DocumentStore {

    /**
     * Get the document with the given {@code key}.
     * <p>
     * The returned document is immutable.
     *
     * @param key the key
     * @return the document, or null if not found
     */
    @CheckForNull
    Document find(String key);

    /**
     * Get a list of documents where the key is greater than a start value and
     * less than an end value.
     * <p>
     * The returned documents are sorted by key and are immutable.
     *
     * @param fromKey the start value (excluding)
     * @param toKey the end value (excluding)
     * @param limit the maximum number of entries to return (starting with the lowest key)
     * @return the list (possibly empty)
     */
    @Nonnull
    List<Document> query(String fromKey, String toKey, int limit);

    /**
     * Create or update a document. All changes of the update operation are
     * applied atomically.
     *
     * @param update the update operation
     * @return the old document, or null if the document did not exist
     * @throws DocumentStoreException if the operation failed
     */
    @CheckForNull
    Document createOrUpdate(UpdateOp update) throws DocumentStoreException;

    /**
     * Dispose this instance.
     */
    void dispose();

}
