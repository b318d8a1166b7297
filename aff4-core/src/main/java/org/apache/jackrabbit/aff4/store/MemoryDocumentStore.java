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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Keeps all documents in memory.
 * <p>
 * Each document is guarded by its own monitor. Readers get a sealed copy,
 * so they never observe a partially applied update. When two updates write
 * the same attribute with the same timestamp, the one applied last wins.
 */
public class MemoryDocumentStore implements DocumentStore {

    /**
     * Key: the URN, value: all versions of all attributes of the object.
     */
    private final ConcurrentSkipListMap<String, Document> documents =
            new ConcurrentSkipListMap<String, Document>();

    @CheckForNull
    @Override
    public Document find(String key) {
        Document doc = documents.get(key);
        if (doc == null) {
            return null;
        }
        Document copy = sealedCopy(doc);
        // created, but the first update is not applied yet
        return copy.getAttributeNames().isEmpty() ? null : copy;
    }

    @Nonnull
    @Override
    public List<Document> query(String fromKey, String toKey, int limit) {
        List<Document> list = new ArrayList<Document>();
        if (fromKey.compareTo(toKey) >= 0) {
            return list;
        }
        for (Document doc : documents.subMap(fromKey, false, toKey, false).values()) {
            if (list.size() >= limit) {
                break;
            }
            Document copy = sealedCopy(doc);
            if (!copy.getAttributeNames().isEmpty()) {
                list.add(copy);
            }
        }
        return list;
    }

    @CheckForNull
    @Override
    public Document createOrUpdate(UpdateOp update) {
        Document doc = documents.get(update.getKey());
        boolean isNew = false;
        if (doc == null) {
            // for a new document, add it (without synchronization)
            Document created = new Document(update.getKey());
            doc = documents.putIfAbsent(update.getKey(), created);
            if (doc == null) {
                doc = created;
                isNew = true;
            }
        }
        synchronized (doc) {
            Document old = isNew ? null : sealedCopy(doc);
            applyChanges(doc, update);
            return old;
        }
    }

    /**
     * Apply the changes of an update operation to a document.
     *
     * @param target the document to change
     * @param update the changes
     */
    public static void applyChanges(Document target, UpdateOp update) {
        for (Map.Entry<String, String> e : update.getChanges().entrySet()) {
            target.put(e.getKey(), update.getTimestamp(), e.getValue());
        }
    }

    @Override
    public String toString() {
        StringBuilder buff = new StringBuilder();
        buff.append("Documents:\n");
        for (Document doc : documents.values()) {
            synchronized (doc) {
                buff.append(doc.format()).append('\n');
            }
        }
        return buff.toString();
    }

    @Override
    public void dispose() {
        documents.clear();
    }

    private static Document sealedCopy(Document doc) {
        Document copy;
        synchronized (doc) {
            copy = doc.copy();
        }
        copy.seal();
        return copy;
    }
}
