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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import javax.annotation.Nonnull;

/**
 * An update operation for one document: a set of attribute values written
 * with a single timestamp. A {@link DocumentStore} applies an update
 * operation atomically.
 */
public final class UpdateOp {

    private final String key;

    private final long timestamp;

    private final Map<String, String> changes = new TreeMap<String, String>();

    /**
     * @param key the key of the document
     * @param timestamp the timestamp of all values of this operation
     */
    public UpdateOp(@Nonnull String key, long timestamp) {
        checkArgument(timestamp >= 0, "Negative timestamp: %s", timestamp);
        this.key = checkNotNull(key);
        this.timestamp = timestamp;
    }

    /**
     * Set the attribute. Setting an attribute twice keeps the last value.
     *
     * @param attribute the attribute name
     * @param value the serialized value
     * @return this
     */
    public UpdateOp set(@Nonnull String attribute, @Nonnull String value) {
        changes.put(checkNotNull(attribute), checkNotNull(value));
        return this;
    }

    @Nonnull
    public String getKey() {
        return key;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * @return the changes, sorted by attribute name
     */
    @Nonnull
    public Map<String, String> getChanges() {
        return Collections.unmodifiableMap(changes);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Override
    public String toString() {
        return "key: " + key + " @" + timestamp + " " + changes.keySet();
    }
}
