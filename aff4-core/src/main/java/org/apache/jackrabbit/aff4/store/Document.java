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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import javax.annotation.Nonnull;

import com.google.common.collect.Maps;

/**
 * A document holds all stored versions of all attributes of one object.
 * The key of the document is the object's URN. For each attribute the
 * document keeps a value map from timestamp to serialized value, sorted by
 * ascending timestamp.
 */
public class Document {

    private final String id;

    private Map<String, NavigableMap<Long, String>> data = new TreeMap<String, NavigableMap<Long, String>>();

    private boolean sealed;

    public Document(@Nonnull String id) {
        this.id = checkNotNull(id);
    }

    /**
     * @return the key of this document
     */
    @Nonnull
    public String getId() {
        return id;
    }

    /**
     * @return the names of all attributes with at least one version
     */
    @Nonnull
    public Set<String> getAttributeNames() {
        return data.keySet();
    }

    /**
     * Returns the versions of an attribute.
     *
     * @param attribute the attribute name
     * @return the map of timestamp to serialized value, possibly empty
     */
    @Nonnull
    public NavigableMap<Long, String> getValueMap(String attribute) {
        NavigableMap<Long, String> values = data.get(attribute);
        if (values == null) {
            return Collections.emptyNavigableMap();
        }
        return values;
    }

    /**
     * Adds a version. An existing version with the same timestamp is
     * replaced.
     *
     * @param attribute the attribute name
     * @param timestamp the timestamp of the version
     * @param value the serialized value
     * @return the replaced value or null
     */
    String put(String attribute, long timestamp, String value) {
        checkState(!sealed, "Document %s is sealed", id);
        NavigableMap<Long, String> values = data.get(attribute);
        if (values == null) {
            values = new TreeMap<Long, String>();
            data.put(attribute, values);
        }
        return values.put(timestamp, checkNotNull(value));
    }

    /**
     * Seals this document and turns it into an immutable object. Any attempt
     * to modify this document afterwards will result in an exception.
     */
    public void seal() {
        if (!sealed) {
            sealed = true;
            Map<String, NavigableMap<Long, String>> copy = new TreeMap<String, NavigableMap<Long, String>>();
            for (Map.Entry<String, NavigableMap<Long, String>> e : data.entrySet()) {
                copy.put(e.getKey(), Maps.unmodifiableNavigableMap(e.getValue()));
            }
            data = Collections.unmodifiableMap(copy);
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * @return an unsealed deep copy of this document
     */
    @Nonnull
    public Document copy() {
        Document target = new Document(id);
        for (Map.Entry<String, NavigableMap<Long, String>> e : data.entrySet()) {
            target.data.put(e.getKey(), new TreeMap<Long, String>(e.getValue()));
        }
        return target;
    }

    /**
     * Formats this document for use in a log message.
     *
     * @return the formatted string
     */
    public String format() {
        StringBuilder buff = new StringBuilder(id).append(" {");
        for (Map.Entry<String, NavigableMap<Long, String>> e : data.entrySet()) {
            buff.append("\n  ").append(e.getKey()).append('=').append(e.getValue());
        }
        return buff.append("\n}").toString();
    }

    @Override
    public String toString() {
        return id;
    }
}
