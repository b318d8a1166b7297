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
import static org.apache.jackrabbit.aff4.api.Aff4Exception.STORE;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.apache.jackrabbit.aff4.api.Aff4Exception;
import org.apache.jackrabbit.aff4.api.Urn;
import org.apache.jackrabbit.aff4.commons.properties.SystemPropertySupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores attribute values keyed by (URN, attribute, timestamp) in a
 * {@link DocumentStore}, one document per URN.
 * <p>
 * Records are never changed or removed: writing an attribute adds a
 * version. All values of one batch are written with a single update
 * operation and therefore become visible together. Failures of the backend
 * are reported as {@link Aff4Exception} of type {@code Store}. No operation
 * is retried.
 */
public class VersionedAttributeStore {

    private static final Logger LOG = LoggerFactory.getLogger(VersionedAttributeStore.class);

    /**
     * The number of versions of one attribute above which a warning is
     * logged.
     */
    static final int DEFAULT_HISTORY_WARN_SIZE = SystemPropertySupplier
            .create("aff4.store.historyWarnSize", 1000)
            .loggingTo(LOG)
            .validateWith(value -> value > 0)
            .get();

    private final DocumentStore store;

    private final int historyWarnSize;

    /**
     * @return the history size above which a warning is logged, as
     *          configured with the {@code aff4.store.historyWarnSize} system
     *          property
     */
    public static int getDefaultHistoryWarnSize() {
        return DEFAULT_HISTORY_WARN_SIZE;
    }

    public VersionedAttributeStore(@Nonnull DocumentStore store) {
        this(store, DEFAULT_HISTORY_WARN_SIZE);
    }

    public VersionedAttributeStore(@Nonnull DocumentStore store, int historyWarnSize) {
        checkArgument(historyWarnSize > 0, "historyWarnSize must be positive: %s", historyWarnSize);
        this.store = checkNotNull(store);
        this.historyWarnSize = historyWarnSize;
    }

    /**
     * Writes a single attribute value.
     *
     * @param urn the object
     * @param attribute the attribute name
     * @param value the serialized value
     * @param timestamp the timestamp of the new version
     * @throws Aff4Exception if the backend failed
     */
    public void write(@Nonnull Urn urn, @Nonnull String attribute, @Nonnull String value, long timestamp)
            throws Aff4Exception {
        write(urn, ImmutableMap.of(attribute, value), timestamp);
    }

    /**
     * Writes a batch of attribute values with one timestamp. Either all
     * values of the batch become visible or none.
     *
     * @param urn the object
     * @param values the serialized values by attribute name
     * @param timestamp the timestamp of the new versions
     * @throws Aff4Exception if the backend failed
     */
    public void write(@Nonnull Urn urn, @Nonnull Map<String, String> values, long timestamp)
            throws Aff4Exception {
        if (values.isEmpty()) {
            return;
        }
        UpdateOp op = new UpdateOp(urn.toString(), timestamp);
        for (Map.Entry<String, String> e : values.entrySet()) {
            op.set(e.getKey(), e.getValue());
        }
        Document old;
        try {
            old = store.createOrUpdate(op);
        } catch (DocumentStoreException e) {
            throw storeFailure(1, "Failed to write " + values.keySet() + " of " + urn, e);
        }
        LOG.debug("Wrote {} of {} at {}", values.keySet(), urn, timestamp);
        if (old != null) {
            for (String attribute : values.keySet()) {
                int size = old.getValueMap(attribute).size() + 1;
                if (size == historyWarnSize + 1) {
                    LOG.warn("Attribute {} of {} has more than {} versions", attribute, urn, historyWarnSize);
                }
            }
        }
    }

    /**
     * Reads the version of an attribute valid at the given time.
     *
     * @param urn the object
     * @param attribute the attribute name
     * @param asOf the latest timestamp to consider
     * @return the record with the highest timestamp not after {@code asOf},
     *          or null if there is none
     * @throws Aff4Exception if the backend failed
     */
    @CheckForNull
    public AttributeRecord read(@Nonnull Urn urn, @Nonnull String attribute, long asOf)
            throws Aff4Exception {
        Document doc = find(urn);
        if (doc == null) {
            return null;
        }
        Map.Entry<Long, String> e = doc.getValueMap(attribute).floorEntry(asOf);
        if (e == null) {
            return null;
        }
        return new AttributeRecord(urn, attribute, e.getKey(), e.getValue());
    }

    /**
     * Reads all versions of an attribute.
     *
     * @param urn the object
     * @param attribute the attribute name
     * @return the records, ordered by ascending timestamp
     * @throws Aff4Exception if the backend failed
     */
    @Nonnull
    public List<AttributeRecord> readAll(@Nonnull Urn urn, @Nonnull String attribute)
            throws Aff4Exception {
        Document doc = find(urn);
        if (doc == null) {
            return Collections.emptyList();
        }
        return toRecords(urn, attribute, doc.getValueMap(attribute));
    }

    /**
     * Reads the snapshot of an object: for each attribute the version valid
     * at the given time.
     *
     * @param urn the object
     * @param asOf the latest timestamp to consider
     * @return the records by attribute name, empty if the object does not
     *          exist
     * @throws Aff4Exception if the backend failed
     */
    @Nonnull
    public Map<String, AttributeRecord> readLatest(@Nonnull Urn urn, long asOf) throws Aff4Exception {
        Document doc = find(urn);
        Map<String, AttributeRecord> snapshot = Maps.newTreeMap();
        if (doc == null) {
            return snapshot;
        }
        for (String attribute : doc.getAttributeNames()) {
            Map.Entry<Long, String> e = doc.getValueMap(attribute).floorEntry(asOf);
            if (e != null) {
                snapshot.put(attribute, new AttributeRecord(urn, attribute, e.getKey(), e.getValue()));
            }
        }
        return snapshot;
    }

    /**
     * Reads all versions of all attributes of an object up to the given time.
     *
     * @param urn the object
     * @param asOf the latest timestamp to consider
     * @return the records by attribute name, each list ordered by ascending
     *          timestamp
     * @throws Aff4Exception if the backend failed
     */
    @Nonnull
    public Map<String, List<AttributeRecord>> readHistory(@Nonnull Urn urn, long asOf) throws Aff4Exception {
        Document doc = find(urn);
        Map<String, List<AttributeRecord>> history = Maps.newTreeMap();
        if (doc == null) {
            return history;
        }
        for (String attribute : doc.getAttributeNames()) {
            NavigableMap<Long, String> values = doc.getValueMap(attribute).headMap(asOf, true);
            if (!values.isEmpty()) {
                history.put(attribute, toRecords(urn, attribute, values));
            }
        }
        return history;
    }

    /**
     * @param urn the object
     * @return whether at least one attribute of the object was written
     * @throws Aff4Exception if the backend failed
     */
    public boolean exists(@Nonnull Urn urn) throws Aff4Exception {
        return find(urn) != null;
    }

    /**
     * Lists the direct children of an object. A child is listed when it or
     * one of its descendants was written.
     *
     * @param urn the parent
     * @return the children, sorted
     * @throws Aff4Exception if the backend failed
     */
    @Nonnull
    public List<Urn> listChildren(@Nonnull Urn urn) throws Aff4Exception {
        String prefix = urn.isRoot() ? urn.toString() : urn.toString() + '/';
        // '0' is the character after '/'
        String toKey = prefix.substring(0, prefix.length() - 1) + '0';
        List<Document> docs;
        try {
            docs = store.query(prefix, toKey, Integer.MAX_VALUE);
        } catch (DocumentStoreException e) {
            throw storeFailure(3, "Failed to list children of " + urn, e);
        }
        Set<String> names = Sets.newLinkedHashSet();
        for (Document doc : docs) {
            String relative = doc.getId().substring(prefix.length());
            int pos = relative.indexOf('/');
            names.add(pos < 0 ? relative : relative.substring(0, pos));
        }
        List<Urn> children = Lists.newArrayList();
        for (String name : names) {
            children.add(Urn.parse(prefix + name));
        }
        Collections.sort(children);
        return children;
    }

    @CheckForNull
    private Document find(Urn urn) throws Aff4Exception {
        try {
            return store.find(urn.toString());
        } catch (DocumentStoreException e) {
            throw storeFailure(2, "Failed to read " + urn, e);
        }
    }

    private static List<AttributeRecord> toRecords(Urn urn, String attribute, NavigableMap<Long, String> values) {
        List<AttributeRecord> records = Lists.newArrayListWithCapacity(values.size());
        for (Map.Entry<Long, String> e : values.entrySet()) {
            records.add(new AttributeRecord(urn, attribute, e.getKey(), e.getValue()));
        }
        return records;
    }

    private static Aff4Exception storeFailure(int code, String message, DocumentStoreException e) {
        LOG.warn("{}: {}", message, e.getMessage());
        return new Aff4Exception(STORE, code, message, e);
    }
}
