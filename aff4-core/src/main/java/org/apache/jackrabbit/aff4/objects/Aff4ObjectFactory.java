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
package org.apache.jackrabbit.aff4.objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static org.apache.jackrabbit.aff4.api.Aff4Exception.NOT_FOUND;
import static org.apache.jackrabbit.aff4.api.Aff4Exception.SCHEMA;
import static org.apache.jackrabbit.aff4.api.Aff4Exception.STORE;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableMap;
import org.apache.jackrabbit.aff4.api.Aff4Exception;
import org.apache.jackrabbit.aff4.api.Age;
import org.apache.jackrabbit.aff4.api.Mode;
import org.apache.jackrabbit.aff4.api.Urn;
import org.apache.jackrabbit.aff4.commons.properties.SystemPropertySupplier;
import org.apache.jackrabbit.aff4.flow.FlowRunner;
import org.apache.jackrabbit.aff4.schema.ObjectKind;
import org.apache.jackrabbit.aff4.schema.SchemaRegistry;
import org.apache.jackrabbit.aff4.stats.Clock;
import org.apache.jackrabbit.aff4.store.AttributeRecord;
import org.apache.jackrabbit.aff4.store.DocumentStore;
import org.apache.jackrabbit.aff4.store.MemoryDocumentStore;
import org.apache.jackrabbit.aff4.store.VersionedAttributeStore;
import org.apache.jackrabbit.aff4.store.util.LoggingDocumentStoreWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and opens {@link Aff4Object} handles.
 * <p>
 * A factory is configured with a {@link Builder}; the store, the schema, the
 * clock and the flow runner are injected there rather than looked up
 * globally. A factory is thread safe, the handles it returns are not.
 */
public class Aff4ObjectFactory {

    private static final Logger LOG = LoggerFactory.getLogger(Aff4ObjectFactory.class);

    /**
     * The flow started to collect the content of a file.
     */
    static final String DEFAULT_FLOW_NAME = SystemPropertySupplier
            .create("aff4.contentLock.flowName", "MultiGetFile")
            .loggingTo(LOG)
            .validateWith(name -> !name.isEmpty())
            .get();

    /**
     * Whether calls to the document store are logged.
     */
    static final boolean DEFAULT_LOGGING = SystemPropertySupplier
            .create("aff4.store.debug", false)
            .loggingTo(LOG)
            .get();

    private final DocumentStore documentStore;

    private final VersionedAttributeStore store;

    private final SchemaRegistry schemaRegistry;

    private final Clock clock;

    private final ContentLockCoordinator contentLockCoordinator;

    Aff4ObjectFactory(Builder builder) {
        DocumentStore ds = builder.getDocumentStore();
        if (builder.logging) {
            ds = new LoggingDocumentStoreWrapper(ds);
        }
        this.documentStore = ds;
        this.store = new VersionedAttributeStore(ds, builder.historyWarnSize);
        this.schemaRegistry = builder.getSchemaRegistry();
        this.clock = builder.clock;
        this.contentLockCoordinator = builder.flowRunner == null ? null
                : new ContentLockCoordinator(store, builder.flowRunner, clock, builder.flowName);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a handle for a new version of an object. No existing state is
     * loaded and nothing is checked against the store. The type attribute
     * is staged, so the object exists once the handle is flushed.
     *
     * @param urn the object
     * @param kind the kind of the object
     * @param mode a writable mode
     * @return the handle
     */
    @Nonnull
    public <T extends Aff4Object> T create(@Nonnull Urn urn, @Nonnull ObjectKind<T> kind, @Nonnull Mode mode) {
        return create(urn, kind, mode, Age.NEWEST);
    }

    @Nonnull
    public <T extends Aff4Object> T create(@Nonnull Urn urn, @Nonnull ObjectKind<T> kind,
                                           @Nonnull Mode mode, @Nonnull Age age) {
        checkNotNull(urn);
        checkArgument(mode.isWritable(), "Cannot create %s in mode %s", urn, mode);
        checkRegistered(kind);
        T object = kind.newInstance(new ObjectContext(this, urn, kind, mode, checkNotNull(age),
                clock.getTime(), Collections.<String, AttributeRecord>emptyMap()));
        object.set(Aff4Object.TYPE, kind.getName());
        LOG.debug("Created {}", object);
        return object;
    }

    /**
     * Opens the newest state of an existing object.
     *
     * @param urn the object
     * @param kind the expected kind; the stored kind must be this kind or
     *             derive from it
     * @param mode the mode
     * @return the handle
     * @throws Aff4Exception of type {@code NotFound} if the object does not
     *          exist, of type {@code Schema} if it has another kind
     */
    @Nonnull
    public <T extends Aff4Object> T open(@Nonnull Urn urn, @Nonnull ObjectKind<T> kind, @Nonnull Mode mode)
            throws Aff4Exception {
        return open(urn, kind, mode, Age.NEWEST);
    }

    @Nonnull
    public <T extends Aff4Object> T open(@Nonnull Urn urn, @Nonnull ObjectKind<T> kind,
                                         @Nonnull Mode mode, @Nonnull Age age) throws Aff4Exception {
        checkRegistered(kind);
        ObjectKind<?> stored = getStoredKind(urn, kind);
        if (!stored.isA(kind)) {
            throw new Aff4Exception(SCHEMA, 4, urn + " is a " + stored.getName() + ", not a " + kind.getName());
        }
        return kind.getObjectClass().cast(load(urn, stored, mode, age));
    }

    /**
     * Opens the newest state of an existing object read-only. The kind is
     * the one stored with the object.
     *
     * @param urn the object
     * @return the handle
     * @throws Aff4Exception of type {@code NotFound} if the object does not
     *          exist, of type {@code Schema} if its kind is unknown
     */
    @Nonnull
    public Aff4Object open(@Nonnull Urn urn) throws Aff4Exception {
        return open(urn, Aff4Kinds.AFF4_OBJECT, Mode.READ, Age.NEWEST);
    }

    /**
     * @param urn an object
     * @return the URNs of the direct children of the object
     * @throws Aff4Exception if the store failed
     */
    @Nonnull
    public List<Urn> listChildren(@Nonnull Urn urn) throws Aff4Exception {
        return store.listChildren(urn);
    }

    @Nonnull
    public SchemaRegistry getSchemaRegistry() {
        return schemaRegistry;
    }

    @Nonnull
    public Clock getClock() {
        return clock;
    }

    @Nonnull
    public DocumentStore getDocumentStore() {
        return documentStore;
    }

    @Nonnull
    VersionedAttributeStore getStore() {
        return store;
    }

    @Nonnull
    ContentLockCoordinator getContentLockCoordinator() {
        checkState(contentLockCoordinator != null, "No FlowRunner configured");
        return contentLockCoordinator;
    }

    public void dispose() {
        documentStore.dispose();
    }

    /**
     * Returns a write timestamp greater than any other the given clock
     * handed out, so that two writes never land on the same version.
     */
    static long nextTimestamp(Clock clock) throws Aff4Exception {
        try {
            return clock.getTimeIncreasing();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Aff4Exception(STORE, 4, "Interrupted while waiting for a write timestamp", e);
        }
    }

    private ObjectKind<?> getStoredKind(Urn urn, ObjectKind<?> requested) throws Aff4Exception {
        if (!store.exists(urn)) {
            throw new Aff4Exception(NOT_FOUND, 1, "No object at " + urn);
        }
        AttributeRecord type = store.read(urn, Aff4Object.TYPE.getName(), Long.MAX_VALUE);
        if (type == null) {
            LOG.debug("{} has no type, assuming {}", urn, requested);
            return requested;
        }
        return schemaRegistry.resolveKind(Aff4Object.TYPE.getType().deserialize(type.getValue()));
    }

    private Aff4Object load(Urn urn, ObjectKind<?> kind, Mode mode, Age age) throws Aff4Exception {
        long openTime = clock.getTime();
        Map<String, AttributeRecord> snapshot;
        if (mode.isReadable()) {
            snapshot = store.readLatest(urn, age.getAsOf());
        } else {
            snapshot = ImmutableMap.of();
        }
        Aff4Object object = kind.newInstance(new ObjectContext(this, urn, kind, mode, age, openTime, snapshot));
        LOG.debug("Opened {} with {} attributes", object, snapshot.size());
        return object;
    }

    private void checkRegistered(ObjectKind<?> kind) {
        checkArgument(schemaRegistry.contains(kind), "Kind %s is not registered", kind);
    }

    /**
     * A builder for an {@link Aff4ObjectFactory}.
     */
    public static class Builder {

        private DocumentStore documentStore;

        private SchemaRegistry schemaRegistry;

        private Clock clock = Clock.SIMPLE;

        private FlowRunner flowRunner;

        private String flowName = DEFAULT_FLOW_NAME;

        private boolean logging = DEFAULT_LOGGING;

        private int historyWarnSize = VersionedAttributeStore.getDefaultHistoryWarnSize();

        Builder() {
        }

        /**
         * Set the document store to use. By default an in-memory store is used.
         *
         * @param documentStore the document store
         * @return this
         */
        public Builder setDocumentStore(@Nonnull DocumentStore documentStore) {
            this.documentStore = checkNotNull(documentStore);
            return this;
        }

        public DocumentStore getDocumentStore() {
            if (documentStore == null) {
                documentStore = new MemoryDocumentStore();
            }
            return documentStore;
        }

        /**
         * Set the kinds known to the factory. By default the standard kinds of
         * {@link Aff4Kinds} are used.
         *
         * @param schemaRegistry the registry
         * @return this
         */
        public Builder setSchemaRegistry(@Nonnull SchemaRegistry schemaRegistry) {
            this.schemaRegistry = checkNotNull(schemaRegistry);
            return this;
        }

        public SchemaRegistry getSchemaRegistry() {
            if (schemaRegistry == null) {
                schemaRegistry = Aff4Kinds.newRegistry();
            }
            return schemaRegistry;
        }

        public Builder setClock(@Nonnull Clock clock) {
            this.clock = checkNotNull(clock);
            return this;
        }

        /**
         * Set the runner for content collection flows. Without a runner,
         * {@link VfsFile#update()} is not available.
         *
         * @param flowRunner the runner
         * @return this
         */
        public Builder setFlowRunner(@Nonnull FlowRunner flowRunner) {
            this.flowRunner = checkNotNull(flowRunner);
            return this;
        }

        public Builder setFlowName(@Nonnull String flowName) {
            checkArgument(!flowName.isEmpty(), "Empty flow name");
            this.flowName = flowName;
            return this;
        }

        /**
         * Log all calls to the document store at DEBUG level.
         *
         * @param logging whether to log
         * @return this
         */
        public Builder setLogging(boolean logging) {
            this.logging = logging;
            return this;
        }

        public Builder setHistoryWarnSize(int historyWarnSize) {
            checkArgument(historyWarnSize > 0, "historyWarnSize must be positive: %s", historyWarnSize);
            this.historyWarnSize = historyWarnSize;
            return this;
        }

        public Aff4ObjectFactory build() {
            return new Aff4ObjectFactory(this);
        }
    }
}
