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
import static org.apache.jackrabbit.aff4.api.Aff4Exception.SCHEMA;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.jackrabbit.aff4.api.Aff4Exception;
import org.apache.jackrabbit.aff4.api.Age;
import org.apache.jackrabbit.aff4.api.Mode;
import org.apache.jackrabbit.aff4.api.Urn;
import org.apache.jackrabbit.aff4.schema.AttributeDefinition;
import org.apache.jackrabbit.aff4.schema.ObjectKind;
import org.apache.jackrabbit.aff4.schema.ValueType;
import org.apache.jackrabbit.aff4.store.AttributeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A handle to a versioned object.
 * <p>
 * A handle sees the attribute values that were stored when it was created
 * or opened, as of the time its {@link Age} selects, plus the values it
 * wrote itself. Values set on the handle are staged in a buffer and written
 * as one batch with a single timestamp on {@link #flush()} or
 * {@link #close()}. Handles are not thread safe.
 */
public class Aff4Object implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Aff4Object.class);

    /**
     * The name of the object's kind.
     */
    public static final AttributeDefinition<String> TYPE =
            AttributeDefinition.single("aff4:type", ValueType.STRING)
                    .withDescription("The kind of this object.");

    private final Aff4ObjectFactory factory;

    private final Urn urn;

    private final ObjectKind<?> kind;

    private final Mode mode;

    private final Age age;

    private final long openTime;

    /**
     * The persisted view: for each attribute the last record this handle
     * knows of.
     */
    private final Map<String, AttributeRecord> snapshot;

    private final Map<String, Object> staged = Maps.newLinkedHashMap();

    private boolean closed;

    public Aff4Object(@Nonnull ObjectContext context) {
        this.factory = context.factory;
        this.urn = context.urn;
        this.kind = context.kind;
        this.mode = context.mode;
        this.age = context.age;
        this.openTime = context.openTime;
        this.snapshot = Maps.newTreeMap();
        this.snapshot.putAll(context.snapshot);
    }

    @Nonnull
    public Urn getUrn() {
        return urn;
    }

    @Nonnull
    public ObjectKind<?> getKind() {
        return kind;
    }

    @Nonnull
    public Mode getMode() {
        return mode;
    }

    /**
     * @return the policy selecting which versions this handle sees
     */
    @Nonnull
    public Age getAgePolicy() {
        return age;
    }

    /**
     * @return the time this handle was created or opened
     */
    public long getAge() {
        return openTime;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stages a value. Staging the same attribute again replaces the staged
     * value. Byte arrays and lists are copied, so later changes by the
     * caller do not reach the staged value.
     * <p>
     * Passing an attribute of another kind is a programming error and fails
     * with an {@code IllegalArgumentException}. Attributes resolved by name
     * at runtime go through {@link #setValue(String, Object)}, which reports
     * the same condition as a {@code Schema} {@link Aff4Exception}.
     *
     * @param attribute an attribute of this object's kind
     * @param value the value
     * @throws IllegalStateException if the handle is read-only or closed
     * @throws IllegalArgumentException if the attribute does not belong to
     *          this object's kind
     */
    public <T> void set(@Nonnull AttributeDefinition<T> attribute, @Nonnull T value) {
        checkState(mode.isWritable(), "%s is opened read-only", urn);
        checkState(!closed, "%s is closed", urn);
        checkDeclared(attribute);
        staged.put(attribute.getName(), copy(checkNotNull(value)));
    }

    /**
     * Stages a value given by attribute name. The value is validated against
     * the attribute's type.
     *
     * @param name the attribute name
     * @param value the value
     * @throws Aff4Exception of type {@code Schema} if the kind has no such
     *          attribute or the value has the wrong type
     */
    public void setValue(@Nonnull String name, @Nonnull Object value) throws Aff4Exception {
        AttributeDefinition<?> attribute = factory.getSchemaRegistry().resolveAttribute(kind, name);
        if (!attribute.getType().isInstance(value)) {
            throw new Aff4Exception(SCHEMA, 3, "Attribute " + name + " expects " + attribute.getType()
                    + " but got " + value.getClass().getName());
        }
        setCast(attribute, value);
    }

    private <T> void setCast(AttributeDefinition<T> attribute, Object value) {
        set(attribute, attribute.cast(value));
    }

    /**
     * Stages a list that has the given element added to the current value.
     *
     * @param attribute a list attribute
     * @param element the element to append
     */
    public <E> void append(@Nonnull AttributeDefinition<List<E>> attribute, @Nonnull E element) {
        checkArgument(attribute.isList(), "%s is not a list attribute", attribute.getName());
        List<E> current = get(attribute);
        ImmutableList.Builder<E> values = ImmutableList.builder();
        if (current != null) {
            values.addAll(current);
        }
        List<E> appended = values.add(element).build();
        set(attribute, appended);
    }

    /**
     * Returns the staged value of an attribute, else the persisted value
     * visible to this handle, else the attribute's default. A staged byte
     * array is returned as a copy.
     *
     * @param attribute an attribute of this object's kind
     * @return the value or null if there is none
     * @throws IllegalArgumentException if the attribute does not belong to
     *          this object's kind, see {@link #getValue(String)} for the
     *          lookup by name
     */
    @CheckForNull
    public <T> T get(@Nonnull AttributeDefinition<T> attribute) {
        checkDeclared(attribute);
        Object value = staged.get(attribute.getName());
        if (value != null) {
            return attribute.cast(copy(value));
        }
        AttributeRecord record = snapshot.get(attribute.getName());
        if (record != null) {
            return attribute.getType().deserialize(record.getValue());
        }
        return attribute.getDefaultValue();
    }

    /**
     * Returns a value by attribute name.
     *
     * @param name the attribute name
     * @return the value or null if there is none
     * @throws Aff4Exception of type {@code Schema} if the kind has no such
     *          attribute
     */
    @CheckForNull
    public Object getValue(@Nonnull String name) throws Aff4Exception {
        return get(factory.getSchemaRegistry().resolveAttribute(kind, name));
    }

    /**
     * @param attribute an attribute of this object's kind
     * @return the persisted record visible to this handle, or null
     */
    @CheckForNull
    public AttributeRecord getRecord(@Nonnull AttributeDefinition<?> attribute) {
        checkDeclared(attribute);
        return snapshot.get(attribute.getName());
    }

    /**
     * @param attribute an attribute of this object's kind
     * @return the timestamp of the persisted value visible to this handle,
     *          or null if there is none
     */
    @CheckForNull
    public Long getTimestamp(@Nonnull AttributeDefinition<?> attribute) {
        AttributeRecord record = getRecord(attribute);
        return record == null ? null : record.getTimestamp();
    }

    /**
     * Returns the values of all attributes of this object that have a
     * staged or persisted value. Stored attributes the kind does not declare
     * are left out.
     *
     * @return the values by attribute name
     */
    @Nonnull
    public Map<String, Object> getAll() {
        Map<String, Object> values = Maps.newTreeMap();
        for (Map.Entry<String, AttributeRecord> e : snapshot.entrySet()) {
            AttributeDefinition<?> attribute = kind.getAttribute(e.getKey());
            if (attribute == null) {
                LOG.debug("Ignoring undeclared attribute {} of {}", e.getKey(), urn);
            } else {
                values.put(e.getKey(), attribute.getType().deserialize(e.getValue().getValue()));
            }
        }
        for (Map.Entry<String, Object> e : staged.entrySet()) {
            values.put(e.getKey(), copy(e.getValue()));
        }
        return ImmutableMap.copyOf(values);
    }

    /**
     * Reads the stored versions of an attribute as selected by this
     * handle's age: all versions for {@link Age#ALL_TIMES}, the versions up to
     * the given time for {@link Age#at(long)} and only the newest version for
     * {@link Age#NEWEST}.
     *
     * @param attribute an attribute of this object's kind
     * @return the records, ordered by ascending timestamp
     * @throws Aff4Exception if the store failed
     */
    @Nonnull
    public List<AttributeRecord> getHistory(@Nonnull AttributeDefinition<?> attribute) throws Aff4Exception {
        checkDeclared(attribute);
        List<AttributeRecord> records = factory.getStore().readAll(urn, attribute.getName());
        if (age.isNewest()) {
            return records.isEmpty()
                    ? Collections.<AttributeRecord>emptyList()
                    : ImmutableList.of(records.get(records.size() - 1));
        }
        ImmutableList.Builder<AttributeRecord> visible = ImmutableList.builder();
        for (AttributeRecord r : records) {
            if (r.getTimestamp() <= age.getAsOf()) {
                visible.add(r);
            }
        }
        return visible.build();
    }

    /**
     * Writes all staged values as one batch. The timestamp of the batch is
     * the current time of the factory's clock, moved past the timestamp of
     * any earlier write. A derived attribute is set to
     * that timestamp when the batch changes the value of its source
     * attribute. Nothing is written if no value is staged.
     *
     * @throws Aff4Exception if the store failed; the staged values are kept
     */
    public void flush() throws Aff4Exception {
        if (staged.isEmpty()) {
            return;
        }
        long timestamp = Aff4ObjectFactory.nextTimestamp(factory.getClock());
        Map<String, String> batch = Maps.newTreeMap();
        for (Map.Entry<String, Object> e : staged.entrySet()) {
            batch.put(e.getKey(), serialize(kind.getAttribute(e.getKey()), e.getValue()));
        }
        for (AttributeDefinition<?> attribute : kind.getAttributes()) {
            if (attribute.isDerived() && !staged.containsKey(attribute.getName())) {
                String source = attribute.getDerivedFrom();
                String value = batch.get(source);
                if (value != null && isChanged(source, value)) {
                    batch.put(attribute.getName(), ValueType.DATE.serialize(timestamp));
                }
            }
        }
        factory.getStore().write(urn, batch, timestamp);
        for (Map.Entry<String, String> e : batch.entrySet()) {
            snapshot.put(e.getKey(), new AttributeRecord(urn, e.getKey(), timestamp, e.getValue()));
        }
        staged.clear();
        LOG.debug("Flushed {} of {} at {}", batch.keySet(), urn, timestamp);
    }

    /**
     * Flushes and closes this handle. Closing a closed handle has no
     * effect. The handle is closed even if the flush fails.
     *
     * @throws Aff4Exception if the flush failed
     */
    @Override
    public void close() throws Aff4Exception {
        if (closed) {
            return;
        }
        try {
            flush();
        } finally {
            closed = true;
        }
    }

    @Override
    public String toString() {
        return kind + " " + urn;
    }

    @Nonnull
    protected Aff4ObjectFactory getFactory() {
        return factory;
    }

    /**
     * Makes a record written by another component visible to this handle.
     */
    void recordWritten(@Nonnull AttributeRecord record) {
        checkArgument(record.getUrn().equals(urn), "%s is not a record of %s", record, urn);
        snapshot.put(record.getName(), record);
    }

    private boolean isChanged(String attribute, String value) throws Aff4Exception {
        AttributeRecord last = factory.getStore().read(urn, attribute, Long.MAX_VALUE);
        return last == null || !last.getValue().equals(value);
    }

    private void checkDeclared(AttributeDefinition<?> attribute) {
        checkArgument(kind.declares(attribute), "Kind %s has no attribute %s", kind, attribute.getName());
    }

    private static Object copy(Object value) {
        if (value instanceof byte[]) {
            return ((byte[]) value).clone();
        } else if (value instanceof List && !(value instanceof ImmutableList)) {
            return ImmutableList.copyOf((List<?>) value);
        }
        return value;
    }

    private static <T> String serialize(AttributeDefinition<T> attribute, Object value) {
        return attribute.getType().serialize(attribute.cast(value));
    }
}
