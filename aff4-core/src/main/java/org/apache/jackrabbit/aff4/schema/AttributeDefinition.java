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
package org.apache.jackrabbit.aff4.schema;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

/**
 * A typed, named slot on an object kind. Every write of the attribute
 * creates a new timestamped version.
 * <p>
 * A definition is immutable; the {@code with*} methods return modified
 * copies.
 *
 * @param <T> the Java type of the values
 */
public final class AttributeDefinition<T> {

    private final String name;

    private final ValueType<T> type;

    private final Multiplicity multiplicity;

    @Nullable
    private final ValueType<?> elementType;

    @Nullable
    private final T defaultValue;

    @Nullable
    private final String derivedFrom;

    private final String description;

    private AttributeDefinition(String name, ValueType<T> type, Multiplicity multiplicity,
                                @Nullable ValueType<?> elementType, @Nullable T defaultValue,
                                @Nullable String derivedFrom, String description) {
        checkArgument(!name.isEmpty(), "Empty attribute name");
        this.name = name;
        this.type = checkNotNull(type);
        this.multiplicity = multiplicity;
        this.elementType = elementType;
        this.defaultValue = defaultValue;
        this.derivedFrom = derivedFrom;
        this.description = description;
    }

    /**
     * Defines a single-valued attribute without default.
     *
     * @param name the attribute name, for example {@code aff4:stat}
     * @param type the value type
     * @return the definition
     */
    public static <T> AttributeDefinition<T> single(@Nonnull String name, @Nonnull ValueType<T> type) {
        return new AttributeDefinition<T>(checkNotNull(name), type, Multiplicity.SINGLE,
                null, null, null, "");
    }

    /**
     * Defines a multi-valued attribute. The default is the empty list.
     *
     * @param name the attribute name
     * @param elementType the type of the elements
     * @return the definition
     */
    public static <E> AttributeDefinition<List<E>> list(@Nonnull String name, @Nonnull ValueType<E> elementType) {
        return new AttributeDefinition<List<E>>(checkNotNull(name), ValueType.listOf(elementType),
                Multiplicity.LIST, elementType, ImmutableList.<E>of(), null, "");
    }

    public AttributeDefinition<T> withDefault(@Nullable T defaultValue) {
        return new AttributeDefinition<T>(name, type, multiplicity, elementType,
                defaultValue, derivedFrom, description);
    }

    /**
     * Marks this attribute as a change marker of another attribute. When a
     * flush writes a value of the source attribute that differs from its last
     * stored value, this attribute is set to the flush timestamp. Only
     * {@link ValueType#DATE} attributes can be derived.
     *
     * @param source the monitored attribute
     * @return the derived definition
     */
    public AttributeDefinition<T> withDerivedFrom(@Nonnull AttributeDefinition<?> source) {
        checkArgument(type == ValueType.DATE, "Derived attribute %s must be a DATE", name);
        checkArgument(!source.getName().equals(name), "Attribute %s cannot derive from itself", name);
        return new AttributeDefinition<T>(name, type, multiplicity, elementType,
                defaultValue, source.getName(), description);
    }

    public AttributeDefinition<T> withDescription(@Nonnull String description) {
        return new AttributeDefinition<T>(name, type, multiplicity, elementType,
                defaultValue, derivedFrom, checkNotNull(description));
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public ValueType<T> getType() {
        return type;
    }

    @Nonnull
    public Multiplicity getMultiplicity() {
        return multiplicity;
    }

    public boolean isList() {
        return multiplicity == Multiplicity.LIST;
    }

    /**
     * @return the element type of a list attribute, or null for a single
     *          valued attribute
     */
    @CheckForNull
    public ValueType<?> getElementType() {
        return elementType;
    }

    @CheckForNull
    public T getDefaultValue() {
        return defaultValue;
    }

    /**
     * @return the name of the attribute this one is derived from, or null
     */
    @CheckForNull
    public String getDerivedFrom() {
        return derivedFrom;
    }

    public boolean isDerived() {
        return derivedFrom != null;
    }

    @Nonnull
    public String getDescription() {
        return description;
    }

    /**
     * Casts a value of unknown type.
     *
     * @param value the value
     * @return the value, typed
     * @throws ClassCastException if the value is not of this attribute's type
     */
    @SuppressWarnings("unchecked")
    public T cast(Object value) {
        if (!type.isInstance(value)) {
            throw new ClassCastException("Attribute " + name + " expects " + type
                    + " but got " + (value == null ? "null" : value.getClass().getName()));
        }
        return (T) value;
    }

    @Override
    public String toString() {
        return name + " (" + type + ")";
    }
}
