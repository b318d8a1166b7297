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

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.jackrabbit.aff4.objects.Aff4Object;
import org.apache.jackrabbit.aff4.objects.ObjectContext;

/**
 * A kind of object, such as a file or a client. A kind declares its
 * attributes, inherits all attributes of its parent kind and knows how to
 * instantiate the {@link Aff4Object} subclass representing it.
 * <p>
 * Kinds are validated when they are built: attribute names are unique
 * within the kind hierarchy and the source of every derived attribute is
 * an attribute of the kind.
 *
 * @param <T> the object class
 */
public final class ObjectKind<T extends Aff4Object> {

    private final String name;

    @Nullable
    private final ObjectKind<?> parent;

    private final Class<T> objectClass;

    private final Function<ObjectContext, T> constructor;

    private final Map<String, AttributeDefinition<?>> attributes;

    private ObjectKind(Builder<T> builder) {
        this.name = builder.name;
        this.parent = builder.parent;
        this.objectClass = builder.objectClass;
        this.constructor = builder.constructor;
        this.attributes = ImmutableMap.copyOf(builder.attributes);
    }

    public static <T extends Aff4Object> Builder<T> builder(@Nonnull String name,
                                                        @Nonnull Class<T> objectClass,
                                                        @Nonnull Function<ObjectContext, T> constructor) {
        return new Builder<T>(name, objectClass, constructor);
    }

    /**
     * @return the name stored in the type attribute of objects of this kind
     */
    @Nonnull
    public String getName() {
        return name;
    }

    @CheckForNull
    public ObjectKind<?> getParent() {
        return parent;
    }

    @Nonnull
    public Class<T> getObjectClass() {
        return objectClass;
    }

    /**
     * @return own and inherited attributes, inherited ones first
     */
    @Nonnull
    public Collection<AttributeDefinition<?>> getAttributes() {
        return attributes.values();
    }

    @CheckForNull
    public AttributeDefinition<?> getAttribute(String attributeName) {
        return attributes.get(attributeName);
    }

    /**
     * @param attribute a definition
     * @return whether the very same definition is declared by this kind or
     *          one of its ancestors
     */
    public boolean declares(AttributeDefinition<?> attribute) {
        return attributes.get(attribute.getName()) == attribute;
    }

    /**
     * @param other another kind
     * @return whether this kind is the other kind or derives from it
     */
    public boolean isA(ObjectKind<?> other) {
        for (ObjectKind<?> k = this; k != null; k = k.parent) {
            if (k == other) {
                return true;
            }
        }
        return false;
    }

    @Nonnull
    public T newInstance(@Nonnull ObjectContext context) {
        return checkNotNull(constructor.apply(context));
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder<T extends Aff4Object> {

        private final String name;

        private final Class<T> objectClass;

        private final Function<ObjectContext, T> constructor;

        private ObjectKind<?> parent;

        private final Map<String, AttributeDefinition<?>> attributes = Maps.newLinkedHashMap();

        private Builder(String name, Class<T> objectClass, Function<ObjectContext, T> constructor) {
            checkArgument(!checkNotNull(name).isEmpty(), "Empty kind name");
            this.name = name;
            this.objectClass = checkNotNull(objectClass);
            this.constructor = checkNotNull(constructor);
        }

        public Builder<T> extend(@Nonnull ObjectKind<?> parent) {
            checkArgument(parent.getObjectClass().isAssignableFrom(objectClass),
                    "%s is not a subclass of %s", objectClass.getName(), parent.getObjectClass().getName());
            checkArgument(attributes.isEmpty(), "Parent kind must be set before attributes");
            this.parent = parent;
            for (AttributeDefinition<?> a : parent.getAttributes()) {
                attributes.put(a.getName(), a);
            }
            return this;
        }

        public Builder<T> attribute(@Nonnull AttributeDefinition<?> attribute) {
            AttributeDefinition<?> existing = attributes.put(attribute.getName(), attribute);
            checkArgument(existing == null, "Duplicate attribute %s in kind %s", attribute.getName(), name);
            return this;
        }

        public ObjectKind<T> build() {
            for (AttributeDefinition<?> a : attributes.values()) {
                if (a.isDerived()) {
                    checkArgument(attributes.containsKey(a.getDerivedFrom()),
                            "Attribute %s of kind %s derives from unknown attribute %s",
                            a.getName(), name, a.getDerivedFrom());
                }
            }
            return new ObjectKind<T>(this);
        }
    }
}
