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
import static org.apache.jackrabbit.aff4.api.Aff4Exception.SCHEMA;

import java.util.Collection;
import java.util.Map;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.jackrabbit.aff4.api.Aff4Exception;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of object kinds known to an object factory, mapping (kind,
 * attribute name) to the typed attribute definition.
 * <p>
 * A registry is built once, validated while it is built and then passed to
 * the components that need it. It is immutable and thread safe.
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, ObjectKind<?>> kinds;

    private SchemaRegistry(Map<String, ObjectKind<?>> kinds) {
        this.kinds = ImmutableMap.copyOf(kinds);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param name the kind name
     * @return the kind, or null if no kind of that name is registered
     */
    @CheckForNull
    public ObjectKind<?> getKind(String name) {
        return kinds.get(name);
    }

    /**
     * Looks up a kind by the name stored in an object's type attribute.
     *
     * @param name the kind name
     * @return the kind
     * @throws Aff4Exception of type {@code Schema} if the kind is unknown
     */
    @Nonnull
    public ObjectKind<?> resolveKind(String name) throws Aff4Exception {
        ObjectKind<?> kind = kinds.get(name);
        if (kind == null) {
            throw new Aff4Exception(SCHEMA, 1, "Unknown object kind: " + name);
        }
        return kind;
    }

    /**
     * Looks up an attribute of a kind by name.
     *
     * @param kind a registered kind
     * @param attributeName the attribute name
     * @return the attribute definition
     * @throws Aff4Exception of type {@code Schema} if the kind does not have
     *          such an attribute
     */
    @Nonnull
    public AttributeDefinition<?> resolveAttribute(ObjectKind<?> kind, String attributeName)
            throws Aff4Exception {
        checkArgument(contains(kind), "Kind %s is not registered", kind);
        AttributeDefinition<?> attribute = kind.getAttribute(attributeName);
        if (attribute == null) {
            throw new Aff4Exception(SCHEMA, 2,
                    "Unknown attribute " + attributeName + " for kind " + kind.getName());
        }
        return attribute;
    }

    public boolean contains(ObjectKind<?> kind) {
        return kinds.get(kind.getName()) == kind;
    }

    @Nonnull
    public Collection<ObjectKind<?>> getKinds() {
        return kinds.values();
    }

    @Override
    public String toString() {
        return "SchemaRegistry" + kinds.keySet();
    }

    public static final class Builder {

        private final Map<String, ObjectKind<?>> kinds = Maps.newLinkedHashMap();

        private Builder() {
        }

        /**
         * Registers a kind together with its ancestors.
         *
         * @param kind the kind
         * @return this builder
         * @throws IllegalArgumentException if a different kind with the same
         *          name is already registered
         */
        public Builder register(@Nonnull ObjectKind<?> kind) {
            checkNotNull(kind);
            if (kind.getParent() != null) {
                register(kind.getParent());
            }
            ObjectKind<?> existing = kinds.get(kind.getName());
            if (existing == null) {
                kinds.put(kind.getName(), kind);
            } else {
                checkArgument(existing == kind, "Kind %s registered twice", kind.getName());
            }
            return this;
        }

        public SchemaRegistry build() {
            SchemaRegistry registry = new SchemaRegistry(kinds);
            LOG.debug("Built {}", registry);
            return registry;
        }
    }
}
