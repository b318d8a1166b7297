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
package org.apache.jackrabbit.aff4.api;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.aff4.commons.UrnUtils;

/**
 * Canonical, case-sensitive, root-anchored identifier of a versioned
 * object, for example {@code aff4:/C.1234567812345678/fs/os/c/bin/bash}.
 * <p>
 * Instances are immutable and validated on construction, so a malformed
 * identifier never reaches the store.
 */
public final class Urn implements Comparable<Urn> {

    public static final Urn ROOT = new Urn(UrnUtils.ROOT);

    private final String value;

    private Urn(String value) {
        this.value = value;
    }

    /**
     * Parses a URN. A value without the {@code aff4:} scheme is anchored at
     * the root, so {@code parse("C.1")} equals {@code parse("aff4:/C.1")}.
     *
     * @param urn the textual form
     * @return the URN
     * @throws IllegalArgumentException if the value is malformed
     */
    @JsonCreator
    @Nonnull
    public static Urn parse(@Nonnull String urn) {
        return new Urn(UrnUtils.canonicalize(checkNotNull(urn)));
    }

    /**
     * Appends a relative path. See {@link UrnUtils#concat(String, String)}
     * for how separators at the boundary are treated.
     *
     * @param relative the relative path
     * @return the child URN
     */
    @Nonnull
    public Urn add(@Nonnull String relative) {
        return parse(UrnUtils.concat(value, checkNotNull(relative)));
    }

    @Nonnull
    public String getName() {
        return UrnUtils.getName(value);
    }

    @Nonnull
    public Urn getParent() {
        return isRoot() ? this : new Urn(UrnUtils.getParent(value));
    }

    /**
     * @return the first element of the URN, such as the client id
     */
    @Nonnull
    public String getRootId() {
        List<String> elements = getElements();
        return elements.isEmpty() ? "" : elements.get(0);
    }

    /**
     * @return the structural elements of this URN (empty for the root)
     */
    @Nonnull
    public List<String> getElements() {
        if (isRoot()) {
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(Splitter.on('/').split(value.substring(UrnUtils.ROOT.length())));
    }

    public int getDepth() {
        return UrnUtils.getDepth(value);
    }

    public boolean isRoot() {
        return UrnUtils.denotesRoot(value);
    }

    public boolean isAncestorOf(@Nonnull Urn other) {
        return UrnUtils.isAncestor(value, other.value);
    }

    /**
     * @param ancestor an ancestor of this URN
     * @return the path of this URN relative to the ancestor
     */
    @Nonnull
    public String relativeTo(@Nonnull Urn ancestor) {
        return UrnUtils.relativize(ancestor.value, value);
    }

    @Override
    public int compareTo(Urn o) {
        return value.compareTo(o.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof Urn)) {
            return false;
        }
        return value.equals(((Urn) obj).value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
