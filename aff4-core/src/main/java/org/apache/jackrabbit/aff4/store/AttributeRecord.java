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

import javax.annotation.Nonnull;

import com.google.common.base.Objects;
import org.apache.jackrabbit.aff4.api.Urn;

/**
 * One stored version of an attribute: the value an attribute of an object
 * had from a given timestamp on. Records are immutable.
 */
public final class AttributeRecord {

    private final Urn urn;

    private final String name;

    private final long timestamp;

    private final String value;

    public AttributeRecord(@Nonnull Urn urn, @Nonnull String name, long timestamp, @Nonnull String value) {
        this.urn = checkNotNull(urn);
        this.name = checkNotNull(name);
        this.timestamp = timestamp;
        this.value = checkNotNull(value);
    }

    @Nonnull
    public Urn getUrn() {
        return urn;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * @return the serialized value
     */
    @Nonnull
    public String getValue() {
        return value;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(urn, name, timestamp, value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof AttributeRecord)) {
            return false;
        }
        AttributeRecord other = (AttributeRecord) obj;
        return timestamp == other.timestamp
                && urn.equals(other.urn)
                && name.equals(other.name)
                && value.equals(other.value);
    }

    @Override
    public String toString() {
        return urn + "[" + name + "@" + timestamp + "]=" + value;
    }
}
