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
package org.apache.jackrabbit.aff4.flow;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nonnull;

import org.apache.jackrabbit.aff4.api.Urn;
import org.apache.jackrabbit.aff4.schema.ValueType;

/**
 * Identifies a background operation run by a {@link FlowRunner}, for example
 * {@code aff4:/C.1234567812345678/flows/W:1A2B3C}. The reference is opaque to
 * this package: it is only stored and handed back to the runner.
 */
public final class FlowReference {

    /**
     * Stores a reference as the text of its URN.
     */
    public static final ValueType<FlowReference> TYPE = new ValueType<FlowReference>("FlowReference", FlowReference.class) {
        @Override
        protected String encode(FlowReference value) {
            return value.urn.toString();
        }

        @Override
        protected FlowReference decode(String serialized) {
            return new FlowReference(Urn.parse(serialized));
        }
    };

    private final Urn urn;

    private FlowReference(Urn urn) {
        this.urn = urn;
    }

    @Nonnull
    public static FlowReference of(@Nonnull Urn urn) {
        return new FlowReference(checkNotNull(urn));
    }

    @Nonnull
    public Urn getUrn() {
        return urn;
    }

    @Override
    public int hashCode() {
        return urn.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof FlowReference)) {
            return false;
        }
        return urn.equals(((FlowReference) obj).urn);
    }

    @Override
    public String toString() {
        return urn.toString();
    }
}
