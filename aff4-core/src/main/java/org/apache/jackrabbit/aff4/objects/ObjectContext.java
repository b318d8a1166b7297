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

import java.util.Map;

import org.apache.jackrabbit.aff4.api.Age;
import org.apache.jackrabbit.aff4.api.Mode;
import org.apache.jackrabbit.aff4.api.Urn;
import org.apache.jackrabbit.aff4.schema.ObjectKind;
import org.apache.jackrabbit.aff4.store.AttributeRecord;

/**
 * Everything an {@link Aff4Object} is constructed from. Instances are
 * created by the {@link Aff4ObjectFactory} only.
 */
public final class ObjectContext {

    final Aff4ObjectFactory factory;

    final Urn urn;

    final ObjectKind<?> kind;

    final Mode mode;

    final Age age;

    final long openTime;

    final Map<String, AttributeRecord> snapshot;

    ObjectContext(Aff4ObjectFactory factory, Urn urn, ObjectKind<?> kind, Mode mode, Age age,
                  long openTime, Map<String, AttributeRecord> snapshot) {
        this.factory = factory;
        this.urn = urn;
        this.kind = kind;
        this.mode = mode;
        this.age = age;
        this.openTime = openTime;
        this.snapshot = snapshot;
    }

    public Urn getUrn() {
        return urn;
    }

    public ObjectKind<?> getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind + " " + urn + " (" + mode + ")";
    }
}
