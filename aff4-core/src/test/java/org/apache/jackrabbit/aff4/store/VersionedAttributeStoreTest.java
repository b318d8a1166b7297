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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import ch.qos.logback.classic.Level;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.jackrabbit.aff4.api.Aff4Exception;
import org.apache.jackrabbit.aff4.api.Urn;
import org.apache.jackrabbit.aff4.junit.LogCustomizer;
import org.junit.Test;

public class VersionedAttributeStoreTest {

    private static final Urn URN = Urn.parse("C.1234567812345678");

    private final VersionedAttributeStore store = new VersionedAttributeStore(new MemoryDocumentStore());

    @Test
    public void readAllReturnsEveryVersionInOrder() throws Exception {
        for (int i = 1; i <= 10; i++) {
            store.write(URN, "metadata:hostname", "host" + i, i * 10);
        }
        List<AttributeRecord> records = store.readAll(URN, "metadata:hostname");
        assertEquals(10, records.size());
        for (int i = 0; i < records.size(); i++) {
            assertEquals((i + 1) * 10, records.get(i).getTimestamp());
            assertEquals("host" + (i + 1), records.get(i).getValue());
            assertEquals(URN, records.get(i).getUrn());
        }
    }

    @Test
    public void readAsOf() throws Exception {
        store.write(URN, "a", "v1", 10);
        store.write(URN, "a", "v2", 20);

        assertNull(store.read(URN, "a", 9));
        assertEquals("v1", store.read(URN, "a", 10).getValue());
        assertEquals("v1", store.read(URN, "a", 19).getValue());
        assertEquals("v2", store.read(URN, "a", Long.MAX_VALUE).getValue());
        assertNull(store.read(URN, "b", Long.MAX_VALUE));
        assertNull(store.read(Urn.parse("C.2"), "a", Long.MAX_VALUE));
    }

    @Test
    public void writesToOneAttributeDoNotTouchOthers() throws Exception {
        store.write(URN, "a", "a1", 1);
        store.write(URN, "b", "b1", 2);
        store.write(URN, "b", "b2", 3);
        assertEquals(ImmutableList.of(new AttributeRecord(URN, "a", 1, "a1")), store.readAll(URN, "a"));
    }

    @Test
    public void batchSharesOneTimestamp() throws Exception {
        store.write(URN, ImmutableMap.of("a", "1", "b", "2"), 42);
        Map<String, AttributeRecord> snapshot = store.readLatest(URN, Long.MAX_VALUE);
        assertEquals(2, snapshot.size());
        assertEquals(42, snapshot.get("a").getTimestamp());
        assertEquals(42, snapshot.get("b").getTimestamp());
    }

    @Test
    public void readLatestAsOf() throws Exception {
        store.write(URN, "a", "a1", 1);
        store.write(URN, "b", "b5", 5);
        store.write(URN, "a", "a9", 9);

        Map<String, AttributeRecord> snapshot = store.readLatest(URN, 5);
        assertEquals("a1", snapshot.get("a").getValue());
        assertEquals("b5", snapshot.get("b").getValue());

        snapshot = store.readLatest(URN, 2);
        assertEquals(1, snapshot.size());

        assertTrue(store.readLatest(Urn.parse("C.2"), Long.MAX_VALUE).isEmpty());
    }

    @Test
    public void readHistory() throws Exception {
        store.write(URN, "a", "a1", 1);
        store.write(URN, "a", "a2", 2);
        store.write(URN, "b", "b3", 3);

        Map<String, List<AttributeRecord>> history = store.readHistory(URN, 2);
        assertEquals(1, history.size());
        assertEquals(2, history.get("a").size());

        history = store.readHistory(URN, Long.MAX_VALUE);
        assertEquals(2, history.size());
    }

    @Test
    public void emptyBatchWritesNothing() throws Exception {
        store.write(URN, ImmutableMap.<String, String>of(), 1);
        assertFalse(store.exists(URN));
    }

    @Test
    public void exists() throws Exception {
        assertFalse(store.exists(URN));
        store.write(URN, "a", "1", 1);
        assertTrue(store.exists(URN));
    }

    @Test
    public void listChildren() throws Exception {
        store.write(URN.add("fs/os/c/bin/bash"), "a", "1", 1);
        store.write(URN.add("flows/W:1"), "a", "1", 1);
        store.write(URN.add("flows/W:2"), "a", "1", 1);
        store.write(Urn.parse("C.12345678123456789"), "a", "1", 1);

        assertEquals(ImmutableList.of(URN.add("flows"), URN.add("fs")), store.listChildren(URN));
        assertEquals(ImmutableList.of(URN.add("flows/W:1"), URN.add("flows/W:2")),
                store.listChildren(URN.add("flows")));
        assertTrue(store.listChildren(URN.add("flows/W:1")).isEmpty());
        assertEquals(ImmutableList.of(URN, Urn.parse("C.12345678123456789")),
                store.listChildren(Urn.ROOT));
    }

    @Test
    public void backendFailureIsRetryableStoreError() throws Exception {
        DocumentStore backend = mock(DocumentStore.class);
        DocumentStoreException failure = new DocumentStoreException("connection refused");
        when(backend.createOrUpdate(any(UpdateOp.class))).thenThrow(failure);
        when(backend.find(anyString())).thenThrow(failure);
        VersionedAttributeStore failing = new VersionedAttributeStore(backend);

        try {
            failing.write(URN, "a", "1", 1);
            fail("write must fail");
        } catch (Aff4Exception e) {
            assertTrue(e.isOfType(Aff4Exception.STORE));
            assertTrue(e.isRetryable());
            assertSame(failure, e.getCause());
        }
        try {
            failing.read(URN, "a", Long.MAX_VALUE);
            fail("read must fail");
        } catch (Aff4Exception e) {
            assertTrue(e.isOfType(Aff4Exception.STORE));
            assertEquals(2, e.getCode());
        }
    }

    @Test
    public void warnsOnLongHistory() throws Exception {
        VersionedAttributeStore small = new VersionedAttributeStore(new MemoryDocumentStore(), 3);
        LogCustomizer logs = LogCustomizer.forLogger(VersionedAttributeStore.class)
                .filter(Level.WARN).contains("more than 3 versions").create();
        logs.starting();
        try {
            for (int i = 1; i <= 3; i++) {
                small.write(URN, "a", "v" + i, i);
            }
            assertTrue(logs.getLogs().isEmpty());
            small.write(URN, "a", "v4", 4);
            small.write(URN, "a", "v5", 5);
            assertEquals(1, logs.getLogs().size());
        } finally {
            logs.finished();
        }
    }
}
