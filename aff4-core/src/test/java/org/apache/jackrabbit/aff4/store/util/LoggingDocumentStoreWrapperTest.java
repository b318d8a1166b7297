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
package org.apache.jackrabbit.aff4.store.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import org.apache.jackrabbit.aff4.junit.LogCustomizer;
import org.apache.jackrabbit.aff4.store.DocumentStore;
import org.apache.jackrabbit.aff4.store.DocumentStoreException;
import org.apache.jackrabbit.aff4.store.MemoryDocumentStore;
import org.apache.jackrabbit.aff4.store.UpdateOp;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class LoggingDocumentStoreWrapperTest {

    private final LogCustomizer logs = LogCustomizer.forLogger(LoggingDocumentStoreWrapper.class)
            .enable(Level.DEBUG).create();

    @Before
    public void before() {
        logs.starting();
    }

    @After
    public void after() {
        logs.finished();
    }

    @Test
    public void logsCallsAndResults() {
        DocumentStore store = new LoggingDocumentStoreWrapper(new MemoryDocumentStore());
        store.createOrUpdate(new UpdateOp("aff4:/C.1", 1).set("a", "1"));
        assertNotNull(store.find("aff4:/C.1"));

        assertTrue(logs.getLogs().contains("ds.find(\"aff4:/C.1\");"));
        assertTrue(logs.getLogs().contains("// aff4:/C.1"));
    }

    @Test
    public void logsAndRethrowsFailures() {
        DocumentStore backend = mock(DocumentStore.class);
        DocumentStoreException failure = new DocumentStoreException("down");
        when(backend.find(anyString())).thenThrow(failure);
        DocumentStore store = new LoggingDocumentStoreWrapper(backend);
        try {
            store.find("aff4:/C.1");
            fail("must fail");
        } catch (DocumentStoreException e) {
            assertSame(failure, e);
        }
        assertEquals("// exception: " + failure, logs.getLogs().get(logs.getLogs().size() - 1));
    }
}
