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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.jackrabbit.aff4.api.Aff4Exception;
import org.apache.jackrabbit.aff4.objects.Aff4Kinds;
import org.apache.jackrabbit.aff4.objects.Aff4Object;
import org.apache.jackrabbit.aff4.objects.VfsClient;
import org.apache.jackrabbit.aff4.objects.VfsFile;
import org.junit.Test;

public class SchemaRegistryTest {

    private final SchemaRegistry registry = Aff4Kinds.newRegistry();

    @Test
    public void ancestorsAreRegistered() {
        assertTrue(registry.contains(Aff4Kinds.AFF4_OBJECT));
        assertTrue(registry.contains(Aff4Kinds.AFF4_VOLUME));
        assertEquals(4, registry.getKinds().size());
    }

    @Test
    public void resolve() throws Exception {
        assertSame(Aff4Kinds.VFS_FILE, registry.resolveKind("VFSFile"));
        assertSame(VfsFile.CONTENT_LAST, registry.resolveAttribute(Aff4Kinds.VFS_FILE, "metadata:content_last"));
        assertSame(Aff4Object.TYPE, registry.resolveAttribute(Aff4Kinds.VFS_CLIENT, "aff4:type"));
    }

    @Test
    public void unknownKind() {
        try {
            registry.resolveKind("VFSMemoryFile");
            fail();
        } catch (Aff4Exception e) {
            assertTrue(e.isSchemaViolation());
            assertEquals(1, e.getCode());
        }
    }

    @Test
    public void unknownAttribute() {
        try {
            registry.resolveAttribute(Aff4Kinds.VFS_FILE, VfsClient.HOSTNAME.getName());
            fail();
        } catch (Aff4Exception e) {
            assertTrue(e.isSchemaViolation());
            assertEquals(2, e.getCode());
        }
    }

    @Test
    public void otherKindOfSameName() {
        ObjectKind<Aff4Object> other = ObjectKind.builder("VFSFile", Aff4Object.class, Aff4Object::new).build();
        assertFalse(registry.contains(other));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateName() {
        ObjectKind<Aff4Object> other = ObjectKind.builder("VFSFile", Aff4Object.class, Aff4Object::new).build();
        SchemaRegistry.builder().register(Aff4Kinds.VFS_FILE).register(other);
    }
}
