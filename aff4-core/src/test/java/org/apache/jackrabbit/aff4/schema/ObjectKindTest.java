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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.aff4.objects.Aff4Kinds;
import org.apache.jackrabbit.aff4.objects.Aff4Object;
import org.apache.jackrabbit.aff4.objects.VfsClient;
import org.apache.jackrabbit.aff4.objects.VfsFile;
import org.junit.Test;

public class ObjectKindTest {

    private static final AttributeDefinition<String> NOTE =
            AttributeDefinition.single("test:note", ValueType.STRING);

    private static final AttributeDefinition<Long> NOTE_LAST =
            AttributeDefinition.single("test:note_last", ValueType.DATE).withDerivedFrom(NOTE);

    @Test
    public void inheritedAttributes() {
        assertSame(Aff4Object.TYPE, Aff4Kinds.VFS_CLIENT.getAttribute("aff4:type"));
        assertTrue(Aff4Kinds.VFS_FILE.declares(Aff4Object.TYPE));
        assertTrue(Aff4Kinds.VFS_FILE.declares(VfsFile.CONTENT));
        assertFalse(Aff4Kinds.VFS_FILE.declares(VfsClient.HOSTNAME));
        assertNull(Aff4Kinds.AFF4_OBJECT.getAttribute(VfsFile.CONTENT.getName()));
        assertEquals(Aff4Object.TYPE, Aff4Kinds.VFS_FILE.getAttributes().iterator().next());
    }

    @Test
    public void isA() {
        assertTrue(Aff4Kinds.VFS_CLIENT.isA(Aff4Kinds.VFS_CLIENT));
        assertTrue(Aff4Kinds.VFS_CLIENT.isA(Aff4Kinds.AFF4_VOLUME));
        assertTrue(Aff4Kinds.VFS_CLIENT.isA(Aff4Kinds.AFF4_OBJECT));
        assertFalse(Aff4Kinds.VFS_CLIENT.isA(Aff4Kinds.VFS_FILE));
        assertFalse(Aff4Kinds.AFF4_OBJECT.isA(Aff4Kinds.VFS_FILE));
    }

    @Test
    public void derivedAttribute() {
        ObjectKind<Aff4Object> kind = ObjectKind.builder("Note", Aff4Object.class, Aff4Object::new)
                .extend(Aff4Kinds.AFF4_OBJECT)
                .attribute(NOTE)
                .attribute(NOTE_LAST)
                .build();
        assertEquals("test:note", kind.getAttribute("test:note_last").getDerivedFrom());
    }

    @Test(expected = IllegalArgumentException.class)
    public void derivedFromUnknownAttribute() {
        ObjectKind.builder("Note", Aff4Object.class, Aff4Object::new)
                .attribute(NOTE_LAST)
                .build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateAttribute() {
        ObjectKind.builder("Note", Aff4Object.class, Aff4Object::new)
                .extend(Aff4Kinds.AFF4_OBJECT)
                .attribute(AttributeDefinition.single("aff4:type", ValueType.STRING));
    }

    @Test(expected = IllegalArgumentException.class)
    public void parentAfterAttributes() {
        ObjectKind.builder("Note", Aff4Object.class, Aff4Object::new)
                .attribute(NOTE)
                .extend(Aff4Kinds.AFF4_OBJECT);
    }

    @Test(expected = IllegalArgumentException.class)
    public void incompatibleObjectClass() {
        ObjectKind.builder("Note", Aff4Object.class, Aff4Object::new)
                .extend(Aff4Kinds.VFS_FILE);
    }

    @Test
    public void listAttribute() {
        AttributeDefinition<List<String>> names = AttributeDefinition.list("test:names", ValueType.STRING);
        assertTrue(names.isList());
        assertEquals(Multiplicity.LIST, names.getMultiplicity());
        assertSame(ValueType.STRING, names.getElementType());
        assertEquals(ImmutableList.of(), names.getDefaultValue());
    }

    @Test(expected = IllegalArgumentException.class)
    public void derivedMustBeDate() {
        AttributeDefinition.single("test:bad", ValueType.STRING).withDerivedFrom(NOTE);
    }

    @Test(expected = ClassCastException.class)
    public void castWrongType() {
        NOTE.cast(1L);
    }
}
