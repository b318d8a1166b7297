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

import org.apache.jackrabbit.aff4.schema.ObjectKind;
import org.apache.jackrabbit.aff4.schema.SchemaRegistry;

/**
 * The standard object kinds.
 */
public final class Aff4Kinds {

    public static final ObjectKind<Aff4Object> AFF4_OBJECT =
            ObjectKind.builder("AFF4Object", Aff4Object.class, Aff4Object::new)
                    .attribute(Aff4Object.TYPE)
                    .build();

    /**
     * A container of other objects.
     */
    public static final ObjectKind<Aff4Object> AFF4_VOLUME =
            ObjectKind.builder("AFF4Volume", Aff4Object.class, Aff4Object::new)
                    .extend(AFF4_OBJECT)
                    .build();

    public static final ObjectKind<VfsFile> VFS_FILE =
            ObjectKind.builder("VFSFile", VfsFile.class, VfsFile::new)
                    .extend(AFF4_OBJECT)
                    .attribute(VfsFile.STAT)
                    .attribute(VfsFile.PATHSPEC)
                    .attribute(VfsFile.CONTENT)
                    .attribute(VfsFile.SIZE)
                    .attribute(VfsFile.CONTENT_LAST)
                    .attribute(VfsFile.CONTENT_LOCK)
                    .build();

    public static final ObjectKind<VfsClient> VFS_CLIENT =
            ObjectKind.builder("VFSGRRClient", VfsClient.class, VfsClient::new)
                    .extend(AFF4_VOLUME)
                    .attribute(VfsClient.HOSTNAME)
                    .attribute(VfsClient.FQDN)
                    .attribute(VfsClient.SYSTEM)
                    .attribute(VfsClient.OS_RELEASE)
                    .attribute(VfsClient.OS_VERSION)
                    .attribute(VfsClient.KERNEL)
                    .attribute(VfsClient.ARCH)
                    .attribute(VfsClient.INSTALL_DATE)
                    .attribute(VfsClient.KNOWLEDGE_BASE)
                    .attribute(VfsClient.USERNAMES)
                    .attribute(VfsClient.LAST_INTERFACES)
                    .attribute(VfsClient.CLIENT_INFO)
                    .build();

    private Aff4Kinds() {
    }

    /**
     * @return a registry of all standard kinds
     */
    public static SchemaRegistry newRegistry() {
        return SchemaRegistry.builder()
                .register(AFF4_VOLUME)
                .register(VFS_FILE)
                .register(VFS_CLIENT)
                .build();
    }
}
