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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.aff4.api.Age;
import org.apache.jackrabbit.aff4.api.Mode;
import org.apache.jackrabbit.aff4.api.Urn;
import org.apache.jackrabbit.aff4.model.KnowledgeBase;
import org.apache.jackrabbit.aff4.model.NetworkInterface;
import org.apache.jackrabbit.aff4.model.User;
import org.apache.jackrabbit.aff4.stats.Clock;
import org.apache.jackrabbit.aff4.summary.ClientSummary;
import org.junit.Before;
import org.junit.Test;

public class VfsClientTest {

    private static final Urn CLIENT = Urn.parse("C.0000000000000000");

    private Clock.Virtual clock;

    private Aff4ObjectFactory factory;

    @Before
    public void before() {
        clock = new Clock.Virtual(1);
        factory = Aff4ObjectFactory.builder().setClock(clock).build();
    }

    @Test
    public void knowledgeBaseUsers() throws Exception {
        VfsClient client = factory.create(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.WRITE, Age.ALL_TIMES);
        KnowledgeBase kb = KnowledgeBase.EMPTY;
        for (int i = 0; i < 5; i++) {
            kb = kb.withUser(new User("user" + i));
        }
        client.set(VfsClient.KNOWLEDGE_BASE, kb);
        client.close();

        client = factory.open(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.READ, Age.ALL_TIMES);
        List<User> users = client.getUsers();
        assertEquals(5, users.size());
        assertEquals("user0", users.get(0).getUsername());
        assertEquals("user4", users.get(4).getUsername());
        assertEquals("C.0000000000000000", client.getClientId());
    }

    @Test
    public void noKnowledgeBase() throws Exception {
        VfsClient client = factory.create(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.WRITE);
        assertTrue(client.getUsers().isEmpty());
    }

    @Test
    public void openAsVolume() throws Exception {
        factory.create(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.WRITE).close();
        Aff4Object object = factory.open(CLIENT);
        assertTrue(object instanceof VfsClient);
        assertEquals(Aff4Kinds.VFS_CLIENT, object.getKind());
        assertTrue(factory.open(CLIENT, Aff4Kinds.AFF4_VOLUME, Mode.READ) instanceof VfsClient);
    }

    @Test
    public void summary() throws Exception {
        factory.create(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.WRITE).close();

        VfsClient client = factory.open(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.READ);
        ClientSummary summary = client.getSummary();
        assertEquals("C.0000000000000000", summary.getClientId());
        assertEquals(1, summary.getTimestamp());
        assertTrue(summary.getUsers().isEmpty());
        assertTrue(summary.getInterfaces().isEmpty());
        assertNull(summary.getSystemInfo().getNode());

        clock.advance(100);
        User user = new User("user1", "Some User", "/home/user1", null);
        NetworkInterface eth0 = new NetworkInterface("eth0", "aa:bb:cc:dd:ee:ff",
                ImmutableList.of("192.168.0.2"));
        client = factory.open(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.READ_WRITE);
        client.set(VfsClient.HOSTNAME, "test_host");
        client.set(VfsClient.SYSTEM, "Linux");
        client.set(VfsClient.OS_RELEASE, "Ubuntu");
        client.set(VfsClient.OS_VERSION, "14.04");
        client.set(VfsClient.KERNEL, "3.13.0-39-generic");
        client.set(VfsClient.FQDN, "test_host.example.com");
        client.set(VfsClient.ARCH, "x86_64");
        client.set(VfsClient.INSTALL_DATE, 1000L);
        client.set(VfsClient.KNOWLEDGE_BASE, KnowledgeBase.EMPTY.withUser(user));
        client.set(VfsClient.LAST_INTERFACES, ImmutableList.of(eth0));
        client.close();

        summary = factory.open(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.READ).getSummary();
        assertEquals(101, summary.getTimestamp());
        assertEquals(ImmutableList.of(user), summary.getUsers());
        assertEquals(ImmutableList.of(eth0), summary.getInterfaces());
        assertNull(summary.getClientInfo());
        assertEquals("test_host", summary.getSystemInfo().getNode());
        assertEquals("Linux", summary.getSystemInfo().getSystem());
        assertEquals("Ubuntu", summary.getSystemInfo().getRelease());
        assertEquals("14.04", summary.getSystemInfo().getVersion());
        assertEquals("3.13.0-39-generic", summary.getSystemInfo().getKernel());
        assertEquals("test_host.example.com", summary.getSystemInfo().getFqdn());
        assertEquals("x86_64", summary.getSystemInfo().getMachine());
        assertEquals(Long.valueOf(1000), summary.getSystemInfo().getInstallDate());
    }
}
