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
package org.apache.jackrabbit.aff4.summary;

import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.aff4.api.Mode;
import org.apache.jackrabbit.aff4.api.Urn;
import org.apache.jackrabbit.aff4.model.ClientInformation;
import org.apache.jackrabbit.aff4.model.KnowledgeBase;
import org.apache.jackrabbit.aff4.model.User;
import org.apache.jackrabbit.aff4.objects.Aff4Kinds;
import org.apache.jackrabbit.aff4.objects.Aff4Object;
import org.apache.jackrabbit.aff4.objects.Aff4ObjectFactory;
import org.apache.jackrabbit.aff4.objects.VfsClient;
import org.apache.jackrabbit.aff4.stats.Clock;
import org.junit.Before;
import org.junit.Test;

public class SummaryAggregatorTest {

    private static final Urn CLIENT = Urn.parse("C.1234567812345678");

    private Clock.Virtual clock;

    private Aff4ObjectFactory factory;

    @Before
    public void before() {
        clock = new Clock.Virtual(10);
        factory = Aff4ObjectFactory.builder().setClock(clock).build();
    }

    @Test
    public void usersFromNamesWithoutKnowledgeBase() throws Exception {
        VfsClient client = factory.create(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.WRITE);
        client.append(VfsClient.USERNAMES, "alice");
        client.append(VfsClient.USERNAMES, "bob");
        client.close();

        ClientSummary summary = SummaryAggregator.summarize(
                factory.open(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.READ));
        assertEquals(ImmutableList.of(new User("alice"), new User("bob")), summary.getUsers());
        assertEquals(10, summary.getTimestamp());
    }

    @Test
    public void knowledgeBaseUsersTakePrecedence() throws Exception {
        VfsClient client = factory.create(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.WRITE);
        client.append(VfsClient.USERNAMES, "alice");
        client.set(VfsClient.KNOWLEDGE_BASE, KnowledgeBase.EMPTY.withUser(new User("root")));
        client.close();

        ClientSummary summary = SummaryAggregator.summarize(
                factory.open(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.READ));
        assertEquals(ImmutableList.of(new User("root")), summary.getUsers());
    }

    @Test
    public void timestampIsNewestConsultedAttribute() throws Exception {
        VfsClient client = factory.create(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.WRITE);
        client.set(VfsClient.HOSTNAME, "host");
        client.close();

        clock.advance(5);
        ClientInformation info = new ClientInformation("GRR", 3100L, 1L, "2015-01-01");
        client = factory.open(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.READ_WRITE);
        client.set(VfsClient.CLIENT_INFO, info);
        client.close();

        // not consulted
        clock.advance(5);
        client = factory.open(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.READ_WRITE);
        client.set(Aff4Object.TYPE, Aff4Kinds.VFS_CLIENT.getName());
        client.close();

        ClientSummary summary = SummaryAggregator.summarize(
                factory.open(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.READ));
        assertEquals(15, summary.getTimestamp());
        assertEquals(info, summary.getClientInfo());
        assertEquals("host", summary.getSystemInfo().getNode());
    }

    @Test
    public void unflushedHandleUsesAge() {
        clock.advance(42);
        VfsClient client = factory.create(CLIENT, Aff4Kinds.VFS_CLIENT, Mode.WRITE);
        client.set(VfsClient.HOSTNAME, "staged");
        ClientSummary summary = SummaryAggregator.summarize(client);
        assertEquals(52, summary.getTimestamp());
        assertEquals("staged", summary.getSystemInfo().getNode());
    }
}
