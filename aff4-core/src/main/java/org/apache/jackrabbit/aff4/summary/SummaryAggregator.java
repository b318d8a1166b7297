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

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.aff4.model.NetworkInterface;
import org.apache.jackrabbit.aff4.model.User;
import org.apache.jackrabbit.aff4.objects.VfsClient;
import org.apache.jackrabbit.aff4.schema.AttributeDefinition;

/**
 * Builds a {@link ClientSummary} from the attributes of a client.
 * <p>
 * Missing attributes result in null or empty fields. The timestamp of the
 * summary is the newest persisted timestamp of the attributes consulted, or
 * the age of the handle if none of them was ever written.
 */
public final class SummaryAggregator {

    private static final List<AttributeDefinition<?>> CONSULTED = ImmutableList.<AttributeDefinition<?>>of(
            VfsClient.HOSTNAME, VfsClient.SYSTEM, VfsClient.OS_RELEASE, VfsClient.OS_VERSION,
            VfsClient.KERNEL, VfsClient.FQDN, VfsClient.ARCH, VfsClient.INSTALL_DATE,
            VfsClient.KNOWLEDGE_BASE, VfsClient.USERNAMES, VfsClient.LAST_INTERFACES,
            VfsClient.CLIENT_INFO);

    private SummaryAggregator() {
    }

    @Nonnull
    public static ClientSummary summarize(@Nonnull VfsClient client) {
        SystemInfo info = new SystemInfo(
                client.get(VfsClient.HOSTNAME),
                client.get(VfsClient.SYSTEM),
                client.get(VfsClient.OS_RELEASE),
                client.get(VfsClient.OS_VERSION),
                client.get(VfsClient.KERNEL),
                client.get(VfsClient.FQDN),
                client.get(VfsClient.ARCH),
                client.get(VfsClient.INSTALL_DATE));
        return new ClientSummary(client.getClientId(), info, getUsers(client),
                nonNull(client.get(VfsClient.LAST_INTERFACES)),
                client.get(VfsClient.CLIENT_INFO), getTimestamp(client));
    }

    private static List<User> getUsers(VfsClient client) {
        List<User> users = client.getUsers();
        if (!users.isEmpty()) {
            return users;
        }
        ImmutableList.Builder<User> fromNames = ImmutableList.builder();
        for (String name : nonNull(client.get(VfsClient.USERNAMES))) {
            fromNames.add(new User(name));
        }
        return fromNames.build();
    }

    private static long getTimestamp(VfsClient client) {
        long timestamp = -1;
        for (AttributeDefinition<?> attribute : CONSULTED) {
            Long t = client.getTimestamp(attribute);
            if (t != null && t > timestamp) {
                timestamp = t;
            }
        }
        return timestamp < 0 ? client.getAge() : timestamp;
    }

    private static <E> List<E> nonNull(@CheckForNull List<E> list) {
        return list == null ? ImmutableList.<E>of() : list;
    }
}
