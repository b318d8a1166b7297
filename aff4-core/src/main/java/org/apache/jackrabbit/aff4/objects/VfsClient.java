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

import java.util.List;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.aff4.model.ClientInformation;
import org.apache.jackrabbit.aff4.model.KnowledgeBase;
import org.apache.jackrabbit.aff4.model.NetworkInterface;
import org.apache.jackrabbit.aff4.model.User;
import org.apache.jackrabbit.aff4.schema.AttributeDefinition;
import org.apache.jackrabbit.aff4.schema.ValueType;
import org.apache.jackrabbit.aff4.summary.ClientSummary;
import org.apache.jackrabbit.aff4.summary.SummaryAggregator;

/**
 * A client, the root of everything collected from one endpoint. Its URN is
 * {@code aff4:/<client-id>}.
 */
public class VfsClient extends Aff4Object {

    public static final AttributeDefinition<String> HOSTNAME =
            AttributeDefinition.single("metadata:hostname", ValueType.STRING)
                    .withDescription("Hostname of the host.");

    public static final AttributeDefinition<String> FQDN =
            AttributeDefinition.single("metadata:fqdn", ValueType.STRING)
                    .withDescription("The fully qualified hostname of the host.");

    public static final AttributeDefinition<String> SYSTEM =
            AttributeDefinition.single("metadata:system", ValueType.STRING)
                    .withDescription("The operating system family, for example Linux or Windows.");

    public static final AttributeDefinition<String> OS_RELEASE =
            AttributeDefinition.single("metadata:os_release", ValueType.STRING)
                    .withDescription("The OS release identifier.");

    public static final AttributeDefinition<String> OS_VERSION =
            AttributeDefinition.single("metadata:os_version", ValueType.STRING)
                    .withDescription("The OS version.");

    public static final AttributeDefinition<String> KERNEL =
            AttributeDefinition.single("metadata:kernel_version", ValueType.STRING)
                    .withDescription("The kernel version.");

    public static final AttributeDefinition<String> ARCH =
            AttributeDefinition.single("metadata:architecture", ValueType.STRING)
                    .withDescription("The machine architecture.");

    public static final AttributeDefinition<Long> INSTALL_DATE =
            AttributeDefinition.single("metadata:install_date", ValueType.DATE)
                    .withDescription("The time the OS was installed.");

    public static final AttributeDefinition<KnowledgeBase> KNOWLEDGE_BASE =
            AttributeDefinition.single("metadata:knowledge_base",
                    ValueType.json("KnowledgeBase", KnowledgeBase.class))
                    .withDescription("Facts about the host, including its accounts.");

    public static final AttributeDefinition<List<String>> USERNAMES =
            AttributeDefinition.list("aff4:user_names", ValueType.STRING)
                    .withDescription("The names of the accounts on the host.");

    public static final AttributeDefinition<List<NetworkInterface>> LAST_INTERFACES =
            AttributeDefinition.list("aff4:last_interfaces",
                    ValueType.json("NetworkInterface", NetworkInterface.class))
                    .withDescription("The network interfaces reported last.");

    public static final AttributeDefinition<ClientInformation> CLIENT_INFO =
            AttributeDefinition.single("metadata:ClientInfo",
                    ValueType.json("ClientInformation", ClientInformation.class))
                    .withDescription("Metadata about the agent software.");

    public VfsClient(@Nonnull ObjectContext context) {
        super(context);
    }

    /**
     * @return the client id, for example {@code C.1234567812345678}
     */
    @Nonnull
    public String getClientId() {
        return getUrn().getRootId();
    }

    /**
     * @return the accounts of the knowledge base, empty if there is none
     */
    @Nonnull
    public List<User> getUsers() {
        KnowledgeBase kb = get(KNOWLEDGE_BASE);
        return kb == null ? ImmutableList.<User>of() : kb.getUsers();
    }

    /**
     * @return a summary of the facts known about this client
     */
    @Nonnull
    public ClientSummary getSummary() {
        return SummaryAggregator.summarize(this);
    }
}
