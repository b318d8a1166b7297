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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.aff4.model.ClientInformation;
import org.apache.jackrabbit.aff4.model.NetworkInterface;
import org.apache.jackrabbit.aff4.model.User;

/**
 * A read-only view of the facts known about a client.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"clientId", "systemInfo", "users", "interfaces", "clientInfo", "timestamp"})
public final class ClientSummary {

    private final String clientId;

    private final SystemInfo systemInfo;

    private final List<User> users;

    private final List<NetworkInterface> interfaces;

    private final ClientInformation clientInfo;

    private final long timestamp;

    public ClientSummary(@Nonnull String clientId, @Nonnull SystemInfo systemInfo,
                         @Nonnull List<User> users, @Nonnull List<NetworkInterface> interfaces,
                         @Nullable ClientInformation clientInfo, long timestamp) {
        this.clientId = checkNotNull(clientId);
        this.systemInfo = checkNotNull(systemInfo);
        this.users = ImmutableList.copyOf(users);
        this.interfaces = ImmutableList.copyOf(interfaces);
        this.clientInfo = clientInfo;
        this.timestamp = timestamp;
    }

    @Nonnull
    public String getClientId() {
        return clientId;
    }

    @Nonnull
    public SystemInfo getSystemInfo() {
        return systemInfo;
    }

    @Nonnull
    public List<User> getUsers() {
        return users;
    }

    @Nonnull
    public List<NetworkInterface> getInterfaces() {
        return interfaces;
    }

    @CheckForNull
    public ClientInformation getClientInfo() {
        return clientInfo;
    }

    /**
     * @return the time of the newest fact in this summary
     */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("clientId", clientId)
                .add("systemInfo", systemInfo)
                .add("users", users)
                .add("interfaces", interfaces)
                .add("clientInfo", clientInfo)
                .add("timestamp", timestamp)
                .toString();
    }
}
