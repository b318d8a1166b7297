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
package org.apache.jackrabbit.aff4.model;

import javax.annotation.CheckForNull;
import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;

/**
 * Metadata about the agent software running on a client.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"clientName", "clientVersion", "revision", "buildTime"})
public final class ClientInformation {

    private final String clientName;

    private final Long clientVersion;

    private final Long revision;

    private final String buildTime;

    @JsonCreator
    public ClientInformation(@JsonProperty("clientName") @Nullable String clientName,
                             @JsonProperty("clientVersion") @Nullable Long clientVersion,
                             @JsonProperty("revision") @Nullable Long revision,
                             @JsonProperty("buildTime") @Nullable String buildTime) {
        this.clientName = clientName;
        this.clientVersion = clientVersion;
        this.revision = revision;
        this.buildTime = buildTime;
    }

    @CheckForNull
    public String getClientName() {
        return clientName;
    }

    @CheckForNull
    public Long getClientVersion() {
        return clientVersion;
    }

    @CheckForNull
    public Long getRevision() {
        return revision;
    }

    @CheckForNull
    public String getBuildTime() {
        return buildTime;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(clientName, clientVersion, revision, buildTime);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof ClientInformation)) {
            return false;
        }
        ClientInformation other = (ClientInformation) obj;
        return Objects.equal(clientName, other.clientName)
                && Objects.equal(clientVersion, other.clientVersion)
                && Objects.equal(revision, other.revision)
                && Objects.equal(buildTime, other.buildTime);
    }

    @Override
    public String toString() {
        return clientName + " " + clientVersion;
    }
}
