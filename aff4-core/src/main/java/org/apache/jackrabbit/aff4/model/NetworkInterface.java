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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A network interface of a client as last reported.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"ifname", "macAddress", "addresses"})
public final class NetworkInterface {

    private final String ifname;

    private final String macAddress;

    private final List<String> addresses;

    @JsonCreator
    public NetworkInterface(@JsonProperty("ifname") @Nonnull String ifname,
                            @JsonProperty("macAddress") @Nullable String macAddress,
                            @JsonProperty("addresses") @Nullable List<String> addresses) {
        this.ifname = checkNotNull(ifname);
        this.macAddress = macAddress;
        this.addresses = addresses == null ? ImmutableList.<String>of() : ImmutableList.copyOf(addresses);
    }

    public NetworkInterface(@Nonnull String ifname) {
        this(ifname, null, null);
    }

    @Nonnull
    public String getIfname() {
        return ifname;
    }

    @CheckForNull
    public String getMacAddress() {
        return macAddress;
    }

    @Nonnull
    public List<String> getAddresses() {
        return addresses;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(ifname, macAddress, addresses);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof NetworkInterface)) {
            return false;
        }
        NetworkInterface other = (NetworkInterface) obj;
        return ifname.equals(other.ifname)
                && Objects.equal(macAddress, other.macAddress)
                && addresses.equals(other.addresses);
    }

    @Override
    public String toString() {
        return ifname + addresses;
    }
}
