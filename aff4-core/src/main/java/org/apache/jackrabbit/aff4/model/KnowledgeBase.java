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
 * Facts collected about a client's operating system and its accounts.
 * Instances are immutable; use {@link #withUser(User)} to add an account.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"hostname", "os", "timeZone", "users"})
public final class KnowledgeBase {

    public static final KnowledgeBase EMPTY = new KnowledgeBase(null, null, null, null);

    private final String hostname;

    private final String os;

    private final String timeZone;

    private final List<User> users;

    @JsonCreator
    public KnowledgeBase(@JsonProperty("hostname") @Nullable String hostname,
                         @JsonProperty("os") @Nullable String os,
                         @JsonProperty("timeZone") @Nullable String timeZone,
                         @JsonProperty("users") @Nullable List<User> users) {
        this.hostname = hostname;
        this.os = os;
        this.timeZone = timeZone;
        this.users = users == null ? ImmutableList.<User>of() : ImmutableList.copyOf(users);
    }

    @CheckForNull
    public String getHostname() {
        return hostname;
    }

    @CheckForNull
    public String getOs() {
        return os;
    }

    @CheckForNull
    public String getTimeZone() {
        return timeZone;
    }

    @Nonnull
    public List<User> getUsers() {
        return users;
    }

    @Nonnull
    public KnowledgeBase withUser(@Nonnull User user) {
        return new KnowledgeBase(hostname, os, timeZone,
                ImmutableList.<User>builder().addAll(users).add(user).build());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(hostname, os, timeZone, users);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof KnowledgeBase)) {
            return false;
        }
        KnowledgeBase other = (KnowledgeBase) obj;
        return Objects.equal(hostname, other.hostname)
                && Objects.equal(os, other.os)
                && Objects.equal(timeZone, other.timeZone)
                && users.equals(other.users);
    }

    @Override
    public String toString() {
        return "KnowledgeBase{hostname=" + hostname + ", os=" + os + ", users=" + users + "}";
    }
}
