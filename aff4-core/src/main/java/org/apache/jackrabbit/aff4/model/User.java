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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;

/**
 * An account found on a client.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"username", "fullName", "homedir", "sid"})
public final class User {

    private final String username;

    private final String fullName;

    private final String homedir;

    private final String sid;

    @JsonCreator
    public User(@JsonProperty("username") @Nonnull String username,
                @JsonProperty("fullName") @Nullable String fullName,
                @JsonProperty("homedir") @Nullable String homedir,
                @JsonProperty("sid") @Nullable String sid) {
        this.username = checkNotNull(username);
        this.fullName = fullName;
        this.homedir = homedir;
        this.sid = sid;
    }

    public User(@Nonnull String username) {
        this(username, null, null, null);
    }

    @Nonnull
    public String getUsername() {
        return username;
    }

    @CheckForNull
    public String getFullName() {
        return fullName;
    }

    @CheckForNull
    public String getHomedir() {
        return homedir;
    }

    /**
     * @return the Windows security identifier, if any
     */
    @CheckForNull
    public String getSid() {
        return sid;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(username, fullName, homedir, sid);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof User)) {
            return false;
        }
        User other = (User) obj;
        return username.equals(other.username)
                && Objects.equal(fullName, other.fullName)
                && Objects.equal(homedir, other.homedir)
                && Objects.equal(sid, other.sid);
    }

    @Override
    public String toString() {
        return username;
    }
}
