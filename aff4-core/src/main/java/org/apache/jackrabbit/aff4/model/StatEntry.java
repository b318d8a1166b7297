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
 * The result of a stat call on a client file. Every field is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"mode", "size", "atime", "mtime", "ctime"})
public final class StatEntry {

    public static final StatEntry EMPTY = new StatEntry(null, null, null, null, null);

    private final Long mode;

    private final Long size;

    private final Long atime;

    private final Long mtime;

    private final Long ctime;

    @JsonCreator
    public StatEntry(@JsonProperty("mode") @Nullable Long mode,
                     @JsonProperty("size") @Nullable Long size,
                     @JsonProperty("atime") @Nullable Long atime,
                     @JsonProperty("mtime") @Nullable Long mtime,
                     @JsonProperty("ctime") @Nullable Long ctime) {
        this.mode = mode;
        this.size = size;
        this.atime = atime;
        this.mtime = mtime;
        this.ctime = ctime;
    }

    @CheckForNull
    public Long getMode() {
        return mode;
    }

    @CheckForNull
    public Long getSize() {
        return size;
    }

    @CheckForNull
    public Long getAtime() {
        return atime;
    }

    @CheckForNull
    public Long getMtime() {
        return mtime;
    }

    @CheckForNull
    public Long getCtime() {
        return ctime;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(mode, size, atime, mtime, ctime);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof StatEntry)) {
            return false;
        }
        StatEntry other = (StatEntry) obj;
        return Objects.equal(mode, other.mode)
                && Objects.equal(size, other.size)
                && Objects.equal(atime, other.atime)
                && Objects.equal(mtime, other.mtime)
                && Objects.equal(ctime, other.ctime);
    }

    @Override
    public String toString() {
        return "StatEntry{mode=" + mode + ", size=" + size + ", mtime=" + mtime + "}";
    }
}
