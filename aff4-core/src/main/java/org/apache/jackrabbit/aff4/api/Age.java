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
package org.apache.jackrabbit.aff4.api;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The point in time an object handle reads attributes at.
 */
public final class Age {

    /**
     * The newest version of each attribute.
     */
    public static final Age NEWEST = new Age(Long.MAX_VALUE, false);

    /**
     * The newest version of each attribute, with the full history of every
     * attribute kept available on the handle.
     */
    public static final Age ALL_TIMES = new Age(Long.MAX_VALUE, true);

    private final long asOf;

    private final boolean allTimes;

    private Age(long asOf, boolean allTimes) {
        this.asOf = asOf;
        this.allTimes = allTimes;
    }

    /**
     * The version of each attribute with the highest timestamp that is
     * less than or equal to the given time.
     *
     * @param timestamp the time in milliseconds since the epoch
     * @return the age
     */
    public static Age at(long timestamp) {
        checkArgument(timestamp >= 0, "Negative timestamp: %s", timestamp);
        return new Age(timestamp, false);
    }

    public long getAsOf() {
        return asOf;
    }

    public boolean isAllTimes() {
        return allTimes;
    }

    public boolean isNewest() {
        return asOf == Long.MAX_VALUE;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(asOf) ^ (allTimes ? 1 : 0);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof Age)) {
            return false;
        }
        Age other = (Age) obj;
        return asOf == other.asOf && allTimes == other.allTimes;
    }

    @Override
    public String toString() {
        if (allTimes) {
            return "ALL_TIMES";
        } else if (isNewest()) {
            return "NEWEST";
        }
        return "@" + asOf;
    }
}
