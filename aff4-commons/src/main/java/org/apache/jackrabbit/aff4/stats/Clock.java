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
package org.apache.jackrabbit.aff4.stats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of wall time for attribute timestamps, in milliseconds since the
 * epoch. All timestamps written to the store are taken from a clock, so
 * replacing the clock makes flush timestamps fully deterministic.
 */
public abstract class Clock {

    private long increasing = 0;

    /**
     * Returns the current time in milliseconds since the epoch.
     *
     * @see System#currentTimeMillis()
     * @return current time in milliseconds since the epoch
     */
    public abstract long getTime();

    /**
     * Returns a strictly increasing timestamp based on the current time.
     * Two calls of this method never return the same timestamp. Instead
     * this method explicitly waits until the current time increases beyond
     * any previously returned value. The wait may last long if the system
     * time is adjusted backwards, so callers should be prepared to deal
     * with an interrupt.
     *
     * @return strictly increasing timestamp
     * @throws InterruptedException if the wait was interrupted
     */
    public synchronized long getTimeIncreasing() throws InterruptedException {
        long now = getTime();
        while (now <= increasing) {
            wait(0, 100000); // 0.1ms
            now = getTime();
        }
        increasing = now;
        return now;
    }

    /**
     * Clock based on {@link System#currentTimeMillis()}.
     */
    public static final Clock SIMPLE = new Clock() {
        @Override
        public long getTime() {
            return System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return "Clock.SIMPLE";
        }
    };

    /**
     * A virtual clock that has no connection to the actual system time. The
     * reported time only changes when it is explicitly moved with
     * {@link #setTime(long)}, {@link #advance(long)} or
     * {@link #waitUntil(long)}, or when {@link #getTimeIncreasing()} is
     * called at a tick it already returned. Two reads of {@link #getTime()}
     * without a move in between return the same value.
     */
    public static class Virtual extends Clock {

        private final AtomicLong time;

        private long increasing = Long.MIN_VALUE;

        public Virtual() {
            this(0);
        }

        public Virtual(long start) {
            this.time = new AtomicLong(start);
        }

        @Override
        public long getTime() {
            return time.get();
        }

        /**
         * Sets the reported time. The virtual clock may be moved backwards.
         *
         * @param timestamp the new time in milliseconds
         */
        public void setTime(long timestamp) {
            time.set(timestamp);
        }

        /**
         * Moves the clock forward.
         *
         * @param millis the number of milliseconds to move forward
         * @return the new time
         */
        public long advance(long millis) {
            return time.addAndGet(millis);
        }

        /**
         * Moves the clock to the given point in time unless it is already
         * beyond it. Returns immediately.
         *
         * @param timestamp time in milliseconds since epoch
         */
        public void waitUntil(long timestamp) {
            long now = time.get();
            while (now < timestamp && !time.compareAndSet(now, timestamp)) {
                now = time.get();
            }
        }

        /**
         * Returns the current time, first moving the clock one millisecond
         * past the last returned value if it has not moved beyond it.
         * Never waits.
         */
        @Override
        public synchronized long getTimeIncreasing() {
            long now = time.get();
            if (now <= increasing) {
                now = increasing + 1;
                waitUntil(now);
            }
            increasing = now;
            return now;
        }

        @Override
        public String toString() {
            return "Clock.Virtual";
        }
    }

}
