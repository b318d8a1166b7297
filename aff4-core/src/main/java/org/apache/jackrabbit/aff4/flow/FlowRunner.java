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
package org.apache.jackrabbit.aff4.flow;

import javax.annotation.Nonnull;

import org.apache.jackrabbit.aff4.api.Aff4Exception;
import org.apache.jackrabbit.aff4.api.Urn;

/**
 * The subsystem that schedules and runs background collection operations.
 */
public interface FlowRunner {

    /**
     * Schedules a new operation. The call returns as soon as the operation
     * is scheduled and does not wait for it to complete.
     *
     * @param flowName the kind of operation, for example {@code MultiGetFile}
     * @param target the object the operation collects data for
     * @return the reference of the new operation
     * @throws Aff4Exception if the operation could not be scheduled
     */
    @Nonnull
    FlowReference start(@Nonnull String flowName, @Nonnull Urn target) throws Aff4Exception;

    /**
     * @param flow a reference returned by {@link #start(String, Urn)}
     * @return the current state of the operation
     * @throws Aff4Exception if the state could not be determined
     */
    @Nonnull
    FlowStatus status(@Nonnull FlowReference flow) throws Aff4Exception;

}
