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

import static com.google.common.base.Preconditions.checkNotNull;
import static org.apache.jackrabbit.aff4.api.Aff4Exception.LOCK;

import javax.annotation.Nonnull;

import org.apache.jackrabbit.aff4.api.Aff4Exception;
import org.apache.jackrabbit.aff4.api.Urn;
import org.apache.jackrabbit.aff4.flow.FlowReference;
import org.apache.jackrabbit.aff4.flow.FlowRunner;
import org.apache.jackrabbit.aff4.flow.FlowStatus;
import org.apache.jackrabbit.aff4.stats.Clock;
import org.apache.jackrabbit.aff4.store.AttributeRecord;
import org.apache.jackrabbit.aff4.store.VersionedAttributeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure at most one flow collects the content of a file at any time.
 * <p>
 * The flow collecting the content is recorded in the
 * {@link VfsFile#CONTENT_LOCK} attribute of the file. The lock is held while
 * that flow is running; it is released implicitly when the flow finishes or
 * fails. The lock is advisory: two concurrent updates of the same file are
 * only ordered by the store, and both may start a flow.
 */
public class ContentLockCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ContentLockCoordinator.class);

    private final VersionedAttributeStore store;

    private final FlowRunner flowRunner;

    private final Clock clock;

    private final String flowName;

    public ContentLockCoordinator(@Nonnull VersionedAttributeStore store,
                                  @Nonnull FlowRunner flowRunner,
                                  @Nonnull Clock clock,
                                  @Nonnull String flowName) {
        this.store = checkNotNull(store);
        this.flowRunner = checkNotNull(flowRunner);
        this.clock = checkNotNull(clock);
        this.flowName = checkNotNull(flowName);
    }

    /**
     * Returns the flow holding the content lock of the file if it is still
     * running, otherwise starts a new flow and records it as the lock
     * holder. The lock is read from the store, not from the handle, and the
     * handle may be closed.
     *
     * @param file the file
     * @return the reference of the flow holding the lock
     * @throws Aff4Exception of type {@code Lock} if the status of the lock
     *          holder could not be determined, any exception thrown when
     *          starting the flow, or of type {@code Store} if the store failed
     */
    @Nonnull
    public FlowReference update(@Nonnull VfsFile file) throws Aff4Exception {
        Urn urn = file.getUrn();
        AttributeRecord lock = store.read(urn, VfsFile.CONTENT_LOCK.getName(), Long.MAX_VALUE);
        if (lock != null) {
            FlowReference holder = VfsFile.CONTENT_LOCK.getType().deserialize(lock.getValue());
            FlowStatus status = getStatus(holder);
            if (status == FlowStatus.RUNNING) {
                LOG.debug("Content of {} is locked by running flow {}", urn, holder);
                return holder;
            }
            LOG.debug("Flow {} holding the content lock of {} is {}", holder, urn, status);
        }
        FlowReference flow = flowRunner.start(flowName, urn);
        long timestamp = Aff4ObjectFactory.nextTimestamp(clock);
        String value = VfsFile.CONTENT_LOCK.getType().serialize(flow);
        store.write(urn, VfsFile.CONTENT_LOCK.getName(), value, timestamp);
        file.recordWritten(new AttributeRecord(urn, VfsFile.CONTENT_LOCK.getName(), timestamp, value));
        LOG.info("Started flow {} ({}) to collect the content of {}", flow, flowName, urn);
        return flow;
    }

    @Nonnull
    public String getFlowName() {
        return flowName;
    }

    private FlowStatus getStatus(FlowReference flow) throws Aff4Exception {
        FlowStatus status;
        try {
            status = flowRunner.status(flow);
        } catch (Aff4Exception e) {
            if (e.isOfType(LOCK)) {
                throw e;
            }
            throw new Aff4Exception(LOCK, 1, "Cannot determine the status of flow " + flow, e);
        } catch (RuntimeException e) {
            throw new Aff4Exception(LOCK, 1, "Cannot determine the status of flow " + flow, e);
        }
        if (status == null) {
            throw new Aff4Exception(LOCK, 2, "No status for flow " + flow);
        }
        return status;
    }
}
