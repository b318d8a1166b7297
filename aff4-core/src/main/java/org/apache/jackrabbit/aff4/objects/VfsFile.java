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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.apache.jackrabbit.aff4.api.Aff4Exception;
import org.apache.jackrabbit.aff4.flow.FlowReference;
import org.apache.jackrabbit.aff4.model.StatEntry;
import org.apache.jackrabbit.aff4.pathspec.PathSpec;
import org.apache.jackrabbit.aff4.schema.AttributeDefinition;
import org.apache.jackrabbit.aff4.schema.ValueType;

/**
 * A file of a client's filesystem as mirrored in the store.
 */
public class VfsFile extends Aff4Object {

    public static final AttributeDefinition<StatEntry> STAT =
            AttributeDefinition.single("aff4:stat", ValueType.json("StatEntry", StatEntry.class))
                    .withDescription("A StatEntry describing this file.");

    public static final AttributeDefinition<PathSpec> PATHSPEC =
            AttributeDefinition.single("aff4:pathspec", ValueType.json("PathSpec", PathSpec.class))
                    .withDescription("The pathspec used to retrieve this object from the client.");

    public static final AttributeDefinition<byte[]> CONTENT =
            AttributeDefinition.single("aff4:content", ValueType.BINARY)
                    .withDescription("The collected content of the file.");

    public static final AttributeDefinition<Long> SIZE =
            AttributeDefinition.single("aff4:size", ValueType.LONG)
                    .withDefault(0L)
                    .withDescription("The number of bytes of collected content.");

    public static final AttributeDefinition<Long> CONTENT_LAST =
            AttributeDefinition.single("metadata:content_last", ValueType.DATE)
                    .withDerivedFrom(CONTENT)
                    .withDescription("The last time the content changed.");

    public static final AttributeDefinition<FlowReference> CONTENT_LOCK =
            AttributeDefinition.single("aff4:content_lock", FlowReference.TYPE)
                    .withDescription("The flow currently collecting the content of this file.");

    private static final byte[] EMPTY = new byte[0];

    public VfsFile(@Nonnull ObjectContext context) {
        super(context);
    }

    /**
     * Stages the given bytes appended to the current content.
     *
     * @param data the bytes to append
     */
    public void write(@Nonnull byte[] data) {
        byte[] current = getContent();
        byte[] content = new byte[current.length + data.length];
        System.arraycopy(current, 0, content, 0, current.length);
        System.arraycopy(checkNotNull(data), 0, content, current.length, data.length);
        set(CONTENT, content);
        set(SIZE, (long) content.length);
    }

    /**
     * @return the content visible to this handle, empty if none was collected
     */
    @Nonnull
    public byte[] getContent() {
        byte[] content = get(CONTENT);
        return content == null ? EMPTY : content;
    }

    /**
     * @return the last time the content changed, or null if it never was
     *          written
     */
    @CheckForNull
    public Long getContentAge() {
        return get(CONTENT_LAST);
    }

    @CheckForNull
    public FlowReference getContentLock() {
        return get(CONTENT_LOCK);
    }

    /**
     * Makes sure the content of this file is being collected. Starts a new
     * collection flow unless one is already running for this file.
     *
     * @return the reference of the flow collecting the content
     * @throws Aff4Exception if the state of the locking flow cannot be
     *          determined, a new flow cannot be started or the store failed
     */
    @Nonnull
    public FlowReference update() throws Aff4Exception {
        return getFactory().getContentLockCoordinator().update(this);
    }
}
