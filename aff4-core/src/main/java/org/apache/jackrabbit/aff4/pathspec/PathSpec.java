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
package org.apache.jackrabbit.aff4.pathspec;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Iterator;
import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A chain of nested path segments, outermost first. For example a file
 * inside an NTFS volume is the OS path of the raw device followed by the
 * TSK path of the file within the volume.
 * <p>
 * Path specifications are immutable; {@link #append(Segment)} returns a
 * new chain.
 */
public final class PathSpec implements Iterable<PathSpec.Segment> {

    private final List<Segment> segments;

    private PathSpec(List<Segment> segments) {
        checkArgument(!segments.isEmpty(), "Empty path specification");
        this.segments = ImmutableList.copyOf(segments);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static PathSpec fromSegments(List<Segment> segments) {
        return new PathSpec(segments);
    }

    /**
     * @param type the path type
     * @param path the raw path
     * @return a chain of a single segment
     */
    @Nonnull
    public static PathSpec of(@Nonnull PathType type, @Nonnull String path) {
        return of(segment(type, path).build());
    }

    @Nonnull
    public static PathSpec of(@Nonnull Segment segment) {
        return new PathSpec(ImmutableList.of(segment));
    }

    public static Segment.Builder segment(@Nonnull PathType type, @Nonnull String path) {
        return new Segment.Builder(type, path);
    }

    /**
     * @param segment the innermost segment to add
     * @return the extended chain
     */
    @Nonnull
    public PathSpec append(@Nonnull Segment segment) {
        return new PathSpec(ImmutableList.<Segment>builder().addAll(segments).add(checkNotNull(segment)).build());
    }

    @Nonnull
    public PathSpec append(@Nonnull PathType type, @Nonnull String path) {
        return append(segment(type, path).build());
    }

    @Nonnull
    public Segment first() {
        return segments.get(0);
    }

    /**
     * @return the innermost segment
     */
    @Nonnull
    public Segment last() {
        return segments.get(segments.size() - 1);
    }

    public int size() {
        return segments.size();
    }

    @JsonValue
    @Nonnull
    public List<Segment> getSegments() {
        return segments;
    }

    @Override
    public Iterator<Segment> iterator() {
        return segments.iterator();
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof PathSpec)) {
            return false;
        }
        return segments.equals(((PathSpec) obj).segments);
    }

    @Override
    public String toString() {
        return segments.toString();
    }

    /**
     * One element of a path specification.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"pathType", "path", "mountPoint", "offset", "streamName"})
    public static final class Segment {

        private final PathType pathType;

        private final String path;

        private final String mountPoint;

        private final Long offset;

        private final String streamName;

        @JsonCreator
        Segment(@JsonProperty("pathType") @Nonnull PathType pathType,
                @JsonProperty("path") @Nonnull String path,
                @JsonProperty("mountPoint") @Nullable String mountPoint,
                @JsonProperty("offset") @Nullable Long offset,
                @JsonProperty("streamName") @Nullable String streamName) {
            checkArgument(offset == null || offset >= 0, "Negative offset: %s", offset);
            this.pathType = checkNotNull(pathType);
            this.path = checkNotNull(path);
            this.mountPoint = mountPoint;
            this.offset = offset;
            this.streamName = streamName;
        }

        @Nonnull
        public PathType getPathType() {
            return pathType;
        }

        /**
         * @return the raw path, including any mount point
         */
        @Nonnull
        public String getPath() {
            return path;
        }

        @CheckForNull
        public String getMountPoint() {
            return mountPoint;
        }

        /**
         * @return the byte offset of an image within its container
         */
        @CheckForNull
        public Long getOffset() {
            return offset;
        }

        /**
         * @return the name of an alternate data stream
         */
        @CheckForNull
        public String getStreamName() {
            return streamName;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(pathType, path, mountPoint, offset, streamName);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            } else if (!(obj instanceof Segment)) {
                return false;
            }
            Segment other = (Segment) obj;
            return pathType == other.pathType
                    && path.equals(other.path)
                    && Objects.equal(mountPoint, other.mountPoint)
                    && Objects.equal(offset, other.offset)
                    && Objects.equal(streamName, other.streamName);
        }

        @Override
        public String toString() {
            return pathType + ":" + path;
        }

        public static final class Builder {

            private final PathType pathType;

            private final String path;

            private String mountPoint;

            private Long offset;

            private String streamName;

            private Builder(PathType pathType, String path) {
                this.pathType = checkNotNull(pathType);
                this.path = checkNotNull(path);
            }

            public Builder mountPoint(@Nonnull String mountPoint) {
                this.mountPoint = checkNotNull(mountPoint);
                return this;
            }

            public Builder offset(long offset) {
                this.offset = offset;
                return this;
            }

            public Builder streamName(@Nonnull String streamName) {
                this.streamName = checkNotNull(streamName);
                return this;
            }

            public Segment build() {
                return new Segment(pathType, path, mountPoint, offset, streamName);
            }
        }
    }
}
