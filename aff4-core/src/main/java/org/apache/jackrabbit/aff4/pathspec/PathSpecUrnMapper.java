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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Iterator;

import javax.annotation.Nonnull;

import org.apache.jackrabbit.aff4.api.Urn;

/**
 * Maps a path specification of a client file to the URN of the object
 * mirroring it, {@code aff4:/<client-id>/fs/<tag>/<path>/...}.
 * <p>
 * The raw paths are kept as they are: backslashes, drive and volume tokens
 * and {@code :name} stream suffixes are not escaped and repeated separators
 * are not collapsed. Segments are joined with a single {@code /}, which
 * replaces one leading {@code /} of the joined segment.
 */
public final class PathSpecUrnMapper {

    /**
     * Size of the unit an image offset is expressed in.
     */
    static final int SECTOR_SIZE = 512;

    private PathSpecUrnMapper() {
    }

    /**
     * @param pathSpec the path specification
     * @param clientId the client id, for example {@code C.1234567812345678}
     * @return the URN of the file
     * @throws IllegalArgumentException if the client id is not a valid URN
     *          element
     */
    @Nonnull
    public static Urn toUrn(@Nonnull PathSpec pathSpec, @Nonnull String clientId) {
        return toUrn(pathSpec, Urn.parse(checkNotNull(clientId)));
    }

    @Nonnull
    public static Urn toUrn(@Nonnull PathSpec pathSpec, @Nonnull Urn client) {
        StringBuilder buff = new StringBuilder(client.add("fs").toString());
        buff.append('/').append(getTag(pathSpec));
        for (PathSpec.Segment segment : pathSpec) {
            String path = getEffectivePath(segment);
            buff.append('/');
            buff.append(path, path.startsWith("/") ? 1 : 0, path.length());
        }
        return Urn.parse(buff.toString());
    }

    /**
     * The tag of the outermost segment. A raw device read by the filesystem
     * parser is mapped into the {@code tsk} tree.
     */
    static String getTag(PathSpec pathSpec) {
        Iterator<PathSpec.Segment> it = pathSpec.iterator();
        PathType outer = it.next().getPathType();
        if (outer == PathType.OS && it.hasNext() && it.next().getPathType() == PathType.TSK) {
            return PathType.TSK.getTag();
        }
        return outer.getTag();
    }

    static String getEffectivePath(PathSpec.Segment segment) {
        String path = segment.getPath();
        String mountPoint = segment.getMountPoint();
        if (mountPoint != null && path.startsWith(mountPoint)) {
            path = path.substring(mountPoint.length());
        }
        StringBuilder buff = new StringBuilder(path);
        if (segment.getOffset() != null) {
            buff.append(':').append(segment.getOffset() / SECTOR_SIZE);
        }
        if (segment.getStreamName() != null) {
            buff.append(':').append(segment.getStreamName());
        }
        return buff.toString();
    }
}
