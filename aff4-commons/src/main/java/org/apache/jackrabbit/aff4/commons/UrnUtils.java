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
package org.apache.jackrabbit.aff4.commons;

import static com.google.common.base.Preconditions.checkArgument;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Utility methods to parse and build the textual form of an AFF4 URN.
 * <p>
 * A URN has the form {@code aff4:/<root-id>/<element>/...}. Only {@code /}
 * is a structural separator. Elements may contain any other character,
 * including backslashes and colons, which are never escaped. Repeated
 * separators inside an element's content are preserved.
 */
public final class UrnUtils {

    public static final String SCHEME = "aff4:";
    public static final String ROOT = SCHEME + "/";

    private UrnUtils() {
        // utility class
    }

    /**
     * Returns the canonical form of the given URN or bare path. A value
     * without scheme, such as {@code C.1234} or {@code /C.1234/fs}, is
     * anchored at the root. Any scheme other than {@code aff4} is rejected.
     *
     * @param urn the URN or path
     * @return the canonical URN
     * @throws IllegalArgumentException if the value is not a valid URN
     */
    @Nonnull
    public static String canonicalize(String urn) {
        String error = validate(urn);
        checkArgument(error == null, "Invalid URN [%s]: %s", urn, error);
        if (urn.startsWith(ROOT)) {
            return urn;
        }
        if (urn.startsWith("/")) {
            return SCHEME + urn;
        }
        return ROOT + urn;
    }

    /**
     * Checks the given value.
     *
     * @param urn the URN or path
     * @return the reason the value is not valid, or null if it is valid
     */
    @CheckForNull
    public static String validate(String urn) {
        if (urn == null || urn.isEmpty()) {
            return "empty";
        }
        for (int i = 0; i < urn.length(); i++) {
            if (Character.isISOControl(urn.charAt(i))) {
                return "control character at index " + i;
            }
        }
        if (urn.startsWith(SCHEME)) {
            if (!urn.startsWith(ROOT)) {
                return "not root-anchored";
            }
            return null;
        }
        int colon = urn.indexOf(':');
        int slash = urn.indexOf('/');
        if (colon > 0 && (slash < 0 || colon < slash)
                && urn.substring(0, colon).matches("[A-Za-z][A-Za-z0-9+.-]*")
                && urn.startsWith("//", colon + 1)) {
            return "unsupported scheme " + urn.substring(0, colon);
        }
        return null;
    }

    /**
     * Whether the URN is the root URN ({@code aff4:/}).
     *
     * @param urn the canonical URN
     * @return whether this is the root
     */
    public static boolean denotesRoot(String urn) {
        return ROOT.equals(urn);
    }

    /**
     * Appends a relative path to the URN. Exactly one separator is placed
     * at the boundary: a trailing separator of the URN and one leading
     * separator of the relative path are absorbed. Separators further
     * inside the relative path are kept as they are.
     *
     * @param urn the canonical URN
     * @param relative the relative path
     * @return the combined URN
     */
    @Nonnull
    public static String concat(String urn, String relative) {
        if (relative.isEmpty()) {
            return urn;
        }
        StringBuilder buff = new StringBuilder(urn.length() + relative.length() + 1);
        buff.append(urn);
        if (buff.charAt(buff.length() - 1) != '/') {
            buff.append('/');
        }
        if (relative.charAt(0) == '/') {
            buff.append(relative, 1, relative.length());
        } else {
            buff.append(relative);
        }
        return buff.toString();
    }

    /**
     * Get the last element of the URN. The name of the root is the empty
     * string.
     *
     * @param urn the canonical URN
     * @return the last element
     */
    @Nonnull
    public static String getName(String urn) {
        if (denotesRoot(urn)) {
            return "";
        }
        return urn.substring(urn.lastIndexOf('/') + 1);
    }

    /**
     * Get the parent of a URN. The parent of the root is the root.
     *
     * @param urn the canonical URN
     * @return the parent URN
     */
    @Nonnull
    public static String getParent(String urn) {
        if (denotesRoot(urn)) {
            return urn;
        }
        int pos = urn.lastIndexOf('/');
        if (pos < ROOT.length()) {
            return ROOT;
        }
        return urn.substring(0, pos);
    }

    /**
     * Calculate the number of elements in the URN. The root has zero
     * elements.
     *
     * @param urn the canonical URN
     * @return the number of elements
     */
    public static int getDepth(String urn) {
        if (denotesRoot(urn)) {
            return 0;
        }
        int count = 1;
        for (int i = ROOT.length(); i < urn.length(); i++) {
            if (urn.charAt(i) == '/') {
                count++;
            }
        }
        return count;
    }

    /**
     * Check if one URN is an ancestor of another.
     *
     * @param ancestor the ancestor URN
     * @param urn the potential offspring URN
     * @return true if the URN is an offspring of the ancestor
     */
    public static boolean isAncestor(String ancestor, String urn) {
        if (ancestor.equals(urn)) {
            return false;
        }
        if (denotesRoot(ancestor)) {
            return urn.startsWith(ROOT);
        }
        return urn.startsWith(ancestor) && urn.charAt(ancestor.length()) == '/';
    }

    /**
     * Relativize a URN with respect to an ancestor.
     *
     * @param ancestor the ancestor URN
     * @param urn the URN to relativize
     * @return the relative path, or the empty string if both are equal
     */
    @Nonnull
    public static String relativize(String ancestor, String urn) {
        if (ancestor.equals(urn)) {
            return "";
        }
        checkArgument(isAncestor(ancestor, urn), "Cannot relativize %s wrt. %s", urn, ancestor);
        if (denotesRoot(ancestor)) {
            return urn.substring(ROOT.length());
        }
        return urn.substring(ancestor.length() + 1);
    }
}
