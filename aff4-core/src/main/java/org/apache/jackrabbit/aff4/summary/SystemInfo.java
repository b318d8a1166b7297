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
package org.apache.jackrabbit.aff4.summary;

import javax.annotation.CheckForNull;
import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Operating system facts of a client. Fields that were never collected are
 * null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"node", "system", "release", "version", "kernel", "fqdn", "machine", "installDate"})
public final class SystemInfo {

    private final String node;

    private final String system;

    private final String release;

    private final String version;

    private final String kernel;

    private final String fqdn;

    private final String machine;

    private final Long installDate;

    public SystemInfo(@Nullable String node, @Nullable String system, @Nullable String release,
                      @Nullable String version, @Nullable String kernel, @Nullable String fqdn,
                      @Nullable String machine, @Nullable Long installDate) {
        this.node = node;
        this.system = system;
        this.release = release;
        this.version = version;
        this.kernel = kernel;
        this.fqdn = fqdn;
        this.machine = machine;
        this.installDate = installDate;
    }

    /**
     * @return the hostname
     */
    @CheckForNull
    public String getNode() {
        return node;
    }

    @CheckForNull
    public String getSystem() {
        return system;
    }

    @CheckForNull
    public String getRelease() {
        return release;
    }

    @CheckForNull
    public String getVersion() {
        return version;
    }

    @CheckForNull
    public String getKernel() {
        return kernel;
    }

    @CheckForNull
    public String getFqdn() {
        return fqdn;
    }

    /**
     * @return the architecture
     */
    @CheckForNull
    public String getMachine() {
        return machine;
    }

    @CheckForNull
    public Long getInstallDate() {
        return installDate;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(node, system, release, version, kernel, fqdn, machine, installDate);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        } else if (!(obj instanceof SystemInfo)) {
            return false;
        }
        SystemInfo other = (SystemInfo) obj;
        return Objects.equal(node, other.node)
                && Objects.equal(system, other.system)
                && Objects.equal(release, other.release)
                && Objects.equal(version, other.version)
                && Objects.equal(kernel, other.kernel)
                && Objects.equal(fqdn, other.fqdn)
                && Objects.equal(machine, other.machine)
                && Objects.equal(installDate, other.installDate);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("node", node)
                .add("system", system)
                .add("release", release)
                .add("version", version)
                .add("kernel", kernel)
                .add("fqdn", fqdn)
                .add("machine", machine)
                .add("installDate", installDate)
                .toString();
    }
}
