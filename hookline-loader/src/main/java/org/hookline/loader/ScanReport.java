// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.hookline.loader;

import org.hookline.api.PluginPackage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result summary of one directory scan.
 */
public final class ScanReport {

    private final List<PluginPackage> packages;
    private final List<ScanFailure> failures;
    private final int rootsScanned;
    private final int rootsAvailable;
    private final int dirsScanned;
    private final String fingerprint;

    public ScanReport(List<? extends PluginPackage> packages, List<ScanFailure> failures, int rootsScanned,
            int rootsAvailable, int dirsScanned, String fingerprint) {
        this.packages = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(packages, "packages")));
        this.failures = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(failures, "failures")));
        this.rootsScanned = rootsScanned;
        this.rootsAvailable = rootsAvailable;
        this.dirsScanned = dirsScanned;
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
    }

    /**
     * Packages loaded successfully, roots in configured order and directories in name order.
     *
     * @return loaded packages
     */
    public List<PluginPackage> getPackages() {
        return packages;
    }

    public List<ScanFailure> getFailures() {
        return failures;
    }

    public int getRootsScanned() {
        return rootsScanned;
    }

    /**
     * Number of roots that exist and could be listed.
     *
     * @return usable roots
     */
    public int getRootsAvailable() {
        return rootsAvailable;
    }

    public int getDirsScanned() {
        return dirsScanned;
    }

    /**
     * Identity of the loaded package set; equal fingerprints mean the same packages,
     * jars and jar timestamps.
     *
     * @return fingerprint string
     */
    public String getFingerprint() {
        return fingerprint;
    }
}
