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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Parent-first policy for package classloaders.
 *
 * <p>Mandatory prefixes always contain {@link ChildFirstClassLoader#DEFAULT_PARENT_FIRST_PACKAGES}.
 * Hosts append their own prefixes for the types they share with providers, typically the
 * value types their hooks produce.
 */
public final class ClassLoadingPolicy {

    private final List<String> mandatoryParentFirstPrefixes;
    private final List<String> hostParentFirstPrefixes;

    public ClassLoadingPolicy(List<String> hostParentFirstPrefixes) {
        LinkedHashSet<String> mandatory = new LinkedHashSet<>(ChildFirstClassLoader.DEFAULT_PARENT_FIRST_PACKAGES);
        LinkedHashSet<String> host = new LinkedHashSet<>();
        addPrefixes(host, hostParentFirstPrefixes);
        host.removeAll(mandatory);

        this.mandatoryParentFirstPrefixes = Collections.unmodifiableList(new ArrayList<>(mandatory));
        this.hostParentFirstPrefixes = Collections.unmodifiableList(new ArrayList<>(host));
    }

    public static ClassLoadingPolicy defaultPolicy() {
        return new ClassLoadingPolicy(null);
    }

    public List<String> getMandatoryParentFirstPrefixes() {
        return mandatoryParentFirstPrefixes;
    }

    public List<String> getHostParentFirstPrefixes() {
        return hostParentFirstPrefixes;
    }

    public List<String> toParentFirstPackages() {
        List<String> merged = new ArrayList<>(mandatoryParentFirstPrefixes);
        merged.addAll(hostParentFirstPrefixes);
        return merged;
    }

    private static void addPrefixes(LinkedHashSet<String> target, List<String> prefixes) {
        if (prefixes == null) {
            return;
        }
        for (String prefix : prefixes) {
            if (prefix == null) {
                continue;
            }
            String trimmed = prefix.trim();
            if (!trimmed.isEmpty()) {
                target.add(trimmed);
            }
        }
    }

    @Override
    public String toString() {
        return "ClassLoadingPolicy{hostParentFirstPrefixes=" + hostParentFirstPrefixes + '}';
    }
}
