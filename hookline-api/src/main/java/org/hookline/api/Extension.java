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

package org.hookline.api;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A resolved extension: the outcome of loading one descriptor of one package.
 *
 * <p>An extension is exactly one of two variants, fixed at construction:
 * <ul>
 *   <li>{@link Kind#LOADED} - see {@link LoadedExtension}, carries the loaded value</li>
 *   <li>{@link Kind#ERRORED} - see {@link ErroredExtension}, carries the load error</li>
 * </ul>
 *
 * <p>The kind is an explicit tag rather than inferred from which field is present, so
 * a load that legitimately produces {@code null} is still a loaded extension.
 */
public abstract class Extension {

    /**
     * Resolution outcome of an extension.
     */
    public enum Kind {
        LOADED,
        ERRORED
    }

    private final Kind kind;
    private final ExtensionDescriptor descriptor;
    private final String packageId;

    Extension(Kind kind, ExtensionDescriptor descriptor, String packageId) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        Preconditions.checkArgument(!Strings.nullToEmpty(packageId).isEmpty(), "packageId is required");
        this.packageId = packageId;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isLoaded() {
        return kind == Kind.LOADED;
    }

    public boolean isErrored() {
        return kind == Kind.ERRORED;
    }

    /**
     * Returns the descriptor this extension was resolved from.
     *
     * @return the original descriptor
     */
    public ExtensionDescriptor getDescriptor() {
        return descriptor;
    }

    public String getHook() {
        return descriptor.getHook();
    }

    public String getName() {
        return descriptor.getName();
    }

    public Map<String, Object> getProperties() {
        return descriptor.getProperties();
    }

    public Optional<Object> getProperty(String key) {
        return descriptor.getProperty(key);
    }

    /**
     * Returns the id of the package that contributed this extension.
     *
     * @return owning package id
     */
    public String getPackageId() {
        return packageId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Extension that = (Extension) o;
        return kind == that.kind
                && descriptor.equals(that.descriptor)
                && packageId.equals(that.packageId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, descriptor, packageId);
    }
}
