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
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Immutable {@link PluginPackage} backed by an {@link ExtensionLoader}.
 *
 * <p>Suitable for packages assembled in code, e.g. built-in extensions or tests.
 */
public final class SimplePackage implements PluginPackage {

    private final String id;
    private final PackageMetadata metadata;
    private final List<ExtensionDescriptor> extensions;
    private final ExtensionLoader loader;

    private SimplePackage(Builder builder) {
        Preconditions.checkArgument(!Strings.nullToEmpty(builder.id).trim().isEmpty(), "id is required");
        this.id = builder.id;
        this.metadata = builder.metadata != null ? builder.metadata : PackageMetadata.of(builder.id);
        this.extensions = builder.extensions.build();
        this.loader = Objects.requireNonNull(builder.loader, "loader is required");
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public PackageMetadata getMetadata() {
        return metadata;
    }

    @Override
    public List<ExtensionDescriptor> getExtensions() {
        return extensions;
    }

    @Override
    public CompletionStage<Object> load(ExtensionDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (!extensions.contains(descriptor)) {
            return CompletableFuture.failedFuture(new ExtensionLoadException(
                    "Extension " + descriptor.getName() + " is not declared by package " + id));
        }
        return loader.load(descriptor);
    }

    @Override
    public String toString() {
        return "SimplePackage{id='" + id + "', extensions=" + extensions.size() + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link SimplePackage}.
     */
    public static final class Builder {
        private String id;
        private PackageMetadata metadata;
        private final ImmutableList.Builder<ExtensionDescriptor> extensions = ImmutableList.builder();
        private ExtensionLoader loader;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder metadata(PackageMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder extension(ExtensionDescriptor descriptor) {
            this.extensions.add(Objects.requireNonNull(descriptor, "descriptor"));
            return this;
        }

        public Builder extensions(List<ExtensionDescriptor> descriptors) {
            this.extensions.addAll(Objects.requireNonNull(descriptors, "descriptors"));
            return this;
        }

        public Builder loader(ExtensionLoader loader) {
            this.loader = loader;
            return this;
        }

        public SimplePackage build() {
            return new SimplePackage(this);
        }
    }
}
