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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static declaration of one extension contributed by a package.
 *
 * <p>A descriptor names the hook it implements and carries a display name plus
 * an open-ended set of hook-specific properties. Descriptors are owned by their
 * {@link PluginPackage} and are immutable once built.
 *
 * <pre>{@code
 * ExtensionDescriptor descriptor = ExtensionDescriptor.builder()
 *         .hook("render")
 *         .name("markdown")
 *         .property("mimeType", "text/markdown")
 *         .build();
 * }</pre>
 */
public final class ExtensionDescriptor {

    private final String hook;
    private final String name;
    private final Map<String, Object> properties;

    private ExtensionDescriptor(Builder builder) {
        Preconditions.checkArgument(!Strings.nullToEmpty(builder.hook).trim().isEmpty(), "hook is required");
        this.hook = builder.hook;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    }

    /**
     * Returns the hook this extension implements.
     *
     * @return hook name, never blank
     */
    public String getHook() {
        return hook;
    }

    /**
     * Returns the display name of this extension.
     *
     * @return extension name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the hook-specific properties in declaration order.
     *
     * @return immutable map of properties
     */
    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * Gets a hook-specific property.
     *
     * @param key property key
     * @return optional property value
     */
    public Optional<Object> getProperty(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    /**
     * Checks whether this descriptor implements the given hook.
     *
     * @param hookName hook to test
     * @return true if the hook names are equal
     */
    public boolean implementsHook(String hookName) {
        return hook.equals(hookName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExtensionDescriptor that = (ExtensionDescriptor) o;
        return hook.equals(that.hook)
                && name.equals(that.name)
                && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hook, name, properties);
    }

    @Override
    public String toString() {
        return "ExtensionDescriptor{"
                + "hook='" + hook + '\''
                + ", name='" + name + '\''
                + ", properties=" + properties.size() + " entries"
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with values from this descriptor.
     *
     * @return builder with copied values
     */
    public Builder toBuilder() {
        return new Builder()
                .hook(hook)
                .name(name)
                .properties(properties);
    }

    /**
     * Builder for {@link ExtensionDescriptor}.
     */
    public static final class Builder {
        private String hook;
        private String name;
        private Map<String, Object> properties = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder hook(String hook) {
            this.hook = hook;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder properties(Map<String, ?> properties) {
            this.properties = properties != null ? new LinkedHashMap<>(properties) : new LinkedHashMap<>();
            return this;
        }

        public Builder property(String key, Object value) {
            this.properties.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public ExtensionDescriptor build() {
            return new ExtensionDescriptor(this);
        }
    }
}
