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

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration of a {@link DirectoryPackageSource}.
 *
 * <p>Recognized properties:
 * <ul>
 *   <li>{@value #PLUGIN_ROOTS} - comma separated plugin root directories</li>
 *   <li>{@value #POLL_INTERVAL_MS} - watch poll interval in milliseconds, default
 *       {@value #DEFAULT_POLL_INTERVAL_MS}</li>
 *   <li>{@value #PARENT_FIRST_PREFIXES} - comma separated class name prefixes loaded
 *       parent-first in addition to the mandatory ones</li>
 * </ul>
 */
public final class DirectoryPackageSourceConfig {

    public static final String PLUGIN_ROOTS = "hookline.plugin.roots";
    public static final String POLL_INTERVAL_MS = "hookline.plugin.poll_interval_ms";
    public static final String PARENT_FIRST_PREFIXES = "hookline.plugin.parent_first_prefixes";
    public static final String DEFAULT_RESOURCE = "hookline.properties";
    public static final long DEFAULT_POLL_INTERVAL_MS = 2000L;

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final List<Path> pluginRoots;
    private final Duration pollInterval;
    private final ClassLoadingPolicy classLoadingPolicy;

    private DirectoryPackageSourceConfig(Builder builder) {
        this.pluginRoots = ImmutableList.copyOf(builder.pluginRoots);
        this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
        Preconditions.checkArgument(!pollInterval.isNegative() && !pollInterval.isZero(),
                "poll interval must be positive: %s", pollInterval);
        this.classLoadingPolicy = new ClassLoadingPolicy(builder.parentFirstPrefixes);
    }

    /**
     * Build a configuration from properties.
     *
     * @param properties configuration properties
     * @return configuration
     * @throws IllegalArgumentException if a value is malformed
     */
    public static DirectoryPackageSourceConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        Builder builder = builder();
        for (String root : LIST_SPLITTER.split(Strings.nullToEmpty(properties.getProperty(PLUGIN_ROOTS)))) {
            builder.pluginRoot(Paths.get(root));
        }
        String interval = properties.getProperty(POLL_INTERVAL_MS);
        if (!Strings.isNullOrEmpty(interval)) {
            try {
                builder.pollInterval(Duration.ofMillis(Long.parseLong(interval.trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + POLL_INTERVAL_MS + ": " + interval, e);
            }
        }
        builder.parentFirstPrefixes(LIST_SPLITTER.splitToList(
                Strings.nullToEmpty(properties.getProperty(PARENT_FIRST_PREFIXES))));
        return builder.build();
    }

    /**
     * Load a configuration from a classpath resource.
     *
     * @param classLoader classloader to look the resource up with
     * @param resource resource name, e.g. {@value #DEFAULT_RESOURCE}
     * @return configuration
     * @throws IOException if the resource is missing or unreadable
     */
    public static DirectoryPackageSourceConfig load(ClassLoader classLoader, String resource) throws IOException {
        Objects.requireNonNull(classLoader, "classLoader");
        Objects.requireNonNull(resource, "resource");
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Configuration resource not found: " + resource);
            }
            Properties properties = new Properties();
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            return fromProperties(properties);
        }
    }

    public List<Path> getPluginRoots() {
        return pluginRoots;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public ClassLoadingPolicy getClassLoadingPolicy() {
        return classLoadingPolicy;
    }

    @Override
    public String toString() {
        return "DirectoryPackageSourceConfig{"
                + "pluginRoots=" + pluginRoots
                + ", pollInterval=" + pollInterval
                + ", classLoadingPolicy=" + classLoadingPolicy
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link DirectoryPackageSourceConfig}.
     */
    public static final class Builder {
        private final List<Path> pluginRoots = new ArrayList<>();
        private Duration pollInterval = Duration.ofMillis(DEFAULT_POLL_INTERVAL_MS);
        private List<String> parentFirstPrefixes = new ArrayList<>();

        private Builder() {
        }

        public Builder pluginRoot(Path root) {
            this.pluginRoots.add(Objects.requireNonNull(root, "root"));
            return this;
        }

        public Builder pluginRoots(List<Path> roots) {
            for (Path root : Objects.requireNonNull(roots, "roots")) {
                pluginRoot(root);
            }
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder parentFirstPrefixes(List<String> prefixes) {
            this.parentFirstPrefixes = prefixes != null ? new ArrayList<>(prefixes) : new ArrayList<>();
            return this;
        }

        public DirectoryPackageSourceConfig build() {
            return new DirectoryPackageSourceConfig(this);
        }
    }
}
