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

import org.hookline.api.ExtensionDescriptor;
import org.hookline.api.ExtensionLoadException;
import org.hookline.api.PackageMetadata;
import org.hookline.api.PluginPackage;
import org.hookline.api.spi.PackageProvider;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Package loaded from a plugin directory through its own classloader.
 *
 * <p>Extension loads are delegated to the directory's {@link PackageProvider} with the
 * package classloader installed as the thread context classloader.
 */
public final class ClassLoaderPackage implements PluginPackage, Closeable {
    private static final Logger LOG = LogManager.getLogger(ClassLoaderPackage.class);

    private final String id;
    private final Path packageDir;
    private final List<Path> resolvedJars;
    private final ClassLoader classLoader;
    private final PackageProvider provider;
    private final PackageMetadata metadata;
    private final List<ExtensionDescriptor> extensions;
    private final String fingerprint;
    private final Instant loadedAt;

    public ClassLoaderPackage(String id, Path packageDir, List<Path> resolvedJars, ClassLoader classLoader,
            PackageProvider provider, PackageMetadata metadata, List<ExtensionDescriptor> extensions,
            String fingerprint, Instant loadedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.packageDir = Objects.requireNonNull(packageDir, "packageDir");
        this.resolvedJars = ImmutableList.copyOf(Objects.requireNonNull(resolvedJars, "resolvedJars"));
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.extensions = ImmutableList.copyOf(Objects.requireNonNull(extensions, "extensions"));
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.loadedAt = Objects.requireNonNull(loadedAt, "loadedAt");
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
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        thread.setContextClassLoader(classLoader);
        try {
            CompletionStage<Object> stage = provider.load(descriptor);
            if (stage == null) {
                return CompletableFuture.failedFuture(new ExtensionLoadException(
                        "Provider of package " + id + " returned no result for extension " + descriptor.getName()));
            }
            return stage;
        } catch (RuntimeException | LinkageError e) {
            return CompletableFuture.failedFuture(new ExtensionLoadException(
                    "Provider of package " + id + " failed to load extension " + descriptor.getName(), e));
        } finally {
            thread.setContextClassLoader(previous);
        }
    }

    public Path getPackageDir() {
        return packageDir;
    }

    public List<Path> getResolvedJars() {
        return resolvedJars;
    }

    public ClassLoader getClassLoader() {
        return classLoader;
    }

    public PackageProvider getProvider() {
        return provider;
    }

    /**
     * Fingerprint of the directory contents this package was loaded from.
     *
     * @return jar paths, sizes and modification times
     */
    public String getFingerprint() {
        return fingerprint;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    /**
     * Close the package classloader. Values already loaded from it may stop working.
     */
    @Override
    public void close() {
        if (!(classLoader instanceof Closeable)) {
            return;
        }
        try {
            ((Closeable) classLoader).close();
        } catch (IOException e) {
            LOG.warn("Failed to close classloader of package {}", id, e);
        }
    }

    @Override
    public String toString() {
        return "ClassLoaderPackage{id='" + id + "', packageDir=" + packageDir
                + ", jars=" + resolvedJars.size() + ", extensions=" + extensions.size() + '}';
    }
}
