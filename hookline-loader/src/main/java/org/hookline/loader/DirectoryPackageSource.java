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
import org.hookline.api.PackageListener;
import org.hookline.api.PackageMetadata;
import org.hookline.api.PackageSource;
import org.hookline.api.PackageSourceException;
import org.hookline.api.PluginPackage;
import org.hookline.api.WatchCancellation;
import org.hookline.api.spi.PackageProvider;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory-driven {@link PackageSource}.
 *
 * <h2>Responsibilities</h2>
 *
 * <p>A {@link #scan()}:
 * <ol>
 *   <li>Lists each configured plugin root and treats its direct subdirectories as package
 *       directories; the directory name is the package id.</li>
 *   <li>Resolves package jars using the convention {@code packageDir/*.jar + packageDir/lib/*.jar}.</li>
 *   <li>Creates a per-package {@link ChildFirstClassLoader} with the configured
 *       parent-first policy.</li>
 *   <li>Discovers exactly one {@link PackageProvider} via {@link ServiceLoader} and reads
 *       its metadata and extension descriptors.</li>
 *   <li>Returns a {@link ScanReport} with the loaded packages and the staged failures.</li>
 * </ol>
 *
 * <p>{@link #find()} runs one scan on the source executor. {@link #watch(PackageListener)}
 * scans immediately and then polls at the configured interval, notifying the listener only
 * when the set of packages changed.
 *
 * <h2>Failure Semantics</h2>
 *
 * <p>Failures are staged ({@code scan}, {@code resolve}, {@code createClassLoader},
 * {@code discover}, {@code instantiate}, {@code conflict}). A failing package directory is
 * skipped and does not stop the others. {@code find()} fails only when no configured root
 * could be listed at all. A watch whose scan throws unexpectedly is terminated through
 * {@link PackageListener#onError(Throwable)}.
 *
 * <h2>Reuse</h2>
 *
 * <p>Package directories are fingerprinted by jar path, size and modification time. An
 * unchanged directory keeps its {@link ClassLoaderPackage} across scans, and an unchanged
 * failing directory is not retried; removed or changed directories have their classloader
 * closed. When two roots contain the same directory name, the first one wins and later ones
 * are recorded as {@code conflict}.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Scans are serialized by a lock. Watches share the single-threaded scan executor.
 */
public class DirectoryPackageSource implements PackageSource, Closeable {
    private static final Logger LOG = LogManager.getLogger(DirectoryPackageSource.class);
    private static final String PROVIDER_SERVICE = "META-INF/services/" + PackageProvider.class.getName();

    private final DirectoryPackageSourceConfig config;
    private final ClassLoader parent;
    private final ScheduledExecutorService executor;
    private final Object scanLock = new Object();
    private final Map<Path, ClassLoaderPackage> packagesByDir = new HashMap<>();
    private final Map<Path, FailedDirectory> failedByDir = new HashMap<>();
    private final List<PollingWatch> watches = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public DirectoryPackageSource(DirectoryPackageSourceConfig config) {
        this(config, DirectoryPackageSource.class.getClassLoader());
    }

    public DirectoryPackageSource(DirectoryPackageSourceConfig config, ClassLoader parent) {
        this.config = Objects.requireNonNull(config, "config");
        this.parent = Objects.requireNonNull(parent, "parent");
        this.executor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("hookline-package-scan-%d").setDaemon(true).build());
    }

    @Override
    public CompletionStage<List<PluginPackage>> find() {
        try {
            return CompletableFuture.supplyAsync(this::findPackages, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new PackageSourceException("Package source is closed", e));
        }
    }

    @Override
    public WatchCancellation watch(PackageListener listener) {
        Objects.requireNonNull(listener, "listener");
        PollingWatch watch = new PollingWatch(listener);
        if (closed) {
            listener.onError(new PackageSourceException("Package source is closed"));
            return watch::cancel;
        }
        watches.add(watch);
        try {
            watch.future = executor.scheduleWithFixedDelay(watch::poll, 0L,
                    config.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            watches.remove(watch);
            listener.onError(new PackageSourceException("Package source is closed", e));
        }
        return watch::cancel;
    }

    /**
     * Scan all plugin roots now, reusing packages whose directories did not change.
     *
     * @return scan report
     */
    public ScanReport scan() {
        List<Path> packageDirs = new ArrayList<>();
        List<ScanFailure> failures = new ArrayList<>();

        int rootsScanned = 0;
        int rootsAvailable = 0;
        for (Path root : config.getPluginRoots()) {
            rootsScanned++;
            if (collectPackageDirs(root, packageDirs, failures)) {
                rootsAvailable++;
            }
        }

        List<PluginPackage> loaded = new ArrayList<>();
        StringBuilder fingerprint = new StringBuilder();
        synchronized (scanLock) {
            Set<String> seenIds = new HashSet<>();
            Set<Path> retained = new HashSet<>();
            for (Path packageDir : packageDirs) {
                String packageId = packageDir.getFileName().toString();
                if (!seenIds.add(packageId)) {
                    failures.add(new ScanFailure(packageDir, ScanFailure.STAGE_CONFLICT,
                            "Duplicate package id: " + packageId, null));
                    continue;
                }
                retained.add(packageDir);
                try {
                    ClassLoaderPackage pkg = loadOrReuse(packageId, packageDir);
                    loaded.add(pkg);
                    fingerprint.append(packageId).append('=').append(pkg.getFingerprint()).append(';');
                } catch (PackageLoadException e) {
                    failures.add(e.toScanFailure());
                }
            }
            evictRemoved(retained);
        }

        for (ScanFailure failure : failures) {
            LOG.warn("Skip package due to scan failure: path={}, stage={}, message={}",
                    failure.getPath(), failure.getStage(), failure.getMessage(), failure.getCause());
        }
        LOG.debug("Scanned {} plugin roots: packages={}, failures={}", rootsScanned, loaded.size(), failures.size());
        return new ScanReport(loaded, failures, rootsScanned, rootsAvailable, packageDirs.size(),
                fingerprint.toString());
    }

    /**
     * Stop all watches and the scan executor, and close every package classloader.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (PollingWatch watch : watches) {
            watch.cancel();
        }
        executor.shutdownNow();
        synchronized (scanLock) {
            for (ClassLoaderPackage pkg : packagesByDir.values()) {
                pkg.close();
            }
            packagesByDir.clear();
            failedByDir.clear();
        }
        LOG.info("Closed directory package source: roots={}", config.getPluginRoots());
    }

    public DirectoryPackageSourceConfig getConfig() {
        return config;
    }

    private List<PluginPackage> findPackages() {
        ScanReport report = scan();
        if (report.getRootsScanned() > 0 && report.getRootsAvailable() == 0) {
            throw new CompletionException(new PackageSourceException(
                    "No plugin root could be scanned: " + config.getPluginRoots()));
        }
        return report.getPackages();
    }

    private boolean collectPackageDirs(Path root, List<Path> packageDirs, List<ScanFailure> failures) {
        Path normalized = normalize(root);
        if (!Files.exists(normalized)) {
            failures.add(new ScanFailure(normalized, ScanFailure.STAGE_SCAN,
                    "Plugin root does not exist: " + normalized, null));
            return false;
        }
        if (!Files.isDirectory(normalized)) {
            failures.add(new ScanFailure(normalized, ScanFailure.STAGE_SCAN,
                    "Plugin root is not a directory: " + normalized, null));
            return false;
        }

        try (Stream<Path> stream = Files.list(normalized)) {
            packageDirs.addAll(stream.filter(Files::isDirectory)
                    .map(DirectoryPackageSource::normalize)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList()));
            return true;
        } catch (IOException e) {
            failures.add(new ScanFailure(normalized, ScanFailure.STAGE_SCAN,
                    "Failed to list plugin root: " + normalized, e));
            return false;
        }
    }

    private ClassLoaderPackage loadOrReuse(String packageId, Path packageDir) throws PackageLoadException {
        List<Path> jars = resolveJars(packageDir);
        String dirFingerprint = fingerprint(jars, packageDir);

        ClassLoaderPackage existing = packagesByDir.get(packageDir);
        if (existing != null) {
            if (existing.getFingerprint().equals(dirFingerprint)) {
                return existing;
            }
            LOG.info("Package directory changed, reloading: packageId={}, packageDir={}", packageId, packageDir);
            packagesByDir.remove(packageDir);
            existing.close();
        }
        FailedDirectory failed = failedByDir.get(packageDir);
        if (failed != null && failed.fingerprint.equals(dirFingerprint)) {
            throw failed.exception;
        }

        try {
            ClassLoaderPackage pkg = loadPackage(packageId, packageDir, jars, dirFingerprint);
            failedByDir.remove(packageDir);
            packagesByDir.put(packageDir, pkg);
            LOG.info("Loaded package: packageId={}, packageDir={}, jarCount={}, extensions={}",
                    packageId, packageDir, jars.size(), pkg.getExtensions().size());
            return pkg;
        } catch (PackageLoadException e) {
            failedByDir.put(packageDir, new FailedDirectory(dirFingerprint, e));
            throw e;
        }
    }

    private ClassLoaderPackage loadPackage(String packageId, Path packageDir, List<Path> jars, String dirFingerprint)
            throws PackageLoadException {
        URL[] urls = toUrls(jars, packageDir);
        ClassLoader filteredParent = new ServiceResourceFilteringParentClassLoader(parent);

        ChildFirstClassLoader classLoader;
        try {
            classLoader = new ChildFirstClassLoader(packageId, urls, filteredParent,
                    config.getClassLoadingPolicy().toParentFirstPackages());
        } catch (RuntimeException e) {
            throw new PackageLoadException(packageDir, ScanFailure.STAGE_CREATE_CLASSLOADER,
                    "Failed to create classloader for " + packageDir, e);
        }

        PackageProvider provider;
        PackageMetadata metadata;
        List<ExtensionDescriptor> extensions;
        try {
            provider = discoverSingleProvider(classLoader, packageDir);
            try {
                metadata = provider.metadata();
                extensions = provider.extensions();
            } catch (RuntimeException | LinkageError e) {
                throw new PackageLoadException(packageDir, ScanFailure.STAGE_INSTANTIATE,
                        "Failed to read package declaration from provider in " + packageDir, e);
            }
            if (metadata == null || extensions == null) {
                throw new PackageLoadException(packageDir, ScanFailure.STAGE_INSTANTIATE,
                        "Provider returned no metadata or extensions in " + packageDir, null);
            }
        } catch (PackageLoadException e) {
            closeQuietly(classLoader);
            throw e;
        }

        return new ClassLoaderPackage(packageId, packageDir, jars, classLoader, provider, metadata, extensions,
                dirFingerprint, Instant.now());
    }

    private List<Path> resolveJars(Path packageDir) throws PackageLoadException {
        List<Path> jars = new ArrayList<>();
        collectJars(packageDir, jars);

        Path libDir = packageDir.resolve("lib");
        if (Files.isDirectory(libDir)) {
            collectJars(libDir, jars);
        }

        if (jars.isEmpty()) {
            throw new PackageLoadException(packageDir, ScanFailure.STAGE_RESOLVE,
                    "No jar found under package directory: " + packageDir, null);
        }
        return jars;
    }

    private void collectJars(Path directory, List<Path> target) throws PackageLoadException {
        try (Stream<Path> stream = Files.list(directory)) {
            target.addAll(stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".jar"))
                    .map(DirectoryPackageSource::normalize)
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            throw new PackageLoadException(directory, ScanFailure.STAGE_RESOLVE,
                    "Failed to resolve jars under " + directory, e);
        }
    }

    private static String fingerprint(List<Path> jars, Path packageDir) throws PackageLoadException {
        StringBuilder builder = new StringBuilder();
        for (Path jar : jars) {
            try {
                builder.append(jar).append(':')
                        .append(Files.size(jar)).append(':')
                        .append(Files.getLastModifiedTime(jar).toMillis()).append(',');
            } catch (IOException e) {
                throw new PackageLoadException(packageDir, ScanFailure.STAGE_RESOLVE,
                        "Failed to read jar attributes: " + jar, e);
            }
        }
        return builder.toString();
    }

    private static URL[] toUrls(List<Path> jars, Path packageDir) throws PackageLoadException {
        URL[] urls = new URL[jars.size()];
        for (int i = 0; i < jars.size(); i++) {
            try {
                urls[i] = jars.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new PackageLoadException(packageDir, ScanFailure.STAGE_RESOLVE,
                        "Invalid jar path: " + jars.get(i), e);
            }
        }
        return urls;
    }

    private static PackageProvider discoverSingleProvider(ClassLoader classLoader, Path packageDir)
            throws PackageLoadException {
        List<PackageProvider> discovered = new ArrayList<>();
        try {
            ServiceLoader.load(PackageProvider.class, classLoader).forEach(discovered::add);
        } catch (Throwable t) {
            throw new PackageLoadException(packageDir, ScanFailure.STAGE_DISCOVER,
                    "Failed to discover " + PackageProvider.class.getName() + " in " + packageDir, t);
        }

        if (discovered.isEmpty()) {
            throw new PackageLoadException(packageDir, ScanFailure.STAGE_DISCOVER,
                    "No " + PackageProvider.class.getName() + " found in " + packageDir, null);
        }
        if (discovered.size() > 1) {
            throw new PackageLoadException(packageDir, ScanFailure.STAGE_DISCOVER,
                    "Multiple " + PackageProvider.class.getName() + " found in " + packageDir + ": "
                            + discovered.size(), null);
        }
        return discovered.get(0);
    }

    private void evictRemoved(Set<Path> retained) {
        List<Path> removed = new ArrayList<>();
        for (Path dir : packagesByDir.keySet()) {
            if (!retained.contains(dir)) {
                removed.add(dir);
            }
        }
        for (Path dir : removed) {
            ClassLoaderPackage pkg = packagesByDir.remove(dir);
            LOG.info("Package directory removed: packageId={}, packageDir={}", pkg.getId(), dir);
            pkg.close();
        }
        failedByDir.keySet().retainAll(retained);
    }

    private static void closeQuietly(ClassLoader classLoader) {
        if (!(classLoader instanceof Closeable)) {
            return;
        }
        try {
            ((Closeable) classLoader).close();
        } catch (IOException e) {
            LOG.debug("Failed to close discarded classloader {}", classLoader, e);
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * One registered watch: polls on the scan executor until cancelled or failed.
     */
    private final class PollingWatch {
        private final PackageListener listener;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;
        private String lastFingerprint;

        private PollingWatch(PackageListener listener) {
            this.listener = listener;
        }

        private void poll() {
            if (cancelled) {
                return;
            }
            ScanReport report;
            try {
                report = scan();
            } catch (RuntimeException e) {
                cancel();
                LOG.error("Package scan failed, terminating watch", e);
                listener.onError(new PackageSourceException("Package scan failed", e));
                return;
            }
            if (cancelled || report.getFingerprint().equals(lastFingerprint)) {
                return;
            }
            lastFingerprint = report.getFingerprint();
            try {
                listener.onPackages(report.getPackages());
            } catch (RuntimeException e) {
                LOG.warn("Package listener failed to handle {} packages", report.getPackages().size(), e);
            }
        }

        private void cancel() {
            cancelled = true;
            watches.remove(this);
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }

    private static final class FailedDirectory {
        private final String fingerprint;
        private final PackageLoadException exception;

        private FailedDirectory(String fingerprint, PackageLoadException exception) {
            this.fingerprint = fingerprint;
            this.exception = exception;
        }
    }

    private static final class PackageLoadException extends Exception {

        private final Path packageDir;
        private final String stage;

        private PackageLoadException(Path packageDir, String stage, String message, Throwable cause) {
            super(message, cause);
            this.packageDir = packageDir;
            this.stage = stage;
        }

        private ScanFailure toScanFailure() {
            return new ScanFailure(packageDir, stage, getMessage(), getCause());
        }
    }

    /**
     * Hide the parent's provider service descriptors so that only the package's own jars
     * contribute a {@link PackageProvider}.
     */
    private static final class ServiceResourceFilteringParentClassLoader extends ClassLoader {

        private ServiceResourceFilteringParentClassLoader(ClassLoader parent) {
            super(parent);
        }

        @Override
        public URL getResource(String name) {
            if (PROVIDER_SERVICE.equals(name)) {
                return null;
            }
            return super.getResource(name);
        }

        @Override
        public Enumeration<URL> getResources(String name) throws IOException {
            if (PROVIDER_SERVICE.equals(name)) {
                return Collections.enumeration(Collections.<URL>emptyList());
            }
            return super.getResources(name);
        }
    }
}
