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

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link PackageSource} holding its package list in memory.
 *
 * <p>{@link #setPackages(List)} replaces the current list and publishes it to every live
 * watcher in registration order. {@link #fail(Throwable)} terminates all watchers and makes
 * subsequent {@link #find()} calls fail with the same error.
 *
 * <p>Thread-safe; callbacks are invoked while holding the source lock so that watchers
 * observe updates in the order they were published.
 */
public class InMemoryPackageSource implements PackageSource {
    private static final Logger LOG = LogManager.getLogger(InMemoryPackageSource.class);

    private final Object lock = new Object();
    private final List<Registration> registrations = new ArrayList<>();
    private List<PluginPackage> packages;
    private Throwable failure;
    private int watchRequests;

    public InMemoryPackageSource() {
        this(ImmutableList.<PluginPackage>of());
    }

    public InMemoryPackageSource(List<? extends PluginPackage> initialPackages) {
        this.packages = ImmutableList.copyOf(Objects.requireNonNull(initialPackages, "initialPackages"));
    }

    @Override
    public CompletionStage<List<PluginPackage>> find() {
        synchronized (lock) {
            if (failure != null) {
                return CompletableFuture.failedFuture(failure);
            }
            return CompletableFuture.completedFuture(packages);
        }
    }

    @Override
    public WatchCancellation watch(PackageListener listener) {
        Objects.requireNonNull(listener, "listener");
        Registration registration = new Registration(listener);
        synchronized (lock) {
            watchRequests++;
            if (failure != null) {
                listener.onError(failure);
                return registration::cancel;
            }
            registrations.add(registration);
            listener.onPackages(packages);
        }
        return registration::cancel;
    }

    /**
     * Replace the current package list and notify all watchers.
     *
     * @param newPackages packages in source order
     * @throws IllegalStateException if the source has already failed
     */
    public void setPackages(List<? extends PluginPackage> newPackages) {
        List<PluginPackage> snapshot = ImmutableList.copyOf(Objects.requireNonNull(newPackages, "newPackages"));
        synchronized (lock) {
            if (failure != null) {
                throw new IllegalStateException("Package source has failed", failure);
            }
            packages = snapshot;
            LOG.debug("Publishing {} packages to {} watchers", snapshot.size(), registrations.size());
            for (Registration registration : new ArrayList<>(registrations)) {
                registration.listener.onPackages(snapshot);
            }
        }
    }

    /**
     * Permanently fail this source.
     *
     * @param error discovery failure delivered to watchers and later {@code find()} callers
     */
    public void fail(Throwable error) {
        Objects.requireNonNull(error, "error");
        synchronized (lock) {
            if (failure != null) {
                return;
            }
            failure = error;
            LOG.warn("Package source failed, notifying {} watchers", registrations.size(), error);
            List<Registration> current = new ArrayList<>(registrations);
            registrations.clear();
            for (Registration registration : current) {
                registration.listener.onError(error);
            }
        }
    }

    public List<PluginPackage> getPackages() {
        synchronized (lock) {
            return packages;
        }
    }

    /**
     * Number of currently registered watchers.
     *
     * @return live watcher count
     */
    public int getWatcherCount() {
        synchronized (lock) {
            return registrations.size();
        }
    }

    /**
     * Number of {@link #watch(PackageListener)} calls ever made, cancelled or not.
     *
     * @return total watch requests
     */
    public int getWatchRequestCount() {
        synchronized (lock) {
            return watchRequests;
        }
    }

    private final class Registration {
        private final PackageListener listener;

        private Registration(PackageListener listener) {
            this.listener = listener;
        }

        private void cancel() {
            synchronized (lock) {
                registrations.remove(this);
            }
        }
    }
}
