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

package org.hookline.core;

import org.hookline.api.Extension;
import org.hookline.api.PackageMetadata;
import org.hookline.api.PackageSource;
import org.hookline.api.PackageSourceException;
import org.hookline.api.PluginPackage;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Facade answering "what currently implements hook X" against a changing package source.
 *
 * <h2>Watch Session</h2>
 *
 * <p>All streams returned by {@link #watch(String)} and {@link #packagesStream()} share a
 * single subscription to the {@link PackageSource}. The multiplexer is {@link State#IDLE}
 * until the first of these calls, which registers exactly one listener with the source and
 * moves it to {@link State#ACTIVE}. It returns to {@code IDLE} only through
 * {@link #stopWatching()}; the next demand then opens a brand-new session whose replayed
 * package list starts empty again.
 *
 * <p>Subscribers of a hook stream first receive the resolution of the session's latest
 * package list, then one resolution per package list change, in arrival order. Cancelling
 * a subscription detaches that subscriber only. A terminal source error is delivered to
 * every subscriber of the session and replayed to later ones until the session is stopped.
 * Stopping a session completes its streams.
 *
 * <h2>One-shot Loading</h2>
 *
 * <p>{@link #load(String)} asks the source for one snapshot via {@link PackageSource#find()}
 * and resolves it once. It never touches the watch session.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Session transitions are guarded by a single lifecycle lock, so at most one session is
 * current at any time. Registering with the source and cancelling the registration happen
 * after the lock is released; observers may therefore call back into the multiplexer from
 * any delivery thread.
 */
public class HookStreamMultiplexer {
    private static final Logger LOG = LogManager.getLogger(HookStreamMultiplexer.class);

    /**
     * Whether the package source is currently being watched.
     */
    public enum State {
        IDLE,
        ACTIVE
    }

    private final PackageSource source;
    private final ExtensionResolver resolver;
    private final Object lifecycleLock = new Object();

    private State state = State.IDLE;
    private WatchSession session;
    private long sessionCounter;

    public HookStreamMultiplexer(PackageSource source) {
        this(source, new ExtensionResolver());
    }

    public HookStreamMultiplexer(PackageSource source, ExtensionResolver resolver) {
        this.source = Objects.requireNonNull(source, "source");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Watch for extensions that implement a hook.
     *
     * <p>Starts watching the package source if not already watching.
     *
     * @param hook hook name
     * @return stream emitting the classified extensions each time the packages change
     */
    public HookStream<List<Extension>> watch(String hook) {
        requireHook(hook);
        return packageStream().mapAsync(packages -> resolver.resolve(packages, hook));
    }

    /**
     * Load all extensions implementing a hook from one package snapshot, without watching.
     *
     * @param hook hook name
     * @return future completing with the classified extensions, or failing when the
     *         snapshot itself cannot be obtained
     */
    public CompletableFuture<List<Extension>> load(String hook) {
        requireHook(hook);
        CompletionStage<List<PluginPackage>> found;
        try {
            found = source.find();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new PackageSourceException("Failed to find packages", e));
        }
        if (found == null) {
            return CompletableFuture.failedFuture(new PackageSourceException("Package source returned no result"));
        }
        LOG.debug("Loading hook {} from a one-shot package snapshot", hook);
        return CompletableFuture.<Void>completedFuture(null)
                .thenCompose(ignored -> found)
                .thenCompose(packages -> resolver.resolve(
                        packages != null ? packages : Collections.<PluginPackage>emptyList(), hook));
    }

    /**
     * Stream of package metadata, one entry per currently known package.
     *
     * <p>Starts watching the package source if not already watching.
     *
     * @return stream emitting the metadata list each time the packages change
     */
    public HookStream<List<PackageMetadata>> packagesStream() {
        return packageStream().map(HookStreamMultiplexer::toMetadata);
    }

    /**
     * Stop watching the package source. A no-op when not watching.
     */
    public void stopWatching() {
        WatchSession closing;
        synchronized (lifecycleLock) {
            if (state == State.IDLE) {
                return;
            }
            closing = session;
            session = null;
            state = State.IDLE;
        }
        closing.close();
    }

    public boolean isWatching() {
        return getState() == State.ACTIVE;
    }

    public State getState() {
        synchronized (lifecycleLock) {
            return state;
        }
    }

    private HookStream<List<PluginPackage>> packageStream() {
        WatchSession opened;
        synchronized (lifecycleLock) {
            if (state == State.ACTIVE) {
                return session.getPackages();
            }
            opened = new WatchSession(++sessionCounter);
            session = opened;
            state = State.ACTIVE;
        }
        try {
            opened.start(source);
        } catch (RuntimeException e) {
            synchronized (lifecycleLock) {
                if (session == opened) {
                    session = null;
                    state = State.IDLE;
                }
            }
            opened.close();
            throw e;
        }
        return opened.getPackages();
    }

    private static List<PackageMetadata> toMetadata(List<PluginPackage> packages) {
        List<PackageMetadata> metadata = new ArrayList<>(packages.size());
        for (PluginPackage pkg : packages) {
            metadata.add(pkg.getMetadata());
        }
        return Collections.unmodifiableList(metadata);
    }

    private static void requireHook(String hook) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(hook), "hook is required");
    }
}
