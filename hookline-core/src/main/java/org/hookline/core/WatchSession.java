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

import org.hookline.api.PackageListener;
import org.hookline.api.PackageSource;
import org.hookline.api.PluginPackage;
import org.hookline.api.WatchCancellation;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * One live subscription to a {@link PackageSource}, shared by every consumer of a
 * {@link HookStreamMultiplexer} while it is watching.
 *
 * <p>Pairs the source's {@link WatchCancellation} with a replay-latest container of the
 * most recent package list, initially empty. The session is created first and registered
 * with the source afterwards by {@link #start(PackageSource)}, so neither step needs the
 * caller's locks. Package lists delivered after {@link #close()} are ignored, and a session
 * closed before registration finished cancels the registration as soon as it returns.
 */
final class WatchSession {
    private static final Logger LOG = LogManager.getLogger(WatchSession.class);

    private final long id;
    private final ReplayLatestBroadcaster<List<PluginPackage>> packages;
    private final Object lock = new Object();
    private WatchCancellation cancellation;
    private volatile boolean closed;

    /**
     * Create a session that is not yet registered with a source.
     *
     * @param id session number, used in log messages
     */
    WatchSession(long id) {
        this.id = id;
        this.packages = new ReplayLatestBroadcaster<>("watch-session-" + id, ImmutableList.<PluginPackage>of());
    }

    /**
     * Register this session's listener with the source.
     *
     * @param source package source to watch
     */
    void start(PackageSource source) {
        Objects.requireNonNull(source, "source");
        WatchCancellation registered = source.watch(new Listener());
        WatchCancellation handle = registered != null ? registered : () -> { };
        boolean closedMeanwhile;
        synchronized (lock) {
            closedMeanwhile = closed;
            if (!closedMeanwhile) {
                cancellation = handle;
            }
        }
        if (closedMeanwhile) {
            handle.cancel();
            return;
        }
        LOG.info("Opened package watch session {}", id);
    }

    ReplayLatestBroadcaster<List<PluginPackage>> getPackages() {
        return packages;
    }

    /**
     * Cancel the source subscription and complete the package stream.
     */
    void close() {
        WatchCancellation registered;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            registered = cancellation;
        }
        try {
            if (registered != null) {
                registered.cancel();
            }
        } finally {
            packages.complete();
            LOG.info("Closed package watch session {}", id);
        }
    }

    private final class Listener implements PackageListener {

        @Override
        public void onPackages(List<PluginPackage> received) {
            if (closed) {
                return;
            }
            List<PluginPackage> snapshot = received != null
                    ? ImmutableList.copyOf(received)
                    : ImmutableList.<PluginPackage>of();
            LOG.debug("Session {} received {} packages", id, snapshot.size());
            packages.publish(snapshot);
        }

        @Override
        public void onError(Throwable error) {
            if (closed) {
                return;
            }
            LOG.warn("Package source failed for watch session {}", id, error);
            packages.fail(error);
        }
    }
}
