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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Hot stream with one upstream and any number of observers, replaying the latest value
 * to late joiners.
 *
 * <p>Values are pushed with {@link #publish(Object)} and fanned out to every registered
 * observer in registration order. A new observer immediately receives the most recent
 * value, if one was published or supplied at construction, and then every later value.
 * Bursts published before an observer attaches collapse to the latest value only.
 *
 * <p>The broadcaster terminates through {@link #fail(Throwable)} or {@link #complete()};
 * the terminal signal is delivered to current observers and replayed to observers that
 * attach afterwards. Values published after termination are dropped.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Registration, publication and termination update state under one lock and queue the
 * resulting deliveries in that same order. Observers are never called while the lock is
 * held: the first thread that finds the queue idle drains it, and calls made meanwhile,
 * from other threads or from an observer, only enqueue. Every observer therefore sees
 * values in publication order, and a late joiner never misses or duplicates a value.
 * An observer that throws is logged and keeps its registration; it does not prevent
 * delivery to the others.
 *
 * @param <T> value type
 */
public final class ReplayLatestBroadcaster<T> implements HookStream<T> {
    private static final Logger LOG = LogManager.getLogger(ReplayLatestBroadcaster.class);

    private enum Status {
        OPEN,
        FAILED,
        COMPLETED
    }

    private final String name;
    private final Object lock = new Object();
    private final List<Registration> registrations = new ArrayList<>();
    private final Deque<Runnable> pending = new ArrayDeque<>();

    private T latest;
    private boolean hasLatest;
    private Status status = Status.OPEN;
    private Throwable failure;
    private boolean draining;

    /**
     * Create a broadcaster without an initial value.
     *
     * @param name name used in log messages
     */
    public ReplayLatestBroadcaster(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Create a broadcaster seeded with an initial value that is replayed until the first
     * publication.
     *
     * @param name name used in log messages
     * @param initial initial value
     */
    public ReplayLatestBroadcaster(String name, T initial) {
        this(name);
        this.latest = initial;
        this.hasLatest = true;
    }

    @Override
    public Subscription subscribe(StreamObserver<? super T> observer) {
        Objects.requireNonNull(observer, "observer");
        Registration registration = new Registration(observer);
        boolean drain;
        synchronized (lock) {
            switch (status) {
                case FAILED:
                    Throwable error = failure;
                    pending.add(() -> deliverError(registration, error));
                    break;
                case COMPLETED:
                    pending.add(() -> deliverComplete(registration));
                    break;
                default:
                    registrations.add(registration);
                    if (hasLatest) {
                        T replayed = latest;
                        pending.add(() -> deliverNext(registration, replayed));
                    }
                    break;
            }
            drain = claimDrain();
        }
        if (drain) {
            drain();
        }
        return registration;
    }

    /**
     * Publish a value to all observers and remember it for late joiners.
     *
     * @param value the new latest value
     */
    public void publish(T value) {
        boolean drain;
        synchronized (lock) {
            if (status != Status.OPEN) {
                LOG.debug("Drop value published to terminated broadcaster {}", name);
                return;
            }
            latest = value;
            hasLatest = true;
            for (Registration registration : registrations) {
                pending.add(() -> deliverNext(registration, value));
            }
            drain = claimDrain();
        }
        if (drain) {
            drain();
        }
    }

    /**
     * Terminate with an error. Ignored if already terminated.
     *
     * @param error terminal error
     */
    public void fail(Throwable error) {
        Objects.requireNonNull(error, "error");
        boolean drain;
        synchronized (lock) {
            if (status != Status.OPEN) {
                return;
            }
            status = Status.FAILED;
            failure = error;
            for (Registration registration : detachAll()) {
                pending.add(() -> deliverError(registration, error));
            }
            drain = claimDrain();
        }
        if (drain) {
            drain();
        }
    }

    /**
     * Terminate normally. Ignored if already terminated.
     */
    public void complete() {
        boolean drain;
        synchronized (lock) {
            if (status != Status.OPEN) {
                return;
            }
            status = Status.COMPLETED;
            for (Registration registration : detachAll()) {
                pending.add(() -> deliverComplete(registration));
            }
            drain = claimDrain();
        }
        if (drain) {
            drain();
        }
    }

    /**
     * Returns the latest value, if any was published or supplied at construction.
     *
     * @return latest value, empty if none or if the latest value is {@code null}
     */
    public Optional<T> getLatest() {
        synchronized (lock) {
            return hasLatest ? Optional.ofNullable(latest) : Optional.empty();
        }
    }

    public int getSubscriberCount() {
        synchronized (lock) {
            return registrations.size();
        }
    }

    public boolean isTerminated() {
        synchronized (lock) {
            return status != Status.OPEN;
        }
    }

    private List<Registration> detachAll() {
        List<Registration> detached = new ArrayList<>(registrations);
        registrations.clear();
        return detached;
    }

    // Caller must hold lock.
    private boolean claimDrain() {
        if (draining || pending.isEmpty()) {
            return false;
        }
        draining = true;
        return true;
    }

    private void drain() {
        boolean idle = false;
        try {
            while (true) {
                Runnable delivery;
                synchronized (lock) {
                    delivery = pending.poll();
                    if (delivery == null) {
                        draining = false;
                        idle = true;
                        return;
                    }
                }
                delivery.run();
            }
        } finally {
            if (!idle) {
                synchronized (lock) {
                    draining = false;
                }
            }
        }
    }

    private void deliverNext(Registration registration, T value) {
        if (registration.cancelled) {
            return;
        }
        try {
            registration.observer.onNext(value);
        } catch (RuntimeException e) {
            LOG.warn("Observer of {} failed to handle value", name, e);
        }
    }

    private void deliverError(Registration registration, Throwable error) {
        if (registration.cancelled) {
            return;
        }
        try {
            registration.observer.onError(error);
        } catch (RuntimeException e) {
            LOG.warn("Observer of {} failed to handle error", name, e);
        }
    }

    private void deliverComplete(Registration registration) {
        if (registration.cancelled) {
            return;
        }
        try {
            registration.observer.onComplete();
        } catch (RuntimeException e) {
            LOG.warn("Observer of {} failed to handle completion", name, e);
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "ReplayLatestBroadcaster{name='" + name + "', status=" + status + '}';
        }
    }

    private final class Registration implements Subscription {
        private final StreamObserver<? super T> observer;
        private volatile boolean cancelled;

        private Registration(StreamObserver<? super T> observer) {
            this.observer = observer;
        }

        @Override
        public void cancel() {
            synchronized (lock) {
                cancelled = true;
                registrations.remove(this);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
