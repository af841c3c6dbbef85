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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Stream projecting each upstream value through an asynchronous function.
 *
 * <p>Each subscriber gets its own projection chain: the projection of a value starts only
 * after the previous projection for that subscriber completed, and terminal signals are
 * delivered after all pending projections. A failing projection terminates that subscriber
 * with the failure and detaches it from the upstream. Downstream observers are called
 * without holding any lock of this stream.
 */
final class MappedHookStream<T, R> implements HookStream<R> {
    private static final Logger LOG = LogManager.getLogger(MappedHookStream.class);

    private final HookStream<T> upstream;
    private final Function<? super T, ? extends CompletionStage<? extends R>> mapper;

    MappedHookStream(HookStream<T> upstream, Function<? super T, ? extends CompletionStage<? extends R>> mapper) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Subscription subscribe(StreamObserver<? super R> observer) {
        ProjectingObserver projecting = new ProjectingObserver(Objects.requireNonNull(observer, "observer"));
        projecting.attach(upstream.subscribe(projecting));
        return projecting;
    }

    private final class ProjectingObserver implements StreamObserver<T>, Subscription {
        private final StreamObserver<? super R> downstream;
        private final Object lock = new Object();
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
        private Subscription upstreamSubscription;
        private volatile boolean cancelled;
        private volatile boolean terminated;

        private ProjectingObserver(StreamObserver<? super R> downstream) {
            this.downstream = downstream;
        }

        private void attach(Subscription subscription) {
            synchronized (lock) {
                upstreamSubscription = subscription;
                if (cancelled || terminated) {
                    subscription.cancel();
                }
            }
        }

        @Override
        public void onNext(T value) {
            chain(previous -> previous.thenCompose(ignored -> project(value))
                    .handle((result, error) -> {
                        if (error != null) {
                            terminate(ExtensionResolver.unwrap(error));
                        } else {
                            emit(result);
                        }
                        return null;
                    }));
        }

        @Override
        public void onError(Throwable error) {
            chain(previous -> previous.thenRun(() -> terminate(error)));
        }

        @Override
        public void onComplete() {
            chain(previous -> previous.thenRun(() -> {
                if (markTerminated()) {
                    downstream.onComplete();
                }
            }));
        }

        // Appends a step under the lock; the step itself runs outside it.
        private void chain(Function<CompletableFuture<Void>, CompletionStage<?>> step) {
            CompletableFuture<Void> next = new CompletableFuture<>();
            CompletableFuture<Void> previous;
            synchronized (lock) {
                previous = tail;
                tail = next;
            }
            step.apply(previous).whenComplete((ignored, error) -> next.complete(null));
        }

        @Override
        public void cancel() {
            Subscription subscription;
            synchronized (lock) {
                cancelled = true;
                subscription = upstreamSubscription;
            }
            if (subscription != null) {
                subscription.cancel();
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        private CompletionStage<R> project(T value) {
            if (cancelled || terminated) {
                return CompletableFuture.completedFuture(null);
            }
            CompletionStage<? extends R> stage;
            try {
                stage = mapper.apply(value);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Projection returned no result"));
            }
            return stage.thenApply(result -> result);
        }

        private void emit(R result) {
            if (cancelled || terminated) {
                return;
            }
            try {
                downstream.onNext(result);
            } catch (RuntimeException e) {
                LOG.warn("Observer failed to handle projected value", e);
            }
        }

        private void terminate(Throwable error) {
            if (!markTerminated()) {
                return;
            }
            Subscription subscription;
            synchronized (lock) {
                subscription = upstreamSubscription;
            }
            if (subscription != null) {
                subscription.cancel();
            }
            downstream.onError(error);
        }

        private boolean markTerminated() {
            synchronized (lock) {
                if (terminated || cancelled) {
                    return false;
                }
                terminated = true;
                return true;
            }
        }
    }
}
