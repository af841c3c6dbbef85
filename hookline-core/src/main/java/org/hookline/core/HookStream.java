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
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A continuous, restartable sequence of values.
 *
 * <p>Every subscriber first receives the latest value, if any, then every subsequent value
 * in the order it was produced. A stream does not terminate on its own; it ends only when
 * its upstream fails ({@link StreamObserver#onError(Throwable)}) or is closed
 * ({@link StreamObserver#onComplete()}), or when the subscriber cancels.
 *
 * @param <T> value type
 */
public interface HookStream<T> {

    /**
     * Attach an observer.
     *
     * @param observer observer receiving values and terminal signals
     * @return subscription detaching this observer only
     */
    Subscription subscribe(StreamObserver<? super T> observer);

    /**
     * Attach a value callback; terminal errors are logged.
     *
     * @param onNext callback receiving values
     * @return subscription detaching this callback only
     */
    default Subscription subscribe(Consumer<? super T> onNext) {
        Logger log = LogManager.getLogger(HookStream.class);
        return subscribe(StreamObserver.<T>of(onNext, error -> log.warn("Hook stream terminated with error", error)));
    }

    /**
     * Project every value through a synchronous function.
     *
     * @param mapper projection
     * @param <R> projected type
     * @return projected stream sharing this stream's upstream
     */
    default <R> HookStream<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return new MappedHookStream<T, R>(this, value -> CompletableFuture.completedFuture(mapper.apply(value)));
    }

    /**
     * Project every value through an asynchronous function.
     *
     * <p>Projections for one subscriber are chained: the projection of a value starts only
     * after the previous projection completed, so results are emitted in upstream order.
     *
     * @param mapper asynchronous projection
     * @param <R> projected type
     * @return projected stream sharing this stream's upstream
     */
    default <R> HookStream<R> mapAsync(Function<? super T, ? extends CompletionStage<? extends R>> mapper) {
        return new MappedHookStream<T, R>(this, Objects.requireNonNull(mapper, "mapper"));
    }
}
