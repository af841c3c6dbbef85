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

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Receives the values of a {@link HookStream}.
 *
 * <p>Calls to one observer never overlap. After {@link #onError(Throwable)} or
 * {@link #onComplete()} no further calls are made.
 *
 * @param <T> value type
 */
public interface StreamObserver<T> {

    void onNext(T value);

    /**
     * The stream terminated because its upstream failed.
     *
     * @param error terminal error
     */
    void onError(Throwable error);

    /**
     * The stream terminated normally, e.g. because its watch session was stopped.
     */
    default void onComplete() {
        // Default: nothing to release
    }

    static <T> StreamObserver<T> of(Consumer<? super T> onNext, Consumer<? super Throwable> onError) {
        Objects.requireNonNull(onNext, "onNext");
        Objects.requireNonNull(onError, "onError");
        return new StreamObserver<T>() {
            @Override
            public void onNext(T value) {
                onNext.accept(value);
            }

            @Override
            public void onError(Throwable error) {
                onError.accept(error);
            }
        };
    }
}
