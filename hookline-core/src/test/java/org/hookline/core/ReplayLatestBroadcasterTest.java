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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Unit tests for {@link ReplayLatestBroadcaster}.
 */
@DisplayName("ReplayLatestBroadcaster Unit Tests")
public class ReplayLatestBroadcasterTest {

    @Test
    @DisplayName("UT-CORE-BC-001: Late subscriber receives only the latest value")
    void testReplayLatest() {
        // Given
        ReplayLatestBroadcaster<String> broadcaster = new ReplayLatestBroadcaster<>("test");
        broadcaster.publish("v1");
        broadcaster.publish("v2");
        RecordingObserver<String> observer = new RecordingObserver<>();

        // When
        broadcaster.subscribe(observer);
        broadcaster.publish("v3");

        // Then
        Assertions.assertEquals(Arrays.asList("v2", "v3"), observer.values);
        Assertions.assertEquals("v3", broadcaster.getLatest().get());
    }

    @Test
    @DisplayName("UT-CORE-BC-002: Nothing is replayed before the first value")
    void testNoInitialValue() {
        ReplayLatestBroadcaster<String> broadcaster = new ReplayLatestBroadcaster<>("test");
        RecordingObserver<String> observer = new RecordingObserver<>();

        broadcaster.subscribe(observer);

        Assertions.assertTrue(observer.values.isEmpty());
        Assertions.assertFalse(broadcaster.getLatest().isPresent());
    }

    @Test
    @DisplayName("UT-CORE-BC-003: Initial value is replayed until replaced")
    void testInitialValue() {
        ReplayLatestBroadcaster<String> broadcaster = new ReplayLatestBroadcaster<>("test", "seed");
        RecordingObserver<String> observer = new RecordingObserver<>();

        broadcaster.subscribe(observer);

        Assertions.assertEquals(Collections.singletonList("seed"), observer.values);
    }

    @Test
    @DisplayName("UT-CORE-BC-004: Cancel detaches only that subscriber")
    void testCancel() {
        // Given
        ReplayLatestBroadcaster<String> broadcaster = new ReplayLatestBroadcaster<>("test");
        RecordingObserver<String> first = new RecordingObserver<>();
        RecordingObserver<String> second = new RecordingObserver<>();
        Subscription subscription = broadcaster.subscribe(first);
        broadcaster.subscribe(second);

        // When
        subscription.cancel();
        broadcaster.publish("v1");

        // Then
        Assertions.assertTrue(subscription.isCancelled());
        Assertions.assertTrue(first.values.isEmpty());
        Assertions.assertEquals(Collections.singletonList("v1"), second.values);
        Assertions.assertEquals(1, broadcaster.getSubscriberCount());
    }

    @Test
    @DisplayName("UT-CORE-BC-005: Failure reaches current and later subscribers")
    void testFail() {
        // Given
        ReplayLatestBroadcaster<String> broadcaster = new ReplayLatestBroadcaster<>("test");
        RecordingObserver<String> early = new RecordingObserver<>();
        broadcaster.subscribe(early);
        IllegalStateException error = new IllegalStateException("source down");

        // When
        broadcaster.fail(error);
        broadcaster.publish("ignored");
        RecordingObserver<String> late = new RecordingObserver<>();
        broadcaster.subscribe(late);

        // Then
        Assertions.assertSame(error, early.error);
        Assertions.assertSame(error, late.error);
        Assertions.assertTrue(early.values.isEmpty());
        Assertions.assertTrue(late.values.isEmpty());
        Assertions.assertTrue(broadcaster.isTerminated());
        Assertions.assertEquals(0, broadcaster.getSubscriberCount());
    }

    @Test
    @DisplayName("UT-CORE-BC-006: Completion reaches current and later subscribers")
    void testComplete() {
        ReplayLatestBroadcaster<String> broadcaster = new ReplayLatestBroadcaster<>("test", "seed");
        RecordingObserver<String> early = new RecordingObserver<>();
        broadcaster.subscribe(early);

        broadcaster.complete();
        RecordingObserver<String> late = new RecordingObserver<>();
        broadcaster.subscribe(late);

        Assertions.assertTrue(early.completed);
        Assertions.assertTrue(late.completed);
        Assertions.assertTrue(late.values.isEmpty());
    }

    @Test
    @DisplayName("UT-CORE-BC-007: A throwing observer does not affect others")
    void testThrowingObserver() {
        // Given
        ReplayLatestBroadcaster<String> broadcaster = new ReplayLatestBroadcaster<>("test");
        broadcaster.subscribe(StreamObserver.<String>of(value -> {
            throw new IllegalStateException("observer bug");
        }, error -> { }));
        RecordingObserver<String> healthy = new RecordingObserver<>();
        broadcaster.subscribe(healthy);

        // When
        broadcaster.publish("v1");

        // Then
        Assertions.assertEquals(Collections.singletonList("v1"), healthy.values);
    }

    @Test
    @DisplayName("UT-CORE-BC-008: A value published from inside an observer reaches everyone after the current one")
    void testReentrantPublish() {
        // Given
        ReplayLatestBroadcaster<String> broadcaster = new ReplayLatestBroadcaster<>("test");
        List<String> first = new CopyOnWriteArrayList<>();
        broadcaster.subscribe(StreamObserver.<String>of(value -> {
            first.add(value);
            if ("v1".equals(value)) {
                broadcaster.publish("v2");
            }
        }, error -> { }));
        RecordingObserver<String> second = new RecordingObserver<>();
        broadcaster.subscribe(second);

        // When
        broadcaster.publish("v1");

        // Then
        Assertions.assertEquals(Arrays.asList("v1", "v2"), first);
        Assertions.assertEquals(Arrays.asList("v1", "v2"), second.values);
        Assertions.assertEquals("v2", broadcaster.getLatest().get());
    }

    @Test
    @DisplayName("UT-CORE-BC-009: A slow observer does not block other callers of the broadcaster")
    void testSlowObserverDoesNotHoldLock() throws Exception {
        // Given
        ReplayLatestBroadcaster<String> broadcaster = new ReplayLatestBroadcaster<>("test");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        broadcaster.subscribe(StreamObserver.<String>of(value -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, error -> { }));
        Thread publisher = new Thread(() -> broadcaster.publish("v1"), "publisher");
        publisher.setDaemon(true);
        publisher.start();
        RecordingObserver<String> late = new RecordingObserver<>();

        try {
            Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));

            // When - the publisher thread is still inside the first observer
            Assertions.assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                broadcaster.subscribe(late);
                Assertions.assertEquals(2, broadcaster.getSubscriberCount());
                Assertions.assertEquals("v1", broadcaster.getLatest().get());
            });
        } finally {
            release.countDown();
        }
        publisher.join(5000);

        // Then - the late subscriber gets its replay once the publisher thread drains it
        Assertions.assertFalse(publisher.isAlive());
        Assertions.assertEquals(Collections.singletonList("v1"), late.values);
    }
}
