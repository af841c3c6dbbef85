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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Unit tests for {@link InMemoryPackageSource}.
 */
@DisplayName("InMemoryPackageSource Unit Tests")
public class InMemoryPackageSourceTest {

    private PluginPackage pkgA;
    private PluginPackage pkgB;

    @BeforeEach
    void setUp() {
        pkgA = simplePackage("pkgA");
        pkgB = simplePackage("pkgB");
    }

    @Test
    @DisplayName("UT-API-SRC-001: find returns the current packages")
    void testFind() throws Exception {
        // Given
        InMemoryPackageSource source = new InMemoryPackageSource(Collections.singletonList(pkgA));

        // When
        List<PluginPackage> found = source.find().toCompletableFuture().get();

        // Then
        Assertions.assertEquals(Collections.singletonList(pkgA), found);
    }

    @Test
    @DisplayName("UT-API-SRC-002: watch delivers the current list and later updates in order")
    void testWatchDeliversUpdates() {
        // Given
        InMemoryPackageSource source = new InMemoryPackageSource(Collections.singletonList(pkgA));
        PackageListener listener = Mockito.mock(PackageListener.class);

        // When
        source.watch(listener);
        source.setPackages(Arrays.asList(pkgA, pkgB));

        // Then
        InOrder inOrder = Mockito.inOrder(listener);
        inOrder.verify(listener).onPackages(Collections.singletonList(pkgA));
        inOrder.verify(listener).onPackages(Arrays.asList(pkgA, pkgB));
        Assertions.assertEquals(1, source.getWatcherCount());
        Assertions.assertEquals(1, source.getWatchRequestCount());
    }

    @Test
    @DisplayName("UT-API-SRC-003: Cancelled watcher stops receiving updates")
    void testCancel() {
        // Given
        InMemoryPackageSource source = new InMemoryPackageSource();
        PackageListener listener = Mockito.mock(PackageListener.class);
        WatchCancellation cancellation = source.watch(listener);

        // When
        cancellation.cancel();
        source.setPackages(Collections.singletonList(pkgA));

        // Then
        Mockito.verify(listener, Mockito.times(1)).onPackages(Mockito.anyList());
        Assertions.assertEquals(0, source.getWatcherCount());
        Assertions.assertEquals(1, source.getWatchRequestCount());
    }

    @Test
    @DisplayName("UT-API-SRC-004: fail notifies watchers once and fails later finds and watches")
    void testFail() {
        // Given
        InMemoryPackageSource source = new InMemoryPackageSource();
        PackageListener listener = Mockito.mock(PackageListener.class);
        source.watch(listener);
        PackageSourceException error = new PackageSourceException("disk gone");

        // When
        source.fail(error);
        source.fail(new PackageSourceException("again"));

        // Then
        Mockito.verify(listener, Mockito.times(1)).onError(error);
        Assertions.assertEquals(0, source.getWatcherCount());
        ExecutionException ex = Assertions.assertThrows(ExecutionException.class,
                () -> source.find().toCompletableFuture().get());
        Assertions.assertSame(error, ex.getCause());

        PackageListener late = Mockito.mock(PackageListener.class);
        source.watch(late);
        Mockito.verify(late).onError(error);
        Mockito.verify(late, Mockito.never()).onPackages(Mockito.anyList());
        Assertions.assertThrows(IllegalStateException.class,
                () -> source.setPackages(Collections.singletonList(pkgA)));
    }

    private static PluginPackage simplePackage(String id) {
        return SimplePackage.builder()
                .id(id)
                .extension(ExtensionDescriptor.builder().hook("render").name(id + "-render").build())
                .loader(descriptor -> CompletableFuture.completedFuture(id))
                .build();
    }
}
