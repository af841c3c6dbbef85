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
import org.hookline.api.ExtensionLoadException;
import org.hookline.api.PackageMetadata;
import org.hookline.api.spi.PackageProvider;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Unit tests for {@link ClassLoaderPackage}.
 */
@DisplayName("ClassLoaderPackage Unit Tests")
public class ClassLoaderPackageTest {

    private static final ExtensionDescriptor RENDER = ExtensionDescriptor.builder().hook("render").name("md").build();

    private PackageProvider provider;
    private TrackingClassLoader classLoader;
    private ClassLoaderPackage pkg;

    @BeforeEach
    void setUp() {
        provider = Mockito.mock(PackageProvider.class);
        classLoader = new TrackingClassLoader();
        pkg = new ClassLoaderPackage("markdown", Paths.get("plugins", "markdown"), Collections.emptyList(),
                classLoader, provider, PackageMetadata.of("markdown"), Collections.singletonList(RENDER),
                "fp", Instant.now());
    }

    @Test
    @DisplayName("UT-LOADER-PKG-001: Load delegates to the provider")
    void testLoadDelegates() throws Exception {
        // Given
        Mockito.when(provider.load(RENDER)).thenReturn(CompletableFuture.completedFuture("R1"));

        // When
        Object value = pkg.load(RENDER).toCompletableFuture().get();

        // Then
        Assertions.assertEquals("R1", value);
        Mockito.verify(provider).load(RENDER);
    }

    @Test
    @DisplayName("UT-LOADER-PKG-002: Provider throw or missing stage fails the load")
    void testProviderFailures() {
        // Given
        Mockito.when(provider.load(RENDER))
                .thenThrow(new IllegalStateException("provider bug"))
                .thenReturn(null);

        // When
        ExecutionException thrown = Assertions.assertThrows(ExecutionException.class,
                () -> pkg.load(RENDER).toCompletableFuture().get());
        ExecutionException missing = Assertions.assertThrows(ExecutionException.class,
                () -> pkg.load(RENDER).toCompletableFuture().get());

        // Then
        Assertions.assertTrue(thrown.getCause() instanceof ExtensionLoadException);
        Assertions.assertEquals("provider bug", thrown.getCause().getCause().getMessage());
        Assertions.assertTrue(missing.getCause() instanceof ExtensionLoadException);
    }

    @Test
    @DisplayName("UT-LOADER-PKG-003: Undeclared descriptor never reaches the provider")
    void testUndeclared() {
        ExtensionDescriptor other = RENDER.toBuilder().name("html").build();

        Assertions.assertThrows(ExecutionException.class, () -> pkg.load(other).toCompletableFuture().get());
        Mockito.verify(provider, Mockito.never()).load(Mockito.any());
    }

    @Test
    @DisplayName("UT-LOADER-PKG-004: Close releases the package classloader")
    void testClose() {
        pkg.close();

        Assertions.assertTrue(classLoader.closed);
    }

    private static final class TrackingClassLoader extends ClassLoader implements Closeable {
        private boolean closed;

        private TrackingClassLoader() {
            super(ClassLoaderPackageTest.class.getClassLoader());
        }

        @Override
        public void close() throws IOException {
            closed = true;
        }
    }
}
