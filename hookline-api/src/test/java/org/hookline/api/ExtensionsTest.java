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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

@DisplayName("Extensions Unit Tests")
public class ExtensionsTest {

    private static final ExtensionDescriptor RENDER = ExtensionDescriptor.builder().hook("render").name("r").build();
    private static final ExtensionDescriptor PARSE = ExtensionDescriptor.builder().hook("render").name("p").build();

    @Test
    @DisplayName("UT-API-EXT-001: Kind is explicit, a null value still counts as loaded")
    void testNullValueIsLoaded() {
        // Given
        Extension extension = new LoadedExtension(RENDER, "pkgA", null);

        // Then
        Assertions.assertTrue(extension.isLoaded());
        Assertions.assertFalse(extension.isErrored());
        Assertions.assertTrue(Extensions.isLoaded(extension));
        Assertions.assertNull(((LoadedExtension) extension).getValue());
    }

    @Test
    @DisplayName("UT-API-EXT-002: Errored extension requires an error")
    void testErroredRequiresError() {
        Assertions.assertThrows(NullPointerException.class, () -> new ErroredExtension(RENDER, "pkgA", null));

        ErroredExtension errored = new ErroredExtension(RENDER, "pkgA", new IllegalStateException("boom"));
        Assertions.assertEquals(Extension.Kind.ERRORED, errored.getKind());
        Assertions.assertEquals("boom", errored.getError().getMessage());
    }

    @Test
    @DisplayName("UT-API-EXT-003: Descriptor fields are exposed on the extension")
    void testDescriptorFields() {
        LoadedExtension extension = new LoadedExtension(
                RENDER.toBuilder().property("mimeType", "text/html").build(), "pkgA", "R1");

        Assertions.assertEquals("render", extension.getHook());
        Assertions.assertEquals("r", extension.getName());
        Assertions.assertEquals("pkgA", extension.getPackageId());
        Assertions.assertEquals("text/html", extension.getProperty("mimeType").orElse(null));
        Assertions.assertEquals("R1", extension.getValue(String.class));
        Assertions.assertThrows(ClassCastException.class, () -> extension.getValue(Integer.class));
    }

    @Test
    @DisplayName("UT-API-EXT-004: loaded and errored partition keeps order")
    void testPartition() {
        // Given
        LoadedExtension first = new LoadedExtension(RENDER, "pkgA", "R1");
        ErroredExtension second = new ErroredExtension(PARSE, "pkgB", new RuntimeException("boom"));
        LoadedExtension third = new LoadedExtension(PARSE, "pkgC", "R3");
        List<Extension> resolved = Arrays.asList(first, second, third);

        // When
        List<LoadedExtension> loaded = Extensions.loaded(resolved);
        List<ErroredExtension> errored = Extensions.errored(resolved);

        // Then
        Assertions.assertEquals(Arrays.asList(first, third), loaded);
        Assertions.assertEquals(Arrays.asList(second), errored);
        Assertions.assertFalse(Extensions.isLoaded(null));
        Assertions.assertFalse(Extensions.isErrored(null));
    }

    @Test
    @DisplayName("UT-API-EXT-005: Loaded and errored extensions are never equal")
    void testEqualityByKind() {
        Assertions.assertEquals(new LoadedExtension(RENDER, "pkgA", "R1"), new LoadedExtension(RENDER, "pkgA", "R1"));
        Assertions.assertNotEquals(new LoadedExtension(RENDER, "pkgA", "R1"), new LoadedExtension(RENDER, "pkgA", "R2"));
        Assertions.assertNotEquals(new LoadedExtension(RENDER, "pkgA", null),
                new ErroredExtension(RENDER, "pkgA", new RuntimeException()));
    }
}
