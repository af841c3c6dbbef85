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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Properties;

/**
 * Unit tests for {@link DirectoryPackageSourceConfig}.
 */
@DisplayName("DirectoryPackageSourceConfig Unit Tests")
public class DirectoryPackageSourceConfigTest {

    @Test
    @DisplayName("UT-LOADER-CFG-001: Defaults apply to empty properties")
    void testDefaults() {
        // When
        DirectoryPackageSourceConfig config = DirectoryPackageSourceConfig.fromProperties(new Properties());

        // Then
        Assertions.assertTrue(config.getPluginRoots().isEmpty());
        Assertions.assertEquals(Duration.ofMillis(DirectoryPackageSourceConfig.DEFAULT_POLL_INTERVAL_MS),
                config.getPollInterval());
        Assertions.assertTrue(config.getClassLoadingPolicy().getHostParentFirstPrefixes().isEmpty());
    }

    @Test
    @DisplayName("UT-LOADER-CFG-002: Properties are parsed and trimmed")
    void testFromProperties() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(DirectoryPackageSourceConfig.PLUGIN_ROOTS, " /opt/plugins , ,/srv/plugins ");
        properties.setProperty(DirectoryPackageSourceConfig.POLL_INTERVAL_MS, " 250 ");
        properties.setProperty(DirectoryPackageSourceConfig.PARENT_FIRST_PREFIXES, "com.example.");

        // When
        DirectoryPackageSourceConfig config = DirectoryPackageSourceConfig.fromProperties(properties);

        // Then
        Assertions.assertEquals(Arrays.asList(Paths.get("/opt/plugins"), Paths.get("/srv/plugins")),
                config.getPluginRoots());
        Assertions.assertEquals(Duration.ofMillis(250), config.getPollInterval());
        Assertions.assertEquals(Collections.singletonList("com.example."),
                config.getClassLoadingPolicy().getHostParentFirstPrefixes());
    }

    @Test
    @DisplayName("UT-LOADER-CFG-003: Malformed or non-positive poll interval is rejected")
    void testInvalidPollInterval() {
        Properties malformed = new Properties();
        malformed.setProperty(DirectoryPackageSourceConfig.POLL_INTERVAL_MS, "soon");
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DirectoryPackageSourceConfig.fromProperties(malformed));

        Properties zero = new Properties();
        zero.setProperty(DirectoryPackageSourceConfig.POLL_INTERVAL_MS, "0");
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DirectoryPackageSourceConfig.fromProperties(zero));
    }

    @Test
    @DisplayName("UT-LOADER-CFG-004: Configuration loads from a classpath resource")
    void testLoadResource() throws IOException {
        // When
        DirectoryPackageSourceConfig config = DirectoryPackageSourceConfig.load(
                getClass().getClassLoader(), DirectoryPackageSourceConfig.DEFAULT_RESOURCE);

        // Then
        Assertions.assertEquals(Arrays.asList(Paths.get("plugins-a"), Paths.get("plugins-b")),
                config.getPluginRoots());
        Assertions.assertEquals(Duration.ofMillis(500), config.getPollInterval());
        Assertions.assertEquals(Collections.singletonList("com.example.shared."),
                config.getClassLoadingPolicy().getHostParentFirstPrefixes());
    }

    @Test
    @DisplayName("UT-LOADER-CFG-005: Missing resource fails with IOException")
    void testMissingResource() {
        Assertions.assertThrows(IOException.class,
                () -> DirectoryPackageSourceConfig.load(getClass().getClassLoader(), "missing.properties"));
    }
}
