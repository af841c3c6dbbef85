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

import java.util.Arrays;
import java.util.List;

@DisplayName("ClassLoadingPolicy Unit Tests")
public class ClassLoadingPolicyTest {

    @Test
    @DisplayName("UT-LOADER-POLICY-001: Default policy contains only mandatory prefixes")
    void testDefaultPolicy() {
        ClassLoadingPolicy policy = ClassLoadingPolicy.defaultPolicy();

        Assertions.assertEquals(ChildFirstClassLoader.DEFAULT_PARENT_FIRST_PACKAGES,
                policy.getMandatoryParentFirstPrefixes());
        Assertions.assertTrue(policy.getHostParentFirstPrefixes().isEmpty());
        Assertions.assertTrue(policy.toParentFirstPackages().contains("org.hookline.api."));
    }

    @Test
    @DisplayName("UT-LOADER-POLICY-002: Host prefixes are trimmed, deduplicated and appended")
    void testHostPrefixes() {
        // Given
        ClassLoadingPolicy policy = new ClassLoadingPolicy(
                Arrays.asList(" com.example. ", "", null, "com.example.", "java."));

        // When
        List<String> merged = policy.toParentFirstPackages();

        // Then
        Assertions.assertEquals(Arrays.asList("com.example."), policy.getHostParentFirstPrefixes());
        Assertions.assertEquals("com.example.", merged.get(merged.size() - 1));
        Assertions.assertEquals(ChildFirstClassLoader.DEFAULT_PARENT_FIRST_PACKAGES.size() + 1, merged.size());
    }
}
