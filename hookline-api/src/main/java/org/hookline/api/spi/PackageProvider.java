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

package org.hookline.api.spi;

import org.hookline.api.ExtensionDescriptor;
import org.hookline.api.PackageMetadata;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Entry point of an externally packaged plugin.
 *
 * <p>Implementations are discovered via Java ServiceLoader from the package's own jars.
 * Configuration file: META-INF/services/org.hookline.api.spi.PackageProvider
 *
 * <p>A provider must have a public no-arg constructor. Exactly one provider is expected
 * per package directory.
 */
public interface PackageProvider {

    /**
     * Package metadata.
     *
     * @return metadata, never null
     */
    PackageMetadata metadata();

    /**
     * Extensions contributed by the package, in declaration order.
     *
     * @return descriptors, never null
     */
    List<ExtensionDescriptor> extensions();

    /**
     * Load the value of one declared extension.
     *
     * @param descriptor one of {@link #extensions()}
     * @return stage completing with the extension value
     */
    CompletionStage<Object> load(ExtensionDescriptor descriptor);
}
