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

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * A unit of distribution that contributes extensions.
 *
 * <p>Packages are created and destroyed by a {@link PackageSource}. Consumers only
 * hold transient references to the lists they are handed and never mutate a package.
 */
public interface PluginPackage {

    /**
     * Unique identifier of this package within its source.
     *
     * @return package id
     */
    String getId();

    /**
     * Descriptive metadata of this package.
     *
     * @return metadata
     */
    PackageMetadata getMetadata();

    /**
     * Extensions contributed by this package, in declaration order.
     *
     * @return ordered list of descriptors
     */
    List<ExtensionDescriptor> getExtensions();

    /**
     * Load the value of one extension declared by this package.
     *
     * <p>Failures may be reported either by returning an exceptionally completed stage
     * or by throwing. Callers must treat both the same way.
     *
     * @param descriptor a descriptor returned by {@link #getExtensions()}
     * @return stage completing with the loaded value, which may be {@code null}
     */
    CompletionStage<Object> load(ExtensionDescriptor descriptor);
}
