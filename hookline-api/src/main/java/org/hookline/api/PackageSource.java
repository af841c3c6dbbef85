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
 * Supplies one-shot and continuous views of the current set of packages.
 *
 * <p>Implementations own package discovery (directory scanning, registries, file
 * watching). Consumers treat every delivered list as an immutable snapshot.
 */
public interface PackageSource {

    /**
     * Return a static snapshot of all packages currently found.
     *
     * @return stage completing with the packages, or failing when discovery itself fails
     *         (usually with a {@link PackageSourceException})
     */
    CompletionStage<List<PluginPackage>> find();

    /**
     * Watch for package changes.
     *
     * <p>The listener is invoked with an initial list, immediately or as soon as one is
     * available, and again on every subsequent change. {@link PackageListener#onError(Throwable)}
     * signals a permanent failure after which no further lists are delivered.
     *
     * @param listener callback receiving package lists
     * @return cancellation that permanently stops further callbacks
     */
    WatchCancellation watch(PackageListener listener);
}
