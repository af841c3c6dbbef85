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

import org.hookline.api.ErroredExtension;
import org.hookline.api.Extension;
import org.hookline.api.ExtensionDescriptor;
import org.hookline.api.ExtensionLoadException;
import org.hookline.api.LoadedExtension;
import org.hookline.api.PluginPackage;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Resolves a hook against a package list.
 *
 * <p>The {@link #resolve(List, String)} flow:
 * <ol>
 *   <li>Visits packages in list order and, within each package, descriptors in declaration
 *       order, keeping those whose hook equals the requested hook.</li>
 *   <li>Loads each matching descriptor through its owning package, one at a time: the next
 *       load starts only after the previous one completed.</li>
 *   <li>Records a {@link LoadedExtension} for each successful load and an
 *       {@link ErroredExtension} for each failed one.</li>
 * </ol>
 *
 * <h2>Failure Semantics</h2>
 *
 * <p>A failing extension never aborts the resolution of its siblings or of other packages.
 * A loader may fail by returning an exceptionally completed stage, by throwing, or by
 * returning {@code null}; all three become errored extensions. The returned future itself
 * never completes exceptionally because of a single extension. A package without an id
 * cannot own extensions and is skipped with a warning.
 *
 * <p>The resolver holds no state across calls.
 */
public class ExtensionResolver {
    private static final Logger LOG = LogManager.getLogger(ExtensionResolver.class);

    /**
     * Resolve every extension implementing {@code hook}.
     *
     * @param packages packages in source order
     * @param hook hook name, compared exactly
     * @return future completing with the classified extensions in package-then-descriptor order
     */
    public CompletableFuture<List<Extension>> resolve(List<? extends PluginPackage> packages, String hook) {
        Objects.requireNonNull(packages, "packages");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(hook), "hook is required");

        List<Extension> extensions = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PluginPackage pkg : packages) {
            String packageId = pkg.getId();
            if (Strings.isNullOrEmpty(packageId)) {
                LOG.warn("Skip package without id while resolving hook {}: {}", hook, pkg);
                continue;
            }
            for (ExtensionDescriptor descriptor : pkg.getExtensions()) {
                if (!descriptor.implementsHook(hook)) {
                    continue;
                }
                chain = chain.thenCompose(ignored -> loadExtension(pkg, packageId, descriptor))
                        .thenAccept(extensions::add);
            }
        }
        return chain.thenApply(ignored -> {
            LOG.debug("Resolved hook {}: packages={}, extensions={}", hook, packages.size(), extensions.size());
            return Collections.unmodifiableList(extensions);
        });
    }

    private CompletableFuture<Extension> loadExtension(PluginPackage pkg, String packageId,
            ExtensionDescriptor descriptor) {
        CompletionStage<Object> stage;
        try {
            stage = pkg.load(descriptor);
        } catch (RuntimeException | LinkageError e) {
            return CompletableFuture.completedFuture(errored(packageId, descriptor, e));
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(errored(packageId, descriptor, new ExtensionLoadException(
                    "Loader of package " + packageId + " returned no result for extension "
                            + descriptor.getName())));
        }

        CompletableFuture<Extension> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            try {
                if (error == null) {
                    result.complete(new LoadedExtension(descriptor, packageId, value));
                } else {
                    result.complete(errored(packageId, descriptor, unwrap(error)));
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private static ErroredExtension errored(String packageId, ExtensionDescriptor descriptor, Throwable error) {
        LOG.warn("Failed to load extension: packageId={}, hook={}, name={}, error={}",
                packageId, descriptor.getHook(), descriptor.getName(), error.toString());
        return new ErroredExtension(descriptor, packageId, error);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
