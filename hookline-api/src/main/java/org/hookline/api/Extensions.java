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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classification helpers over resolved extensions, used by consumers that report on
 * the outcome of a hook resolution.
 */
public final class Extensions {

    private Extensions() {
    }

    public static boolean isLoaded(Extension extension) {
        return extension != null && extension.getKind() == Extension.Kind.LOADED;
    }

    public static boolean isErrored(Extension extension) {
        return extension != null && extension.getKind() == Extension.Kind.ERRORED;
    }

    /**
     * Selects the loaded extensions, keeping their order.
     *
     * @param extensions resolved extensions
     * @return loaded extensions only
     */
    public static List<LoadedExtension> loaded(List<? extends Extension> extensions) {
        Objects.requireNonNull(extensions, "extensions");
        List<LoadedExtension> result = new ArrayList<>();
        for (Extension extension : extensions) {
            if (isLoaded(extension)) {
                result.add((LoadedExtension) extension);
            }
        }
        return result;
    }

    /**
     * Selects the errored extensions, keeping their order.
     *
     * @param extensions resolved extensions
     * @return errored extensions only
     */
    public static List<ErroredExtension> errored(List<? extends Extension> extensions) {
        Objects.requireNonNull(extensions, "extensions");
        List<ErroredExtension> result = new ArrayList<>();
        for (Extension extension : extensions) {
            if (isErrored(extension)) {
                result.add((ErroredExtension) extension);
            }
        }
        return result;
    }
}
