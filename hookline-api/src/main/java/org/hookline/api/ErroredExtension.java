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

import java.util.Objects;

/**
 * An extension whose load failed.
 *
 * <p>The error is data, not control flow: it is kept for reporting and never rethrown
 * by the resolver.
 */
public final class ErroredExtension extends Extension {

    private final Throwable error;

    public ErroredExtension(ExtensionDescriptor descriptor, String packageId, Throwable error) {
        super(Kind.ERRORED, descriptor, packageId);
        this.error = Objects.requireNonNull(error, "error is required for errored extension");
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && error.equals(((ErroredExtension) o).error);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + error.hashCode();
    }

    @Override
    public String toString() {
        return "ErroredExtension{"
                + "hook='" + getHook() + '\''
                + ", name='" + getName() + '\''
                + ", packageId='" + getPackageId() + '\''
                + ", error=" + error
                + '}';
    }
}
