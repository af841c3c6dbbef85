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
 * An extension whose load completed successfully.
 */
public final class LoadedExtension extends Extension {

    private final Object value;

    public LoadedExtension(ExtensionDescriptor descriptor, String packageId, Object value) {
        super(Kind.LOADED, descriptor, packageId);
        this.value = value;
    }

    /**
     * Returns the loaded value.
     *
     * @return the value produced by the package loader, possibly {@code null}
     */
    public Object getValue() {
        return value;
    }

    /**
     * Returns the loaded value cast to the expected type.
     *
     * @param type expected value type
     * @param <T> value type
     * @return the value, possibly {@code null}
     * @throws ClassCastException if the value is not an instance of {@code type}
     */
    public <T> T getValue(Class<T> type) {
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equals(value, ((LoadedExtension) o).value);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "LoadedExtension{"
                + "hook='" + getHook() + '\''
                + ", name='" + getName() + '\''
                + ", packageId='" + getPackageId() + '\''
                + ", value=" + value
                + '}';
    }
}
