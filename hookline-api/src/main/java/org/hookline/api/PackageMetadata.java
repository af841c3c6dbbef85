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
import java.util.Optional;

/**
 * Descriptive metadata of a package.
 *
 * <p>Only the name is required; author, version and summary are optional.
 */
public final class PackageMetadata {

    private final String name;
    private final String author;
    private final String version;
    private final String summary;

    private PackageMetadata(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.author = builder.author;
        this.version = builder.version;
        this.summary = builder.summary;
    }

    /**
     * Creates metadata with only a name.
     *
     * @param name package name
     * @return metadata instance
     */
    public static PackageMetadata of(String name) {
        return builder().name(name).build();
    }

    public String getName() {
        return name;
    }

    public Optional<String> getAuthor() {
        return Optional.ofNullable(author);
    }

    public Optional<String> getVersion() {
        return Optional.ofNullable(version);
    }

    public Optional<String> getSummary() {
        return Optional.ofNullable(summary);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PackageMetadata that = (PackageMetadata) o;
        return name.equals(that.name)
                && Objects.equals(author, that.author)
                && Objects.equals(version, that.version)
                && Objects.equals(summary, that.summary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, author, version, summary);
    }

    @Override
    public String toString() {
        return "PackageMetadata{"
                + "name='" + name + '\''
                + (version != null ? ", version='" + version + '\'' : "")
                + (author != null ? ", author='" + author + '\'' : "")
                + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link PackageMetadata}.
     */
    public static final class Builder {
        private String name;
        private String author;
        private String version;
        private String summary;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public PackageMetadata build() {
            return new PackageMetadata(this);
        }
    }
}
