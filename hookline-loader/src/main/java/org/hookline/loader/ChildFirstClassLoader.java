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

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * Package classloader that resolves classes and resources from the package's own jars
 * before its parent, except for an allowlist of parent-first prefixes.
 *
 * <p>Parent-first prefixes keep the JDK, logging and the hook API loaded from a single
 * source so that providers and the host agree on shared types.
 */
public class ChildFirstClassLoader extends URLClassLoader {

    public static final List<String> DEFAULT_PARENT_FIRST_PACKAGES;

    static {
        List<String> packages = new ArrayList<>();
        packages.add("java.");
        packages.add("javax.");
        packages.add("jdk.");
        packages.add("sun.");
        packages.add("com.sun.");
        packages.add("org.slf4j.");
        packages.add("org.apache.logging.");
        packages.add("org.hookline.api.");
        DEFAULT_PARENT_FIRST_PACKAGES = Collections.unmodifiableList(packages);
    }

    private final String packageId;
    private final List<String> parentFirstPackages;

    public ChildFirstClassLoader(String packageId, URL[] urls, ClassLoader parent, List<String> parentFirstPackages) {
        super("hookline-package-" + packageId, urls, parent);
        this.packageId = packageId;
        this.parentFirstPackages = parentFirstPackages != null
                ? Collections.unmodifiableList(new ArrayList<>(parentFirstPackages))
                : DEFAULT_PARENT_FIRST_PACKAGES;
    }

    public String getPackageId() {
        return packageId;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> loaded = findLoadedClass(name);
            if (loaded != null) {
                return loaded;
            }
            if (isParentFirst(name)) {
                return super.loadClass(name, resolve);
            }
            try {
                Class<?> clazz = findClass(name);
                if (resolve) {
                    resolveClass(clazz);
                }
                return clazz;
            } catch (ClassNotFoundException notInPackage) {
                return super.loadClass(name, resolve);
            }
        }
    }

    @Override
    public URL getResource(String name) {
        if (isParentFirst(name.replace('/', '.'))) {
            return super.getResource(name);
        }
        URL own = findResource(name);
        return own != null ? own : super.getResource(name);
    }

    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        if (isParentFirst(name.replace('/', '.'))) {
            return super.getResources(name);
        }
        List<URL> urls = new ArrayList<>(Collections.list(findResources(name)));
        ClassLoader parent = getParent();
        if (parent != null) {
            urls.addAll(Collections.list(parent.getResources(name)));
        }
        return Collections.enumeration(urls);
    }

    private boolean isParentFirst(String name) {
        for (String prefix : parentFirstPackages) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ChildFirstClassLoader{packageId='" + packageId + "', urls=" + getURLs().length + '}';
    }
}
