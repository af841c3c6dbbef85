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

/**
 * Public vocabulary of the hook runtime.
 *
 * <p>{@link org.hookline.api.PluginPackage} and {@link org.hookline.api.ExtensionDescriptor}
 * describe what is installed, {@link org.hookline.api.PackageSource} describes where it comes
 * from, and {@link org.hookline.api.Extension} with its two variants
 * {@link org.hookline.api.LoadedExtension} and {@link org.hookline.api.ErroredExtension}
 * describes what happened when a hook was resolved.
 */
package org.hookline.api;
