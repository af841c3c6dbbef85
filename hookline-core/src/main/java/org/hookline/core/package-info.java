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
 * Hook resolution and multiplexing.
 *
 * <p>{@link org.hookline.core.ExtensionResolver} turns a package list and a hook name into an
 * ordered list of loaded and errored extensions. {@link org.hookline.core.HookStreamMultiplexer}
 * shares one package source subscription among any number of hook watchers and republishes
 * resolved extensions whenever the packages change.
 *
 * <p>Streams are plain observer registrations ({@link org.hookline.core.HookStream},
 * {@link org.hookline.core.StreamObserver}, {@link org.hookline.core.Subscription}) backed by
 * {@link org.hookline.core.ReplayLatestBroadcaster}, which caches the latest value for late
 * subscribers.
 */
package org.hookline.core;
