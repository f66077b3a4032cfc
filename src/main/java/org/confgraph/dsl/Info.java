/*
 * Copyright 2025 The Confgraph Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.confgraph.dsl;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Describes the application being configured; passed to each component's {@link
 * Component#configure}, {@link Component#connect} and {@link Component#clean}.
 */
public final class Info {
  /** The name of the application. */
  public final String name;

  /** The libraries the application links against. */
  public final ImmutableSortedSet<String> libraries;

  /** Maps each required package to a version constraint (empty if unconstrained). */
  public final ImmutableSortedMap<String, String> packages;

  public Info(
      String name,
      ImmutableSortedSet<String> libraries,
      ImmutableSortedMap<String, String> packages) {
    this.name = Preconditions.checkNotNull(name);
    this.libraries = libraries;
    this.packages = packages;
  }

  @Override
  public String toString() {
    return String.format("%s libraries=%s packages=%s", name, libraries, packages);
  }
}
