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

import com.google.common.collect.ImmutableList;
import org.confgraph.key.Key;
import org.confgraph.key.Value;

/**
 * The capabilities of a configurable unit. The specializer never calls {@link #connect}, {@link
 * #configure} or {@link #clean}; they are carried through the graph unchanged for the code
 * generator that consumes it. Implementations must be immutable.
 */
public interface Component {
  /** A human-readable name, unique within an application. */
  String name();

  /** The name of the module that implements this component in generated code. */
  String moduleName();

  /** The configuration keys this component reads. */
  ImmutableList<Key<?>> keys();

  /** The packages this component requires. */
  Value<ImmutableList<String>> packages();

  /** The libraries this component requires. */
  Value<ImmutableList<String>> libraries();

  /**
   * Returns the code that starts this component, given the names of the already-started values for
   * each of its parameters and dependencies.
   */
  String connect(Info info, String moduleName, ImmutableList<String> args);

  /** Prepares whatever this component needs before code generation. */
  void configure(Info info);

  /** Removes anything created by {@link #configure}. */
  void clean(Info info);
}
