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
import com.google.common.collect.ImmutableList;
import org.confgraph.key.Key;
import org.confgraph.key.Value;

/**
 * A Component with no keys, packages or libraries, whose {@link #configure} and {@link #clean} do
 * nothing. Subclasses override whatever they need.
 */
public class BaseComponent implements Component {
  private static final Value<ImmutableList<String>> NONE = Value.pure(ImmutableList.of());

  private final String name;
  private final String moduleName;

  public BaseComponent(String name, String moduleName) {
    this.name = Preconditions.checkNotNull(name);
    this.moduleName = Preconditions.checkNotNull(moduleName);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String moduleName() {
    return moduleName;
  }

  @Override
  public ImmutableList<Key<?>> keys() {
    return ImmutableList.of();
  }

  @Override
  public Value<ImmutableList<String>> packages() {
    return NONE;
  }

  @Override
  public Value<ImmutableList<String>> libraries() {
    return NONE;
  }

  /** The default start code applies {@code moduleName.start} to the arguments. */
  @Override
  public String connect(Info info, String moduleName, ImmutableList<String> args) {
    return args.isEmpty()
        ? moduleName + ".start ()"
        : moduleName + ".start " + String.join(" ", args);
  }

  @Override
  public void configure(Info info) {}

  @Override
  public void clean(Info info) {}

  @Override
  public String toString() {
    return name;
  }
}
