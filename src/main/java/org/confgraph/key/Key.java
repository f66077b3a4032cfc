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

package org.confgraph.key;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A Key names a late-bound configuration value. Keys are compared by identity; two Keys with the
 * same name are distinct.
 *
 * <p>A Key does not hold a value itself. Values are bound to keys by a {@link Context}, and a Key
 * may have a default that is used by {@link Value#eval} (but never by {@link Value#peek}) when the
 * context has no binding for it.
 */
public final class Key<T> {
  public final String name;

  private final @Nullable T defaultValue;

  private Key(String name, @Nullable T defaultValue) {
    Preconditions.checkArgument(!name.isEmpty(), "Key names must be non-empty");
    this.name = name;
    this.defaultValue = defaultValue;
  }

  /** Returns a new Key with no default; evaluating it requires a binding. */
  public static <T> Key<T> create(String name) {
    return new Key<>(name, null);
  }

  /** Returns a new Key that evaluates to {@code defaultValue} when it is not bound. */
  public static <T> Key<T> create(String name, T defaultValue) {
    return new Key<>(name, Preconditions.checkNotNull(defaultValue));
  }

  /** Returns this key's default, or null if it has none. */
  public @Nullable T defaultValue() {
    return defaultValue;
  }

  /** Returns a Value that reads this key. */
  public Value<T> value() {
    return Value.of(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
