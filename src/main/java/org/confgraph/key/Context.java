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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/** An immutable set of bindings from Keys to their concrete values. */
public final class Context {
  public static final Context EMPTY = new Context(ImmutableMap.of());

  private final ImmutableMap<Key<?>, Object> bindings;

  private Context(ImmutableMap<Key<?>, Object> bindings) {
    this.bindings = bindings;
  }

  /** Returns the value bound to {@code key}, or null if it is unbound. Defaults are ignored. */
  @SuppressWarnings("unchecked")
  public <T> @Nullable T get(Key<T> key) {
    return (T) bindings.get(key);
  }

  public boolean isBound(Key<?> key) {
    return bindings.containsKey(key);
  }

  /** Returns the keys with a binding in this context, in the order they were bound. */
  public ImmutableSet<Key<?>> keys() {
    return bindings.keySet();
  }

  /** Returns a Context with the same bindings as this one, except that {@code key} is bound. */
  public <T> Context with(Key<T> key, T value) {
    return new Builder(this).set(key, value).build();
  }

  public static Builder builder() {
    return new Builder(EMPTY);
  }

  /** Accumulates bindings; binding a key a second time replaces its previous value. */
  public static class Builder {
    private final Map<Key<?>, Object> bindings;

    private Builder(Context start) {
      bindings = new LinkedHashMap<>(start.bindings);
    }

    @CanIgnoreReturnValue
    public <T> Builder set(Key<T> key, T value) {
      bindings.put(Preconditions.checkNotNull(key), Preconditions.checkNotNull(value));
      return this;
    }

    public Context build() {
      return new Context(ImmutableMap.copyOf(bindings));
    }
  }

  @Override
  public String toString() {
    return bindings.entrySet().stream()
        .map(e -> e.getKey().name + "=" + e.getValue())
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
