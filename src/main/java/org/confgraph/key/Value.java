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
import com.google.common.collect.ImmutableSet;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * A Value is a computation over zero or more Keys. It can be asked for its result in three ways:
 *
 * <ul>
 *   <li>{@link #peek} returns a result only if every key it reads is bound in the given Context,
 *       and null otherwise;
 *   <li>{@link #peekWithDefaults} also uses key defaults for unbound keys, and returns null if
 *       some key has neither a binding nor a default; and
 *   <li>{@link #eval} is like {@link #peekWithDefaults} but throws a {@link ConfigurationError}
 *       instead of returning null.
 * </ul>
 *
 * Values are immutable.
 */
public abstract class Value<T> {

  /** The keys that this value reads. */
  public abstract ImmutableSet<Key<?>> keys();

  /**
   * Returns the result, or null if one of the keys is unbound (and, if {@code useDefaults} is
   * true, has no default).
   */
  abstract @Nullable T lookup(Context context, boolean useDefaults);

  /** Returns the result if all of {@link #keys} are bound in {@code context}, otherwise null. */
  public @Nullable T peek(Context context) {
    return lookup(context, false);
  }

  /**
   * Returns the result if each of {@link #keys} is either bound in {@code context} or has a
   * default, otherwise null.
   */
  public @Nullable T peekWithDefaults(Context context) {
    return lookup(context, true);
  }

  /** Returns the result, falling back to key defaults for any unbound keys. */
  public T eval(Context context) {
    T result = lookup(context, true);
    if (result == null) {
      Key<?> missing =
          keys().stream()
              .filter(k -> !context.isBound(k) && k.defaultValue() == null)
              .findFirst()
              .orElseThrow();
      throw new ConfigurationError(missing);
    }
    return result;
  }

  /** Returns a Value with no keys that always returns {@code value}. */
  public static <T> Value<T> pure(T value) {
    return new Pure<>(Preconditions.checkNotNull(value));
  }

  /** Returns a Value that reads {@code key}. */
  public static <T> Value<T> of(Key<T> key) {
    return new Read<>(key);
  }

  /**
   * Returns a Value whose result is {@code fn} applied to this one's; {@code name} is only used by
   * {@link #toString}.
   */
  public <R> Value<R> map(String name, Function<? super T, ? extends R> fn) {
    return new Mapped<>(name, this, fn);
  }

  /**
   * Returns a Value whose result is {@code fn} applied to the results of {@code x} and {@code y}.
   */
  public static <A, B, R> Value<R> map2(
      String name, Value<A> x, Value<B> y, BiFunction<? super A, ? super B, ? extends R> fn) {
    return new Combined<>(name, x, y, fn);
  }

  public static Value<Boolean> not(Value<Boolean> x) {
    return x.map("!", b -> !b);
  }

  public static Value<Boolean> and(Value<Boolean> x, Value<Boolean> y) {
    return map2("&&", x, y, (a, b) -> a && b);
  }

  public static Value<Boolean> or(Value<Boolean> x, Value<Boolean> y) {
    return map2("||", x, y, (a, b) -> a || b);
  }

  private static class Pure<T> extends Value<T> {
    final T value;

    Pure(T value) {
      this.value = value;
    }

    @Override
    public ImmutableSet<Key<?>> keys() {
      return ImmutableSet.of();
    }

    @Override
    T lookup(Context context, boolean useDefaults) {
      return value;
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  private static class Read<T> extends Value<T> {
    final Key<T> key;

    Read(Key<T> key) {
      this.key = Preconditions.checkNotNull(key);
    }

    @Override
    public ImmutableSet<Key<?>> keys() {
      return ImmutableSet.of(key);
    }

    @Override
    @Nullable T lookup(Context context, boolean useDefaults) {
      T result = context.get(key);
      return (result == null && useDefaults) ? key.defaultValue() : result;
    }

    @Override
    public String toString() {
      return key.name;
    }
  }

  private static class Mapped<A, R> extends Value<R> {
    final String name;
    final Value<A> x;
    final Function<? super A, ? extends R> fn;

    Mapped(String name, Value<A> x, Function<? super A, ? extends R> fn) {
      this.name = name;
      this.x = x;
      this.fn = fn;
    }

    @Override
    public ImmutableSet<Key<?>> keys() {
      return x.keys();
    }

    @Override
    @Nullable R lookup(Context context, boolean useDefaults) {
      A a = x.lookup(context, useDefaults);
      return (a == null) ? null : Preconditions.checkNotNull(fn.apply(a));
    }

    @Override
    public String toString() {
      return name + x;
    }
  }

  private static class Combined<A, B, R> extends Value<R> {
    final String name;
    final Value<A> x;
    final Value<B> y;
    final BiFunction<? super A, ? super B, ? extends R> fn;

    Combined(
        String name, Value<A> x, Value<B> y, BiFunction<? super A, ? super B, ? extends R> fn) {
      this.name = name;
      this.x = x;
      this.y = y;
      this.fn = fn;
    }

    @Override
    public ImmutableSet<Key<?>> keys() {
      return ImmutableSet.<Key<?>>builder().addAll(x.keys()).addAll(y.keys()).build();
    }

    @Override
    @Nullable R lookup(Context context, boolean useDefaults) {
      A a = x.lookup(context, useDefaults);
      if (a == null) {
        return null;
      }
      B b = y.lookup(context, useDefaults);
      return (b == null) ? null : Preconditions.checkNotNull(fn.apply(a, b));
    }

    @Override
    public String toString() {
      return String.format("(%s %s %s)", x, name, y);
    }
  }
}
