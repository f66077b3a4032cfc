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

package org.confgraph.util;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.function.BinaryOperator;

/**
 * An associative operation with an identity. Folds that use a Monoid may combine elements in any
 * order, so {@link #combine} should also be commutative unless the caller fixes the order.
 */
public interface Monoid<T> {
  T empty();

  T combine(T x, T y);

  /** Adds integers. */
  Monoid<Integer> SUM_INTS = of(0, Integer::sum);

  /** Returns a Monoid with the given identity and operation. */
  static <T> Monoid<T> of(T empty, BinaryOperator<T> combine) {
    Preconditions.checkNotNull(empty);
    Preconditions.checkNotNull(combine);
    return new Monoid<T>() {
      @Override
      public T empty() {
        return empty;
      }

      @Override
      public T combine(T x, T y) {
        return combine.apply(x, y);
      }
    };
  }

  /** Returns a Monoid that computes the union of sets. */
  static <E> Monoid<ImmutableSet<E>> union() {
    return of(
        ImmutableSet.of(),
        (x, y) -> {
          if (x.isEmpty()) {
            return y;
          } else if (y.isEmpty()) {
            return x;
          }
          return ImmutableSet.<E>builder().addAll(x).addAll(y).build();
        });
  }
}
