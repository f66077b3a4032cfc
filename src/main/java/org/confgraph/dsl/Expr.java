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
import java.util.Arrays;
import org.confgraph.key.Value;

/**
 * An expression tree describing a staged configuration. There are three kinds of node:
 *
 * <ul>
 *   <li>an {@link Instance} of a Component, with zero or more dependency expressions that must be
 *       configured before it;
 *   <li>an {@link If}, choosing between two expressions based on a boolean Value that may not be
 *       known yet; and
 *   <li>an {@link App}, applying a functor-like expression to an argument.
 * </ul>
 *
 * Expressions are immutable; the same Expr may appear more than once in a tree, but {@link
 * org.confgraph.graph.GraphBuilder} creates a separate vertex for each occurrence.
 */
public abstract class Expr {

  private Expr() {}

  /** Returns an Instance of {@code component} with the given dependencies. */
  public static Expr of(Component component, Expr... dependencies) {
    return new Instance(component, ImmutableList.copyOf(dependencies));
  }

  /** Returns an If that evaluates to {@code then} when {@code cond} is true. */
  public static Expr ifThenElse(Value<Boolean> cond, Expr then, Expr otherwise) {
    return new If(cond, then, otherwise);
  }

  /** Returns the application of {@code fn} to {@code arg}. */
  public static Expr apply(Expr fn, Expr arg) {
    return new App(fn, arg);
  }

  /**
   * Returns the curried application of {@code fn} to each of {@code args} in turn, i.e. {@code
   * apply(fn, a, b)} is {@code apply(apply(fn, a), b)}.
   */
  public static Expr apply(Expr fn, Expr arg, Expr... moreArgs) {
    return Arrays.stream(moreArgs).reduce(apply(fn, arg), Expr::apply);
  }

  /** A component instance. */
  public static final class Instance extends Expr {
    public final Component component;
    public final ImmutableList<Expr> dependencies;

    Instance(Component component, ImmutableList<Expr> dependencies) {
      this.component = Preconditions.checkNotNull(component);
      this.dependencies = dependencies;
    }

    @Override
    public String toString() {
      return dependencies.isEmpty()
          ? component.moduleName()
          : component.moduleName() + dependencies;
    }
  }

  /** A conditional. */
  public static final class If extends Expr {
    public final Value<Boolean> cond;
    public final Expr then;
    public final Expr otherwise;

    If(Value<Boolean> cond, Expr then, Expr otherwise) {
      this.cond = Preconditions.checkNotNull(cond);
      this.then = Preconditions.checkNotNull(then);
      this.otherwise = Preconditions.checkNotNull(otherwise);
    }

    @Override
    public String toString() {
      return String.format("if(%s, %s, %s)", cond, then, otherwise);
    }
  }

  /** An application. */
  public static final class App extends Expr {
    public final Expr fn;
    public final Expr arg;

    App(Expr fn, Expr arg) {
      this.fn = Preconditions.checkNotNull(fn);
      this.arg = Preconditions.checkNotNull(arg);
    }

    @Override
    public String toString() {
      return String.format("$(%s, %s)", fn, arg);
    }
  }
}
