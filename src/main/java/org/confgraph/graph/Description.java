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

package org.confgraph.graph;

import com.google.common.base.Preconditions;
import org.confgraph.dsl.Component;
import org.confgraph.key.Value;

/**
 * What a {@link Vertex} stands for. There are exactly three kinds:
 *
 * <ul>
 *   <li>{@link If}, a conditional on a boolean Value that has not been resolved yet;
 *   <li>{@link Impl}, a (possibly partially applied) Component; and
 *   <li>{@link App}, the application of its first parameter to the rest.
 * </ul>
 *
 * Descriptions are immutable and may be shared by any number of vertices.
 */
public abstract class Description {

  private Description() {}

  /** The label used for this description in Graphviz output. */
  public abstract String dotName();

  public static final class If extends Description {
    public final Value<Boolean> cond;

    public If(Value<Boolean> cond) {
      this.cond = Preconditions.checkNotNull(cond);
    }

    @Override
    public String dotName() {
      return "If";
    }

    @Override
    public String toString() {
      return "if " + cond;
    }
  }

  public static final class Impl extends Description {
    public final Component component;

    public Impl(Component component) {
      this.component = Preconditions.checkNotNull(component);
    }

    @Override
    public String dotName() {
      return component.moduleName();
    }

    @Override
    public String toString() {
      return component.moduleName();
    }
  }

  public static final class App extends Description {
    public static final App INSTANCE = new App();

    private App() {}

    @Override
    public String dotName() {
      return "$";
    }

    @Override
    public String toString() {
      return "$";
    }
  }
}
