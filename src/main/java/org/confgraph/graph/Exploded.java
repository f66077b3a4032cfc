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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.confgraph.dsl.Component;
import org.confgraph.key.Value;

/**
 * A typed view of a single vertex and its children, reconstructed from the vertex's outgoing
 * edges. {@link #of} is where the per-vertex shape invariants are enforced:
 *
 * <ul>
 *   <li>an If vertex has exactly one Then and one Else edge, and nothing else;
 *   <li>an Impl vertex has Parameter edges numbered 0 to n-1 and Dependency edges numbered 0 to
 *       m-1 (n, m &gt;= 0), and no Branch edges; and
 *   <li>an App vertex has Parameter edges numbered 0 to n-1 with n &gt;= 2, and nothing else.
 * </ul>
 *
 * A vertex that breaks these rules can only be the result of a bug in graph construction or in
 * one of the rewrites, so violations throw an IllegalStateException.
 */
public abstract class Exploded {

  private Exploded() {}

  /** An Impl vertex: a component with its parameters and dependencies, in index order. */
  public static final class Impl extends Exploded {
    public final Component component;
    public final ImmutableList<Vertex> args;
    public final ImmutableList<Vertex> deps;

    Impl(Component component, ImmutableList<Vertex> args, ImmutableList<Vertex> deps) {
      this.component = component;
      this.args = args;
      this.deps = deps;
    }
  }

  /** An If vertex. */
  public static final class If extends Exploded {
    public final Value<Boolean> cond;
    public final Vertex then;
    public final Vertex otherwise;

    If(Value<Boolean> cond, Vertex then, Vertex otherwise) {
      this.cond = cond;
      this.then = then;
      this.otherwise = otherwise;
    }
  }

  /** An App vertex, with the function (parameter 0) split off from its arguments. */
  public static final class App extends Exploded {
    public final Vertex fn;
    public final ImmutableList<Vertex> args;

    App(Vertex fn, ImmutableList<Vertex> args) {
      this.fn = fn;
      this.args = args;
    }
  }

  /** Returns the typed view of {@code v}, which must be a vertex of {@code graph}. */
  public static Exploded of(Graph graph, Vertex v) {
    List<Edge> params = new ArrayList<>();
    List<Edge> deps = new ArrayList<>();
    Vertex then = null;
    Vertex otherwise = null;
    int numBranches = 0;
    for (Edge e : graph.succEdges(v)) {
      switch (e.label.kind) {
        case PARAMETER -> params.add(e);
        case DEPENDENCY -> deps.add(e);
        case BRANCH -> {
          ++numBranches;
          if (e.label.side == Label.Side.THEN) {
            then = e.dst;
          } else {
            otherwise = e.dst;
          }
        }
      }
    }
    ImmutableList<Vertex> sortedParams = inIndexOrder(params, v);
    ImmutableList<Vertex> sortedDeps = inIndexOrder(deps, v);
    Description description = v.description;
    if (description instanceof Description.Impl impl) {
      checkState(numBranches == 0, "Impl vertex %s has Branch edges", v);
      return new Impl(impl.component, sortedParams, sortedDeps);
    } else if (description instanceof Description.If cond) {
      checkState(
          numBranches == 2 && then != null && otherwise != null,
          "If vertex %s must have exactly one Then and one Else edge",
          v);
      checkState(
          sortedParams.isEmpty() && sortedDeps.isEmpty(),
          "If vertex %s has Parameter or Dependency edges",
          v);
      return new If(cond.cond, then, otherwise);
    } else {
      assert description instanceof Description.App;
      checkState(
          numBranches == 0 && sortedDeps.isEmpty(),
          "App vertex %s has Branch or Dependency edges",
          v);
      checkState(sortedParams.size() >= 2, "App vertex %s has fewer than 2 parameters", v);
      return new App(sortedParams.get(0), sortedParams.subList(1, sortedParams.size()));
    }
  }

  /**
   * Sorts {@code edges} by index and returns their destinations; the indices must be exactly 0 to
   * {@code edges.size()-1}.
   */
  private static ImmutableList<Vertex> inIndexOrder(List<Edge> edges, Vertex v) {
    edges.sort(Comparator.comparingInt(e -> e.label.index));
    for (int i = 0; i < edges.size(); i++) {
      checkState(
          edges.get(i).label.index == i,
          "%s edges of %s are not numbered 0 to %s",
          edges.get(i).label.kind,
          v,
          edges.size() - 1);
    }
    return edges.stream().map(e -> e.dst).collect(ImmutableList.toImmutableList());
  }
}
