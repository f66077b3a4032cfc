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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.confgraph.dsl.Component;
import org.confgraph.dsl.Expr;
import org.confgraph.key.Value;

/**
 * Converts an {@link Expr} tree into a {@link Graph} with one vertex per node of the tree.
 *
 * <p>A GraphBuilder accumulates the graph as it goes, so each instance should only be used to
 * build one graph; most callers just use {@link #create}.
 */
public class GraphBuilder {
  private Graph graph = Graph.EMPTY;

  /** Returns the graph for {@code expr}; its root is the vertex for {@code expr} itself. */
  public static Graph create(Expr expr) {
    GraphBuilder builder = new GraphBuilder();
    builder.add(expr);
    return builder.graph;
  }

  /** The graph built so far. */
  public Graph graph() {
    return graph;
  }

  /** Adds vertices for {@code expr} and everything below it, and returns the vertex for expr. */
  public Vertex add(Expr expr) {
    if (expr instanceof Expr.Instance instance) {
      // Dependencies are built first, in order.
      ImmutableList<Vertex> deps =
          instance.dependencies.stream().map(this::add).collect(ImmutableList.toImmutableList());
      return addImpl(instance.component, ImmutableList.of(), deps);
    } else if (expr instanceof Expr.If ifExpr) {
      Vertex then = add(ifExpr.then);
      Vertex otherwise = add(ifExpr.otherwise);
      return addIf(ifExpr.cond, then, otherwise);
    } else {
      Expr.App app = (Expr.App) expr;
      Vertex fn = add(app.fn);
      Vertex arg = add(app.arg);
      return addApp(fn, ImmutableList.of(arg));
    }
  }

  /** Adds a new Impl vertex with the given parameters and dependencies. */
  public Vertex addImpl(Component component, List<Vertex> args, List<Vertex> deps) {
    Vertex v = Vertex.create(new Description.Impl(component));
    graph = addImpl(graph, v, args, deps);
    return v;
  }

  /** Adds a new If vertex. */
  public Vertex addIf(Value<Boolean> cond, Vertex then, Vertex otherwise) {
    Vertex v = Vertex.create(new Description.If(cond));
    graph = addIf(graph, v, then, otherwise);
    return v;
  }

  /** Adds a new App vertex applying {@code fn} to {@code args}. */
  public Vertex addApp(Vertex fn, List<Vertex> args) {
    Vertex v = Vertex.create(Description.App.INSTANCE);
    graph = graph.addEdge(v, Label.parameter(0), fn);
    for (int i = 0; i < args.size(); i++) {
      graph = graph.addEdge(v, Label.parameter(i + 1), args.get(i));
    }
    return v;
  }

  /**
   * Returns {@code graph} with {@code v} (an Impl vertex not yet in the graph) linked to the given
   * parameters and dependencies.
   */
  static Graph addImpl(Graph graph, Vertex v, List<Vertex> args, List<Vertex> deps) {
    assert v.isImpl();
    graph = graph.addVertex(v);
    for (int i = 0; i < args.size(); i++) {
      graph = graph.addEdge(v, Label.parameter(i), args.get(i));
    }
    for (int i = 0; i < deps.size(); i++) {
      graph = graph.addEdge(v, Label.dependency(i), deps.get(i));
    }
    return graph;
  }

  /** Returns {@code graph} with {@code v} (a new If vertex) linked to its branches. */
  static Graph addIf(Graph graph, Vertex v, Vertex then, Vertex otherwise) {
    assert v.isIf();
    return graph.addEdge(v, Label.THEN, then).addEdge(v, Label.ELSE, otherwise);
  }
}
