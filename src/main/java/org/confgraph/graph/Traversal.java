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
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import org.confgraph.util.Monoid;

/** A static-only class for visiting and summarizing every vertex of a graph. */
public class Traversal {

  private Traversal() {}

  /**
   * Calls {@code visitor} once with each vertex of {@code graph}, visiting the source of each edge
   * before its destination.
   *
   * <p>Throws an IllegalStateException if the graph has a cycle; well-formed graphs never do.
   */
  public static void iter(Graph graph, Consumer<Vertex> visitor) {
    Preconditions.checkState(!hasCycle(graph), "A graph should not have cycles");
    topologicalOrder(graph).forEach(visitor);
  }

  /**
   * Combines {@code fn} applied to the description of each vertex. The order in which results are
   * combined is unspecified.
   */
  public static <T> T collect(
      Monoid<T> monoid, Function<? super Description, ? extends T> fn, Graph graph) {
    T result = monoid.empty();
    for (Vertex v : graph.vertices()) {
      result = monoid.combine(fn.apply(v.description), result);
    }
    return result;
  }

  /** Returns true if {@code graph} contains a cycle. */
  public static boolean hasCycle(Graph graph) {
    // Iterative depth-first search; a vertex is ACTIVE while it is on the stack, and an edge to
    // an ACTIVE vertex closes a cycle.
    Map<Vertex, Boolean> active = new HashMap<>();
    ArrayDeque<Vertex> stack = new ArrayDeque<>();
    ArrayDeque<Iterator<Edge>> pending = new ArrayDeque<>();
    for (Vertex start : graph.vertices()) {
      if (active.containsKey(start)) {
        continue;
      }
      active.put(start, true);
      stack.push(start);
      pending.push(graph.succEdges(start).iterator());
      while (!stack.isEmpty()) {
        Iterator<Edge> edges = pending.peek();
        if (edges.hasNext()) {
          Vertex next = edges.next().dst;
          Boolean state = active.get(next);
          if (state == null) {
            active.put(next, true);
            stack.push(next);
            pending.push(graph.succEdges(next).iterator());
          } else if (state) {
            return true;
          }
        } else {
          active.put(stack.pop(), false);
          pending.pop();
        }
      }
    }
    return false;
  }

  /**
   * Returns the vertices of an acyclic graph with each edge's source before its destination. The
   * order depends only on the order in which vertices and edges were added to the graph.
   */
  public static ImmutableList<Vertex> topologicalOrder(Graph graph) {
    Map<Vertex, Integer> remaining = new HashMap<>();
    ArrayDeque<Vertex> ready = new ArrayDeque<>();
    for (Vertex v : graph.vertices()) {
      int inDegree = graph.inDegree(v);
      remaining.put(v, inDegree);
      if (inDegree == 0) {
        ready.add(v);
      }
    }
    ImmutableList.Builder<Vertex> result = ImmutableList.builderWithExpectedSize(remaining.size());
    while (!ready.isEmpty()) {
      Vertex v = ready.poll();
      result.add(v);
      for (Edge e : graph.succEdges(v)) {
        if (remaining.merge(e.dst, -1, Integer::sum) == 0) {
          ready.add(e.dst);
        }
      }
    }
    ImmutableList<Vertex> order = result.build();
    Preconditions.checkState(order.size() == graph.numVertices(), "A graph should not have cycles");
    return order;
  }
}
