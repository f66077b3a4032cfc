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

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

/**
 * A static-only class that checks the structural invariants of a whole graph:
 *
 * <ul>
 *   <li>every vertex has the shape required by its description (see {@link Exploded});
 *   <li>there are no cycles; and
 *   <li>exactly one vertex (the root) has no inlinks, and every vertex is reachable from it.
 * </ul>
 *
 * Graphs built by {@link GraphBuilder} and transformed by the rewrites in this package always
 * satisfy these; a failure indicates a bug.
 */
public class Invariants {

  private Invariants() {}

  /** Throws an IllegalStateException if {@code graph} breaks one of the invariants. */
  public static void check(Graph graph) {
    checkState(graph.numVertices() != 0, "Graph is empty");
    for (Vertex v : graph.vertices()) {
      Exploded.of(graph, v);
    }
    checkState(!Traversal.hasCycle(graph), "Graph has a cycle");
    Vertex root = graph.root();
    Set<Vertex> reached = new HashSet<>();
    ArrayDeque<Vertex> toVisit = new ArrayDeque<>();
    toVisit.add(root);
    while (!toVisit.isEmpty()) {
      Vertex v = toVisit.poll();
      if (reached.add(v)) {
        toVisit.addAll(graph.successors(v));
      }
    }
    // With a single root and no cycles every vertex should be reachable, but check anyway.
    checkState(
        reached.size() == graph.numVertices(),
        "%s vertices are unreachable from the root",
        graph.numVertices() - reached.size());
  }
}
