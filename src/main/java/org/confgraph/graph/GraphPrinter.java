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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A static-only class that renders a graph as a term, e.g. {@code if(k, wrap(A), wrap(B))}.
 *
 * <ul>
 *   <li>An Impl vertex prints as its module name, followed by its parameters in parentheses and
 *       its dependencies in square brackets (either is omitted if empty).
 *   <li>An If vertex prints as {@code if(cond, then, else)}.
 *   <li>An App vertex prints as {@code $(fn, arg...)}.
 * </ul>
 *
 * A shared vertex is printed in full at each of its uses. Rendering uses only the raw edges, so
 * even a graph that breaks the usual invariants can be printed (a cycle prints as {@code
 * <cycle>}); a graph with more than one root prints each on its own line.
 */
public class GraphPrinter {

  private GraphPrinter() {}

  private static final Comparator<Edge> EDGE_ORDER =
      Comparator.comparing(e -> e.label, Label.ORDER);

  /** Renders each vertex with no inlinks. */
  public static String print(Graph graph) {
    List<Vertex> roots =
        graph.vertices().stream().filter(v -> graph.inDegree(v) == 0).collect(Collectors.toList());
    if (roots.isEmpty()) {
      return graph.numVertices() == 0 ? "<empty>" : "<no root>";
    }
    return roots.stream().map(v -> print(graph, v)).collect(Collectors.joining("\n"));
  }

  /** Renders {@code v} and everything reachable from it. */
  public static String print(Graph graph, Vertex v) {
    StringBuilder sb = new StringBuilder();
    render(graph, v, sb, new HashSet<>());
    return sb.toString();
  }

  private static void render(Graph graph, Vertex v, StringBuilder sb, Set<Vertex> inProgress) {
    if (!inProgress.add(v)) {
      sb.append("<cycle>");
      return;
    }
    List<Edge> edges = new ArrayList<>(graph.succEdges(v));
    edges.sort(EDGE_ORDER);
    if (v.description instanceof Description.If ifDesc) {
      sb.append("if(").append(ifDesc.cond);
      for (Edge e : edges) {
        sb.append(", ");
        render(graph, e.dst, sb, inProgress);
      }
      sb.append(")");
    } else {
      sb.append(v.description);
      renderGroup(graph, edges, Label.Kind.PARAMETER, "(", ")", sb, inProgress);
      renderGroup(graph, edges, Label.Kind.DEPENDENCY, "[", "]", sb, inProgress);
    }
    inProgress.remove(v);
  }

  private static void renderGroup(
      Graph graph,
      List<Edge> edges,
      Label.Kind kind,
      String open,
      String close,
      StringBuilder sb,
      Set<Vertex> inProgress) {
    String separator = open;
    for (Edge e : edges) {
      if (e.label.kind == kind) {
        sb.append(separator);
        render(graph, e.dst, sb, inProgress);
        separator = ", ";
      }
    }
    if (!separator.equals(open)) {
      sb.append(close);
    }
  }
}
