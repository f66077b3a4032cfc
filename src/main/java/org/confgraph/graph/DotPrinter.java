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

/**
 * A static-only class that renders a graph in Graphviz's DOT language, for diagnostics.
 *
 * <p>App vertices are labelled {@code $}, If vertices {@code If}, and Impl vertices with their
 * module name. Parameter edges are labelled with their index, Dependency edges are labelled with
 * their index and dashed, and Branch edges are dotted.
 */
public class DotPrinter {

  private DotPrinter() {}

  public static String print(Graph graph, String name) {
    StringBuilder sb = new StringBuilder();
    sb.append("digraph ").append(quote(name)).append(" {\n");
    for (Vertex v : graph.vertices()) {
      sb.append(String.format("  v%d [label=%s];\n", v.id, quote(v.description.dotName())));
    }
    for (Edge e : graph.edges()) {
      sb.append(String.format("  v%d -> v%d [%s];\n", e.src.id, e.dst.id, attributes(e.label)));
    }
    return sb.append("}\n").toString();
  }

  private static String attributes(Label label) {
    return switch (label.kind) {
      case PARAMETER -> String.format("label=\"%d\"", label.index);
      case DEPENDENCY -> String.format("label=\"%d\", style=dashed", label.index);
      case BRANCH -> "style=dotted";
    };
  }

  private static String quote(String s) {
    return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }
}
