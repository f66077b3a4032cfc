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

import org.jspecify.annotations.Nullable;

/**
 * A static-only class that applies a {@link Rule} to a graph until it no longer matches.
 *
 * <p>Each step scans the whole graph for a match, so a transform that takes n steps is O(n * V).
 * The graphs we see are small enough that this has not been worth improving.
 */
public class Rewriter {

  private Rewriter() {}

  /**
   * A local graph rewrite. {@link #match} looks at a single vertex and returns null if the rewrite
   * does not apply there, or some payload (often just the vertex) describing what to rewrite.
   *
   * <p>For {@link #transform} to terminate, each call to {@link #apply} must remove the vertex it
   * matched without creating a new vertex that the rule matches for the same reason.
   */
  public interface Rule<M> {
    @Nullable M match(Graph graph, Vertex v);

    Graph apply(Graph graph, M match);
  }

  /** Returns the first match of {@code rule} against a vertex of {@code graph}, or null. */
  public static <M> @Nullable M find(Graph graph, Rule<M> rule) {
    for (Vertex v : graph.vertices()) {
      M match = rule.match(graph, v);
      if (match != null) {
        return match;
      }
    }
    return null;
  }

  /** Applies {@code rule} until it finds no match, and returns the resulting graph. */
  public static <M> Graph transform(Graph graph, Rule<M> rule) {
    return transform(graph, rule, () -> {});
  }

  /**
   * Applies {@code rule} until it finds no match, and returns the resulting graph. {@code
   * afterRewrite} is run once after each rewrite.
   */
  public static <M> Graph transform(Graph graph, Rule<M> rule, Runnable afterRewrite) {
    for (M match = find(graph, rule); match != null; match = find(graph, rule)) {
      graph = rule.apply(graph, match);
      afterRewrite.run();
    }
    return graph;
  }
}
