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
import org.jspecify.annotations.Nullable;

/**
 * Moves If vertices towards the root.
 *
 * <p>If {@code n} is an Impl or App vertex with an If child {@code m}, we replace the pair by
 * three new vertices:
 *
 * <ul>
 *   <li>{@code n0}, a copy of {@code n} with {@code m} replaced by {@code m}'s Then child;
 *   <li>{@code n1}, a copy of {@code n} with {@code m} replaced by {@code m}'s Else child; and
 *   <li>{@code m'}, an If with the same condition as {@code m}, branching to {@code n0} and
 *       {@code n1}.
 * </ul>
 *
 * Everything that pointed to {@code n} now points to {@code m'}. Only {@code n} is duplicated;
 * its other children become shared by the two copies.
 *
 * <p>When no more rewrites are possible, no Impl or App vertex has an If child.
 */
public class PushIf implements Rewriter.Rule<PushIf.Match> {
  public static final PushIf INSTANCE = new PushIf();

  private PushIf() {}

  /** An Impl or App vertex and one of its If children. */
  public static final class Match {
    public final Vertex parent;
    public final Vertex ifVertex;

    Match(Vertex parent, Vertex ifVertex) {
      this.parent = parent;
      this.ifVertex = ifVertex;
    }
  }

  @Override
  public @Nullable Match match(Graph graph, Vertex v) {
    if (v.isIf()) {
      return null;
    }
    for (Edge e : graph.succEdges(v)) {
      if (e.dst.isIf()) {
        return new Match(v, e.dst);
      }
    }
    return null;
  }

  @Override
  public Graph apply(Graph graph, Match match) {
    Vertex parent = match.parent;
    Vertex ifVertex = match.ifVertex;
    Exploded.If cond = (Exploded.If) Exploded.of(graph, ifVertex);
    ImmutableList<Edge> preds = graph.predEdges(parent);
    ImmutableList<Edge> succs = graph.succEdges(parent);
    Vertex parentThen = parent.copy();
    Vertex parentElse = parent.copy();
    Graph result = graph.removeVertex(parent);
    // Every edge that went to the If goes to the corresponding branch instead, including any
    // duplicate edges (the same If as two different parameters).
    result = result.addEdgesWithSrc(succs, parentThen, ifVertex, cond.then);
    result = result.addEdgesWithSrc(succs, parentElse, ifVertex, cond.otherwise);
    Vertex hoisted = ifVertex.copy();
    result = GraphBuilder.addIf(result, hoisted, parentThen, parentElse);
    result = result.addEdgesWithDst(preds, hoisted);
    // The original If may still be the child of some other vertex; if so it will be hoisted
    // separately.
    if (result.inDegree(ifVertex) == 0) {
      result = result.removeVertex(ifVertex);
    }
    return result;
  }
}
