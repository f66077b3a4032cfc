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
 * Fuses App vertices into the Impl vertex they apply.
 *
 * <p>An App vertex whose function (parameter 0) is an Impl vertex with parameters {@code args'}
 * and dependencies {@code deps} is replaced by a new Impl vertex for the same component, with
 * parameters {@code args'} followed by the App's remaining parameters and the same {@code deps}.
 * Repeated application collapses a chain of curried applications into a single fully-applied
 * Impl.
 *
 * <p>The original Impl vertex is removed once nothing refers to it; if it is also applied
 * elsewhere (or used unapplied) it is left in place.
 */
public class RemovePartialApp implements Rewriter.Rule<RemovePartialApp.Match> {
  public static final RemovePartialApp INSTANCE = new RemovePartialApp();

  private RemovePartialApp() {}

  /** An App vertex together with the Impl vertex it applies and the fused children. */
  public static final class Match {
    public final Vertex app;
    public final Vertex fn;
    public final ImmutableList<Vertex> args;
    public final ImmutableList<Vertex> deps;

    Match(Vertex app, Vertex fn, ImmutableList<Vertex> args, ImmutableList<Vertex> deps) {
      this.app = app;
      this.fn = fn;
      this.args = args;
      this.deps = deps;
    }
  }

  @Override
  public @Nullable Match match(Graph graph, Vertex v) {
    if (Exploded.of(graph, v) instanceof Exploded.App app
        && Exploded.of(graph, app.fn) instanceof Exploded.Impl impl) {
      ImmutableList<Vertex> args =
          ImmutableList.<Vertex>builder().addAll(impl.args).addAll(app.args).build();
      return new Match(v, app.fn, args, impl.deps);
    }
    return null;
  }

  @Override
  public Graph apply(Graph graph, Match match) {
    ImmutableList<Edge> preds = graph.predEdges(match.app);
    Graph result = graph.removeVertex(match.app);
    Vertex fused = match.fn.copy();
    result = GraphBuilder.addImpl(result, fused, match.args, match.deps);
    result = result.addEdgesWithDst(preds, fused);
    // fn's children are all children of fused too, so at most fn itself goes.
    if (result.inDegree(match.fn) == 0) {
      result = result.removeRecursively(match.fn, fused);
    }
    return result;
  }
}
