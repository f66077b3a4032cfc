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
import org.confgraph.key.Context;
import org.confgraph.key.Value;
import org.jspecify.annotations.Nullable;

/**
 * Resolves If vertices using the key bindings in a {@link Context}.
 *
 * <p>Each resolved If is replaced by the branch its condition selects; the other branch is pruned
 * recursively, stopping at any vertex that is still referenced from outside the pruned subgraph.
 *
 * <p>In partial mode only Ifs whose condition can be computed from bound keys alone ({@link
 * org.confgraph.key.Value#peek} is non-null) are resolved, and the rest are left in the graph. In
 * full mode every If is resolved, using key defaults where needed. An If whose condition reads a
 * key with neither a binding nor a default is only matched once no other If can be resolved, so
 * an If in a branch that the context discards never causes an error; if one is matched it causes
 * a {@link org.confgraph.key.ConfigurationError}.
 */
public class EvalIf implements Rewriter.Rule<Vertex> {
  private final Context context;
  private final boolean partial;

  public EvalIf(Context context, boolean partial) {
    this.context = Preconditions.checkNotNull(context);
    this.partial = partial;
  }

  /** Returns the value of {@code cond} if this rule can compute it without error, or null. */
  private @Nullable Boolean resolve(Value<Boolean> cond) {
    return partial ? cond.peek(context) : cond.peekWithDefaults(context);
  }

  private boolean isResolvable(Vertex v) {
    return v.description instanceof Description.If ifDesc && resolve(ifDesc.cond) != null;
  }

  @Override
  public @Nullable Vertex match(Graph graph, Vertex v) {
    if (!v.isIf()) {
      return null;
    } else if (isResolvable(v)) {
      return v;
    } else if (!partial && graph.forAllVertices(u -> !isResolvable(u))) {
      return v;
    }
    return null;
  }

  @Override
  public Graph apply(Graph graph, Vertex v) {
    Exploded.If ifVertex = (Exploded.If) Exploded.of(graph, v);
    Boolean value = resolve(ifVertex.cond);
    if (value == null) {
      assert !partial;
      // Throws a ConfigurationError naming the missing key.
      value = ifVertex.cond.eval(context);
    }
    Vertex selected = value ? ifVertex.then : ifVertex.otherwise;
    Vertex discarded = value ? ifVertex.otherwise : ifVertex.then;
    ImmutableList<Edge> preds = graph.predEdges(v);
    // Redirect before pruning, so that anything the selected branch shares with the discarded one
    // is still referenced when the pruning reaches it.
    Graph result = graph.removeVertex(v).addEdgesWithDst(preds, selected);
    if (discarded != selected && result.inDegree(discarded) == 0) {
      result = result.removeRecursively(discarded, selected);
    }
    return result;
  }
}
