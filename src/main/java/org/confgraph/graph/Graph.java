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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * An immutable directed graph with {@link Vertex} nodes and {@link Label}led edges.
 *
 * <p>Every method that "changes" a Graph returns a new Graph and leaves the receiver unchanged, so
 * a rewrite that fails halfway through can never leave a partially-modified graph visible. Vertices
 * and edges are enumerated in the order they were added, which makes rewriting deterministic.
 *
 * <p>Queries about a single vertex ({@link #inDegree}, {@link #succEdges} and so on) require the
 * vertex to be in the graph and throw an IllegalArgumentException otherwise; edits accept any
 * vertex. The Graph itself enforces nothing beyond that; the shape invariants for each kind of
 * vertex are checked by {@link Exploded} and {@link Invariants}.
 */
public final class Graph {
  public static final Graph EMPTY = new Graph(ImmutableMap.of(), 0);

  /** The edges into and out of a single vertex. */
  private static final class Adjacency {
    static final Adjacency NONE = new Adjacency(ImmutableList.of(), ImmutableList.of());

    final ImmutableList<Edge> out;
    final ImmutableList<Edge> in;

    Adjacency(ImmutableList<Edge> out, ImmutableList<Edge> in) {
      this.out = out;
      this.in = in;
    }

    Adjacency addOut(Edge e) {
      return new Adjacency(append(out, e), in);
    }

    Adjacency addIn(Edge e) {
      return new Adjacency(out, append(in, e));
    }

    Adjacency removeOut(Edge e) {
      return new Adjacency(without(out, e), in);
    }

    Adjacency removeIn(Edge e) {
      return new Adjacency(out, without(in, e));
    }

    private static ImmutableList<Edge> append(ImmutableList<Edge> edges, Edge e) {
      return ImmutableList.<Edge>builderWithExpectedSize(edges.size() + 1)
          .addAll(edges)
          .add(e)
          .build();
    }

    private static ImmutableList<Edge> without(ImmutableList<Edge> edges, Edge e) {
      return edges.stream().filter(x -> !x.equals(e)).collect(ImmutableList.toImmutableList());
    }
  }

  private final ImmutableMap<Vertex, Adjacency> adjacency;
  private final int numEdges;

  private Graph(ImmutableMap<Vertex, Adjacency> adjacency, int numEdges) {
    this.adjacency = adjacency;
    this.numEdges = numEdges;
  }

  public int numVertices() {
    return adjacency.size();
  }

  public int numEdges() {
    return numEdges;
  }

  public boolean containsVertex(Vertex v) {
    return adjacency.containsKey(v);
  }

  /** All vertices, in the order they were added. */
  public ImmutableSet<Vertex> vertices() {
    return adjacency.keySet();
  }

  /** All edges, grouped by source vertex. */
  public ImmutableList<Edge> edges() {
    return adjacency.values().stream()
        .flatMap(a -> a.out.stream())
        .collect(ImmutableList.toImmutableList());
  }

  private Adjacency adjacency(Vertex v) {
    Adjacency result = adjacency.get(v);
    Preconditions.checkArgument(result != null, "%s is not in the graph", v);
    return result;
  }

  /** The edges whose source is {@code v}. */
  public ImmutableList<Edge> succEdges(Vertex v) {
    return adjacency(v).out;
  }

  /** The edges whose destination is {@code v}. */
  public ImmutableList<Edge> predEdges(Vertex v) {
    return adjacency(v).in;
  }

  /** The destinations of {@link #succEdges}; a vertex appears once for each edge to it. */
  public ImmutableList<Vertex> successors(Vertex v) {
    return succEdges(v).stream().map(e -> e.dst).collect(ImmutableList.toImmutableList());
  }

  public int inDegree(Vertex v) {
    return adjacency(v).in.size();
  }

  public int outDegree(Vertex v) {
    return adjacency(v).out.size();
  }

  /** Returns a graph with {@code v} added; returns this graph if {@code v} is already present. */
  public Graph addVertex(Vertex v) {
    if (containsVertex(v)) {
      return this;
    }
    Map<Vertex, Adjacency> map = new LinkedHashMap<>(adjacency);
    map.put(v, Adjacency.NONE);
    return new Graph(ImmutableMap.copyOf(map), numEdges);
  }

  /**
   * Returns a graph with {@code e} added, adding either of its endpoints that are not already
   * present. Adding an edge that is already present returns this graph.
   */
  public Graph addEdge(Edge e) {
    Adjacency fromSrc = adjacency.get(e.src);
    if (fromSrc != null && fromSrc.out.contains(e)) {
      return this;
    }
    Map<Vertex, Adjacency> map = new LinkedHashMap<>(adjacency);
    map.put(e.src, (fromSrc == null ? Adjacency.NONE : fromSrc).addOut(e));
    map.put(e.dst, map.getOrDefault(e.dst, Adjacency.NONE).addIn(e));
    return new Graph(ImmutableMap.copyOf(map), numEdges + 1);
  }

  public Graph addEdge(Vertex src, Label label, Vertex dst) {
    return addEdge(new Edge(src, label, dst));
  }

  /**
   * Returns a graph without {@code v} or any edge into or out of it; returns this graph if {@code
   * v} is not present.
   */
  public Graph removeVertex(Vertex v) {
    Adjacency removed = adjacency.get(v);
    if (removed == null) {
      return this;
    }
    Map<Vertex, Adjacency> map = new LinkedHashMap<>(adjacency);
    map.remove(v);
    int removedEdges = removed.out.size();
    for (Edge e : removed.out) {
      // A self-loop's other end was removed with v.
      map.computeIfPresent(e.dst, (unused, a) -> a.removeIn(e));
    }
    for (Edge e : removed.in) {
      if (e.src != v) {
        map.computeIfPresent(e.src, (unused, a) -> a.removeOut(e));
        ++removedEdges;
      }
    }
    return new Graph(ImmutableMap.copyOf(map), numEdges - removedEdges);
  }

  /** Returns true if {@code test} holds for every vertex. */
  public boolean forAllVertices(Predicate<Vertex> test) {
    return vertices().stream().allMatch(test);
  }

  /**
   * Returns the unique vertex with no inlinks. Throws an IllegalStateException if there isn't
   * exactly one.
   */
  public Vertex root() {
    ImmutableList<Vertex> roots =
        vertices().stream().filter(v -> inDegree(v) == 0).collect(ImmutableList.toImmutableList());
    Preconditions.checkState(roots.size() == 1, "Expected a single root, found %s", roots);
    return roots.get(0);
  }

  /**
   * Returns a graph with a new edge from each of {@code edges}' sources to {@code newDst}, with
   * the same label. The old edges are not removed.
   */
  public Graph addEdgesWithDst(List<Edge> edges, Vertex newDst) {
    Graph result = this;
    for (Edge e : edges) {
      result = result.addEdge(e.withDst(newDst));
    }
    return result;
  }

  /**
   * Returns a graph with a new edge from {@code newSrc} to each of {@code edges}' destinations,
   * with the same label, except that an edge whose destination is {@code sub} goes to {@code by}
   * instead. The old edges are not removed.
   */
  public Graph addEdgesWithSrc(List<Edge> edges, Vertex newSrc, Vertex sub, Vertex by) {
    Graph result = this;
    for (Edge e : edges) {
      Edge copy = e.withSrc(newSrc);
      result = result.addEdge(e.dst == sub ? copy.withDst(by) : copy);
    }
    return result;
  }

  /**
   * Returns a graph without {@code v} and without any of its descendants that are left with no
   * inlinks as a result. A descendant that is still referenced from elsewhere is left in place,
   * along with everything below it. {@code keep} (if non-null) is never removed, even if it ends
   * up with no inlinks.
   */
  public Graph removeRecursively(Vertex v, @Nullable Vertex keep) {
    if (v == keep || !containsVertex(v)) {
      return this;
    }
    ImmutableList<Vertex> children = successors(v);
    Graph result = removeVertex(v);
    for (Vertex child : children) {
      // A child with two edges from v will already be gone the second time we see it.
      if (child != keep && result.containsVertex(child) && result.inDegree(child) == 0) {
        result = result.removeRecursively(child, keep);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return GraphPrinter.print(this);
  }
}
