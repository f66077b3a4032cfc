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

package org.confgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.confgraph.dsl.Expr;
import org.confgraph.graph.Description;
import org.confgraph.graph.EvalIf;
import org.confgraph.graph.Graph;
import org.confgraph.graph.GraphBuilder;
import org.confgraph.graph.GraphPrinter;
import org.confgraph.graph.Invariants;
import org.confgraph.graph.PushIf;
import org.confgraph.graph.RemovePartialApp;
import org.confgraph.graph.Rewriter;
import org.confgraph.graph.Traversal;
import org.confgraph.graph.Vertex;
import org.confgraph.key.Context;
import org.confgraph.key.Value;
import org.confgraph.util.Monoid;

/**
 * Specializes a configuration expression against concrete key values. The usual sequence is
 *
 * <pre>{@code
 * Specializer specializer = new Specializer();
 * Graph graph = specializer.create(expr);
 * graph = specializer.normalize(graph);
 * graph = specializer.eval(graph, context, false);
 * }</pre>
 *
 * after which {@link #isFullyReduced} is true and the graph contains only Impl vertices, ready to
 * be walked with {@link Traversal#iter} by a code generator.
 *
 * <ul>
 *   <li>{@link #normalize} hoists every If above the Impl and App vertices that use it ({@link
 *       PushIf}), then fuses curried applications into single Impl vertices ({@link
 *       RemovePartialApp}). Hoisting must be complete first, or an If could end up as one of the
 *       parameters of a fused Impl.
 *   <li>{@link #eval} resolves If vertices ({@link EvalIf}); with {@code partial} true, only those
 *       whose conditions are already determined by the context.
 * </ul>
 *
 * <p>A Specializer holds no graph state, only its options and (if {@link #verbose}) a record of
 * the phases it has run.
 */
public class Specializer {

  /** If true, each phase appends an entry to {@link #debugInfo}. */
  public boolean verbose;

  /** If true, the graph invariants are checked after each phase. */
  public boolean checkInvariants;

  public final DebugInfo debugInfo = new DebugInfo();

  /** Saved results from each phase run by a verbose Specializer. */
  public static class DebugInfo {
    private final List<String> phases = new ArrayList<>();

    void add(String phase, int rewrites, Graph graph) {
      phases.add(
          String.format(
              "%s (%d rewrites, %d vertices):\n%s",
              phase, rewrites, graph.numVertices(), GraphPrinter.print(graph)));
    }

    void clear() {
      phases.clear();
    }

    /** One entry per phase since the last {@link Specializer#create}, in the order run. */
    public ImmutableList<String> phases() {
      return ImmutableList.copyOf(phases);
    }

    @Override
    public String toString() {
      return String.join("\n---\n", phases);
    }
  }

  public Specializer() {}

  public Specializer(boolean verbose, boolean checkInvariants) {
    this.verbose = verbose;
    this.checkInvariants = checkInvariants;
  }

  /**
   * Returns a Specializer configured from the {@code confgraph.verbose} and {@code
   * confgraph.checkInvariants} system properties (both default to false).
   */
  public static Specializer fromSystemProperties() {
    return new Specializer(
        Boolean.parseBoolean(System.getProperty("confgraph.verbose", "false")),
        Boolean.parseBoolean(System.getProperty("confgraph.checkInvariants", "false")));
  }

  /** Builds the graph for {@code expr}. Starts a new run, so {@link #debugInfo} is cleared. */
  public Graph create(Expr expr) {
    debugInfo.clear();
    return finishPhase("create", 0, GraphBuilder.create(expr));
  }

  /** Hoists If vertices, then removes partial applications, each to a fixpoint. */
  public Graph normalize(Graph graph) {
    int[] count = new int[1];
    graph = Rewriter.transform(graph, PushIf.INSTANCE, () -> ++count[0]);
    graph = finishPhase("pushIf", count[0], graph);
    count[0] = 0;
    graph = Rewriter.transform(graph, RemovePartialApp.INSTANCE, () -> ++count[0]);
    return finishPhase("removePartialApp", count[0], graph);
  }

  /**
   * Resolves If vertices using {@code context}. If {@code partial} is false every If is resolved
   * and a {@link org.confgraph.key.ConfigurationError} is thrown if a condition can't be computed
   * (only Ifs that survive the resolution of all the others are considered); if {@code partial} is
   * true, Ifs whose conditions depend on unbound keys are left in place.
   */
  public Graph eval(Graph graph, Context context, boolean partial) {
    int[] count = new int[1];
    graph = Rewriter.transform(graph, new EvalIf(context, partial), () -> ++count[0]);
    return finishPhase(partial ? "partialEval" : "eval", count[0], graph);
  }

  private Graph finishPhase(String phase, int rewrites, Graph graph) {
    if (checkInvariants) {
      Invariants.check(graph);
    }
    if (verbose) {
      debugInfo.add(phase, rewrites, graph);
    }
    return graph;
  }

  /** Returns true if every vertex of {@code graph} is an Impl. */
  public static boolean isFullyReduced(Graph graph) {
    return graph.forAllVertices(Vertex::isImpl);
  }

  /** Returns the number of Impl vertices in {@code graph}. */
  public static int countComponents(Graph graph) {
    return Traversal.collect(
        Monoid.SUM_INTS, d -> (d instanceof Description.Impl) ? 1 : 0, graph);
  }

  /** Returns the union of the packages required by every component in {@code graph}. */
  public static ImmutableSet<String> packages(Graph graph, Context context) {
    return Traversal.collect(
        Monoid.<String>union(),
        d -> evalList(d, impl -> impl.component.packages(), context),
        graph);
  }

  /** Returns the union of the libraries required by every component in {@code graph}. */
  public static ImmutableSet<String> libraries(Graph graph, Context context) {
    return Traversal.collect(
        Monoid.<String>union(),
        d -> evalList(d, impl -> impl.component.libraries(), context),
        graph);
  }

  private static ImmutableSet<String> evalList(
      Description d,
      Function<Description.Impl, Value<ImmutableList<String>>> getter,
      Context context) {
    if (d instanceof Description.Impl impl) {
      return ImmutableSet.copyOf(getter.apply(impl).eval(context));
    }
    return ImmutableSet.of();
  }
}
