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

import static com.google.common.truth.Truth.assertThat;
import static org.confgraph.testing.TestComponent.expr;

import com.google.common.collect.ImmutableList;
import org.confgraph.dsl.Expr;
import org.confgraph.key.Key;
import org.confgraph.testing.TestComponent;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GraphBuilderTest {

  private static final Key<Boolean> K = Key.create("k");

  @Test
  public void singleInstance() {
    Graph g = GraphBuilder.create(expr("a"));
    assertThat(g.numVertices()).isEqualTo(1);
    assertThat(g.numEdges()).isEqualTo(0);
    assertThat(g.toString()).isEqualTo("a");
    Invariants.check(g);
  }

  @Test
  public void dependencies() {
    Graph g = GraphBuilder.create(expr("f", expr("d1"), expr("d2", expr("e"))));
    assertThat(g.toString()).isEqualTo("f[d1, d2[e]]");
    assertThat(g.numVertices()).isEqualTo(4);
    Vertex root = g.root();
    Exploded.Impl f = (Exploded.Impl) Exploded.of(g, root);
    assertThat(f.args).isEmpty();
    assertThat(f.deps).hasSize(2);
    Invariants.check(g);
  }

  @Test
  public void ifAndApp() {
    Expr e = Expr.apply(expr("wrap"), Expr.ifThenElse(K.value(), expr("A"), expr("B")));
    Graph g = GraphBuilder.create(e);
    assertThat(g.toString()).isEqualTo("$(wrap, if(k, A, B))");
    assertThat(g.numVertices()).isEqualTo(5);
    assertThat(g.numEdges()).isEqualTo(4);
    Vertex root = g.root();
    assertThat(root.isApp()).isTrue();
    Exploded.App app = (Exploded.App) Exploded.of(g, root);
    assertThat(app.fn.isImpl()).isTrue();
    assertThat(app.args).hasSize(1);
    assertThat(app.args.get(0).isIf()).isTrue();
    Invariants.check(g);
  }

  @Test
  public void curriedApplication() {
    Graph g = GraphBuilder.create(Expr.apply(expr("f"), expr("a"), expr("b")));
    assertThat(g.toString()).isEqualTo("$($(f, a), b)");
    assertThat(g.numVertices()).isEqualTo(5);
  }

  @Test
  public void repeatedExprIsNotShared() {
    Expr shared = expr("s");
    Graph g = GraphBuilder.create(expr("f", shared, shared));
    assertThat(g.numVertices()).isEqualTo(3);
    assertThat(g.toString()).isEqualTo("f[s, s]");
  }

  @Test
  public void incrementalBuild() {
    GraphBuilder builder = new GraphBuilder();
    Vertex a = builder.add(expr("a"));
    Vertex b = builder.add(expr("b"));
    Vertex f = builder.addImpl(new TestComponent("f"), ImmutableList.of(a), ImmutableList.of(b));
    Vertex c = builder.addIf(K.value(), f, a);
    Graph g = builder.graph();
    assertThat(g.vertices()).containsExactly(a, b, f, c).inOrder();
    assertThat(g.root()).isSameInstanceAs(c);
    assertThat(g.toString()).isEqualTo("if(k, f(a)[b], a)");
    Invariants.check(g);
  }
}
