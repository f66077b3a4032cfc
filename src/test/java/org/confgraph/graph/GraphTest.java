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
import static org.junit.Assert.assertThrows;

import org.confgraph.testing.TestComponent;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GraphTest {

  private static Vertex impl(String name) {
    return Vertex.create(new Description.Impl(new TestComponent(name)));
  }

  @Test
  public void addAndQuery() {
    Vertex a = impl("a");
    Vertex b = impl("b");
    Vertex c = impl("c");
    Graph g =
        Graph.EMPTY
            .addEdge(a, Label.parameter(0), b)
            .addEdge(a, Label.dependency(0), c)
            .addEdge(b, Label.parameter(0), c);
    assertThat(g.vertices()).containsExactly(a, b, c).inOrder();
    assertThat(g.numEdges()).isEqualTo(3);
    assertThat(g.outDegree(a)).isEqualTo(2);
    assertThat(g.inDegree(a)).isEqualTo(0);
    assertThat(g.inDegree(c)).isEqualTo(2);
    assertThat(g.successors(a)).containsExactly(b, c).inOrder();
    assertThat(g.predEdges(c))
        .containsExactly(new Edge(a, Label.dependency(0), c), new Edge(b, Label.parameter(0), c));
    assertThat(g.root()).isSameInstanceAs(a);
  }

  @Test
  public void persistent() {
    Vertex a = impl("a");
    Vertex b = impl("b");
    Graph g1 = Graph.EMPTY.addVertex(a);
    Graph g2 = g1.addEdge(a, Label.parameter(0), b);
    Graph g3 = g2.removeVertex(b);
    assertThat(Graph.EMPTY.numVertices()).isEqualTo(0);
    assertThat(g1.vertices()).containsExactly(a);
    assertThat(g1.numEdges()).isEqualTo(0);
    assertThat(g2.vertices()).containsExactly(a, b);
    assertThat(g2.outDegree(a)).isEqualTo(1);
    assertThat(g3.vertices()).containsExactly(a);
    assertThat(g3.outDegree(a)).isEqualTo(0);
    // g2 was not affected by the removal
    assertThat(g2.outDegree(a)).isEqualTo(1);
  }

  @Test
  public void duplicateEdgeIsIgnored() {
    Vertex a = impl("a");
    Vertex b = impl("b");
    Graph g = Graph.EMPTY.addEdge(a, Label.parameter(0), b);
    assertThat(g.addEdge(a, Label.parameter(0), b)).isSameInstanceAs(g);
    // ... but the same endpoints with a different label is a different edge
    Graph g2 = g.addEdge(a, Label.parameter(1), b);
    assertThat(g2.numEdges()).isEqualTo(2);
    assertThat(g2.inDegree(b)).isEqualTo(2);
    assertThat(g.addVertex(a)).isSameInstanceAs(g);
  }

  @Test
  public void removeVertexRemovesAllItsEdges() {
    Vertex a = impl("a");
    Vertex b = impl("b");
    Vertex c = impl("c");
    Graph g =
        Graph.EMPTY
            .addEdge(a, Label.parameter(0), b)
            .addEdge(b, Label.parameter(0), c)
            .addEdge(a, Label.parameter(1), c);
    Graph removed = g.removeVertex(b);
    assertThat(removed.vertices()).containsExactly(a, c);
    assertThat(removed.numEdges()).isEqualTo(1);
    assertThat(removed.succEdges(a)).containsExactly(new Edge(a, Label.parameter(1), c));
    assertThat(removed.inDegree(c)).isEqualTo(1);
    assertThat(removed.removeVertex(b)).isSameInstanceAs(removed);
  }

  @Test
  public void removeSelfLoop() {
    Vertex a = impl("a");
    Vertex b = impl("b");
    Graph g = Graph.EMPTY.addEdge(a, Label.parameter(0), a).addEdge(b, Label.parameter(0), a);
    assertThat(g.numEdges()).isEqualTo(2);
    Graph removed = g.removeVertex(a);
    assertThat(removed.vertices()).containsExactly(b);
    assertThat(removed.numEdges()).isEqualTo(0);
    assertThat(removed.outDegree(b)).isEqualTo(0);
  }

  @Test
  public void removeRecursivelyStopsAtSharedVertices() {
    // top -> left -> shared, top -> right -> shared, left -> onlyLeft
    Vertex top = impl("top");
    Vertex left = impl("left");
    Vertex right = impl("right");
    Vertex shared = impl("shared");
    Vertex onlyLeft = impl("onlyLeft");
    Graph g =
        Graph.EMPTY
            .addEdge(top, Label.dependency(0), left)
            .addEdge(top, Label.dependency(1), right)
            .addEdge(left, Label.dependency(0), shared)
            .addEdge(left, Label.dependency(1), onlyLeft)
            .addEdge(right, Label.dependency(0), shared);
    Graph pruned = g.removeVertex(top).removeRecursively(left, null);
    assertThat(pruned.vertices()).containsExactly(right, shared);
    assertThat(pruned.inDegree(shared)).isEqualTo(1);
  }

  @Test
  public void removeRecursivelyNeverRemovesKeep() {
    Vertex a = impl("a");
    Vertex b = impl("b");
    Graph g = Graph.EMPTY.addEdge(a, Label.parameter(0), b);
    assertThat(g.removeRecursively(a, b).vertices()).containsExactly(b);
    assertThat(g.removeRecursively(a, a)).isSameInstanceAs(g);
  }

  @Test
  public void rootRequiresExactlyOne() {
    Vertex a = impl("a");
    Vertex b = impl("b");
    Graph twoRoots = Graph.EMPTY.addVertex(a).addVertex(b);
    assertThrows(IllegalStateException.class, twoRoots::root);
    assertThrows(IllegalStateException.class, Graph.EMPTY::root);
  }

  @Test
  public void queryingMissingVertexFails() {
    Vertex b = impl("b");
    Graph g = Graph.EMPTY.addVertex(impl("a"));
    assertThrows(IllegalArgumentException.class, () -> g.inDegree(b));
    assertThrows(IllegalArgumentException.class, () -> g.outDegree(b));
    assertThrows(IllegalArgumentException.class, () -> g.succEdges(b));
    assertThrows(IllegalArgumentException.class, () -> g.predEdges(b));
    assertThrows(IllegalArgumentException.class, () -> g.successors(b));
    assertThat(g.containsVertex(b)).isFalse();
  }

  @Test
  public void editsAcceptAnyVertex() {
    Vertex a = impl("a");
    Graph g = Graph.EMPTY.addVertex(a);
    assertThat(g.removeVertex(impl("b"))).isSameInstanceAs(g);
    assertThat(g.removeRecursively(impl("b"), null)).isSameInstanceAs(g);
    assertThrows(NullPointerException.class, () -> g.addEdge(a, Label.parameter(0), null));
  }
}
