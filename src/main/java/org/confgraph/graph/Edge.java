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
import java.util.Objects;

/** A labelled edge from {@link #src} to {@link #dst}. Edges are values. */
public final class Edge {
  public final Vertex src;
  public final Label label;
  public final Vertex dst;

  public Edge(Vertex src, Label label, Vertex dst) {
    this.src = Preconditions.checkNotNull(src);
    this.label = Preconditions.checkNotNull(label);
    this.dst = Preconditions.checkNotNull(dst);
  }

  /** Returns an edge with the same source and label as this one, but the given destination. */
  public Edge withDst(Vertex newDst) {
    return new Edge(src, label, newDst);
  }

  /** Returns an edge with the same label and destination as this one, but the given source. */
  public Edge withSrc(Vertex newSrc) {
    return new Edge(newSrc, label, dst);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Edge)) {
      return false;
    }
    Edge other = (Edge) obj;
    return src == other.src && dst == other.dst && label.equals(other.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(src, label, dst);
  }

  @Override
  public String toString() {
    return src + " -" + label + "-> " + dst;
  }
}
