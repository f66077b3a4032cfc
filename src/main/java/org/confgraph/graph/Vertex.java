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
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A node in a {@link Graph}. Vertices are compared by identity: rewrites that need "the same
 * vertex with different children" create a new Vertex with the same Description, and the {@link
 * #id} distinguishes them in debugging output.
 */
public final class Vertex {
  private static final AtomicInteger nextId = new AtomicInteger();

  /** Assigned in creation order; only used for printing. */
  public final int id;

  public final Description description;

  private Vertex(Description description) {
    this.id = nextId.getAndIncrement();
    this.description = Preconditions.checkNotNull(description);
  }

  public static Vertex create(Description description) {
    return new Vertex(description);
  }

  /** Returns a new Vertex with the same description as this one. */
  public Vertex copy() {
    return new Vertex(description);
  }

  public boolean isImpl() {
    return description instanceof Description.Impl;
  }

  public boolean isIf() {
    return description instanceof Description.If;
  }

  public boolean isApp() {
    return description instanceof Description.App;
  }

  @Override
  public String toString() {
    return description + "#" + id;
  }
}
