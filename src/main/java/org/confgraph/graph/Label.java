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
import java.util.Comparator;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The label on an {@link Edge}: {@code Parameter(i)}, {@code Dependency(i)}, or {@code Branch}
 * with a {@link Side}. Labels are values; two labels with the same kind, index and side are equal.
 */
public final class Label {

  public enum Kind {
    PARAMETER,
    DEPENDENCY,
    BRANCH
  }

  public enum Side {
    THEN,
    ELSE
  }

  public static final Label THEN = new Label(Kind.BRANCH, -1, Side.THEN);
  public static final Label ELSE = new Label(Kind.BRANCH, -1, Side.ELSE);

  /** Orders labels by kind, then index, then THEN before ELSE. */
  public static final Comparator<Label> ORDER =
      Comparator.<Label, Kind>comparing(label -> label.kind)
          .thenComparingInt(label -> label.index)
          .thenComparingInt(label -> (label.side == null) ? -1 : label.side.ordinal());

  public final Kind kind;

  /** For PARAMETER and DEPENDENCY labels, the (zero-based) index; -1 for BRANCH labels. */
  public final int index;

  /** For BRANCH labels, which branch; null otherwise. */
  public final @Nullable Side side;

  private Label(Kind kind, int index, @Nullable Side side) {
    this.kind = kind;
    this.index = index;
    this.side = side;
  }

  public static Label parameter(int index) {
    Preconditions.checkArgument(index >= 0);
    return new Label(Kind.PARAMETER, index, null);
  }

  public static Label dependency(int index) {
    Preconditions.checkArgument(index >= 0);
    return new Label(Kind.DEPENDENCY, index, null);
  }

  public static Label branch(Side side) {
    return (side == Side.THEN) ? THEN : ELSE;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof Label)) {
      return false;
    }
    Label other = (Label) obj;
    return kind == other.kind && index == other.index && side == other.side;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, index, side);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case PARAMETER -> "Parameter(" + index + ")";
      case DEPENDENCY -> "Dependency(" + index + ")";
      case BRANCH -> (side == Side.THEN) ? "Then" : "Else";
    };
  }
}
