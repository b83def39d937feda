/*
 * Copyright 2025 The hdl-lower Authors
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

package org.hdllower.graph;

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The shape of a signal or expression. There are three kinds:
 *
 * <ul>
 *   <li>{@link Kind#SCALAR}: a value whose bits cannot be addressed individually, e.g. a single bit
 *       or a {@code real};
 *   <li>{@link Kind#RANGED}: a bit-vector, whose bits can be selected and masked independently; and
 *   <li>{@link Kind#UNPACKED}: a fixed-size array of independently addressable SCALAR or RANGED
 *       elements.
 * </ul>
 *
 * <p>DTypes are immutable and compared by value.
 */
public final class DType {
  public enum Kind {
    SCALAR,
    RANGED,
    UNPACKED
  }

  public final Kind kind;

  /** The type name printed for SCALAR dtypes. */
  private final String name;

  /** For SCALAR and RANGED, the number of bits; for UNPACKED, the width of one element. */
  private final int elementWidth;

  /** Non-null only for UNPACKED. */
  private final @Nullable DType element;

  /** The number of elements; 1 unless UNPACKED. */
  private final int count;

  /** A single bit. */
  public static final DType BIT = scalar("logic", 1);

  private DType(Kind kind, String name, int elementWidth, @Nullable DType element, int count) {
    this.kind = kind;
    this.name = name;
    this.elementWidth = elementWidth;
    this.element = element;
    this.count = count;
  }

  /** Returns a SCALAR dtype with the given name and width. */
  public static DType scalar(String name, int width) {
    Preconditions.checkArgument(width > 0);
    return new DType(Kind.SCALAR, name, width, null, 1);
  }

  /** Returns a RANGED dtype {@code logic[width-1:0]}. */
  public static DType ranged(int width) {
    Preconditions.checkArgument(width > 0);
    return new DType(Kind.RANGED, "logic", width, null, 1);
  }

  /** Returns an UNPACKED array of {@code count} elements. */
  public static DType unpacked(DType element, int count) {
    Preconditions.checkArgument(element.kind != Kind.UNPACKED, "Nested unpacked arrays");
    Preconditions.checkArgument(count > 0);
    return new DType(Kind.UNPACKED, element.name, element.elementWidth, element, count);
  }

  public boolean isUnpacked() {
    return kind == Kind.UNPACKED;
  }

  /**
   * True if this dtype, or its element type if this is UNPACKED, is a bit-vector. Forcing a ranged
   * signal requires a per-bit enable; everything else can use a single enable bit (per element).
   */
  public boolean isRanged() {
    return elementType().kind == Kind.RANGED;
  }

  /** Returns the element type if this is UNPACKED, otherwise this. */
  public DType elementType() {
    return (element != null) ? element : this;
  }

  /** Returns the number of elements if this is UNPACKED, otherwise 1. */
  public int count() {
    return count;
  }

  /** The total number of bits in a value of this type. */
  public int width() {
    return elementWidth * count;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DType d
        && kind == d.kind
        && name.equals(d.name)
        && elementWidth == d.elementWidth
        && Objects.equals(element, d.element)
        && count == d.count;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, name, elementWidth, count);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case SCALAR -> name;
      case RANGED -> String.format("%s[%s:0]", name, elementWidth - 1);
      case UNPACKED -> String.format("%s [0:%s]", element, count - 1);
    };
  }
}
