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

import org.hdllower.diag.SourceLocation;

/** Selects a contiguous range of bits from a bit-vector: {@code from[lsb+width-1:lsb]}. */
public final class Sel extends Expr {
  public final int lsb;
  public final int width;

  Sel(Netlist netlist, SourceLocation loc, int lsb, int width) {
    super(netlist, NodeKind.SEL, loc);
    this.lsb = lsb;
    this.width = width;
  }

  public Expr from() {
    return operand(0);
  }

  @Override
  public DType dtype() {
    return DType.ranged(width);
  }

  @Override
  Node copyNode() {
    return new Sel(netlist, location(), lsb, width);
  }

  @Override
  public String toString() {
    if (width == 1) {
      return String.format("%s[%s]", from(), lsb);
    }
    return String.format("%s[%s:%s]", from(), lsb + width - 1, lsb);
  }
}
