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

import java.math.BigInteger;
import org.hdllower.diag.SourceLocation;

/** A constant bit pattern of fixed width. */
public final class Const extends Expr {
  public final int width;

  /** Never negative, and never has bits set at or above {@link #width}. */
  public final BigInteger value;

  Const(Netlist netlist, SourceLocation loc, int width, BigInteger value) {
    super(netlist, NodeKind.CONST, loc);
    this.width = width;
    this.value = value;
  }

  /** Returns a value with the low {@code width} bits set. */
  public static BigInteger mask(int width) {
    return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
  }

  public boolean isAllOnes() {
    return value.equals(mask(width));
  }

  @Override
  public DType dtype() {
    return (width == 1) ? DType.BIT : DType.ranged(width);
  }

  @Override
  Node copyNode() {
    return new Const(netlist, location(), width, value);
  }

  @Override
  public String toString() {
    return width + "'h" + value.toString(16);
  }
}
