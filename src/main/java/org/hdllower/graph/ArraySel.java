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

/** Selects one element of an unpacked array: {@code from[index]}. */
public final class ArraySel extends Expr {
  /** The width used for constant indices. */
  public static final int INDEX_WIDTH = 32;

  ArraySel(Netlist netlist, SourceLocation loc) {
    super(netlist, NodeKind.ARRAY_SEL, loc);
  }

  public Expr from() {
    return operand(0);
  }

  public Expr index() {
    return operand(1);
  }

  /** Returns the index if it is a constant, or -1 if it is not. */
  public int constIndex() {
    return (index() instanceof Const c) ? c.value.intValueExact() : -1;
  }

  @Override
  public DType dtype() {
    return from().dtype().elementType();
  }

  @Override
  Node copyNode() {
    return new ArraySel(netlist, location());
  }

  @Override
  public String toString() {
    int i = constIndex();
    return String.format("%s[%s]", from(), (i >= 0) ? String.valueOf(i) : index().toString());
  }
}
