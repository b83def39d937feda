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

/** {@code cond ? then : otherwise}; {@code cond} is true if any of its bits are set. */
public final class Cond extends Expr {
  Cond(Netlist netlist, SourceLocation loc) {
    super(netlist, NodeKind.COND, loc);
  }

  public Expr cond() {
    return operand(0);
  }

  public Expr then() {
    return operand(1);
  }

  public Expr otherwise() {
    return operand(2);
  }

  @Override
  public DType dtype() {
    return then().dtype();
  }

  @Override
  Node copyNode() {
    return new Cond(netlist, location());
  }

  @Override
  public String toString() {
    return String.format("(%s ? %s : %s)", cond(), then(), otherwise());
  }
}
