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
import org.hdllower.diag.SourceLocation;

/** A bitwise {@code &}, {@code |} (two operands) or {@code ~} (one operand). */
public final class BitOp extends Expr {
  BitOp(Netlist netlist, NodeKind kind, SourceLocation loc) {
    super(netlist, kind, loc);
    Preconditions.checkArgument(
        kind == NodeKind.AND || kind == NodeKind.OR || kind == NodeKind.NOT);
  }

  public Expr lhs() {
    return operand(0);
  }

  /** Only valid for AND and OR. */
  public Expr rhs() {
    return operand(1);
  }

  @Override
  public DType dtype() {
    return lhs().dtype();
  }

  @Override
  Node copyNode() {
    return new BitOp(netlist, kind(), location());
  }

  @Override
  public String toString() {
    return switch (kind()) {
      case AND -> String.format("(%s & %s)", lhs(), rhs());
      case OR -> String.format("(%s | %s)", lhs(), rhs());
      default -> "~" + lhs();
    };
  }
}
