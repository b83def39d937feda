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

/**
 * A statement that stores the value of an expression (its {@link #rhs}) in an lvalue (its {@link
 * #lhs}). The lvalue is an expression whose references to the signals being stored have {@link
 * VarRef.Access#WRITE} access, e.g. {@code x}, {@code x[3:0]}, {@code arr[i]} or {@code {x, y}}.
 */
public abstract class NodeAssign extends Statement {
  NodeAssign(Netlist netlist, NodeKind kind, SourceLocation loc) {
    super(netlist, kind, loc);
  }

  public final Expr lhs() {
    return (Expr) child(0);
  }

  public final Expr rhs() {
    return (Expr) child(1);
  }

  /** The keyword (if any) printed before the assignment. */
  abstract String prefix();

  @Override
  public String toString() {
    return String.format("%s%s = %s;", prefix(), lhs(), rhs());
  }
}
