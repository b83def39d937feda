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
 * The instance of a {@link Var} in a particular {@link Scope}. All {@link VarRef}s refer to a
 * VarScope, since the same declaration has independent storage in each instance of its module.
 */
public final class VarScope extends Node {
  private final Var var;

  VarScope(Netlist netlist, SourceLocation loc, Var var) {
    super(netlist, NodeKind.VAR_SCOPE, loc);
    this.var = var;
  }

  public Var var() {
    return var;
  }

  public Scope scope() {
    return (Scope) parent();
  }

  public String name() {
    return var.name;
  }

  public DType dtype() {
    return var.dtype;
  }

  @Override
  void checkReferences() {
    Invariants.check(
        !var.isDestroyed() && var.isLinked(), "VarScope #%s refers to a dead Var #%s", id, var.id);
  }

  @Override
  Node copyNode() {
    return new VarScope(netlist, location(), var);
  }

  @Override
  public String toString() {
    return "signal " + var.name;
  }
}
