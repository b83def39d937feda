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

import com.google.common.collect.ImmutableList;
import org.hdllower.diag.SourceLocation;
import org.jspecify.annotations.Nullable;

/**
 * A concrete instantiation of a Module. A Scope owns a {@link VarScope} for each of the module's
 * Vars, and the {@link Active} blocks that implement the instance's behavior.
 */
public final class Scope extends Node {
  public final String name;

  Scope(Netlist netlist, SourceLocation loc, String name) {
    super(netlist, NodeKind.SCOPE, loc);
    this.name = name;
  }

  /** The module this is an instance of. */
  public Module module() {
    return (Module) parent();
  }

  public void addVarScope(VarScope varScope) {
    link(varScope);
  }

  public void addActive(Active active) {
    link(active);
  }

  public ImmutableList<VarScope> varScopes() {
    return childrenOf(VarScope.class);
  }

  public ImmutableList<Active> actives() {
    return childrenOf(Active.class);
  }

  /** Returns the VarScope in this scope for the Var with the given name, or null if none. */
  public @Nullable VarScope find(String varName) {
    for (VarScope varScope : varScopes()) {
      if (varScope.var().name.equals(varName)) {
        return varScope;
      }
    }
    return null;
  }

  @Override
  Node copyNode() {
    return new Scope(netlist, location(), name);
  }

  @Override
  public String toString() {
    return "scope " + name;
  }
}
