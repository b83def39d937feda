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

/** A design unit, owning the Vars it declares and a Scope for each of its instances. */
public final class Module extends Node {
  public final String name;

  Module(Netlist netlist, SourceLocation loc, String name) {
    super(netlist, NodeKind.MODULE, loc);
    this.name = name;
  }

  public void addVar(Var var) {
    link(var);
  }

  public void addScope(Scope scope) {
    link(scope);
  }

  public ImmutableList<Var> vars() {
    return childrenOf(Var.class);
  }

  public ImmutableList<Scope> scopes() {
    return childrenOf(Scope.class);
  }

  @Override
  Node copyNode() {
    return new Module(netlist, location(), name);
  }

  @Override
  public String toString() {
    return "module " + name;
  }
}
