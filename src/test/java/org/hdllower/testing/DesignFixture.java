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

package org.hdllower.testing;

import org.hdllower.diag.SourceLocation;
import org.hdllower.graph.Active;
import org.hdllower.graph.ArraySel;
import org.hdllower.graph.Const;
import org.hdllower.graph.DType;
import org.hdllower.graph.Expr;
import org.hdllower.graph.Module;
import org.hdllower.graph.Netlist;
import org.hdllower.graph.Scope;
import org.hdllower.graph.Statement;
import org.hdllower.graph.Var;
import org.hdllower.graph.VarRef;
import org.hdllower.graph.VarScope;

/**
 * Builds small designs for tests: a single module {@code top} with a single scope {@code top}, to
 * which signals and blocks can be added with short helper methods.
 *
 * <p>Each statement gets a distinct source location ({@code test.v:N:0}, numbered in order of
 * creation) so that tests can tell which statement generated what.
 */
public class DesignFixture {
  public static final String TOP = "top";

  public final Netlist netlist = new Netlist();
  public final Module module;
  public final Scope scope;

  private int line;

  public DesignFixture() {
    module = netlist.newModule(loc(), TOP);
    netlist.addModule(module);
    scope = netlist.newScope(loc(), TOP);
    module.addScope(scope);
  }

  /** Returns a new source location, on the line after the previous one. */
  public SourceLocation loc() {
    return SourceLocation.of("test.v", ++line, 0);
  }

  public VarScope net(String name, DType dtype) {
    return signal(name, dtype, Var.VarKind.NET);
  }

  public VarScope variable(String name, DType dtype) {
    return signal(name, dtype, Var.VarKind.VARIABLE);
  }

  /** Declares a new Var in the module, and a VarScope for it in the scope. */
  public VarScope signal(String name, DType dtype, Var.VarKind kind) {
    Var var = netlist.newVar(loc(), name, dtype, kind);
    module.addVar(var);
    VarScope vs = netlist.newVarScope(loc(), var);
    scope.addVarScope(vs);
    return vs;
  }

  public Active initial() {
    return active(Active.Sense.INITIAL, "initial");
  }

  public Active combo() {
    return active(Active.Sense.COMBO, "comb");
  }

  public Active process() {
    return active(Active.Sense.PROCESS, "proc");
  }

  private Active active(Active.Sense sense, String name) {
    Active active = netlist.newActive(loc(), sense, name);
    scope.addActive(active);
    return active;
  }

  public VarRef read(VarScope vs) {
    return netlist.newVarRef(loc(), vs, VarRef.Access.READ);
  }

  public VarRef write(VarScope vs) {
    return netlist.newVarRef(loc(), vs, VarRef.Access.WRITE);
  }

  public Const constant(int width, long value) {
    return netlist.newConst(loc(), width, value);
  }

  public ArraySel element(Expr from, int index) {
    return netlist.newArraySel(loc(), from, index);
  }

  public Statement assign(Expr lhs, Expr rhs) {
    return netlist.newAssign(loc(), lhs, rhs);
  }

  public Statement assignW(Expr lhs, Expr rhs) {
    return netlist.newAssignW(loc(), lhs, rhs);
  }

  public Statement force(Expr lhs, Expr rhs) {
    return netlist.newAssignForce(loc(), lhs, rhs);
  }

  public Statement release(Expr lhs) {
    return netlist.newRelease(loc(), lhs);
  }

  /** Returns the dump of the scope, which is where all the interesting changes happen. */
  public String dumpScope() {
    return scope.dump();
  }
}
