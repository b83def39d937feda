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
 * A reference to a signal. The referenced {@link VarScope} is not owned by the VarRef, and can be
 * changed with {@link #retarget}.
 */
public final class VarRef extends Expr {

  public enum Access {
    READ,
    WRITE,
    /** Read and then written by the same reference, e.g. an {@code inout} task argument. */
    READWRITE
  }

  private VarScope varScope;
  private final Access access;

  VarRef(Netlist netlist, SourceLocation loc, VarScope varScope, Access access) {
    super(netlist, NodeKind.VAR_REF, loc);
    this.varScope = varScope;
    this.access = access;
  }

  public VarScope varScope() {
    return varScope;
  }

  public Access access() {
    return access;
  }

  /** Makes this reference refer to a different signal, which must have the same dtype. */
  public void retarget(VarScope newTarget) {
    Invariants.checkLive(newTarget);
    Invariants.check(
        newTarget.dtype().equals(varScope.dtype()),
        "Cannot retarget %s (%s) to %s (%s)",
        varScope.name(),
        varScope.dtype(),
        newTarget.name(),
        newTarget.dtype());
    this.varScope = newTarget;
  }

  @Override
  public DType dtype() {
    return varScope.dtype();
  }

  @Override
  void checkReferences() {
    Invariants.check(
        !varScope.isDestroyed() && varScope.isLinked(),
        "VarRef #%s refers to a dead VarScope #%s",
        id,
        varScope.id);
  }

  @Override
  Node copyNode() {
    return new VarRef(netlist, location(), varScope, access);
  }

  @Override
  public String toString() {
    return varScope.name();
  }
}
