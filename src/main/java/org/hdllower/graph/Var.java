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
 * A signal declaration in a Module. Each instance of the module has a corresponding {@link
 * VarScope}.
 */
public final class Var extends Node {

  public enum VarKind {
    /** Continuously driven, e.g. by a continuous assignment. */
    NET,
    /** Driven only by explicit procedural writes. */
    VARIABLE
  }

  public final String name;
  public final DType dtype;
  public final VarKind varKind;

  /** If true, the signal may be forced or released at run time by the host environment. */
  private boolean forceable;

  /** If true, this is a port of the top-level design. */
  private boolean primaryIO;

  /** If true, the host environment can read and write this signal directly. */
  private boolean publicReadWrite;

  Var(Netlist netlist, SourceLocation loc, String name, DType dtype, VarKind varKind) {
    super(netlist, NodeKind.VAR, loc);
    this.name = name;
    this.dtype = dtype;
    this.varKind = varKind;
  }

  public boolean isNet() {
    return varKind == VarKind.NET;
  }

  public boolean isForceable() {
    return forceable;
  }

  /** Marks this Var as forceable; also marks the netlist as containing forceable signals. */
  public void setForceable(boolean forceable) {
    this.forceable = forceable;
    if (forceable) {
      netlist.setHasForceableSignals(true);
    }
  }

  public boolean isPrimaryIO() {
    return primaryIO;
  }

  public void setPrimaryIO(boolean primaryIO) {
    this.primaryIO = primaryIO;
  }

  public boolean isPublicReadWrite() {
    return publicReadWrite;
  }

  public void setPublicReadWrite(boolean publicReadWrite) {
    this.publicReadWrite = publicReadWrite;
  }

  /** The module that declares this Var. */
  public Module module() {
    return (Module) parent();
  }

  @Override
  Node copyNode() {
    Var copy = new Var(netlist, location(), name, dtype, varKind);
    copy.forceable = forceable;
    copy.primaryIO = primaryIO;
    copy.publicReadWrite = publicReadWrite;
    return copy;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("var ").append(name).append(": ").append(dtype);
    sb.append(isNet() ? " net" : " var");
    if (forceable) {
      sb.append(" forceable");
    }
    if (primaryIO) {
      sb.append(" io");
    }
    if (publicReadWrite) {
      sb.append(" public-rw");
    }
    return sb.toString();
  }
}
