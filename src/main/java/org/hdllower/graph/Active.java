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
import java.util.Locale;
import org.hdllower.diag.SourceLocation;

/** A block of statements, together with the event that causes them to be executed. */
public final class Active extends Node {

  public enum Sense {
    /** Executed once, before any simulation activity (e.g. static initialization). */
    INITIAL,
    /** Re-evaluated whenever any of the values it reads change. */
    COMBO,
    /** Procedural code, executed in order as simulation proceeds. */
    PROCESS
  }

  public final Sense sense;

  /** Used only for printing. */
  public final String name;

  Active(Netlist netlist, SourceLocation loc, Sense sense, String name) {
    super(netlist, NodeKind.ACTIVE, loc);
    this.sense = sense;
    this.name = name;
  }

  public Scope scope() {
    return (Scope) parent();
  }

  public void addStatement(Statement statement) {
    link(statement);
  }

  public ImmutableList<Statement> statements() {
    return childrenOf(Statement.class);
  }

  @Override
  Node copyNode() {
    return new Active(netlist, location(), sense, name);
  }

  @Override
  public String toString() {
    return String.format("%s \"%s\"", sense.name().toLowerCase(Locale.ROOT), name);
  }
}
