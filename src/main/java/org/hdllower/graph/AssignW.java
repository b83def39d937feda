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

/** A continuous assignment; the lhs is driven by the rhs for the whole simulation. */
public final class AssignW extends NodeAssign {
  AssignW(Netlist netlist, SourceLocation loc) {
    super(netlist, NodeKind.ASSIGN_W, loc);
  }

  @Override
  String prefix() {
    return "assign ";
  }

  @Override
  Node copyNode() {
    return new AssignW(netlist, location());
  }
}
