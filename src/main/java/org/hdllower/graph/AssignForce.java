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
 * {@code force lhs = rhs}: until released, reads of the lhs return the rhs regardless of how the
 * lhs is driven.
 */
public final class AssignForce extends NodeAssign {
  AssignForce(Netlist netlist, SourceLocation loc) {
    super(netlist, NodeKind.ASSIGN_FORCE, loc);
  }

  @Override
  String prefix() {
    return "force ";
  }

  @Override
  Node copyNode() {
    return new AssignForce(netlist, location());
  }
}
