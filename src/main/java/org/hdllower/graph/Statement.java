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

/** A statement in an {@link Active} block. */
public abstract class Statement extends Node {
  Statement(Netlist netlist, NodeKind kind, SourceLocation loc) {
    super(netlist, kind, loc);
  }

  @Override
  public Statement cloneTree() {
    return (Statement) super.cloneTree();
  }
}
