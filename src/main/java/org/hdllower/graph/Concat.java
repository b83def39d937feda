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
import java.util.stream.Collectors;
import org.hdllower.diag.SourceLocation;

/** The concatenation of two or more bit patterns, most significant first: {@code {a, b}}. */
public final class Concat extends Expr {
  Concat(Netlist netlist, SourceLocation loc) {
    super(netlist, NodeKind.CONCAT, loc);
  }

  public ImmutableList<Expr> parts() {
    return childrenOf(Expr.class);
  }

  @Override
  public DType dtype() {
    return DType.ranged(parts().stream().mapToInt(p -> p.dtype().width()).sum());
  }

  @Override
  Node copyNode() {
    return new Concat(netlist, location());
  }

  @Override
  public String toString() {
    return parts().stream().map(Expr::toString).collect(Collectors.joining(", ", "{", "}"));
  }
}
