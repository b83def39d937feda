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

package org.hdllower.force;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hdllower.diag.SourceLocation;
import org.hdllower.graph.AssignForce;
import org.hdllower.graph.Const;
import org.hdllower.graph.Expr;
import org.hdllower.graph.Netlist;
import org.hdllower.graph.Relinker;
import org.hdllower.graph.Statement;

/**
 * Replaces each {@code force L = R;} with
 *
 * <pre>
 *   L__VforceEn = '1;
 *   L__VforceVal = R;
 *   L__VforceRd = R;
 * </pre>
 *
 * where {@code L__VforceEn} stands for {@code L} with each signal it writes replaced by that
 * signal's enable (and similarly for the others). The last assignment makes the forced value
 * visible immediately, without waiting for the combinational override to be re-evaluated.
 *
 * <p>If {@code L} is an entire unpacked array, each element is forced separately.
 */
final class ForceLowering {
  private static final Logger logger = LogManager.getLogger();

  private final Netlist netlist;
  private final ShadowStateAllocator allocator;
  private int count;

  ForceLowering(Netlist netlist, ShadowStateAllocator allocator) {
    this.netlist = netlist;
    this.allocator = allocator;
  }

  /** The number of force statements lowered so far. */
  int count() {
    return count;
  }

  void lower(AssignForce force) {
    SourceLocation loc = force.location();
    logger.debug("Lowering {} at {}", force, loc);
    Relinker relinker = force.unlink();
    Expr lhs = force.lhs();
    Expr rhs = force.rhs();
    lhs.unlink();
    rhs.unlink();
    List<Statement> replacements = new ArrayList<>();
    if (Lvalues.isWholeArray(lhs)) {
      for (int i = 0; i < lhs.dtype().count(); i++) {
        Expr lhsElement = netlist.newArraySel(loc, lhs.cloneTree(), i);
        Expr rhsElement = netlist.newArraySel(loc, rhs.cloneTree(), i);
        lowerOne(loc, lhsElement, rhsElement, replacements);
      }
      netlist.destroy(lhs);
      netlist.destroy(rhs);
    } else {
      lowerOne(loc, lhs, rhs, replacements);
    }
    relinker.relink(replacements);
    netlist.destroy(force);
    count++;
  }

  /** Appends the three assignments for one (detached) target and value, consuming both. */
  private void lowerOne(SourceLocation loc, Expr lhs, Expr rhs, List<Statement> out) {
    Expr enLhs = Lvalues.retargetWrites(lhs.cloneTree(), vs -> allocator.getOrCreate(vs).enable());
    int width = enLhs.dtype().width();
    Expr valLhs = Lvalues.retargetWrites(lhs.cloneTree(), vs -> allocator.getOrCreate(vs).value());
    Expr rdLhs = Lvalues.retargetWrites(lhs, vs -> allocator.getOrCreate(vs).readAlias());
    out.addAll(
        ImmutableList.of(
            netlist.newAssign(loc, enLhs, netlist.newConst(loc, width, Const.mask(width))),
            netlist.newAssign(loc, valLhs, rhs.cloneTree()),
            netlist.newAssign(loc, rdLhs, rhs)));
  }
}
