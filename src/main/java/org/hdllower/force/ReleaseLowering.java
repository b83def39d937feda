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

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hdllower.diag.SourceLocation;
import org.hdllower.diag.WarningCode;
import org.hdllower.graph.ArraySel;
import org.hdllower.graph.Assign;
import org.hdllower.graph.Expr;
import org.hdllower.graph.Invariants;
import org.hdllower.graph.Netlist;
import org.hdllower.graph.Node;
import org.hdllower.graph.Relinker;
import org.hdllower.graph.Release;
import org.hdllower.graph.Statement;
import org.hdllower.graph.VarRef;
import org.hdllower.graph.VarScope;
import org.jspecify.annotations.Nullable;

/**
 * Replaces each {@code release L;} with an assignment that restores the unforced value of {@code
 * L}, followed by an assignment that clears {@code L}'s enable bits.
 *
 * <p>How the value is restored depends on the kind of signal:
 *
 * <ul>
 *   <li>A net is continuously driven, so its own value is already the unforced one; the read alias
 *       is just set back to it ({@code L__VforceRd = L}).
 *   <li>A variable keeps the forced value until it is next assigned, so it is set to its current
 *       effective value ({@code L = en ? val : L}, or the bitwise equivalent). This must be
 *       computed before the enable is cleared, so all the restoring assignments precede all the
 *       enable resets.
 * </ul>
 *
 * An entire unpacked array is released element by element; a single element keeps its index.
 *
 * <p>The generated statements may mix blocking and non-blocking assignments to the same signal, so
 * they are marked to suppress the corresponding warning.
 */
final class ReleaseLowering {
  private static final Logger logger = LogManager.getLogger();

  private final Netlist netlist;
  private final ShadowStateAllocator allocator;
  private int count;

  ReleaseLowering(Netlist netlist, ShadowStateAllocator allocator) {
    this.netlist = netlist;
    this.allocator = allocator;
  }

  /** The number of release statements lowered so far. */
  int count() {
    return count;
  }

  void lower(Release release) {
    SourceLocation loc = release.location().withWarningOff(WarningCode.BLKANDNBLK);
    logger.debug("Lowering {} at {}", release, release.location());
    Relinker relinker = release.unlink();
    Expr lhs = release.lhs();
    lhs.unlink();
    List<Expr> targets = new ArrayList<>();
    if (Lvalues.isWholeArray(lhs)) {
      for (int i = 0; i < lhs.dtype().count(); i++) {
        targets.add(netlist.newArraySel(loc, lhs.cloneTree(), i));
      }
      netlist.destroy(lhs);
    } else {
      targets.add(lhs);
    }
    List<Statement> replacements = new ArrayList<>();
    for (Expr target : targets) {
      replacements.add(restore(loc, target));
    }
    for (Expr target : targets) {
      Expr enLhs =
          Lvalues.retargetWrites(target.cloneTree(), vs -> allocator.getOrCreate(vs).enable());
      replacements.add(
          netlist.newAssign(loc, enLhs, netlist.newConst(loc, enLhs.dtype().width(), 0)));
    }
    targets.forEach(netlist::destroy);
    relinker.relink(replacements);
    netlist.destroy(release);
    count++;
  }

  /** Returns the assignment that restores the unforced value of {@code target}. */
  private Assign restore(SourceLocation loc, Expr target) {
    Expr lhs =
        Lvalues.retargetWrites(
            target.cloneTree(),
            vs -> vs.var().isNet() ? allocator.getOrCreate(vs).readAlias() : vs);
    Assign result = netlist.newAssign(loc, lhs, target.cloneTree());
    // The right hand side is a copy of the target, so its references are WRITEs; each is replaced
    // (along with the array select around it, if any) by the value to restore.
    for (VarRef ref : result.rhs().collect(VarRef.class)) {
      if (ref.isDestroyed() || ref.access() != VarRef.Access.WRITE) {
        continue;
      }
      Node parent = ref.parent();
      Expr root = ref;
      Expr index = null;
      if (parent instanceof ArraySel sel && sel.from() == ref) {
        root = sel;
        index = sel.index();
      } else {
        Invariants.check(
            !ref.dtype().isUnpacked(), "Cannot release %s (%s)", ref, ref.dtype());
      }
      root.replaceWith(restoredValue(loc, ref.varScope(), index));
      netlist.destroy(root);
    }
    return result;
  }

  private Expr restoredValue(SourceLocation loc, VarScope varScope, @Nullable Expr index) {
    if (varScope.var().isNet()) {
      return allocator.element(loc, allocator.originalRead(loc, varScope), index);
    } else {
      return allocator.effectiveRead(loc, allocator.getOrCreate(varScope), index);
    }
  }
}
