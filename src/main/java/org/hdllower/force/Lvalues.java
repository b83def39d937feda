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

import java.util.function.Function;
import org.hdllower.graph.Expr;
import org.hdllower.graph.Netlist;
import org.hdllower.graph.VarRef;
import org.hdllower.graph.VarScope;

/** Static helpers for manipulating the left-hand side of an assignment. */
final class Lvalues {

  private Lvalues() {}

  /** True if {@code lvalue} is a reference to an entire unpacked array. */
  static boolean isWholeArray(Expr lvalue) {
    return lvalue instanceof VarRef && lvalue.dtype().isUnpacked();
  }

  /**
   * Redirects each WRITE reference in {@code lvalue} to {@code pick.apply(target)}, keeping the
   * shape of the lvalue (selects, array indices and concatenations) unchanged. READ references
   * (e.g. in an index expression) are not changed.
   *
   * <p>{@code lvalue} must be detached; it is consumed, and the (detached) result should be used in
   * its place. The new target need not have the same dtype as the old one, so each redirected
   * reference is replaced by a new VarRef.
   */
  static Expr retargetWrites(Expr lvalue, Function<VarScope, VarScope> pick) {
    Netlist netlist = lvalue.netlist();
    Expr result = lvalue;
    for (VarRef ref : lvalue.collect(VarRef.class)) {
      if (ref.access() != VarRef.Access.WRITE) {
        continue;
      }
      VarScope target = pick.apply(ref.varScope());
      if (target == ref.varScope()) {
        continue;
      }
      VarRef replacement = netlist.newVarRef(ref.location(), target, VarRef.Access.WRITE);
      if (ref == lvalue) {
        result = replacement;
      } else {
        ref.replaceWith(replacement);
      }
      netlist.destroy(ref);
    }
    return result;
  }
}
