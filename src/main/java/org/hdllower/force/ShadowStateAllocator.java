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

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hdllower.diag.Diagnostic;
import org.hdllower.diag.Reporter;
import org.hdllower.diag.SourceLocation;
import org.hdllower.graph.Active;
import org.hdllower.graph.ArraySel;
import org.hdllower.graph.DType;
import org.hdllower.graph.Expr;
import org.hdllower.graph.Netlist;
import org.hdllower.graph.Scope;
import org.hdllower.graph.Statement;
import org.hdllower.graph.Var;
import org.hdllower.graph.VarRef;
import org.hdllower.graph.VarScope;
import org.jspecify.annotations.Nullable;

/**
 * Creates the shadow signals for each forced signal, on demand and at most once per signal per
 * scope.
 *
 * <p>For a signal {@code x} the first call to {@link #getOrCreate} adds three Vars next to {@code
 * x}'s declaration (once per Var, shared by all of its scopes) and three VarScopes next to {@code
 * x}'s VarScope:
 *
 * <ul>
 *   <li>{@code x__VforceRd}, a net with the same dtype as {@code x};
 *   <li>{@code x__VforceEn}, the enable, with one bit per bit of {@code x} if {@code x} is a
 *       bit-vector (or an array of them), otherwise one bit (per element); and
 *   <li>{@code x__VforceVal}, a variable with the same dtype as {@code x}.
 * </ul>
 *
 * It also adds two blocks to {@code x}'s scope: an INITIAL block that clears the enable, and a
 * COMBO block that continuously drives the read alias.
 *
 * <p>All state is local to one run of the pass, and keyed by node id.
 */
final class ShadowStateAllocator {
  private static final Logger logger = LogManager.getLogger();

  /** The Vars created for one original Var. */
  private static final class ShadowVars {
    final Var readAlias;
    final Var enable;
    final Var value;

    ShadowVars(Var readAlias, Var enable, Var value) {
      this.readAlias = readAlias;
      this.enable = enable;
      this.value = value;
    }
  }

  private final Netlist netlist;
  private final Reporter reporter;
  private final ForceOptions options;

  /** Keyed by the id of the original Var. */
  private final Map<Integer, ShadowVars> shadowVars = new HashMap<>();

  /** Keyed by the id of the original VarScope; iterates in creation order. */
  private final Map<Integer, ShadowSet> shadowSets = new LinkedHashMap<>();

  /**
   * The ids of VarRefs that read an original signal from inside the code we synthesize. They must
   * see the signal's true value, so they are exempt from redirection to the read alias.
   */
  private final Set<Integer> pinnedReads = new HashSet<>();

  ShadowStateAllocator(Netlist netlist, Reporter reporter, ForceOptions options) {
    this.netlist = netlist;
    this.reporter = reporter;
    this.options = options;
  }

  /** Returns the ShadowSet for the given signal, creating it if necessary. */
  ShadowSet getOrCreate(VarScope varScope) {
    ShadowSet result = shadowSets.get(varScope.id);
    if (result == null) {
      result = create(varScope);
      shadowSets.put(varScope.id, result);
    }
    return result;
  }

  /** Returns the ShadowSet for the given signal, or null if it has never been forced. */
  @Nullable ShadowSet get(VarScope varScope) {
    return shadowSets.get(varScope.id);
  }

  /** All ShadowSets created so far, in the order they were created. */
  Collection<ShadowSet> all() {
    return Collections.unmodifiableCollection(shadowSets.values());
  }

  /** True if {@code ref} was created by {@link #originalRead}. */
  boolean isPinned(VarRef ref) {
    return pinnedReads.contains(ref.id);
  }

  /** Returns a new read of the original signal that will not be redirected to the read alias. */
  VarRef originalRead(SourceLocation loc, VarScope original) {
    VarRef ref = netlist.newVarRef(loc, original, VarRef.Access.READ);
    pinnedReads.add(ref.id);
    return ref;
  }

  /**
   * Returns an expression for the current effective value of a forced signal, computed directly
   * from its enable, value and original signal (rather than from its read alias, which may not have
   * been updated yet):
   *
   * <ul>
   *   <li>{@code (en & val) | (~en & orig)} if the signal is ranged, or
   *   <li>{@code en ? val : orig} otherwise.
   * </ul>
   *
   * If {@code index} is non-null each signal is indexed by a copy of it, giving the effective value
   * of one element of an unpacked array. The caller retains ownership of {@code index}.
   */
  Expr effectiveRead(SourceLocation loc, ShadowSet shadows, @Nullable Expr index) {
    Expr en = element(loc, read(loc, shadows.enable()), index);
    Expr val = element(loc, read(loc, shadows.value()), index);
    Expr orig = element(loc, originalRead(loc, shadows.original()), index);
    if (shadows.original().dtype().isRanged()) {
      Expr notEn = netlist.newNot(loc, en.cloneTree());
      return netlist.newOr(
          loc, netlist.newAnd(loc, en, val), netlist.newAnd(loc, notEn, orig));
    } else {
      return netlist.newCond(loc, en, val, orig);
    }
  }

  /** Returns {@code ref[index]}, or {@code ref} if index is null; index is copied, not consumed. */
  Expr element(SourceLocation loc, Expr ref, @Nullable Expr index) {
    return (index == null) ? ref : netlist.newArraySel(loc, ref, index.cloneTree());
  }

  private VarRef read(SourceLocation loc, VarScope varScope) {
    return netlist.newVarRef(loc, varScope, VarRef.Access.READ);
  }

  private VarRef write(SourceLocation loc, VarScope varScope) {
    return netlist.newVarRef(loc, varScope, VarRef.Access.WRITE);
  }

  /** Returns the dtype of the enable signal for a signal of the given dtype. */
  static DType enableType(DType dtype) {
    return switch (dtype.kind) {
      case SCALAR -> DType.BIT;
      case RANGED -> dtype;
      case UNPACKED -> dtype.isRanged() ? dtype : DType.unpacked(DType.BIT, dtype.count());
    };
  }

  private ShadowVars varsFor(Var var) {
    ShadowVars result = shadowVars.get(var.id);
    if (result == null) {
      SourceLocation loc = var.location();
      Var readAlias =
          netlist.newVar(loc, var.name + options.readSuffix(), var.dtype, Var.VarKind.NET);
      Var enable =
          netlist.newVar(
              loc, var.name + options.enableSuffix(), enableType(var.dtype), Var.VarKind.VARIABLE);
      Var value =
          netlist.newVar(loc, var.name + options.valueSuffix(), var.dtype, Var.VarKind.VARIABLE);
      var.addNextHere(readAlias);
      readAlias.addNextHere(enable);
      enable.addNextHere(value);
      if (var.isPrimaryIO()) {
        reporter.report(
            Diagnostic.unsupportedWarning(
                loc,
                "Unsupported: Force/Release on primary input/output net '%s'\n"
                    + "... Suggest assign it to/from a temporary net and force/release that",
                var.name));
      }
      result = new ShadowVars(readAlias, enable, value);
      shadowVars.put(var.id, result);
    }
    return result;
  }

  private ShadowSet create(VarScope original) {
    ShadowVars vars = varsFor(original.var());
    SourceLocation loc = original.location();
    VarScope readAlias = netlist.newVarScope(loc, vars.readAlias);
    VarScope enable = netlist.newVarScope(loc, vars.enable);
    VarScope value = netlist.newVarScope(loc, vars.value);
    original.addNextHere(readAlias);
    readAlias.addNextHere(enable);
    enable.addNextHere(value);
    ShadowSet result = new ShadowSet(original, readAlias, enable, value);
    Scope scope = original.scope();
    scope.addActive(initialization(loc, result));
    scope.addActive(combinationalOverride(loc, result));
    logger.debug("Created force shadow signals for {} in {}", original.name(), scope.name);
    return result;
  }

  /** Returns an INITIAL block that sets every bit of the enable to zero. */
  private Active initialization(SourceLocation loc, ShadowSet shadows) {
    Active active = netlist.newActive(loc, Active.Sense.INITIAL, "force-init");
    DType enableType = shadows.enable().dtype();
    int width = enableType.elementType().width();
    if (enableType.isUnpacked()) {
      for (int i = 0; i < enableType.count(); i++) {
        Expr lhs = netlist.newArraySel(loc, write(loc, shadows.enable()), i);
        active.addStatement(netlist.newAssign(loc, lhs, netlist.newConst(loc, width, 0)));
      }
    } else {
      Expr lhs = write(loc, shadows.enable());
      active.addStatement(netlist.newAssign(loc, lhs, netlist.newConst(loc, width, 0)));
    }
    return active;
  }

  /** Returns a COMBO block that drives the read alias from the enable, value and original. */
  private Active combinationalOverride(SourceLocation loc, ShadowSet shadows) {
    Active active = netlist.newActive(loc, Active.Sense.COMBO, "force-comb");
    DType dtype = shadows.original().dtype();
    if (dtype.isUnpacked()) {
      for (int i = 0; i < dtype.count(); i++) {
        Expr index = netlist.newConst(loc, ArraySel.INDEX_WIDTH, i);
        Expr lhs = netlist.newArraySel(loc, write(loc, shadows.readAlias()), index.cloneTree());
        active.addStatement(override(loc, lhs, effectiveRead(loc, shadows, index)));
        netlist.destroy(index);
      }
    } else {
      Expr lhs = write(loc, shadows.readAlias());
      active.addStatement(override(loc, lhs, effectiveRead(loc, shadows, null)));
    }
    return active;
  }

  private Statement override(SourceLocation loc, Expr lhs, Expr rhs) {
    return netlist.newAssignW(loc, lhs, rhs);
  }
}
