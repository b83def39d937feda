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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hdllower.diag.Reporter;
import org.hdllower.graph.AssignForce;
import org.hdllower.graph.Netlist;
import org.hdllower.graph.Node;
import org.hdllower.graph.Release;
import org.hdllower.graph.VarScope;

/**
 * Eliminates force and release statements and forceable signals from a design, replacing them with
 * ordinary assignments to shadow signals.
 *
 * <p>For each forced signal {@code x} the pass creates a read alias, an enable and a value (see
 * {@link ShadowSet}), and a continuous assignment that drives the read alias with {@code x}'s value
 * where it is not forced and the forced value where it is. Force and release statements are
 * rewritten to update the enable and value (see {@link ForceLowering} and {@link
 * ReleaseLowering}), and finally every other read of {@code x} is redirected to its read alias.
 *
 * <p>Problems with the input design are reported to the given {@link Reporter}; they do not stop
 * the pass. A {@link org.hdllower.graph.GraphInvariantException} indicates a bug in the pass or
 * in the input graph's construction.
 */
public final class ForcePass {
  private static final Logger logger = LogManager.getLogger();

  /** Counts of what the pass did. */
  public record Summary(int forces, int releases, int shadowSets, int readsRedirected) {
    public static final Summary SKIPPED = new Summary(0, 0, 0, 0);
  }

  private final ShadowStateAllocator allocator;
  private final ForceLowering forceLowering;
  private final ReleaseLowering releaseLowering;

  private ForcePass(Netlist netlist, Reporter reporter, ForceOptions options) {
    this.allocator = new ShadowStateAllocator(netlist, reporter, options);
    this.forceLowering = new ForceLowering(netlist, allocator);
    this.releaseLowering = new ReleaseLowering(netlist, allocator);
  }

  /** Runs the pass on {@code netlist}, using the default options. */
  public static Summary forceAll(Netlist netlist, Reporter reporter) {
    return forceAll(netlist, reporter, ForceOptions.DEFAULT);
  }

  /**
   * Runs the pass on {@code netlist}. Does nothing unless {@link Netlist#hasForceableSignals} is
   * true.
   */
  public static Summary forceAll(Netlist netlist, Reporter reporter, ForceOptions options) {
    if (!netlist.hasForceableSignals()) {
      logger.info("No forceable signals; skipping force lowering");
      return Summary.SKIPPED;
    }
    ForcePass pass = new ForcePass(netlist, reporter, options);
    netlist.walk(pass::visit);
    ReferenceRewriter rewriter = new ReferenceRewriter(pass.allocator, reporter);
    rewriter.rewrite(netlist);
    Summary summary =
        new Summary(
            pass.forceLowering.count(),
            pass.releaseLowering.count(),
            pass.allocator.all().size(),
            rewriter.redirected());
    logger.info(
        "Force lowering: {} forces, {} releases, {} forced signals, {} reads redirected",
        summary.forces(),
        summary.releases(),
        summary.shadowSets(),
        summary.readsRedirected());
    if (options.checkTree()) {
      netlist.check();
    }
    if (options.dumpTree() && logger.isDebugEnabled()) {
      logger.debug("Tree after force lowering:\n{}", netlist.dump());
    }
    return summary;
  }

  /** Returns true if the walk should continue into the children of {@code node}. */
  private boolean visit(Node node) {
    return switch (node.kind()) {
      case NETLIST, MODULE, SCOPE, ACTIVE -> true;
      case VAR_SCOPE -> {
        VarScope varScope = (VarScope) node;
        if (varScope.var().isForceable()) {
          ShadowSet shadows = allocator.getOrCreate(varScope);
          shadows.enable().var().setPublicReadWrite(true);
          shadows.value().var().setPublicReadWrite(true);
        }
        yield false;
      }
      case ASSIGN_FORCE -> {
        forceLowering.lower((AssignForce) node);
        yield false;
      }
      case RELEASE -> {
        releaseLowering.lower((Release) node);
        yield false;
      }
      case VAR, ASSIGN, ASSIGN_W, VAR_REF, CONST, ARRAY_SEL, SEL, CONCAT, AND, OR, NOT, COND ->
          false;
    };
  }
}
