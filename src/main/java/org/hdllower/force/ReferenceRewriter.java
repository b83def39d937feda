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
import org.hdllower.diag.Diagnostic;
import org.hdllower.diag.Reporter;
import org.hdllower.graph.Netlist;
import org.hdllower.graph.VarRef;

/**
 * Redirects every read of a forced signal to its read alias, except for the reads that the pass
 * itself generated to get at the signal's unforced value.
 */
final class ReferenceRewriter {
  private static final Logger logger = LogManager.getLogger();

  private final ShadowStateAllocator allocator;
  private final Reporter reporter;
  private int redirected;

  ReferenceRewriter(ShadowStateAllocator allocator, Reporter reporter) {
    this.allocator = allocator;
    this.reporter = reporter;
  }

  /** The number of references redirected so far. */
  int redirected() {
    return redirected;
  }

  void rewrite(Netlist netlist) {
    for (VarRef ref : netlist.collect(VarRef.class)) {
      ShadowSet shadows = allocator.get(ref.varScope());
      if (shadows == null) {
        continue;
      }
      switch (ref.access()) {
        case READ -> {
          if (!allocator.isPinned(ref)) {
            ref.retarget(shadows.readAlias());
            redirected++;
          }
        }
        case WRITE -> {}
        case READWRITE ->
            reporter.report(
                Diagnostic.unsupportedError(
                    ref.location(),
                    "Unsupported: Signals used via read-write reference cannot be forced"));
      }
    }
    logger.debug("Redirected {} reads to forced signals", redirected);
  }
}
