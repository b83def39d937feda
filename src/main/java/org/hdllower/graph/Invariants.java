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

import com.google.errorprone.annotations.FormatMethod;

/** Static helpers for checking the structural invariants of the design graph. */
public final class Invariants {

  // Static methods only
  private Invariants() {}

  /** Throws a {@link GraphInvariantException} unless {@code condition} is true. */
  @FormatMethod
  public static void check(boolean condition, String fmt, Object... fmtArgs) {
    if (!condition) {
      throw new GraphInvariantException(String.format(fmt, fmtArgs));
    }
  }

  /** Throws a {@link GraphInvariantException} if {@code node} has been destroyed. */
  public static void checkLive(Node node) {
    check(!node.isDestroyed(), "Use of destroyed node #%s (%s)", node.id, node.kind());
  }
}
