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
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Remembers where a node was before {@link Node#unlink} detached it, so that one or more
 * replacement nodes can be linked in at the same position. Each Relinker can be used only once.
 */
public final class Relinker {
  /** Null once this Relinker has been used. */
  private @Nullable Node parent;

  private final int position;

  Relinker(Node parent, int position) {
    this.parent = parent;
    this.position = position;
  }

  /** Links {@code replacement} where the unlinked node used to be. */
  public void relink(Node replacement) {
    relink(ImmutableList.of(replacement));
  }

  /**
   * Links each of {@code replacements}, in order, where the unlinked node used to be. An empty list
   * is allowed (the unlinked node is simply removed).
   */
  public void relink(List<? extends Node> replacements) {
    Node p = parent;
    Invariants.check(p != null, "Relinker has already been used");
    int pos = position;
    for (Node replacement : replacements) {
      p.link(pos++, replacement);
    }
    parent = null;
  }
}
