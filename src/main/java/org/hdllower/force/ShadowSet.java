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

import org.hdllower.graph.VarScope;

/**
 * The shadow signals that implement forcing for one signal in one scope.
 *
 * <p>Once the pass completes, {@code readAlias} is continuously driven with {@code enable ? value :
 * original} (bitwise if {@code enable} has more than one bit, and per element for unpacked
 * arrays), and every read of {@code original} has been redirected to {@code readAlias}.
 */
public final class ShadowSet {
  private final VarScope original;
  private final VarScope readAlias;
  private final VarScope enable;
  private final VarScope value;

  ShadowSet(VarScope original, VarScope readAlias, VarScope enable, VarScope value) {
    this.original = original;
    this.readAlias = readAlias;
    this.enable = enable;
    this.value = value;
  }

  /** The forced signal. */
  public VarScope original() {
    return original;
  }

  /** A net with the same dtype as the original, read in place of it. */
  public VarScope readAlias() {
    return readAlias;
  }

  /** Which bits (or elements) of the original are currently forced. */
  public VarScope enable() {
    return enable;
  }

  /** The value forced on the enabled bits. */
  public VarScope value() {
    return value;
  }

  @Override
  public String toString() {
    return String.format("%s{%s, %s, %s}", original, readAlias, enable, value);
  }
}
