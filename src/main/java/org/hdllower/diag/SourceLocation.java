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

package org.hdllower.diag;

import com.google.common.base.Preconditions;
import java.util.EnumSet;
import java.util.Objects;

/**
 * A position in the design sources, plus the set of warnings that have been turned off at that
 * position. SourceLocations are immutable; {@link #withWarningOff} returns a modified copy.
 */
public final class SourceLocation {
  /** Used for nodes that have no meaningful source position. */
  public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

  public final String file;
  public final int lineNum;
  public final int charPositionInLine;

  private final EnumSet<WarningCode> warningsOff;

  private SourceLocation(
      String file, int lineNum, int charPositionInLine, EnumSet<WarningCode> warningsOff) {
    this.file = file;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
    this.warningsOff = warningsOff;
  }

  private SourceLocation(String file, int lineNum, int charPositionInLine) {
    this(file, lineNum, charPositionInLine, EnumSet.noneOf(WarningCode.class));
  }

  public static SourceLocation of(String file, int lineNum, int charPositionInLine) {
    Preconditions.checkArgument(lineNum >= 0 && charPositionInLine >= 0);
    return new SourceLocation(Preconditions.checkNotNull(file), lineNum, charPositionInLine);
  }

  /** Returns a copy of this location with the given warning turned off. */
  public SourceLocation withWarningOff(WarningCode code) {
    if (warningsOff.contains(code)) {
      return this;
    }
    EnumSet<WarningCode> off = EnumSet.copyOf(warningsOff);
    off.add(code);
    return new SourceLocation(file, lineNum, charPositionInLine, off);
  }

  public boolean isWarningOff(WarningCode code) {
    return warningsOff.contains(code);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SourceLocation loc
        && file.equals(loc.file)
        && lineNum == loc.lineNum
        && charPositionInLine == loc.charPositionInLine
        && warningsOff.equals(loc.warningsOff);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, lineNum, charPositionInLine, warningsOff);
  }

  @Override
  public String toString() {
    return String.format("%s:%s:%s", file, lineNum, charPositionInLine);
  }
}
