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

import com.google.errorprone.annotations.FormatMethod;

/**
 * A problem found in the design while it was being compiled. Diagnostics are reported to a {@link
 * Reporter} rather than thrown, so that compilation can continue and report further problems.
 */
public final class Diagnostic {

  /** What kind of problem this is. */
  public enum Code {
    /** The design uses a construct that this compiler cannot (fully) translate. */
    UNSUPPORTED
  }

  public enum Severity {
    /** The output is still produced but may not behave as the source specifies. */
    WARNING,
    /** The output is known not to behave as the source specifies. */
    ERROR
  }

  public final Code code;
  public final Severity severity;
  public final SourceLocation location;
  public final String msg;

  public Diagnostic(Code code, Severity severity, SourceLocation location, String msg) {
    this.code = code;
    this.severity = severity;
    this.location = location;
    this.msg = msg;
  }

  /** Returns a new UNSUPPORTED warning at the given location. */
  @FormatMethod
  public static Diagnostic unsupportedWarning(SourceLocation location, String fmt, Object... args) {
    return new Diagnostic(Code.UNSUPPORTED, Severity.WARNING, location, String.format(fmt, args));
  }

  /** Returns a new UNSUPPORTED error at the given location. */
  @FormatMethod
  public static Diagnostic unsupportedError(SourceLocation location, String fmt, Object... args) {
    return new Diagnostic(Code.UNSUPPORTED, Severity.ERROR, location, String.format(fmt, args));
  }

  @Override
  public String toString() {
    return String.format("%%%s-%s: %s (%s)", severity, code, msg, location);
  }
}
