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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** A Reporter that logs each diagnostic and saves them all for later inspection. */
public class DiagnosticCollector implements Reporter {
  private static final Logger logger = LogManager.getLogger();

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  @Override
  public void report(Diagnostic diagnostic) {
    if (diagnostic.severity == Diagnostic.Severity.ERROR) {
      logger.error("{}", diagnostic);
    } else {
      logger.warn("{}", diagnostic);
    }
    diagnostics.add(diagnostic);
  }

  /** All diagnostics reported so far, in order. */
  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  /** Returns true if any ERROR diagnostic has been reported. */
  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(d -> d.severity == Diagnostic.Severity.ERROR);
  }

  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }
}
