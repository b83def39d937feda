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

/**
 * The closed set of node kinds that can appear in a design graph. Passes dispatch on this with
 * exhaustive {@code switch} expressions, so adding a kind forces every pass to decide how to
 * handle it.
 */
public enum NodeKind {
  // Structure
  NETLIST,
  MODULE,
  VAR,
  SCOPE,
  VAR_SCOPE,
  ACTIVE,

  // Statements
  ASSIGN,
  ASSIGN_W,
  ASSIGN_FORCE,
  RELEASE,

  // Expressions
  VAR_REF,
  CONST,
  ARRAY_SEL,
  SEL,
  CONCAT,
  AND,
  OR,
  NOT,
  COND
}
