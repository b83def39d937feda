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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Properties;

/**
 * Options controlling the force lowering pass. Instances are immutable; use a {@link Builder}, or
 * {@link #fromProperties} to read them from properties named {@code hdllower.force.*}:
 *
 * <ul>
 *   <li>{@code hdllower.force.check} (default {@code true}): verify the graph's structural
 *       invariants after the pass;
 *   <li>{@code hdllower.force.dump} (default {@code false}): log the whole graph after the pass, at
 *       DEBUG level;
 *   <li>{@code hdllower.force.suffix.read}, {@code .enable}, {@code .value}: the suffixes appended
 *       to a signal's name to name its shadow signals.
 * </ul>
 */
public final class ForceOptions {
  public static final String PREFIX = "hdllower.force.";

  public static final ForceOptions DEFAULT = builder().build();

  private final boolean checkTree;
  private final boolean dumpTree;
  private final String readSuffix;
  private final String enableSuffix;
  private final String valueSuffix;

  private ForceOptions(Builder builder) {
    this.checkTree = builder.checkTree;
    this.dumpTree = builder.dumpTree;
    this.readSuffix = builder.readSuffix;
    this.enableSuffix = builder.enableSuffix;
    this.valueSuffix = builder.valueSuffix;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Reads options from the given properties; missing properties get their default values. */
  public static ForceOptions fromProperties(Properties props) {
    Builder builder = builder();
    builder.setCheckTree(Boolean.parseBoolean(props.getProperty(PREFIX + "check", "true")));
    builder.setDumpTree(Boolean.parseBoolean(props.getProperty(PREFIX + "dump", "false")));
    builder.setSuffixes(
        props.getProperty(PREFIX + "suffix.read", builder.readSuffix),
        props.getProperty(PREFIX + "suffix.enable", builder.enableSuffix),
        props.getProperty(PREFIX + "suffix.value", builder.valueSuffix));
    return builder.build();
  }

  /** Equivalent to {@code fromProperties(System.getProperties())}. */
  public static ForceOptions fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /** If true, {@link org.hdllower.graph.Netlist#check} is called after the pass completes. */
  public boolean checkTree() {
    return checkTree;
  }

  /** If true, the graph is logged after the pass completes. */
  public boolean dumpTree() {
    return dumpTree;
  }

  /** Appended to a signal's name to name its read alias. */
  public String readSuffix() {
    return readSuffix;
  }

  /** Appended to a signal's name to name its force enable. */
  public String enableSuffix() {
    return enableSuffix;
  }

  /** Appended to a signal's name to name its forced value. */
  public String valueSuffix() {
    return valueSuffix;
  }

  @Override
  public String toString() {
    return String.format(
        "check=%s dump=%s suffixes=[%s, %s, %s]",
        checkTree, dumpTree, readSuffix, enableSuffix, valueSuffix);
  }

  /** A Builder is used to construct a new ForceOptions. */
  public static class Builder {
    private boolean checkTree = true;
    private boolean dumpTree = false;
    private String readSuffix = "__VforceRd";
    private String enableSuffix = "__VforceEn";
    private String valueSuffix = "__VforceVal";

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setCheckTree(boolean checkTree) {
      this.checkTree = checkTree;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setDumpTree(boolean dumpTree) {
      this.dumpTree = dumpTree;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSuffixes(String readSuffix, String enableSuffix, String valueSuffix) {
      Preconditions.checkArgument(
          !readSuffix.isEmpty() && !enableSuffix.isEmpty() && !valueSuffix.isEmpty(),
          "Shadow signal suffixes must not be empty");
      Preconditions.checkArgument(
          ImmutableSet.of(readSuffix, enableSuffix, valueSuffix).size() == 3,
          "Shadow signal suffixes must be distinct");
      this.readSuffix = readSuffix;
      this.enableSuffix = enableSuffix;
      this.valueSuffix = valueSuffix;
      return this;
    }

    public ForceOptions build() {
      return new ForceOptions(this);
    }
  }
}
