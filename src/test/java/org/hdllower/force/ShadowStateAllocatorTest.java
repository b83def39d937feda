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

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.hdllower.diag.Diagnostic;
import org.hdllower.diag.DiagnosticCollector;
import org.hdllower.graph.DType;
import org.hdllower.graph.Expr;
import org.hdllower.graph.Scope;
import org.hdllower.graph.Var;
import org.hdllower.graph.VarRef;
import org.hdllower.graph.VarScope;
import org.hdllower.testing.DesignFixture;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class ShadowStateAllocatorTest {
  DesignFixture design;
  DiagnosticCollector diagnostics;
  ShadowStateAllocator allocator;

  @Before
  public void setup() {
    design = new DesignFixture();
    diagnostics = new DiagnosticCollector();
    allocator = new ShadowStateAllocator(design.netlist, diagnostics, ForceOptions.DEFAULT);
  }

  @Test
  public void createsOncePerSignal() {
    VarScope x = design.variable("x", DType.ranged(8));
    VarScope y = design.variable("y", DType.BIT);
    assertThat(allocator.get(x)).isNull();
    ShadowSet shadows = allocator.getOrCreate(x);
    assertThat(allocator.getOrCreate(x)).isSameInstanceAs(shadows);
    assertThat(allocator.get(x)).isSameInstanceAs(shadows);
    assertThat(allocator.get(y)).isNull();
    assertThat(allocator.all()).containsExactly(shadows);
    assertThat(shadows.original()).isSameInstanceAs(x);
    assertThat(design.scope.actives()).hasSize(2);
    design.netlist.check();
  }

  @Test
  public void declarationsFollowTheOriginal() {
    VarScope x = design.variable("x", DType.ranged(8));
    design.variable("y", DType.BIT);
    allocator.getOrCreate(x);
    assertThat(design.module.vars().stream().map(v -> v.name))
        .containsExactly("x", "x__VforceRd", "x__VforceEn", "x__VforceVal", "y")
        .inOrder();
    assertThat(design.scope.varScopes().stream().map(VarScope::name))
        .containsExactly("x", "x__VforceRd", "x__VforceEn", "x__VforceVal", "y")
        .inOrder();
    assertThat(design.module.vars().get(1).toString()).isEqualTo("var x__VforceRd: logic[7:0] net");
    assertThat(design.module.vars().get(2).toString()).isEqualTo("var x__VforceEn: logic[7:0] var");
    assertThat(design.module.vars().get(3).toString())
        .isEqualTo("var x__VforceVal: logic[7:0] var");
  }

  @Test
  public void rangedWiring() {
    VarScope x = design.net("x", DType.ranged(8));
    allocator.getOrCreate(x);
    assertThat(design.dumpScope())
        .isEqualTo(
            """
            scope top
              signal x
              signal x__VforceRd
              signal x__VforceEn
              signal x__VforceVal
              initial "force-init"
                x__VforceEn = 8'h0;
              combo "force-comb"
                assign x__VforceRd = ((x__VforceEn & x__VforceVal) | (~x__VforceEn & x));
            """);
  }

  @Test
  public void scalarWiring() {
    VarScope b = design.variable("b", DType.BIT);
    allocator.getOrCreate(b);
    assertThat(design.dumpScope())
        .contains(
            """
              initial "force-init"
                b__VforceEn = 1'h0;
              combo "force-comb"
                assign b__VforceRd = (b__VforceEn ? b__VforceVal : b);
            """);
  }

  @Test
  public void arrayWiring() {
    VarScope arr = design.net("arr", DType.unpacked(DType.ranged(4), 2));
    VarScope reals = design.variable("r", DType.unpacked(DType.scalar("real", 64), 2));
    allocator.getOrCreate(arr);
    allocator.getOrCreate(reals);
    String dump = design.dumpScope();
    assertThat(dump)
        .contains(
            """
              initial "force-init"
                arr__VforceEn[0] = 4'h0;
                arr__VforceEn[1] = 4'h0;
              combo "force-comb"
                assign arr__VforceRd[0] = ((arr__VforceEn[0] & arr__VforceVal[0]) | \
            (~arr__VforceEn[0] & arr[0]));
                assign arr__VforceRd[1] = ((arr__VforceEn[1] & arr__VforceVal[1]) | \
            (~arr__VforceEn[1] & arr[1]));
            """);
    assertThat(dump)
        .contains(
            """
              initial "force-init"
                r__VforceEn[0] = 1'h0;
                r__VforceEn[1] = 1'h0;
              combo "force-comb"
                assign r__VforceRd[0] = (r__VforceEn[0] ? r__VforceVal[0] : r[0]);
                assign r__VforceRd[1] = (r__VforceEn[1] ? r__VforceVal[1] : r[1]);
            """);
    design.netlist.check();
  }

  /** Signal dtypes, and the dtype their enable should have. */
  enum EnableCase {
    BIT(DType.BIT, DType.BIT),
    REAL(DType.scalar("real", 64), DType.BIT),
    ONE_BIT_VECTOR(DType.ranged(1), DType.ranged(1)),
    BYTE(DType.ranged(8), DType.ranged(8)),
    BYTE_ARRAY(DType.unpacked(DType.ranged(8), 4), DType.unpacked(DType.ranged(8), 4)),
    REAL_ARRAY(DType.unpacked(DType.scalar("real", 64), 3), DType.unpacked(DType.BIT, 3));

    final DType signal;
    final DType enable;

    EnableCase(DType signal, DType enable) {
      this.signal = signal;
      this.enable = enable;
    }
  }

  @Test
  public void shadowTypes(@TestParameter EnableCase testCase) {
    assertThat(ShadowStateAllocator.enableType(testCase.signal)).isEqualTo(testCase.enable);
    VarScope s = design.variable("s", testCase.signal);
    ShadowSet shadows = allocator.getOrCreate(s);
    assertThat(shadows.readAlias().dtype()).isEqualTo(testCase.signal);
    assertThat(shadows.readAlias().var().isNet()).isTrue();
    assertThat(shadows.enable().dtype()).isEqualTo(testCase.enable);
    assertThat(shadows.enable().var().isNet()).isFalse();
    assertThat(shadows.value().dtype()).isEqualTo(testCase.signal);
    assertThat(shadows.value().var().isNet()).isFalse();
    design.netlist.check();
  }

  @Test
  public void varsAreSharedBetweenScopes() {
    VarScope x = design.net("x", DType.ranged(8));
    x.var().setPrimaryIO(true);
    Scope other = design.netlist.newScope(design.loc(), "other");
    design.module.addScope(other);
    VarScope otherX = design.netlist.newVarScope(design.loc(), x.var());
    other.addVarScope(otherX);

    ShadowSet first = allocator.getOrCreate(x);
    ShadowSet second = allocator.getOrCreate(otherX);
    assertThat(second).isNotSameInstanceAs(first);
    assertThat(second.readAlias().var()).isSameInstanceAs(first.readAlias().var());
    assertThat(second.enable().var()).isSameInstanceAs(first.enable().var());
    assertThat(second.value().scope()).isSameInstanceAs(other);
    assertThat(other.actives()).hasSize(2);
    assertThat(design.module.vars()).hasSize(4);

    // The primary IO warning is reported once per declaration, not per scope.
    assertThat(diagnostics.diagnostics()).hasSize(1);
    Diagnostic warning = diagnostics.diagnostics().get(0);
    assertThat(warning.severity).isEqualTo(Diagnostic.Severity.WARNING);
    assertThat(warning.code).isEqualTo(Diagnostic.Code.UNSUPPORTED);
    assertThat(warning.msg)
        .startsWith("Unsupported: Force/Release on primary input/output net 'x'\n");
    assertThat(warning.location).isEqualTo(x.var().location());
    design.netlist.check();
  }

  @Test
  public void customSuffixes() {
    ForceOptions options = ForceOptions.builder().setSuffixes("_rd", "_en", "_val").build();
    allocator = new ShadowStateAllocator(design.netlist, diagnostics, options);
    VarScope x = design.variable("x", DType.BIT);
    ShadowSet shadows = allocator.getOrCreate(x);
    assertThat(shadows.readAlias().name()).isEqualTo("x_rd");
    assertThat(shadows.enable().name()).isEqualTo("x_en");
    assertThat(shadows.value().name()).isEqualTo("x_val");
  }

  @Test
  public void originalReadsArePinned() {
    VarScope x = design.variable("x", DType.ranged(8));
    ShadowSet shadows = allocator.getOrCreate(x);
    for (VarRef ref : design.scope.collect(VarRef.class)) {
      assertThat(allocator.isPinned(ref)).isEqualTo(ref.varScope() == x);
    }
    Expr mux = allocator.effectiveRead(design.loc(), shadows, null);
    assertThat(mux.toString()).isEqualTo("((x__VforceEn & x__VforceVal) | (~x__VforceEn & x))");
    VarRef unpinned = design.read(x);
    assertThat(allocator.isPinned(unpinned)).isFalse();
    design.netlist.destroy(mux);
    design.netlist.destroy(unpinned);
  }

  @Test
  public void primaryIoIsStillLowered() {
    VarScope x = design.variable("x", DType.BIT);
    Var var = x.var();
    var.setPrimaryIO(true);
    ShadowSet shadows = allocator.getOrCreate(x);
    assertThat(shadows.enable().var().name).isEqualTo("x__VforceEn");
    assertThat(diagnostics.hasErrors()).isFalse();
    assertThat(diagnostics.diagnostics()).hasSize(1);
  }
}
