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

import com.google.common.collect.ImmutableList;
import org.hdllower.diag.DiagnosticCollector;
import org.hdllower.diag.WarningCode;
import org.hdllower.graph.Active;
import org.hdllower.graph.Assign;
import org.hdllower.graph.DType;
import org.hdllower.graph.Node;
import org.hdllower.graph.Release;
import org.hdllower.graph.Statement;
import org.hdllower.graph.VarRef;
import org.hdllower.graph.VarScope;
import org.hdllower.testing.DesignFixture;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReleaseLoweringTest {
  DesignFixture design;
  ShadowStateAllocator allocator;
  ReleaseLowering lowering;
  Active proc;

  @Before
  public void setup() {
    design = new DesignFixture();
    allocator =
        new ShadowStateAllocator(design.netlist, new DiagnosticCollector(), ForceOptions.DEFAULT);
    lowering = new ReleaseLowering(design.netlist, allocator);
    proc = design.process();
  }

  /** Adds {@code statement} to the process, lowers it, and returns the resulting process dump. */
  private String lower(Statement statement) {
    proc.addStatement(statement);
    lowering.lower((Release) statement);
    design.netlist.check();
    return proc.dump();
  }

  @Test
  public void net() {
    VarScope n = design.net("n", DType.ranged(8));
    assertThat(lower(design.release(design.write(n))))
        .isEqualTo(
            """
            process "proc"
              n__VforceRd = n;
              n__VforceEn = 8'h0;
            """);
    // The read of n must see its driven value, not the read alias.
    VarRef read = (VarRef) ((Assign) proc.statements().get(0)).rhs();
    assertThat(allocator.isPinned(read)).isTrue();
  }

  @Test
  public void variable() {
    VarScope v = design.variable("v", DType.ranged(8));
    assertThat(lower(design.release(design.write(v))))
        .isEqualTo(
            """
            process "proc"
              v = ((v__VforceEn & v__VforceVal) | (~v__VforceEn & v));
              v__VforceEn = 8'h0;
            """);
  }

  @Test
  public void scalarVariable() {
    VarScope b = design.variable("b", DType.BIT);
    assertThat(lower(design.release(design.write(b))))
        .isEqualTo(
            """
            process "proc"
              b = (b__VforceEn ? b__VforceVal : b);
              b__VforceEn = 1'h0;
            """);
  }

  @Test
  public void bitSelectOfVariable() {
    VarScope v = design.variable("v", DType.ranged(8));
    Statement release =
        design.release(design.netlist.newSel(design.loc(), design.write(v), 4, 4));
    assertThat(lower(release))
        .isEqualTo(
            """
            process "proc"
              v[7:4] = ((v__VforceEn & v__VforceVal) | (~v__VforceEn & v))[7:4];
              v__VforceEn[7:4] = 4'h0;
            """);
  }

  @Test
  public void netArrayElement() {
    VarScope arr = design.net("arr", DType.unpacked(DType.ranged(8), 4));
    Statement release = design.release(design.element(design.write(arr), 1));
    // Only the released element is restored.
    assertThat(lower(release))
        .isEqualTo(
            """
            process "proc"
              arr__VforceRd[1] = arr[1];
              arr__VforceEn[1] = 8'h0;
            """);
  }

  @Test
  public void variableArrayElementWithDynamicIndex() {
    VarScope arr = design.variable("arr", DType.unpacked(DType.BIT, 4));
    VarScope i = design.variable("i", DType.ranged(2));
    Statement release =
        design.release(
            design.netlist.newArraySel(design.loc(), design.write(arr), design.read(i)));
    assertThat(lower(release))
        .isEqualTo(
            """
            process "proc"
              arr[i] = (arr__VforceEn[i] ? arr__VforceVal[i] : arr[i]);
              arr__VforceEn[i] = 1'h0;
            """);
  }

  @Test
  public void wholeArrayRestoresAllElementsBeforeResettingEnables() {
    VarScope arr = design.variable("arr", DType.unpacked(DType.BIT, 2));
    assertThat(lower(design.release(design.write(arr))))
        .isEqualTo(
            """
            process "proc"
              arr[0] = (arr__VforceEn[0] ? arr__VforceVal[0] : arr[0]);
              arr[1] = (arr__VforceEn[1] ? arr__VforceVal[1] : arr[1]);
              arr__VforceEn[0] = 1'h0;
              arr__VforceEn[1] = 1'h0;
            """);
  }

  @Test
  public void concatenationOfNetAndVariable() {
    VarScope n = design.net("n", DType.ranged(4));
    VarScope v = design.variable("v", DType.BIT);
    Statement release =
        design.release(
            design.netlist.newConcat(
                design.loc(), ImmutableList.of(design.write(n), design.write(v))));
    assertThat(lower(release))
        .isEqualTo(
            """
            process "proc"
              {n__VforceRd, v} = {n, (v__VforceEn ? v__VforceVal : v)};
              {n__VforceEn, v__VforceEn} = 5'h0;
            """);
  }

  @Test
  public void suppressesMixedAssignmentWarnings() {
    VarScope v = design.variable("v", DType.ranged(8));
    Statement release = design.release(design.write(v));
    lower(release);
    assertThat(lowering.count()).isEqualTo(1);
    assertThat(release.isDestroyed()).isTrue();
    for (Statement s : proc.statements()) {
      assertThat(s.location().isWarningOff(WarningCode.BLKANDNBLK)).isTrue();
      assertThat(s.location().lineNum).isEqualTo(release.location().lineNum);
      for (Node n : s.collect(Node.class)) {
        assertThat(n.isLinked()).isTrue();
      }
    }
  }
}
