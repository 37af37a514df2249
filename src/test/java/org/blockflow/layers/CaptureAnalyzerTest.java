/*
 * Copyright 2025 The Blockflow Authors
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

package org.blockflow.layers;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.Variable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CaptureAnalyzerTest {
  private Program program;
  private Block global;
  private Variable a;
  private Variable b;
  private Block block;

  /**
   * Sets up a child of the global block containing
   *
   * <pre>
   *   t = mul(a, b)
   *   a = add(t, a)
   * </pre>
   */
  @Before
  public void setUp() {
    program = new Program();
    global = program.globalBlock();
    a = global.createVar(Variable.named("a").dataType(DataType.FP32));
    b = global.createVar(Variable.named("b").dataType(DataType.FP32));
    program.enterScope();
    block = program.current();
    Variable t = block.createVar(Variable.named("t").dataType(DataType.FP32));
    block.appendOp(Operation.builder("mul").input("X", a).input("Y", b).output("Out", t).build());
    block.appendOp(Operation.builder("add").input("X", t).input("Y", a).output("Out", a).build());
  }

  @Test
  public void capturesInFirstReadOrder() {
    CaptureAnalyzer.Captures captures =
        CaptureAnalyzer.analyze(block, ImmutableSet.of(), ImmutableSet.of());
    assertThat(captures.params).containsExactly("a", "b").inOrder();
    assertThat(captures.produced).containsExactly("t", "a").inOrder();
  }

  @Test
  public void seedsAreLocal() {
    CaptureAnalyzer.Captures captures =
        CaptureAnalyzer.analyze(block, ImmutableSet.of("b"), ImmutableSet.of());
    assertThat(captures.params).containsExactly("a");
    assertThat(captures.produced).containsExactly("b", "t", "a").inOrder();
  }

  @Test
  public void excludedNamesAreNotCaptured() {
    CaptureAnalyzer.Captures captures =
        CaptureAnalyzer.analyze(block, ImmutableSet.of(), ImmutableSet.of("a"));
    assertThat(captures.params).containsExactly("b");
  }

  @Test
  public void resolveThroughAncestors() {
    program.enterScope();
    Block inner = program.current();
    assertThat(CaptureAnalyzer.resolve(inner.parent(), ImmutableSet.of("b", "a"), "test"))
        .containsExactly(b, a)
        .inOrder();
  }

  @Test
  public void escapedReference() {
    BuildError e =
        assertThrows(
            BuildError.class,
            () -> CaptureAnalyzer.resolve(global, ImmutableSet.of("a", "t"), "while_0"));
    assertThat(e.kind).isEqualTo(BuildError.Kind.STRUCTURAL);
    assertThat(e.msg).contains("'t'");
    assertThat(e.msg).contains("while_0");
  }

  @Test
  public void visibleOutputs() {
    CaptureAnalyzer.Captures captures =
        CaptureAnalyzer.analyze(block, ImmutableSet.of(), ImmutableSet.of());
    assertThat(CaptureAnalyzer.visibleOutputs(global, captures.produced)).containsExactly(a);
  }
}
