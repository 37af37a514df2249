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

import com.google.common.collect.ImmutableList;
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.VarType;
import org.blockflow.program.Variable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class WhileTest {
  private final Program program = new Program();
  private final Block global = program.globalBlock();
  private final Layers layers = new Layers(program);

  private Variable boolVar(String name, long... shape) {
    return global.createVar(Variable.named(name).dataType(DataType.BOOL).shape(shape));
  }

  @Test
  public void conditionMustBeScalar() {
    BuildError e =
        assertThrows(BuildError.class, () -> new While(program, boolVar("wide", 2)));
    assertThat(e.kind).isEqualTo(BuildError.Kind.TYPE);
    While loop = new While(program, boolVar("narrow", 1));
    assertThat(loop.state()).isEqualTo(ConstructState.BEFORE);
    assertThat(loop.name()).isEqualTo("while_1");
  }

  @Test
  public void conditionMustBeBool() {
    Variable i = layers.fillConstant(ImmutableList.of(1L), DataType.INT64, 0);
    BuildError e = assertThrows(BuildError.class, () -> new While(program, i));
    assertThat(e.kind).isEqualTo(BuildError.Kind.TYPE);
  }

  @Test
  public void counterLoop() {
    Variable i = layers.fillConstant(ImmutableList.of(1L), DataType.INT64, 0);
    Variable limit = layers.fillConstant(ImmutableList.of(1L), DataType.INT64, 10);
    Variable cond = layers.lessThan(i, limit);
    While loop = new While(program, cond);
    loop.block(
        () -> {
          assertThat(program.current()).isNotSameInstanceAs(global);
          layers.increment(i, 1, true);
          layers.lessThan(i, limit, cond);
        });
    assertThat(loop.state()).isEqualTo(ConstructState.AFTER);
    assertThat(program.current()).isSameInstanceAs(global);
    assertThat(program.numBlocks()).isEqualTo(2);

    Operation op = global.ops().get(global.ops().size() - 1);
    assertThat(op.type()).isEqualTo("while");
    assertThat(op.input("X")).containsExactly(i.name(), limit.name()).inOrder();
    assertThat(op.input("Condition")).containsExactly(cond.name());
    assertThat(op.output("Out")).containsExactly(cond.name(), i.name()).inOrder();
    assertThat(op.subBlock()).isSameInstanceAs(program.block(1));
    Variable stepScopes = global.var(op.output("StepScopes").get(0));
    assertThat(stepScopes.type()).isEqualTo(VarType.STEP_SCOPES);
    assertThat(op.subBlock().ops()).hasSize(2);
  }

  @Test
  public void localsAreNotOutputs() {
    Variable cond = boolVar("cond", 1);
    Variable x = global.createVar(Variable.named("x").dataType(DataType.FP32).shape(1));
    While loop = new While(program, cond);
    loop.block(
        () -> {
          Variable copy = layers.assign(x);
          layers.assign(copy, x);
        });
    Operation op = global.ops().get(global.ops().size() - 1);
    assertThat(op.input("X")).containsExactly("x");
    assertThat(op.output("Out")).containsExactly("cond", "x").inOrder();
  }

  @Test
  public void nestedLoopCapturesFromGrandparent() {
    Variable cond = boolVar("cond", 1);
    Variable x = global.createVar(Variable.named("x").dataType(DataType.FP32).shape(1));
    While outer = new While(program, cond);
    outer.block(
        () -> {
          Variable innerCond = layers.equal(x, x);
          new While(program, innerCond).block(() -> layers.assign(x, x));
        });
    Block outerBlock = program.block(1);
    Operation innerOp = outerBlock.ops().get(outerBlock.ops().size() - 1);
    assertThat(innerOp.type()).isEqualTo("while");
    assertThat(innerOp.input("X")).containsExactly("x");
    Operation outerOp = global.ops().get(global.ops().size() - 1);
    assertThat(outerOp.input("X")).containsExactly("x");
  }

  @Test
  public void errorRollsBack() {
    Variable cond = boolVar("cond", 1);
    Variable x = global.createVar(Variable.named("x").dataType(DataType.FP32).shape(1));
    int numOps = global.ops().size();
    int numVars = global.vars().size();
    While loop = new While(program, cond);
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () ->
                loop.block(
                    () -> {
                      layers.assign(x, x);
                      throw new IllegalStateException("boom");
                    }));
    assertThat(e).hasMessageThat().isEqualTo("boom");
    assertThat(program.numBlocks()).isEqualTo(1);
    assertThat(program.current()).isSameInstanceAs(global);
    assertThat(global.ops()).hasSize(numOps);
    assertThat(global.vars()).hasSize(numVars);
    BuildError again = assertThrows(BuildError.class, () -> loop.block(() -> {}));
    assertThat(again.kind).isEqualTo(BuildError.Kind.SEQUENCING);
  }

  @Test
  public void escapedReferenceIsStructural() {
    Variable cond = boolVar("cond", 1);
    // Defined in a different Program, so no block of this one can resolve it
    Variable orphan =
        new Program().globalBlock().createVar(Variable.named("orphan").dataType(DataType.FP32));
    While loop = new While(program, cond);
    BuildError e =
        assertThrows(BuildError.class, () -> loop.block(() -> layers.assign(orphan, orphan)));
    assertThat(e.kind).isEqualTo(BuildError.Kind.STRUCTURAL);
    assertThat(program.numBlocks()).isEqualTo(1);
  }

  @Test
  public void blockOnlyOnce() {
    Variable cond = boolVar("cond", 1);
    Variable x = global.createVar(Variable.named("x").dataType(DataType.FP32).shape(1));
    While loop = new While(program, cond);
    loop.block(() -> layers.assign(x, x));
    BuildError e = assertThrows(BuildError.class, () -> loop.block(() -> layers.assign(x, x)));
    assertThat(e.kind).isEqualTo(BuildError.Kind.SEQUENCING);
  }
}
