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
import static org.blockflow.layers.OpsForTesting.add;
import static org.blockflow.layers.OpsForTesting.lastOp;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.blockflow.program.Block;
import org.blockflow.program.BuildOptions;
import org.blockflow.program.DataType;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.UniqueNames;
import org.blockflow.program.VarType;
import org.blockflow.program.Variable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParallelDoTest {
  private static final ImmutableList<String> PLACES = ImmutableList.of("gpu:0", "gpu:1", "gpu:2");

  private static Variable fp32(Block block, String name, long... shape) {
    return block.createVar(Variable.named(name).dataType(DataType.FP32).shape(shape));
  }

  @Test
  public void replicatedBlock() {
    Program program = new Program();
    Block global = program.globalBlock();
    Variable data = fp32(global, "data", -1, 4);
    Variable w = fp32(global, "w", -1, 4);
    ParallelDo pd = new ParallelDo(program, PLACES);
    pd.block(
        () -> {
          Variable x = pd.readInput(data);
          pd.writeOutput(add(program, x, w));
        });
    Operation op = lastOp(global);
    assertThat(op.type()).isEqualTo("parallel_do");
    assertThat(op.input("inputs")).containsExactly("data");
    assertThat(op.input("parameters")).containsExactly("w");
    assertThat(op.attr("places")).isEqualTo(PLACES);
    assertThat(op.attr("use_nccl")).isEqualTo(false);
    ImmutableList<String> scopes = op.output("parallel_scopes");
    assertThat(scopes).hasSize(3);
    for (String scope : scopes) {
      assertThat(global.var(scope).type()).isEqualTo(VarType.STEP_SCOPES);
    }
    ImmutableList<Variable> results = pd.results();
    assertThat(results).hasSize(1);
    assertThat(global.findVar(results.get(0).name())).isSameInstanceAs(results.get(0));
    assertThat(op.output("outputs")).containsExactly(results.get(0).name());
  }

  @Test
  public void ncclFromOptions() {
    Program program = new Program(BuildOptions.builder().useNccl(true).build(), new UniqueNames());
    Variable data = fp32(program.globalBlock(), "data", -1, 4);
    ParallelDo pd = new ParallelDo(program, PLACES);
    pd.block(() -> pd.writeOutput(new Layers(program).assign(pd.readInput(data))));
    assertThat(lastOp(program.globalBlock()).attr("use_nccl")).isEqualTo(true);
  }

  @Test
  public void needsPlaces() {
    BuildError e =
        assertThrows(
            BuildError.class, () -> new ParallelDo(new Program(), ImmutableList.of()));
    assertThat(e.kind).isEqualTo(BuildError.Kind.TYPE);
  }

  @Test
  public void sequencing() {
    Program program = new Program();
    Variable data = fp32(program.globalBlock(), "data", -1, 4);
    ParallelDo pd = new ParallelDo(program, PLACES);
    assertThat(assertThrows(BuildError.class, () -> pd.readInput(data)).kind)
        .isEqualTo(BuildError.Kind.SEQUENCING);
    assertThat(assertThrows(BuildError.class, pd::results).kind)
        .isEqualTo(BuildError.Kind.SEQUENCING);
    pd.block(() -> new Layers(program).assign(pd.readInput(data), data));
    assertThat(assertThrows(BuildError.class, pd::results).kind)
        .isEqualTo(BuildError.Kind.STRUCTURAL);
  }
}
