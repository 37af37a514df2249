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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.VarType;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * A loop that repeats its block while a boolean scalar condition holds. The block is responsible
 * for recomputing the condition, typically as its last operation:
 *
 * <pre>
 *   While loop = new While(program, cond);
 *   loop.block(() -> {
 *     ...
 *     layers.increment(i, 1, true);
 *     layers.lessThan(i, limit, cond);
 *   });
 * </pre>
 *
 * <p>The emitted {@code while} operation has inputs {@code X} (every variable the block captures
 * from outside, except the condition) and {@code Condition}, and outputs {@code Out} (every
 * variable written in the block that is also visible outside it) and {@code StepScopes}.
 */
public final class While extends ControlConstruct {
  private final Variable cond;

  public While(Program program, Variable cond) {
    this(program, cond, null);
  }

  public While(Program program, Variable cond, @Nullable String name) {
    super(program, "while", name);
    if (cond.type() != VarType.LOD_TENSOR || cond.dataType() != DataType.BOOL) {
      throw BuildError.typeError("condition %s should be a bool variable", cond.name());
    }
    if (cond.numElements() != 1) {
      throw BuildError.typeError(
          "condition %s should be a bool scalar, but has shape %s", cond.name(), cond.shape());
    }
    this.cond = cond;
  }

  public Variable condition() {
    return cond;
  }

  /** Builds the loop body. May only be called once. */
  public void block(BlockBody body) {
    buildBlock(body);
  }

  @Override
  Operation complete(Block whileBlock, Block parent) {
    CaptureAnalyzer.Captures captures =
        CaptureAnalyzer.analyze(whileBlock, ImmutableSet.of(cond.name()), ImmutableSet.of());
    ImmutableList<Variable> x = CaptureAnalyzer.resolve(parent, captures.params, helper.name);
    ImmutableList<Variable> out = CaptureAnalyzer.visibleOutputs(parent, captures.produced);
    Variable stepScopes = helper.createStepScopes(parent);
    return parent.appendOp(
        Operation.builder("while")
            .input("X", x)
            .input("Condition", cond)
            .output("Out", out)
            .output("StepScopes", stepScopes)
            .attr(Operation.SUB_BLOCK, whileBlock)
            .build());
  }
}
