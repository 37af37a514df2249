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
import java.util.List;
import org.blockflow.program.Block;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * A block that runs at most once, if its condition inputs allow. The inputs are wired explicitly
 * (as {@code X}) and every other variable the block reads from outside becomes one of its {@code
 * Params}.
 *
 * <p>A conditional block must write at least one variable that is visible outside it; otherwise it
 * could have no effect, and completing it throws a STRUCTURAL BuildError.
 */
public final class ConditionalBlock extends ControlConstruct {
  private final ImmutableList<Variable> inputs;

  /**
   * If true, the single input is a boolean scalar deciding whether the block runs; otherwise the
   * block runs when its inputs are non-empty.
   */
  private final boolean isScalarCondition;

  public ConditionalBlock(Program program, List<Variable> inputs, boolean isScalarCondition) {
    this(program, inputs, isScalarCondition, null);
  }

  public ConditionalBlock(
      Program program, List<Variable> inputs, boolean isScalarCondition, @Nullable String name) {
    super(program, "conditional_block", name);
    for (Variable input : inputs) {
      if (input == null) {
        throw BuildError.typeError("Each input of %s should be a variable", helper.name);
      }
    }
    this.inputs = ImmutableList.copyOf(inputs);
    this.isScalarCondition = isScalarCondition;
  }

  public ImmutableList<Variable> inputs() {
    return inputs;
  }

  /** Builds the conditional body. May only be called once. */
  public void block(BlockBody body) {
    buildBlock(body);
  }

  @Override
  Operation complete(Block inside, Block parent) {
    ImmutableSet<String> inputNames =
        inputs.stream().map(Variable::name).collect(ImmutableSet.toImmutableSet());
    CaptureAnalyzer.Captures captures =
        CaptureAnalyzer.analyze(inside, ImmutableSet.of(), inputNames);
    ImmutableList<Variable> params =
        CaptureAnalyzer.resolve(parent, captures.params, helper.name);
    ImmutableList<Variable> out = CaptureAnalyzer.visibleOutputs(parent, captures.produced);
    if (out.isEmpty()) {
      throw BuildError.structural("Must set output inside block of %s", helper.name);
    }
    Variable scope = helper.createStepScopes(parent);
    return parent.appendOp(
        Operation.builder("conditional_block")
            .input("X", inputs)
            .input("Params", params)
            .output("Out", out)
            .output("Scope", scope)
            .attr(Operation.SUB_BLOCK, inside)
            .attr("is_scalar_condition", isScalarCondition)
            .build());
  }
}
