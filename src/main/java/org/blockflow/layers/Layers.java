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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * Appends elementary operations (constants, copies, comparisons, boolean logic and debug printing)
 * to a Program. Unless created with {@link #into}, operations go to the Program's current block.
 */
public final class Layers {
  private final Program program;

  /** If non-null, the block that receives all operations; otherwise the current block. */
  private final @Nullable Block target;

  public Layers(Program program) {
    this(program, null);
  }

  private Layers(Program program, @Nullable Block target) {
    this.program = program;
    this.target = target;
  }

  /** Returns a Layers that appends to {@code block} regardless of which block is current. */
  public Layers into(Block block) {
    Preconditions.checkArgument(block.program() == program);
    return new Layers(program, block);
  }

  private Block block() {
    return (target != null) ? target : program.current();
  }

  private LayerHelper helper(String layerType) {
    return new LayerHelper(program, layerType);
  }

  /** The phases during which a {@link #print} operation logs its input. */
  public enum PrintPhase {
    FORWARD,
    BACKWARD,
    BOTH
  }

  /** Returns a new tensor of the given shape with every element set to {@code value}. */
  public Variable fillConstant(List<Long> shape, DataType dataType, double value) {
    Block block = block();
    Variable out = helper("fill_constant").createTmpVariable(block, dataType, shape);
    block.appendOp(
        Operation.builder("fill_constant")
            .output("Out", out)
            .attr("shape", ImmutableList.copyOf(shape))
            .attr("dtype", dataType.printName())
            .attr("value", value)
            .attr("force_cpu", program.options().forceCpu())
            .build());
    return out;
  }

  /**
   * Returns a new tensor filled with {@code value} whose dimension {@code outputDimIdx} is copied
   * at run time from dimension {@code inputDimIdx} of {@code input} (usually the batch size).
   */
  public Variable fillConstantBatchSizeLike(
      Variable input,
      List<Long> shape,
      DataType dataType,
      double value,
      int inputDimIdx,
      int outputDimIdx) {
    Block block = block();
    Variable out =
        helper("fill_constant_batch_size_like").createTmpVariable(block, dataType, shape);
    block.appendOp(fillBatchSizeLikeOp(input, out, value, inputDimIdx, outputDimIdx));
    return out;
  }

  /** The operation that fills {@code out} with a value, using {@code input} for the batch size. */
  static Operation fillBatchSizeLikeOp(
      Variable input, Variable out, double value, int inputDimIdx, int outputDimIdx) {
    DataType dataType = Preconditions.checkNotNull(out.dataType());
    return Operation.builder("fill_constant_batch_size_like")
        .input("Input", input)
        .output("Out", out)
        .attr("shape", out.shape())
        .attr("dtype", dataType.printName())
        .attr("value", value)
        .attr("input_dim_idx", inputDimIdx)
        .attr("output_dim_idx", outputDimIdx)
        .build();
  }

  /** Returns a copy of {@code input}. */
  public Variable assign(Variable input) {
    Variable out = helper("assign").createTmpVariable(block(), input.dataType(), input.shape());
    return assign(input, out);
  }

  /** Copies {@code input} into {@code output}, which must already exist; returns output. */
  @CanIgnoreReturnValue
  public Variable assign(Variable input, Variable output) {
    block().appendOp(Operation.builder("assign").input("X", input).output("Out", output).build());
    return output;
  }

  /**
   * Adds {@code value} to each element of {@code x}. If {@code inPlace} is true the result is
   * written back to {@code x}; otherwise a new tensor is returned.
   */
  @CanIgnoreReturnValue
  public Variable increment(Variable x, double value, boolean inPlace) {
    Block block = block();
    Variable out =
        inPlace ? x : helper("increment").createTmpVariable(block, x.dataType(), x.shape());
    block.appendOp(
        Operation.builder("increment")
            .input("X", x)
            .output("Out", out)
            .attr("step", value)
            .build());
    return out;
  }

  /** Returns the element-wise truth value of {@code x < y}. */
  public Variable lessThan(Variable x, Variable y) {
    return lessThan(x, y, null);
  }

  /**
   * Stores the element-wise truth value of {@code x < y} in {@code cond}, or in a new boolean
   * tensor if {@code cond} is null; returns the result.
   */
  @CanIgnoreReturnValue
  public Variable lessThan(Variable x, Variable y, @Nullable Variable cond) {
    return compare("less_than", x, y, cond, true);
  }

  /** Returns the element-wise truth value of {@code x == y}. */
  public Variable equal(Variable x, Variable y) {
    return equal(x, y, null);
  }

  /** Like {@link #lessThan(Variable, Variable, Variable)}, but for {@code x == y}. */
  @CanIgnoreReturnValue
  public Variable equal(Variable x, Variable y, @Nullable Variable cond) {
    return compare("equal", x, y, cond, false);
  }

  private Variable compare(
      String type, Variable x, Variable y, @Nullable Variable cond, boolean placed) {
    Block block = block();
    if (cond == null) {
      LayerHelper helper = helper(type);
      cond =
          block.createVar(
              Variable.named(helper.uniqueName(helper.name + ".tmp"))
                  .dataType(DataType.BOOL)
                  .shape(x.shape())
                  .stopGradient(true));
    }
    Operation.Builder op = Operation.builder(type).input("X", x).input("Y", y).output("Out", cond);
    if (placed) {
      op.attr("force_cpu", program.options().forceCpu());
    }
    block.appendOp(op.build());
    return cond;
  }

  /** Returns the element-wise negation of a boolean tensor. */
  public Variable logicalNot(Variable x) {
    return logical("logical_not", x, null);
  }

  /** Returns the element-wise conjunction of two boolean tensors. */
  public Variable logicalAnd(Variable x, Variable y) {
    return logical("logical_and", x, y);
  }

  /** Returns the element-wise disjunction of two boolean tensors. */
  public Variable logicalOr(Variable x, Variable y) {
    return logical("logical_or", x, y);
  }

  private Variable logical(String type, Variable x, @Nullable Variable y) {
    Block block = block();
    Variable out = helper(type).createTmpVariable(block, DataType.BOOL, x.shape());
    Operation.Builder op = Operation.builder(type).input("X", x);
    if (y != null) {
      op.input("Y", y);
    }
    block.appendOp(op.output("Out", out).build());
    return out;
  }

  /** Returns {@code input} unchanged, logging it with the given message whenever it is accessed. */
  public Variable print(Variable input, String message) {
    return print(input, -1, message, -1, PrintPhase.BOTH);
  }

  /**
   * Returns {@code input} unchanged, logging it whenever it is accessed.
   *
   * @param firstN only log the first {@code firstN} accesses; negative for no limit
   * @param message a prefix for each log entry
   * @param summarize how many elements to log; negative for all of them
   * @param phase whether to log the value, its gradient, or both
   */
  public Variable print(
      Variable input, int firstN, String message, int summarize, PrintPhase phase) {
    Block block = block();
    Variable out = helper("print").createTmpVariable(block, input.dataType(), input.shape());
    block.appendOp(
        Operation.builder("print")
            .input("In", input)
            .output("Out", out)
            .attr("first_n", firstN)
            .attr("summarize", summarize)
            .attr("message", message)
            .attr("print_tensor_name", true)
            .attr("print_tensor_type", true)
            .attr("print_tensor_shape", true)
            .attr("print_tensor_lod", true)
            .attr("print_phase", phase.name())
            .build());
    return out;
  }
}
