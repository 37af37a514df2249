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
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.VarType;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * Appends the operations that manipulate variable-length sequences: rank tables, tensor arrays,
 * and splitting or merging a batch by a boolean mask. The value-level behavior of each operation is
 * given by the corresponding method of {@link org.blockflow.seq.SequenceKernels}.
 *
 * <p>Unless created with {@link #into}, operations go to the Program's current block.
 */
public final class SequenceLayers {
  private final Program program;
  private final @Nullable Block target;

  public SequenceLayers(Program program) {
    this(program, null);
  }

  private SequenceLayers(Program program, @Nullable Block target) {
    this.program = program;
    this.target = target;
  }

  /** Returns a SequenceLayers that appends to {@code block} even when it is not current. */
  public SequenceLayers into(Block block) {
    Preconditions.checkArgument(block.program() == program);
    return new SequenceLayers(program, block);
  }

  private Block block() {
    return (target != null) ? target : program.current();
  }

  private LayerHelper helper(String layerType) {
    return new LayerHelper(program, layerType);
  }

  /** The two halves of a batch split by a mask. */
  public record Split(Variable outTrue, Variable outFalse) {}

  /**
   * Returns a rank table for {@code x}: the sequences at the given nesting level, ordered by
   * descending length.
   */
  public Variable lodRankTable(Variable x, int level) {
    Block block = block();
    LayerHelper helper = helper("lod_rank_table");
    Variable table =
        block.createVar(
            Variable.named(helper.uniqueName("lod_rank_table"))
                .type(VarType.LOD_RANK_TABLE)
                .stopGradient(true));
    block.appendOp(
        Operation.builder("lod_rank_table")
            .input("X", x)
            .output("Out", table)
            .attr("level", level)
            .build());
    return table;
  }

  /** Returns the length of the longest sequence in a rank table, as an int64 scalar. */
  public Variable maxSequenceLen(Variable rankTable) {
    Block block = block();
    Variable out =
        helper("max_sequence_len").createTmpVariable(block, DataType.INT64, ImmutableList.of(1L));
    block.appendOp(
        Operation.builder("max_sequence_len")
            .input("RankTable", rankTable)
            .output("Out", out)
            .build());
    return out;
  }

  /**
   * Returns a tensor array whose element {@code t} holds step {@code t} of every sequence in
   * {@code x} that is longer than {@code t}, in rank-table order.
   */
  public Variable lodTensorToArray(Variable x, Variable rankTable) {
    Block block = block();
    LayerHelper helper = helper("lod_tensor_to_array");
    Variable array =
        block.createVar(
            Variable.named(helper.uniqueName("lod_tensor_to_array"))
                .type(VarType.LOD_TENSOR_ARRAY)
                .dataType(x.dataType()));
    block.appendOp(
        Operation.builder("lod_tensor_to_array")
            .input("X", x)
            .input("RankTable", rankTable)
            .output("Out", array)
            .build());
    return array;
  }

  /** The inverse of {@link #lodTensorToArray}. */
  public Variable arrayToLodTensor(Variable array, Variable rankTable) {
    Block block = block();
    Variable out = helper("array_to_lod_tensor").createTmpVariable(block, array.dataType());
    block.appendOp(
        Operation.builder("array_to_lod_tensor")
            .input("X", array)
            .input("RankTable", rankTable)
            .output("Out", out)
            .build());
    return out;
  }

  /** Creates an empty tensor array. No operation is needed. */
  public Variable createArray(DataType dataType) {
    LayerHelper helper = helper("array");
    return block()
        .createVar(
            Variable.named(helper.name + ".out")
                .type(VarType.LOD_TENSOR_ARRAY)
                .dataType(dataType));
  }

  /**
   * Writes {@code x} at index {@code i} of {@code array}, creating the slot if necessary. If
   * {@code array} is null a new array is created. Returns the array.
   */
  @CanIgnoreReturnValue
  public Variable arrayWrite(Variable x, Variable i, @Nullable Variable array) {
    Block block = block();
    if (array == null) {
      LayerHelper helper = helper("array_write");
      array =
          block.createVar(
              Variable.named(helper.name + ".out")
                  .type(VarType.LOD_TENSOR_ARRAY)
                  .dataType(x.dataType()));
    }
    block.appendOp(
        Operation.builder("write_to_array")
            .input("X", x)
            .input("I", i)
            .output("Out", array)
            .build());
    return array;
  }

  /** Returns element {@code i} of {@code array}. */
  public Variable arrayRead(Variable array, Variable i) {
    if (array.type() != VarType.LOD_TENSOR_ARRAY) {
      throw BuildError.typeError("%s should be a tensor array variable", array.name());
    }
    Block block = block();
    Variable out = helper("array_read").createTmpVariable(block, array.dataType());
    block.appendOp(
        Operation.builder("read_from_array")
            .input("X", array)
            .input("I", i)
            .output("Out", out)
            .build());
    return out;
  }

  /** Returns the number of elements in {@code array}, as an int64 scalar. */
  public Variable arrayLength(Variable array) {
    Block block = block();
    LayerHelper helper = helper("array_length");
    Variable out =
        block.createVar(
            Variable.named(helper.uniqueName(helper.name + ".tmp"))
                .dataType(DataType.INT64)
                .shape(1)
                .stopGradient(true));
    block.appendOp(
        Operation.builder("lod_array_length").input("X", array).output("Out", out).build());
    return out;
  }

  /**
   * Returns the leading rows of {@code x} that belong to sequences still active at step {@code
   * i}, according to {@code rankTable}.
   */
  public Variable shrinkMemory(Variable x, Variable i, Variable rankTable) {
    Block block = block();
    Variable out = helper("shrink_memory").createTmpVariable(block, x.dataType());
    block.appendOp(
        Operation.builder("shrink_rnn_memory")
            .input("X", x)
            .input("I", i)
            .input("RankTable", rankTable)
            .output("Out", out)
            .build());
    return out;
  }

  /** Returns {@code x} with its sequences permuted into rank-table order. */
  public Variable reorderLodTensorByRank(Variable x, Variable rankTable) {
    Block block = block();
    Variable out = helper("reorder_lod_tensor_by_rank").createTmpVariable(block, x.dataType());
    block.appendOp(reorderOp(x, rankTable, out));
    return out;
  }

  static Operation reorderOp(Variable x, Variable rankTable, Variable out) {
    return Operation.builder("reorder_lod_tensor_by_rank")
        .input("X", x)
        .input("RankTable", rankTable)
        .output("Out", out)
        .build();
  }

  /**
   * Splits {@code input} at the given nesting level into the units whose mask entry is true and
   * those whose mask entry is false.
   */
  public Split splitLodTensor(Variable input, Variable mask, int level) {
    Block block = block();
    LayerHelper helper = helper("split_lod_tensor");
    Variable outTrue = helper.createTmpVariable(block, input.dataType(), input.shape());
    Variable outFalse = helper.createTmpVariable(block, input.dataType(), input.shape());
    block.appendOp(
        Operation.builder("split_lod_tensor")
            .input("X", input)
            .input("Mask", mask)
            .output("OutTrue", outTrue)
            .output("OutFalse", outFalse)
            .attr("level", level)
            .build());
    return new Split(outTrue, outFalse);
  }

  /**
   * The inverse of {@link #splitLodTensor}: interleaves {@code inTrue} and {@code inFalse} by
   * {@code mask}. {@code x} supplies the nesting information above {@code level}.
   */
  public Variable mergeLodTensor(
      Variable inTrue, Variable inFalse, Variable x, Variable mask, int level) {
    Block block = block();
    Variable out = helper("merge_lod_tensor").createTmpVariable(block, inTrue.dataType());
    block.appendOp(
        Operation.builder("merge_lod_tensor")
            .input("X", x)
            .input("Mask", mask)
            .input("InTrue", inTrue)
            .input("InFalse", inFalse)
            .output("Out", out)
            .attr("level", level)
            .build());
    return out;
  }
}
