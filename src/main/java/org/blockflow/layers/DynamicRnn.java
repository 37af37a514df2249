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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.VarType;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * A recurrence over a batch of variable-length sequences, lowered to a {@link While} loop.
 *
 * <p>The first {@link #stepInput} builds a rank table that orders the sequences by descending
 * length. Each step input is scattered into a tensor array (element {@code t} holds step {@code t}
 * of every sequence longer than {@code t}), so the number of active rows shrinks as shorter
 * sequences finish. Memories and static inputs are shrunk to match at every step. The loop
 * counter, the continuation condition and the writes of updated memories are appended
 * automatically at the end of the block; after the loop each output array is gathered back into
 * one tensor in the original sequence order.
 *
 * <pre>
 *   DynamicRnn drnn = new DynamicRnn(program);
 *   drnn.block(() -> {
 *     Variable word = drnn.stepInput(sentence);
 *     Variable prev = drnn.memory(ImmutableList.of(200L), 0.0, DataType.FP32);
 *     Variable hidden = ...;
 *     drnn.updateMemory(prev, hidden);
 *     drnn.output(hidden);
 *   });
 *   Variable hiddens = drnn.result();
 * </pre>
 */
public final class DynamicRnn {
  private final Program program;
  private final LayerHelper helper;
  private final Lifecycle<ConstructState> lifecycle;

  /** Taken before anything was added for this construct; a failed block rolls back to it. */
  private final Program.Checkpoint start;

  private final Variable zeroIdx;
  private final Variable cond;
  private final While whileOp;

  private @Nullable Variable stepIdx;
  private @Nullable Variable rankTable;
  private @Nullable Variable maxSeqLen;

  /** The arrays created by {@link #stepInput}, in call order. */
  private final List<Variable> inputArrays = new ArrayList<>();

  /** Maps the name of each value returned by {@link #memory} to the array that carries it. */
  private final Map<String, Variable> memArrays = new LinkedHashMap<>();

  /** A value to be written to a memory array at the end of each step. */
  private record MemoryWrite(Variable newMem, Variable memArray) {}

  /** The writes registered by {@link #updateMemory}, in call order. */
  private final List<MemoryWrite> memWrites = new ArrayList<>();

  private final List<Variable> outputArrays = new ArrayList<>();
  private final List<Variable> outputs = new ArrayList<>();

  public DynamicRnn(Program program) {
    this(program, null);
  }

  public DynamicRnn(Program program, @Nullable String name) {
    this.program = program;
    this.helper = new LayerHelper(program, "dynamic_rnn", name);
    this.lifecycle = Lifecycle.standard(helper.name);
    this.start = program.checkpoint();
    Layers layers = new Layers(program);
    this.zeroIdx = layers.fillConstant(ImmutableList.of(1L), DataType.INT64, 0);
    this.cond =
        helper.createTmpVariable(program.current(), DataType.BOOL, ImmutableList.of(1L));
    this.whileOp = new While(program, cond);
  }

  public String name() {
    return helper.name;
  }

  public ConstructState state() {
    return lifecycle.state();
  }

  /** The rank table built by the first step input, or null if there has been none. */
  public @Nullable Variable rankTable() {
    return rankTable;
  }

  /**
   * Builds the step block. {@code body} must call {@link #stepInput} at least once. May only be
   * called once. If it fails, everything added for this construct since it was created is removed,
   * including the loop counters.
   */
  public void block(BlockBody body) {
    lifecycle.moveTo(ConstructState.IN);
    boolean completed = false;
    try {
      Variable idx = new Layers(program).fillConstant(ImmutableList.of(1L), DataType.INT64, 0);
      stepIdx = idx;
      whileOp.block(
          () -> {
            body.build();
            if (maxSeqLen == null) {
              throw BuildError.structural(
                  "step_input must be invoked inside the block of %s", helper.name);
            }
            Layers layers = new Layers(program);
            SequenceLayers seq = new SequenceLayers(program);
            layers.increment(idx, 1, true);
            for (MemoryWrite write : memWrites) {
              seq.arrayWrite(write.newMem(), idx, write.memArray());
            }
            layers.lessThan(idx, maxSeqLen, cond);
          });
      lifecycle.moveTo(ConstructState.AFTER);
      Variable table = requireRankTable("block");
      SequenceLayers seq = new SequenceLayers(program);
      for (Variable array : outputArrays) {
        outputs.add(seq.arrayToLodTensor(array, table));
      }
      completed = true;
    } finally {
      if (!completed) {
        lifecycle.abandon();
        program.rollbackTo(start);
      }
    }
  }

  private Block parentBlock() {
    return whileOp.parentBlock();
  }

  private Variable stepIdx() {
    assert stepIdx != null;
    return stepIdx;
  }

  private Variable requireRankTable(String method) {
    if (rankTable == null) {
      throw BuildError.sequencing(
          "%s of %s must be invoked after step_input", method, helper.name);
    }
    return rankTable;
  }

  /**
   * Returns the rows of {@code x} for the current step, taken from each sequence that is still
   * active, in rank-table order.
   */
  public Variable stepInput(Variable x) {
    lifecycle.require(ConstructState.IN, "step_input");
    Block parent = parentBlock();
    SequenceLayers parentSeq = new SequenceLayers(program).into(parent);
    if (rankTable == null) {
      rankTable = parentSeq.lodRankTable(x, 0);
      maxSeqLen = parentSeq.maxSequenceLen(rankTable);
      new Layers(program).into(parent).lessThan(stepIdx(), maxSeqLen, cond);
    }
    Variable array = parentSeq.lodTensorToArray(x, rankTable);
    inputArrays.add(array);
    return new SequenceLayers(program).arrayRead(array, stepIdx());
  }

  /**
   * Returns the rows of {@code x} that belong to sequences still active at the current step. The
   * rows of {@code x} are reordered by the rank table once, outside the loop.
   */
  public Variable staticInput(Variable x) {
    lifecycle.require(ConstructState.IN, "static_input");
    Variable table = requireRankTable("static_input");
    Block parent = parentBlock();
    Variable reordered =
        parent.createVar(
            Variable.named(helper.uniqueName("dynamic_rnn_static_input_reordered"))
                .dataType(x.dataType()));
    parent.appendOp(SequenceLayers.reorderOp(x, table, reordered));
    return new SequenceLayers(program).shrinkMemory(reordered, stepIdx(), table);
  }

  /** Like {@link #memory(Variable, boolean)} without reordering {@code init}. */
  public Variable memory(Variable init) {
    return memory(init, false);
  }

  /**
   * Declares recurrent state whose value before the first step is {@code init}. If {@code
   * needReorder} is true the rows of {@code init} are first permuted into rank-table order.
   * Returns the value of the state at the current step, shrunk to the active rows; pass it to
   * {@link #updateMemory}.
   */
  public Variable memory(Variable init, boolean needReorder) {
    lifecycle.require(ConstructState.IN, "memory");
    Variable table = requireRankTable("memory");
    Block parent = parentBlock();
    Variable initTensor = init;
    if (needReorder) {
      initTensor =
          parent.createVar(
              Variable.named(helper.uniqueName("dynamic_rnn_mem_init_reordered"))
                  .dataType(init.dataType()));
      parent.appendOp(SequenceLayers.reorderOp(init, table, initTensor));
    }
    Variable memArray =
        parent.createVar(
            Variable.named(helper.uniqueName("dynamic_rnn_mem_array"))
                .type(VarType.LOD_TENSOR_ARRAY)
                .dataType(init.dataType()));
    new SequenceLayers(program).into(parent).arrayWrite(initTensor, zeroIdx, memArray);
    SequenceLayers seq = new SequenceLayers(program);
    Variable retv = seq.arrayRead(memArray, stepIdx());
    retv = seq.shrinkMemory(retv, stepIdx(), table);
    memArrays.put(retv.name(), memArray);
    return retv;
  }

  /**
   * Declares recurrent state that starts as a constant. Each row has the given shape, and the
   * number of rows is that of the first step input's first element.
   */
  public Variable memory(List<Long> shape, double value, DataType dataType) {
    lifecycle.require(ConstructState.IN, "memory");
    if (inputArrays.isEmpty()) {
      throw BuildError.sequencing(
          "step_input of %s should be invoked before memory(shape, ...)", helper.name);
    }
    Block parent = parentBlock();
    List<Long> initShape = new ArrayList<>();
    initShape.add(-1L);
    initShape.addAll(shape);
    Variable init =
        parent.createVar(
            Variable.named(helper.uniqueName("mem_init")).dataType(dataType).shape(initShape));
    Variable arr = inputArrays.get(0);
    Variable in0 =
        parent.createVar(Variable.named(helper.uniqueName("in0")).dataType(arr.dataType()));
    parent.appendOp(
        Operation.builder("read_from_array")
            .input("X", arr)
            .input("I", zeroIdx)
            .output("Out", in0)
            .build());
    parent.appendOp(Layers.fillBatchSizeLikeOp(in0, init, value, 0, 0));
    return memory(init);
  }

  /**
   * Sets the value that {@code exMem} (returned by {@link #memory}) will hold at the next step.
   */
  public void updateMemory(Variable exMem, Variable newMem) {
    lifecycle.require(ConstructState.IN, "update_memory");
    Variable memArray = memArrays.get(exMem.name());
    if (memArray == null) {
      throw BuildError.structural(
          "%s: update_memory(%s) does not refer to a value returned by memory()",
          helper.name, exMem.name());
    }
    memWrites.add(new MemoryWrite(newMem, memArray));
  }

  /** Collects each argument from every step; see {@link #results}. */
  public void output(Variable... outs) {
    lifecycle.require(ConstructState.IN, "output");
    Block parent = parentBlock();
    SequenceLayers seq = new SequenceLayers(program);
    for (Variable each : outs) {
      Variable outside =
          parent.createVar(
              Variable.named(helper.uniqueName(helper.name + "_output_array_" + each.name()))
                  .type(VarType.LOD_TENSOR_ARRAY)
                  .dataType(each.dataType()));
      seq.arrayWrite(each, stepIdx(), outside);
      outputArrays.add(outside);
    }
  }

  /**
   * Returns one tensor per call to {@link #output}, holding that value from every step with the
   * sequences in their original order. Only valid after the block is complete.
   */
  public ImmutableList<Variable> results() {
    lifecycle.require(ConstructState.AFTER, "results");
    if (outputs.isEmpty()) {
      throw BuildError.structural("%s has no output", helper.name);
    }
    return ImmutableList.copyOf(outputs);
  }

  /** Returns the only output. */
  public Variable result() {
    ImmutableList<Variable> results = results();
    if (results.size() != 1) {
      throw BuildError.structural("%s has %s outputs, not one", helper.name, results.size());
    }
    return results.get(0);
  }
}
