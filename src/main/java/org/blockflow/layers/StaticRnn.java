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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * A recurrence over a fixed number of steps, taken from the leading dimension of its step inputs.
 * The step block sees one slice of each step input per iteration, and recurrent state is declared
 * with {@link #memory} and advanced with {@link #updateMemory}:
 *
 * <pre>
 *   StaticRnn rnn = new StaticRnn(program);
 *   rnn.step(() -> {
 *     Variable word = rnn.stepInput(sentence);
 *     Variable prev = rnn.memory(boot);
 *     Variable hidden = ...;
 *     rnn.updateMemory(prev, hidden);
 *     rnn.stepOutput(hidden);
 *   });
 *   Variable hiddens = rnn.result();
 * </pre>
 *
 * <p>The emitted {@code recurrent} operation carries three parallel lists, one entry per memory in
 * the order the memories were declared: {@code initial_states} (boot values), {@code ex_states}
 * (previous-step placeholders) and {@code states} (current-step values).
 */
public final class StaticRnn extends ControlConstruct {
  /** Maps the name of each previous-step placeholder to its link, in declaration order. */
  private final Map<String, MemoryLink> memories = new LinkedHashMap<>();

  /** Per-step slices of the step inputs, defined in the step block. */
  private final List<Variable> inputs = new ArrayList<>();

  /** Stacked step outputs, defined in the parent block. */
  private final List<Variable> outputs = new ArrayList<>();

  /** The number of steps, or -1 until the first step input is seen. */
  private long seqLen = -1;

  public StaticRnn(Program program) {
    this(program, null);
  }

  public StaticRnn(Program program, @Nullable String name) {
    super(program, "static_rnn", name);
  }

  /** Builds the step block. May only be called once. */
  public void step(BlockBody body) {
    buildBlock(body);
  }

  /** Returns the memories declared so far, in declaration order. */
  public ImmutableList<MemoryLink> memories() {
    return ImmutableList.copyOf(memories.values());
  }

  /**
   * Declares recurrent state whose value before the first step is {@code init}. Returns the
   * placeholder that holds the previous step's value; pass it to {@link #updateMemory}.
   */
  public Variable memory(Variable init) {
    requireIn("memory");
    Variable preMem =
        subBlock()
            .createVar(
                Variable.named(helper.uniqueName(helper.name + "@mem"))
                    .dataType(init.dataType())
                    .shape(init.shape()));
    memories.put(preMem.name(), new MemoryLink(init, preMem));
    return preMem;
  }

  /** Like {@link #memory(List, Variable, double, int, int)} with a zero boot value. */
  public Variable memory(List<Long> shape, Variable batchRef) {
    return memory(shape, batchRef, 0.0, 0, 1);
  }

  /**
   * Declares recurrent state with a constant boot value of the given shape, whose batch dimension
   * ({@code initBatchDimIdx}) is copied at run time from dimension {@code refBatchDimIdx} of
   * {@code batchRef}.
   */
  public Variable memory(
      List<Long> shape,
      Variable batchRef,
      double initValue,
      int initBatchDimIdx,
      int refBatchDimIdx) {
    requireIn("memory");
    Block parent = parentBlock();
    Variable boot =
        parent.createVar(
            Variable.named(helper.uniqueName(helper.name + "@memory_boot"))
                .dataType(dataTypeOf(batchRef))
                .shape(shape));
    parent.appendOp(
        Layers.fillBatchSizeLikeOp(batchRef, boot, initValue, refBatchDimIdx, initBatchDimIdx));
    return memory(boot);
  }

  /**
   * Returns the slice of {@code x} seen by the current step. Every step input must have the same
   * leading dimension, which is the number of steps. Passing the same variable again returns the
   * same slice.
   */
  public Variable stepInput(Variable x) {
    requireIn("step_input");
    if (x.shape().isEmpty()) {
      throw BuildError.shape("step input %s has no leading dimension", x.name());
    }
    long len = x.shape().get(0);
    if (seqLen < 0) {
      seqLen = len;
    } else if (seqLen != len) {
      throw BuildError.shape(
          "%s only takes step inputs of a fixed length %s, but %s has %s",
          helper.name, seqLen, x.name(), len);
    }
    Variable ipt = subBlock().findVar(x.name());
    if (ipt == null) {
      ipt =
          subBlock()
              .createVar(
                  Variable.named(x.name())
                      .like(x)
                      .shape(x.shape().subList(1, x.shape().size())));
    }
    if (!inputs.contains(ipt)) {
      inputs.add(ipt);
    }
    return ipt;
  }

  /** Collects {@code o} from every step into one output of shape {@code [steps] + o.shape}. */
  public void stepOutput(Variable o) {
    requireIn("step_output");
    Block block = subBlock();
    Variable tmp = helper.createTmpVariable(block, o.dataType(), o.shape());
    block.appendOp(memoryHelperOp(o, tmp));
    List<Long> shape = new ArrayList<>();
    shape.add(seqLen);
    shape.addAll(o.shape());
    outputs.add(
        parentBlock()
            .createVar(Variable.named(tmp.name()).dataType(o.dataType()).shape(shape)));
  }

  /** Calls {@link #stepOutput} for each argument. */
  public void output(Variable... outs) {
    for (Variable o : outs) {
      stepOutput(o);
    }
  }

  /**
   * Sets the value that {@code mem} (a placeholder returned by {@link #memory}) will hold in the
   * next step.
   */
  public void updateMemory(Variable mem, Variable var) {
    requireIn("update_memory");
    MemoryLink link = memories.get(mem.name());
    if (link == null || link.preMem() != mem) {
      throw BuildError.structural(
          "%s: update_memory(%s) does not refer to a placeholder returned by memory()",
          helper.name, mem.name());
    }
    link.setMem(var);
  }

  /** Returns the stacked step outputs. Only valid after the step block is complete. */
  public ImmutableList<Variable> results() {
    requireAfter("results");
    if (outputs.isEmpty()) {
      throw BuildError.structural("%s has no output", helper.name);
    }
    return ImmutableList.copyOf(outputs);
  }

  /** Returns the only stacked step output. */
  public Variable result() {
    ImmutableList<Variable> results = results();
    if (results.size() != 1) {
      throw BuildError.structural("%s has %s outputs, not one", helper.name, results.size());
    }
    return results.get(0);
  }

  private DataType dataTypeOf(Variable v) {
    DataType dataType = v.dataType();
    return (dataType != null) ? dataType : program.options().floatType();
  }

  private static Operation memoryHelperOp(Variable x, Variable out) {
    Operation.Builder op = Operation.builder("rnn_memory_helper").input("X", x).output("Out", out);
    DataType dataType = x.dataType();
    if (dataType != null) {
      op.attr("dtype", dataType.printName());
    }
    return op.build();
  }

  @Override
  Operation complete(Block rnnBlock, Block parent) {
    ImmutableList.Builder<Variable> bootMemories = ImmutableList.builder();
    ImmutableList.Builder<String> preMemories = ImmutableList.builder();
    ImmutableList.Builder<String> states = ImmutableList.builder();
    for (MemoryLink link : memories.values()) {
      Variable mem = link.mem();
      if (mem == null) {
        throw BuildError.structural(
            "%s: update_memory was never called for %s", helper.name, link.preMem().name());
      }
      Variable newMem = helper.createTmpVariable(rnnBlock, mem.dataType(), mem.shape());
      rnnBlock.appendOp(memoryHelperOp(mem, newMem));
      bootMemories.add(link.init());
      preMemories.add(link.preMem().name());
      states.add(newMem.name());
    }
    ImmutableSet.Builder<String> seeds = ImmutableSet.builder();
    inputs.forEach(v -> seeds.add(v.name()));
    seeds.addAll(memories.keySet());
    CaptureAnalyzer.Captures captures =
        CaptureAnalyzer.analyze(rnnBlock, seeds.build(), ImmutableSet.of());
    ImmutableList<Variable> parameters =
        CaptureAnalyzer.resolve(parent, captures.params, helper.name);
    ImmutableList<String> inputNames =
        inputs.stream().map(Variable::name).collect(ImmutableList.toImmutableList());
    ImmutableList<Variable> inlinks = CaptureAnalyzer.resolve(parent, inputNames, helper.name);
    Variable stepScopes = helper.createStepScopes(parent);
    return parent.appendOp(
        Operation.builder("recurrent")
            .input("inputs", inlinks)
            .input("initial_states", bootMemories.build())
            .input("parameters", parameters)
            .output("outputs", outputs)
            .output("step_scopes", stepScopes)
            .attr("ex_states", preMemories.build())
            .attr("states", states.build())
            .attr(Operation.SUB_BLOCK, rnnBlock)
            .build());
  }
}
