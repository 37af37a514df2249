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
import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Program;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * Row-wise if/else over a batch. A boolean mask splits the rows of each input into a "true" part
 * and a "false" part; each part is processed by its own {@link ConditionalBlock}, and the branch
 * outputs are merged back into the original row order:
 *
 * <pre>
 *   IfElse ie = new IfElse(program, mask);
 *   ie.trueBlock(() -> ie.output(layers.assign(ie.input(x))));
 *   ie.falseBlock(() -> ie.output(layers.fillConstant(...)));
 *   ImmutableList&lt;Variable&gt; merged = ie.results();
 * </pre>
 *
 * <p>Each outer variable passed to {@link #input} is split only once; later reads (from either
 * branch) reuse the same pair of halves.
 */
public final class IfElse {

  /** Where construction currently is relative to the two branches. */
  public enum Status {
    OUTSIDE_BLOCKS,
    IN_TRUE_BLOCK,
    IN_FALSE_BLOCK
  }

  private static final ImmutableSetMultimap<Status, Status> TRANSITIONS =
      ImmutableSetMultimap.of(
          Status.OUTSIDE_BLOCKS, Status.IN_TRUE_BLOCK,
          Status.OUTSIDE_BLOCKS, Status.IN_FALSE_BLOCK,
          Status.IN_TRUE_BLOCK, Status.OUTSIDE_BLOCKS,
          Status.IN_FALSE_BLOCK, Status.OUTSIDE_BLOCKS);

  private final Program program;
  private final LayerHelper helper;
  private final Variable cond;
  private final Lifecycle<Status> lifecycle;
  private final ConditionalBlock trueBranch;
  private final ConditionalBlock falseBranch;

  /** Maps the name of each outer variable read by {@link #input} to its two halves. */
  private final Map<String, SequenceLayers.Split> inputTable = new LinkedHashMap<>();

  private final List<Variable> trueOutputs = new ArrayList<>();
  private final List<Variable> falseOutputs = new ArrayList<>();

  /** Taken when the first branch is started; a failed branch rolls back to it. */
  private Program.@Nullable Checkpoint start;

  /** Set by the first call to {@link #results}. */
  private @Nullable ImmutableList<Variable> results;

  public IfElse(Program program, Variable cond) {
    this(program, cond, null);
  }

  public IfElse(Program program, Variable cond, @Nullable String name) {
    if (cond.dataType() != DataType.BOOL) {
      throw BuildError.typeError("cond %s must be a bool variable", cond.name());
    }
    this.program = program;
    this.helper = new LayerHelper(program, "ifelse", name);
    this.cond = cond;
    this.lifecycle = new Lifecycle<>(helper.name, Status.OUTSIDE_BLOCKS, TRANSITIONS);
    this.trueBranch = new ConditionalBlock(program, ImmutableList.of(cond), false);
    this.falseBranch = new ConditionalBlock(program, ImmutableList.of(cond), false);
  }

  public String name() {
    return helper.name;
  }

  public Status status() {
    return lifecycle.state();
  }

  /** Builds the branch that processes the rows whose mask entry is true. */
  public void trueBlock(BlockBody body) {
    branch(true, body);
  }

  /** Builds the branch that processes the rows whose mask entry is false. */
  public void falseBlock(BlockBody body) {
    branch(false, body);
  }

  private void branch(boolean isTrue, BlockBody body) {
    lifecycle.require(Status.OUTSIDE_BLOCKS, isTrue ? "trueBlock" : "falseBlock");
    lifecycle.moveTo(isTrue ? Status.IN_TRUE_BLOCK : Status.IN_FALSE_BLOCK);
    if (start == null) {
      start = program.checkpoint();
    }
    Program.Checkpoint checkpoint = start;
    List<Variable> outputs = isTrue ? trueOutputs : falseOutputs;
    boolean completed = false;
    try {
      (isTrue ? trueBranch : falseBranch)
          .block(
              () -> {
                body.build();
                if (outputs.isEmpty()) {
                  throw BuildError.structural("Must set output inside block of %s", helper.name);
                }
              });
      completed = true;
    } finally {
      if (!completed) {
        lifecycle.abandon();
        program.rollbackTo(checkpoint);
      }
    }
    lifecycle.moveTo(Status.OUTSIDE_BLOCKS);
  }

  /** Returns the branch currently being built; throws if neither is. */
  private ConditionalBlock currentBranch(String method) {
    Status status = lifecycle.state();
    if (lifecycle.isAbandoned() || status == Status.OUTSIDE_BLOCKS) {
      throw BuildError.sequencing(
          "%s of %s can only be invoked inside the true or false block", method, helper.name);
    }
    return (status == Status.IN_TRUE_BLOCK) ? trueBranch : falseBranch;
  }

  /** Returns the half of {@code x} that belongs to the branch currently being built. */
  public Variable input(Variable x) {
    ConditionalBlock branch = currentBranch("input");
    SequenceLayers.Split split = inputTable.get(x.name());
    if (split == null) {
      split = new SequenceLayers(program).into(branch.parentBlock()).splitLodTensor(x, cond, 0);
      inputTable.put(x.name(), split);
    }
    return (branch == trueBranch) ? split.outTrue() : split.outFalse();
  }

  /**
   * Declares values computed by the current branch as its outputs. Each is copied to a new
   * variable outside the branch.
   */
  public void output(Variable... outs) {
    ConditionalBlock branch = currentBranch("output");
    Block parent = branch.parentBlock();
    List<Variable> table = (branch == trueBranch) ? trueOutputs : falseOutputs;
    Layers layers = new Layers(program);
    for (Variable out : outs) {
      Variable outside =
          parent.createVar(
              Variable.named(helper.uniqueName(helper.name + "_output"))
                  .dataType(out.dataType()));
      layers.assign(out, outside);
      table.add(outside);
    }
  }

  /**
   * Returns the combined outputs. If only one branch declared outputs they are returned as they
   * are; otherwise each pair of corresponding outputs is merged back into the original row order.
   */
  public ImmutableList<Variable> results() {
    lifecycle.require(Status.OUTSIDE_BLOCKS, "results");
    if (results != null) {
      return results;
    }
    int trueLen = trueOutputs.size();
    int falseLen = falseOutputs.size();
    if (trueLen == 0 && falseLen == 0) {
      throw BuildError.structural(
          "Must invoke trueBlock or falseBlock of %s before results()", helper.name);
    } else if (trueLen == 0 || falseLen == 0) {
      results = ImmutableList.copyOf(trueLen != 0 ? trueOutputs : falseOutputs);
    } else if (trueLen != falseLen) {
      throw BuildError.structural(
          "%s: true block has %s outputs but false block has %s",
          helper.name, trueLen, falseLen);
    } else {
      SequenceLayers seq = new SequenceLayers(program);
      ImmutableList.Builder<Variable> merged = ImmutableList.builder();
      for (int i = 0; i < trueLen; i++) {
        merged.add(seq.mergeLodTensor(trueOutputs.get(i), falseOutputs.get(i), cond, cond, 0));
      }
      results = merged.build();
    }
    return results;
  }
}
