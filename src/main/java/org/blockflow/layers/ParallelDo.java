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
import java.util.List;
import org.blockflow.program.Block;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * A block to be replicated across a list of places (devices). Inputs read with {@link #readInput}
 * are split among the replicas; every other variable the block captures becomes a parameter
 * broadcast to all of them. Outputs written with {@link #writeOutput} are gathered after the
 * replicas finish.
 *
 * <p>The emitted {@code parallel_do} operation carries one step scope per place.
 */
public final class ParallelDo extends ControlConstruct {
  private final ImmutableList<String> places;
  private final boolean useNccl;
  private final List<Variable> inputs = new ArrayList<>();
  private final List<Variable> outputs = new ArrayList<>();

  public ParallelDo(Program program, List<String> places) {
    this(program, places, program.options().useNccl(), null);
  }

  public ParallelDo(
      Program program, List<String> places, boolean useNccl, @Nullable String name) {
    super(program, "parallel_do", name);
    if (places.isEmpty()) {
      throw BuildError.typeError("%s needs at least one place", helper.name);
    }
    this.places = ImmutableList.copyOf(places);
    this.useNccl = useNccl;
  }

  public ImmutableList<String> places() {
    return places;
  }

  /** Builds the replicated block. May only be called once. */
  public void block(BlockBody body) {
    buildBlock(body);
  }

  /** Marks {@code var} as an input to be split among the replicas, and returns it. */
  public Variable readInput(Variable var) {
    requireIn("read_input");
    inputs.add(var);
    return var;
  }

  /** Marks {@code var} as an output to be gathered from the replicas. */
  public void writeOutput(Variable var) {
    requireIn("write_output");
    outputs.add(var);
  }

  /** Returns the gathered outputs. Only valid after the block is complete. */
  public ImmutableList<Variable> results() {
    requireAfter("results");
    if (outputs.isEmpty()) {
      throw BuildError.structural("%s has no output", helper.name);
    }
    return ImmutableList.copyOf(outputs);
  }

  @Override
  Operation complete(Block replicated, Block parent) {
    for (int i = 0; i < outputs.size(); i++) {
      Variable o = outputs.get(i);
      Variable outside = parent.findVarRecursive(o.name());
      if (outside == null) {
        outside = parent.createVar(Variable.named(o.name()).like(o));
      }
      outputs.set(i, outside);
    }
    ImmutableList<String> inputNames =
        inputs.stream().map(Variable::name).collect(ImmutableList.toImmutableList());
    ImmutableList<Variable> resolvedInputs =
        CaptureAnalyzer.resolve(parent, inputNames, helper.name);
    CaptureAnalyzer.Captures captures =
        CaptureAnalyzer.analyze(replicated, ImmutableSet.copyOf(inputNames), ImmutableSet.of());
    ImmutableList<Variable> parameters =
        CaptureAnalyzer.resolve(parent, captures.params, helper.name);
    ImmutableList.Builder<Variable> stepScopes = ImmutableList.builder();
    for (int i = 0; i < places.size(); i++) {
      stepScopes.add(helper.createStepScopes(parent));
    }
    return parent.appendOp(
        Operation.builder("parallel_do")
            .input("inputs", resolvedInputs)
            .input("parameters", parameters)
            .output("outputs", outputs)
            .output("parallel_scopes", stepScopes.build())
            .attr(Operation.SUB_BLOCK, replicated)
            .attr("use_nccl", useNccl)
            .attr("places", places)
            .build());
  }
}
