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
import java.util.List;
import org.blockflow.program.Program;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * Mutually exclusive branches, built from a chain of scalar {@link ConditionalBlock}s. Inside
 * {@link #scope}, the k-th {@link #caseOf} runs its body only if its own predicate holds and every
 * earlier predicate was false; {@link #defaultCase} runs only if all of them were false:
 *
 * <pre>
 *   Switch sw = new Switch(program);
 *   sw.scope(() -> {
 *     sw.caseOf(isSmall, () -> layers.assign(small, result));
 *     sw.caseOf(isMedium, () -> layers.assign(medium, result));
 *     sw.defaultCase(() -> layers.assign(large, result));
 *   });
 * </pre>
 *
 * The guards are computed in the block that encloses the switch: after k cases the running
 * condition {@code NOT p1 AND ... AND NOT pk} is kept, and the next case's guard is that condition
 * AND its own predicate.
 */
public final class Switch {
  private final Program program;
  private final Layers layers;
  private final String name;
  private final Lifecycle<ConstructState> lifecycle;

  /** Element k is {@code NOT p1 AND ... AND NOT p(k+1)}. */
  private final List<Variable> preNotConditions = new ArrayList<>();

  /** The guard of each branch, in the order the branches were added. */
  private final List<Variable> guards = new ArrayList<>();

  public Switch(Program program) {
    this(program, null);
  }

  public Switch(Program program, @Nullable String name) {
    this.program = program;
    this.layers = new Layers(program);
    this.name = (name != null) ? name : program.names().generate("switch");
    this.lifecycle = Lifecycle.standard(this.name);
  }

  public String name() {
    return name;
  }

  public ConstructState state() {
    return lifecycle.state();
  }

  /**
   * Returns the effective guard of each branch built so far (including the default, if any), in
   * order.
   */
  public ImmutableList<Variable> guards() {
    return ImmutableList.copyOf(guards);
  }

  /**
   * Opens the switch; {@code body} should call {@link #caseOf} and {@link #defaultCase}. If {@code
   * body} throws, the guards and branches added so far are removed again.
   */
  public void scope(BlockBody body) {
    lifecycle.moveTo(ConstructState.IN);
    Program.Checkpoint start = program.checkpoint();
    boolean completed = false;
    try {
      body.build();
      completed = true;
    } finally {
      if (!completed) {
        lifecycle.abandon();
        program.rollbackTo(start);
      }
    }
    lifecycle.moveTo(ConstructState.AFTER);
  }

  /** Adds a branch that runs {@code body} if {@code condition} holds and no earlier case did. */
  public void caseOf(Variable condition, BlockBody body) {
    lifecycle.require(ConstructState.IN, "case");
    Variable guard;
    if (preNotConditions.isEmpty()) {
      guard = condition;
      preNotConditions.add(layers.logicalNot(condition));
    } else {
      Variable preNot = preNotConditions.get(preNotConditions.size() - 1);
      preNotConditions.add(layers.logicalAnd(preNot, layers.logicalNot(condition)));
      guard = layers.logicalAnd(preNot, condition);
    }
    addBranch(guard, body);
  }

  /** Adds a branch that runs {@code body} if none of the cases did. */
  public void defaultCase(BlockBody body) {
    lifecycle.require(ConstructState.IN, "default");
    if (preNotConditions.isEmpty()) {
      throw BuildError.sequencing("%s: there should be at least one case before default", name);
    }
    addBranch(preNotConditions.get(preNotConditions.size() - 1), body);
  }

  private void addBranch(Variable guard, BlockBody body) {
    guards.add(guard);
    new ConditionalBlock(program, ImmutableList.of(guard), true).block(body);
  }
}
