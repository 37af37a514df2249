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
import java.util.logging.Logger;
import org.blockflow.program.Block;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.jspecify.annotations.Nullable;

/**
 * The common lowering pattern of the control constructs that own a single block: enter a scope,
 * let the caller populate it, then analyze the completed block and append one composite operation
 * to the parent block.
 *
 * <p>If the caller's code (or the completion logic) throws, the scope is rolled back, completion is
 * not run, and the construct is left unusable.
 */
abstract class ControlConstruct {
  private static final Logger logger = Logger.getLogger(ControlConstruct.class.getName());

  final Program program;
  final LayerHelper helper;
  final Lifecycle<ConstructState> lifecycle;

  /** The block created by {@link #buildBlock}; null until then. */
  private @Nullable Block subBlock;

  ControlConstruct(Program program, String layerType, @Nullable String name) {
    this.program = program;
    this.helper = new LayerHelper(program, layerType, name);
    this.lifecycle = Lifecycle.standard(helper.name);
  }

  /** Returns the unique name of this construct, e.g. "while_0". */
  public String name() {
    return helper.name;
  }

  public ConstructState state() {
    return lifecycle.state();
  }

  /**
   * Creates this construct's block, calls {@code body} to populate it, and then calls {@link
   * #complete} to emit the composite operation. May only be called once.
   */
  final void buildBlock(BlockBody body) {
    lifecycle.moveTo(ConstructState.IN);
    boolean completed = false;
    try (ScopeGuard scope = ScopeGuard.enter(program)) {
      Block block = scope.block();
      subBlock = block;
      body.build();
      lifecycle.moveTo(ConstructState.AFTER);
      Operation op = complete(block, parentBlock());
      scope.commit();
      completed = true;
      logger.fine(() -> String.format("%s: %s", helper.name, op));
    } finally {
      if (!completed) {
        lifecycle.abandon();
      }
    }
  }

  /**
   * Called with this construct's block still current, after the caller has populated it. Should
   * append exactly one composite operation to {@code parent} and return it.
   */
  abstract Operation complete(Block subBlock, Block parent);

  /** Throws a SEQUENCING BuildError unless this construct's block is being populated. */
  final void requireIn(String method) {
    lifecycle.require(ConstructState.IN, method);
  }

  /** Throws a SEQUENCING BuildError unless this construct's block has been completed. */
  final void requireAfter(String method) {
    lifecycle.require(ConstructState.AFTER, method);
  }

  /** The block created for this construct. Only valid once {@link #buildBlock} has been called. */
  final Block subBlock() {
    Preconditions.checkState(subBlock != null);
    return subBlock;
  }

  /** The block that encloses this construct's block, and receives its composite operation. */
  final Block parentBlock() {
    Block parent = subBlock().parent();
    Preconditions.checkState(parent != null);
    return parent;
  }
}
