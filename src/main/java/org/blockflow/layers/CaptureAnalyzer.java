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
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import org.blockflow.program.Block;
import org.blockflow.program.Operation;
import org.blockflow.program.Variable;

/**
 * Determines the interface of a completed sub-block: the names it reads but does not produce (its
 * <i>captures</i>, which must be supplied by an enclosing block) and the names it produces.
 *
 * <p>Operations are visited in order. An input is a capture if no earlier operation produced it and
 * it was not one of the seed names; every output is added to the produced set. Composite operations
 * nested in the block already list their own captures as inputs, so they need no special treatment.
 */
final class CaptureAnalyzer {

  // Static methods only
  private CaptureAnalyzer() {}

  /** The result of analyzing one block. */
  static final class Captures {
    /** Captured names, in the order they were first read. */
    final ImmutableList<String> params;

    /** The seed names followed by every name produced in the block, in order of production. */
    final ImmutableSet<String> produced;

    private Captures(ImmutableList<String> params, ImmutableSet<String> produced) {
      this.params = params;
      this.produced = produced;
    }
  }

  /**
   * Analyzes {@code block}.
   *
   * @param seeds names that are defined locally before the first operation runs, e.g. loop inputs
   *     and memories
   * @param excluded names that are wired explicitly by the composite operation and so are never
   *     reported as captures
   */
  static Captures analyze(Block block, Collection<String> seeds, Collection<String> excluded) {
    Set<String> produced = new LinkedHashSet<>(seeds);
    Set<String> params = new LinkedHashSet<>();
    for (Operation op : block.ops()) {
      op.inputNames()
          .filter(name -> !produced.contains(name) && !excluded.contains(name))
          .forEach(params::add);
      op.outputNames().forEach(produced::add);
    }
    return new Captures(ImmutableList.copyOf(params), ImmutableSet.copyOf(produced));
  }

  /**
   * Resolves each name against {@code parent} and its ancestors. Throws a STRUCTURAL BuildError if
   * any name is not defined by one of them, i.e. if a reference escaped its defining scope.
   */
  static ImmutableList<Variable> resolve(Block parent, Collection<String> names, String owner) {
    ImmutableList.Builder<Variable> result = ImmutableList.builder();
    for (String name : names) {
      Variable var = parent.findVarRecursive(name);
      if (var == null) {
        throw BuildError.structural(
            "'%s' is referenced in %s but not defined in any enclosing block", name, owner);
      }
      result.add(var);
    }
    return result.build();
  }

  /**
   * Returns the Variables visible from {@code parent} whose names are in {@code produced}, in the
   * order of {@code produced}. A name produced inside a block that is also visible outside it is
   * an update the enclosing block should see.
   */
  static ImmutableList<Variable> visibleOutputs(Block parent, Collection<String> produced) {
    ImmutableList.Builder<Variable> result = ImmutableList.builder();
    for (String name : produced) {
      Variable var = parent.findVarRecursive(name);
      if (var != null) {
        result.add(var);
      }
    }
    return result.build();
  }
}
