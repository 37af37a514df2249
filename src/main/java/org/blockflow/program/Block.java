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

package org.blockflow.program;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A Block is one scope of a {@link Program}: an ordered list of Operations and a map from name to
 * Variable. Every Block except the global block has a parent; names defined in a Block are visible
 * from the Block itself and from all of its descendants, but never from siblings.
 *
 * <p>Blocks are owned by their Program and addressed by index, so a Block never holds a direct
 * reference to its parent.
 */
public final class Block {
  private final Program program;
  private final int index;

  /** The index of the parent Block, or -1 for the global block. */
  private final int parentIndex;

  private final List<Operation> ops = new ArrayList<>();

  /** Insertion-ordered, so that printing and rollback see variables in creation order. */
  private final Map<String, Variable> vars = new LinkedHashMap<>();

  Block(Program program, int index, int parentIndex) {
    this.program = program;
    this.index = index;
    this.parentIndex = parentIndex;
  }

  public Program program() {
    return program;
  }

  public int index() {
    return index;
  }

  public int parentIndex() {
    return parentIndex;
  }

  /** Returns the parent of this Block, or null if this is the global block. */
  public @Nullable Block parent() {
    return (parentIndex < 0) ? null : program.block(parentIndex);
  }

  /** Returns an unmodifiable view of this Block's operations, in the order they were appended. */
  public List<Operation> ops() {
    return Collections.unmodifiableList(ops);
  }

  /** Returns an unmodifiable view of this Block's variables, in the order they were created. */
  public Map<String, Variable> vars() {
    return Collections.unmodifiableMap(vars);
  }

  /**
   * Creates a new Variable in this Block. Throws an IllegalArgumentException if this Block already
   * has a Variable with the same name.
   */
  @CanIgnoreReturnValue
  public Variable createVar(Variable.Builder builder) {
    Variable result = builder.build(index);
    Variable prev = vars.putIfAbsent(result.name(), result);
    Preconditions.checkArgument(
        prev == null, "Variable '%s' already defined in block %s", result.name(), index);
    return result;
  }

  public boolean hasVar(String name) {
    return vars.containsKey(name);
  }

  /** Returns the Variable with the given name in this Block (ignoring ancestors), or null. */
  public @Nullable Variable findVar(String name) {
    return vars.get(name);
  }

  /**
   * Returns the Variable with the given name from this Block or the nearest ancestor that defines
   * it, or null if there is none.
   */
  public @Nullable Variable findVarRecursive(String name) {
    for (Block block = this; block != null; block = block.parent()) {
      Variable result = block.vars.get(name);
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  /** Returns the Variable with the given name in this Block; it must exist. */
  public Variable var(String name) {
    Variable result = vars.get(name);
    Preconditions.checkArgument(result != null, "No variable '%s' in block %s", name, index);
    return result;
  }

  /** Appends an Operation to this Block. */
  @CanIgnoreReturnValue
  public Operation appendOp(Operation op) {
    ops.add(op);
    return op;
  }

  /** Returns true if {@code other} is this Block or one of its descendants. */
  public boolean encloses(Block other) {
    for (Block block = other; block != null; block = block.parent()) {
      if (block == this) {
        return true;
      }
    }
    return false;
  }

  int numOps() {
    return ops.size();
  }

  int numVars() {
    return vars.size();
  }

  /** Discards any operations and variables added after the given counts were recorded. */
  void truncate(int numOps, int numVars) {
    assert numOps <= ops.size() && numVars <= vars.size();
    ops.subList(numOps, ops.size()).clear();
    Iterator<Variable> it = vars.values().iterator();
    for (int i = 0; it.hasNext(); i++) {
      it.next();
      if (i >= numVars) {
        it.remove();
      }
    }
  }

  @Override
  public String toString() {
    return "block " + index;
  }
}
