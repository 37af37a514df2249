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
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A Program is a rooted tree of {@link Block}s. The Blocks are kept in an arena and addressed by
 * index; block 0 is the global block.
 *
 * <p>At any time exactly one Block is <i>current</i>, i.e. the Block into which new operations are
 * appended. {@link #enterScope} creates a child of the current Block and makes it current; {@link
 * #exitScope} restores its parent. Scopes must be exited in the reverse of the order they were
 * entered.
 *
 * <p>Program construction is single-threaded; a Program must not be shared between threads while
 * it is being built.
 */
public final class Program {
  private static final Logger logger = Logger.getLogger(Program.class.getName());

  private final List<Block> blocks = new ArrayList<>();
  private final BuildOptions options;
  private final UniqueNames names;

  /** Scopes that have been entered but not yet exited, innermost first. */
  private final Deque<ScopeMark> openScopes = new ArrayDeque<>();

  private int currentIndex;

  /** Creates an empty Program with the default options and a fresh naming service. */
  public Program() {
    this(BuildOptions.DEFAULT, new UniqueNames());
  }

  public Program(BuildOptions options, UniqueNames names) {
    this.options = options;
    this.names = names;
    blocks.add(new Block(this, 0, -1));
  }

  public BuildOptions options() {
    return options;
  }

  /** The naming service used to generate variable names for this Program. */
  public UniqueNames names() {
    return names;
  }

  public Block globalBlock() {
    return blocks.get(0);
  }

  /** Returns the Block into which new operations should be appended. */
  public Block current() {
    return blocks.get(currentIndex);
  }

  public Block block(int index) {
    return blocks.get(index);
  }

  public int numBlocks() {
    return blocks.size();
  }

  public ImmutableList<Block> blocks() {
    return ImmutableList.copyOf(blocks);
  }

  /** Returns the number of scopes that have been entered but not exited. */
  public int scopeDepth() {
    return openScopes.size();
  }

  /**
   * Records how many Blocks there are and how many operations and variables each holds, so that
   * everything added afterwards can be discarded with {@link #rollbackTo}.
   */
  public Checkpoint checkpoint() {
    int[] numOps = new int[blocks.size()];
    int[] numVars = new int[blocks.size()];
    for (int i = 0; i < numOps.length; i++) {
      numOps[i] = blocks.get(i).numOps();
      numVars[i] = blocks.get(i).numVars();
    }
    return new Checkpoint(openScopes.size(), numOps, numVars);
  }

  /**
   * Removes every Block created since {@code checkpoint} was taken and truncates the others to the
   * operations and variables they held then. Scopes entered after the checkpoint must already have
   * been exited.
   */
  public void rollbackTo(Checkpoint checkpoint) {
    Preconditions.checkState(
        openScopes.size() == checkpoint.scopeDepth,
        "Cannot roll back past a scope that is still open");
    truncate(checkpoint);
    logger.log(Level.FINE, "Rolled back to {0} blocks", checkpoint.numOps.length);
  }

  private void truncate(Checkpoint checkpoint) {
    int numBlocks = checkpoint.numOps.length;
    blocks.subList(numBlocks, blocks.size()).clear();
    for (int i = 0; i < numBlocks; i++) {
      blocks.get(i).truncate(checkpoint.numOps[i], checkpoint.numVars[i]);
    }
  }

  /**
   * Creates a new Block as a child of the current Block and makes it current. The result must be
   * passed to {@link #exitScope} to restore the previous Block.
   */
  public ScopeMark enterScope() {
    Checkpoint checkpoint = checkpoint();
    Block block = new Block(this, blocks.size(), currentIndex);
    blocks.add(block);
    ScopeMark mark = new ScopeMark(block.index(), checkpoint);
    openScopes.push(mark);
    currentIndex = block.index();
    return mark;
  }

  /**
   * Exits the innermost scope, making its parent current again.
   *
   * <p>If {@code committed} is false, the scope is rolled back: its Block (and any Blocks created
   * inside it) are removed from the arena, and every other Block's operations and variables are
   * truncated to what they were when the scope was entered.
   */
  public void exitScope(ScopeMark mark, boolean committed) {
    Preconditions.checkState(
        openScopes.peek() == mark, "Scopes must be exited in the reverse order of entry");
    openScopes.pop();
    Block block = blocks.get(mark.blockIndex);
    currentIndex = block.parentIndex();
    if (!committed) {
      truncate(mark.checkpoint);
      logger.log(Level.FINE, "Rolled back {0}", block);
    }
  }

  /** The size of each Block of a Program at some point during construction. */
  public static final class Checkpoint {
    private final int scopeDepth;
    private final int[] numOps;
    private final int[] numVars;

    private Checkpoint(int scopeDepth, int[] numOps, int[] numVars) {
      this.scopeDepth = scopeDepth;
      this.numOps = numOps;
      this.numVars = numVars;
    }
  }

  /** Records the state of a Program when a scope was entered. */
  public static final class ScopeMark {
    private final int blockIndex;
    private final Checkpoint checkpoint;

    private ScopeMark(int blockIndex, Checkpoint checkpoint) {
      this.blockIndex = blockIndex;
      this.checkpoint = checkpoint;
    }

    /** The index of the Block that was created when this scope was entered. */
    public int blockIndex() {
      return blockIndex;
    }
  }
}
