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

/**
 * Renders a Program as readable text, one Block at a time, for debugging and tests. For example
 *
 * <pre>
 * block 0:
 *   i_0:int64[1]
 *   fill_constant() -> (Out=[i_0]) {value=0.0, dtype="int64", shape=[1], force_cpu=true}
 * block 1 (parent 0):
 *   ...
 * </pre>
 */
public final class ProgramPrinter {

  // Static methods only
  private ProgramPrinter() {}

  /** Returns the text of every Block in the Program, in index order. */
  public static String print(Program program) {
    StringBuilder sb = new StringBuilder();
    for (Block block : program.blocks()) {
      printBlock(sb, block);
    }
    return sb.toString();
  }

  /** Returns the text of a single Block. */
  public static String print(Block block) {
    StringBuilder sb = new StringBuilder();
    printBlock(sb, block);
    return sb.toString();
  }

  private static void printBlock(StringBuilder sb, Block block) {
    sb.append("block ").append(block.index());
    if (block.parentIndex() >= 0) {
      sb.append(" (parent ").append(block.parentIndex()).append(')');
    }
    sb.append(":\n");
    for (Variable var : block.vars().values()) {
      sb.append("  ").append(var).append('\n');
    }
    for (Operation op : block.ops()) {
      sb.append("  ").append(op).append('\n');
    }
  }
}
