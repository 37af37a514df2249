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

import org.blockflow.program.Block;
import org.blockflow.program.Operation;
import org.blockflow.program.Program;
import org.blockflow.program.Variable;

/** Stand-ins for operator-library layers that the constructs treat as opaque. */
final class OpsForTesting {

  // Static methods only
  private OpsForTesting() {}

  /** Appends {@code out = elementwise_add(x, y)} to the current block; out is shaped like x. */
  static Variable add(Program program, Variable x, Variable y) {
    Block block = program.current();
    Variable out =
        block.createVar(
            Variable.named(program.names().generate("add.tmp"))
                .dataType(x.dataType())
                .shape(x.shape()));
    block.appendOp(
        Operation.builder("elementwise_add")
            .input("X", x)
            .input("Y", y)
            .output("Out", out)
            .build());
    return out;
  }

  /** Returns the last operation of {@code block}. */
  static Operation lastOp(Block block) {
    return block.ops().get(block.ops().size() - 1);
  }
}
