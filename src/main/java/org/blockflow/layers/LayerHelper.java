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

import java.util.List;
import org.blockflow.program.Block;
import org.blockflow.program.DataType;
import org.blockflow.program.Program;
import org.blockflow.program.VarType;
import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * A LayerHelper names the variables created by one layer or construct. Each instance takes a unique
 * name from the Program's naming service (e.g. "while_0"), and the variables it creates are named
 * after it (e.g. "while_0.tmp_0").
 */
final class LayerHelper {
  final Program program;

  /** The unique name of the layer. */
  final String name;

  LayerHelper(Program program, String layerType) {
    this(program, layerType, null);
  }

  /** If {@code name} is non-null it is used as given; otherwise a unique name is generated. */
  LayerHelper(Program program, String layerType, @Nullable String name) {
    this.program = program;
    this.name = (name != null) ? name : program.names().generate(layerType);
  }

  /** Returns a new unique name beginning with {@code prefix}. */
  String uniqueName(String prefix) {
    return program.names().generate(prefix);
  }

  /** Creates a temporary tensor in {@code block}. */
  Variable createTmpVariable(Block block, @Nullable DataType dataType) {
    return block.createVar(Variable.named(uniqueName(name + ".tmp")).dataType(dataType));
  }

  /** Creates a temporary tensor with a known shape in {@code block}. */
  Variable createTmpVariable(Block block, @Nullable DataType dataType, List<Long> shape) {
    return block.createVar(
        Variable.named(uniqueName(name + ".tmp")).dataType(dataType).shape(shape));
  }

  /** Creates the step-scope placeholder for a composite operation in {@code block}. */
  Variable createStepScopes(Block block) {
    return block.createVar(
        Variable.named(uniqueName(name + ".step_scopes")).type(VarType.STEP_SCOPES));
  }
}
