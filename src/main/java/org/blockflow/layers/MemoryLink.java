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

import org.blockflow.program.Variable;
import org.jspecify.annotations.Nullable;

/**
 * Threads one piece of recurrent state through the iterations of a {@link StaticRnn}: the boot
 * value used before the first step, the placeholder that holds the previous step's value inside
 * the block, and the value computed by the current step.
 */
public final class MemoryLink {
  private final Variable init;
  private final Variable preMem;
  private @Nullable Variable mem;

  MemoryLink(Variable init, Variable preMem) {
    this.init = init;
    this.preMem = preMem;
  }

  /** The value of the state before the first step. */
  public Variable init() {
    return init;
  }

  /** The placeholder that holds the previous step's value. */
  public Variable preMem() {
    return preMem;
  }

  /** The value computed by the current step, or null if it has not been set. */
  public @Nullable Variable mem() {
    return mem;
  }

  void setMem(Variable mem) {
    this.mem = mem;
  }
}
