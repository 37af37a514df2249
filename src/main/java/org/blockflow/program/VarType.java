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

/** The kind of value a Variable holds at execution time. */
public enum VarType {
  /** A tensor, possibly carrying one or more levels of variable-length nesting. */
  LOD_TENSOR,

  /** An index-addressable sequence of tensors, used as loop-carried storage. */
  LOD_TENSOR_ARRAY,

  /** The (index, length) ordering produced by a {@code lod_rank_table} operation. */
  LOD_RANK_TABLE,

  /**
   * A per-invocation runtime state container. Step scopes are referenced by composite operations
   * but never populated during construction.
   */
  STEP_SCOPES
}
