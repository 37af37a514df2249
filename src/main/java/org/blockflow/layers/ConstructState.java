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

import com.google.common.collect.ImmutableSetMultimap;

/** The lifecycle of a control construct relative to its block. */
public enum ConstructState {
  /** The construct has been created but its block has not been entered. */
  BEFORE,

  /** The construct's block is being populated. */
  IN,

  /** The construct's block has been closed and its composite operation emitted. */
  AFTER;

  /** BEFORE -> IN -> AFTER; nothing else. */
  static final ImmutableSetMultimap<ConstructState, ConstructState> TRANSITIONS =
      ImmutableSetMultimap.of(BEFORE, IN, IN, AFTER);
}
