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

/**
 * Tracks the state of one construct and rejects transitions that the construct does not allow.
 *
 * <p>Once a construct's block has been abandoned because of an error the Lifecycle is poisoned, and
 * every further check throws.
 */
final class Lifecycle<S extends Enum<S>> {
  /** Names the construct in error messages. */
  private final String owner;

  private final ImmutableSetMultimap<S, S> transitions;
  private S state;
  private boolean abandoned;

  Lifecycle(String owner, S initial, ImmutableSetMultimap<S, S> transitions) {
    this.owner = owner;
    this.state = initial;
    this.transitions = transitions;
  }

  /** Returns a Lifecycle that starts BEFORE and allows only BEFORE -> IN -> AFTER. */
  static Lifecycle<ConstructState> standard(String owner) {
    return new Lifecycle<>(owner, ConstructState.BEFORE, ConstructState.TRANSITIONS);
  }

  S state() {
    return state;
  }

  boolean isAbandoned() {
    return abandoned;
  }

  /** Moves to {@code next}, which must be a permitted successor of the current state. */
  void moveTo(S next) {
    checkUsable();
    if (!transitions.containsEntry(state, next)) {
      throw BuildError.sequencing("%s cannot move from %s to %s", owner, state, next);
    }
    state = next;
  }

  /** Throws a SEQUENCING BuildError unless the current state is {@code expected}. */
  void require(S expected, String method) {
    checkUsable();
    if (state != expected) {
      throw BuildError.sequencing(
          "%s of %s can only be invoked in state %s (now %s)", method, owner, expected, state);
    }
  }

  /** Marks the construct as unusable after its block was rolled back. */
  void abandon() {
    abandoned = true;
  }

  private void checkUsable() {
    if (abandoned) {
      throw BuildError.sequencing("%s was abandoned after an earlier error", owner);
    }
  }
}
