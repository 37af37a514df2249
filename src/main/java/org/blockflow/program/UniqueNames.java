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

import java.util.HashMap;
import java.util.Map;

/**
 * Generates names that are unique within one naming context, by appending a per-prefix counter to
 * a human-readable prefix ({@code "tmp"} becomes {@code "tmp_0"}, {@code "tmp_1"}, ...).
 *
 * <p>Each {@link Program} has its own instance, so that building the same program twice produces
 * the same names.
 */
public final class UniqueNames {
  private final Map<String, Integer> counters = new HashMap<>();

  /** Returns a name beginning with {@code prefix} that has not been returned before. */
  public String generate(String prefix) {
    int next = counters.merge(prefix, 1, Integer::sum) - 1;
    return prefix + "_" + next;
  }

  /** Forgets all previously generated names. */
  public void reset() {
    counters.clear();
  }
}
