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

package org.blockflow.seq;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A growable, index-addressable list of LodTensors, used as loop-carried storage. */
public final class TensorArray {
  private final List<@Nullable LodTensor> elements = new ArrayList<>();

  /** Stores {@code value} at {@code i}, creating any missing slots up to {@code i}. */
  public void write(int i, LodTensor value) {
    Preconditions.checkArgument(i >= 0, "negative index %s", i);
    while (elements.size() <= i) {
      elements.add(null);
    }
    elements.set(i, value);
  }

  /** Returns the element at {@code i}, which must have been written. */
  public LodTensor read(int i) {
    Preconditions.checkElementIndex(i, elements.size());
    LodTensor result = elements.get(i);
    Preconditions.checkArgument(result != null, "element %s has not been written", i);
    return result;
  }

  public int length() {
    return elements.size();
  }
}
