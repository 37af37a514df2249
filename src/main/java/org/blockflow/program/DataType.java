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

import java.util.Locale;

/** The element type of a tensor-like Variable. */
public enum DataType {
  BOOL,
  INT32,
  INT64,
  FP32,
  FP64;

  /** Returns the lower-case name used when printing a program, e.g. "fp32". */
  public String printName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
