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

import com.google.common.base.Ascii;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Options that affect the operations emitted while building a {@link Program}. */
public final class BuildOptions {

  /** The options used when none are specified. */
  public static final BuildOptions DEFAULT = builder().build();

  /** If true, comparison results and loop counters are placed on the host CPU. */
  private final boolean forceCpu;

  /** If true, replicated blocks synchronize gradients with NCCL. */
  private final boolean useNccl;

  /** The element type used for values whose type is not otherwise determined. */
  private final DataType floatType;

  private BuildOptions(Builder builder) {
    this.forceCpu = builder.forceCpu;
    this.useNccl = builder.useNccl;
    this.floatType = builder.floatType;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options read from system properties, falling back to the defaults:
   *
   * <ul>
   *   <li>{@code blockflow.forceCpu} (default true)
   *   <li>{@code blockflow.useNccl} (default false)
   *   <li>{@code blockflow.floatType} (default FP32)
   * </ul>
   */
  public static BuildOptions fromSystemProperties() {
    return builder()
        .forceCpu(Boolean.parseBoolean(System.getProperty("blockflow.forceCpu", "true")))
        .useNccl(Boolean.parseBoolean(System.getProperty("blockflow.useNccl", "false")))
        .floatType(
            DataType.valueOf(
                Ascii.toUpperCase(System.getProperty("blockflow.floatType", "fp32"))))
        .build();
  }

  public boolean forceCpu() {
    return forceCpu;
  }

  public boolean useNccl() {
    return useNccl;
  }

  public DataType floatType() {
    return floatType;
  }

  /** Builds BuildOptions. */
  public static final class Builder {
    private boolean forceCpu = true;
    private boolean useNccl;
    private DataType floatType = DataType.FP32;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder forceCpu(boolean forceCpu) {
      this.forceCpu = forceCpu;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder useNccl(boolean useNccl) {
      this.useNccl = useNccl;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder floatType(DataType floatType) {
      this.floatType = floatType;
      return this;
    }

    public BuildOptions build() {
      return new BuildOptions(this);
    }
  }
}
