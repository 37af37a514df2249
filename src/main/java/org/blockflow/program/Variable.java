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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Longs;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * A Variable describes one named value in a Block. Variables are referenced by name from
 * Operations; the same name is never used for two Variables in one Block.
 *
 * <p>Variables are immutable; use {@link #named} to get a Builder and {@link Block#createVar} to
 * add the result to a Block.
 */
public final class Variable {
  private final String name;
  private final VarType type;
  private final @Nullable DataType dataType;

  /** Dimensions, outermost first; -1 marks a dimension (usually the batch) that is unknown. */
  private final ImmutableList<Long> shape;

  /** How many levels of variable-length nesting the value carries. */
  private final int lodLevel;

  private final boolean persistable;
  private final boolean stopGradient;

  /** The index of the Block that owns this Variable. */
  private final int blockIndex;

  private Variable(Builder builder, int blockIndex) {
    this.name = builder.name;
    this.type = builder.type;
    this.dataType = builder.dataType;
    this.shape = builder.shape;
    this.lodLevel = builder.lodLevel;
    this.persistable = builder.persistable;
    this.stopGradient = builder.stopGradient;
    this.blockIndex = blockIndex;
  }

  /** Returns a new Builder for a LOD_TENSOR Variable with the given name. */
  public static Builder named(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public VarType type() {
    return type;
  }

  public @Nullable DataType dataType() {
    return dataType;
  }

  public ImmutableList<Long> shape() {
    return shape;
  }

  public int lodLevel() {
    return lodLevel;
  }

  public boolean persistable() {
    return persistable;
  }

  public boolean stopGradient() {
    return stopGradient;
  }

  public int blockIndex() {
    return blockIndex;
  }

  /**
   * Returns the product of this Variable's dimensions; a Variable with an empty shape has one
   * element. Unknown (-1) dimensions make the result negative.
   */
  public long numElements() {
    long result = 1;
    for (long dim : shape) {
      result *= dim;
    }
    return result;
  }

  /** Returns true if this is a tensor whose shape holds exactly one element. */
  public boolean isScalar() {
    return type == VarType.LOD_TENSOR && numElements() == 1;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name).append(':');
    if (type != VarType.LOD_TENSOR) {
      sb.append(type.name().toLowerCase(Locale.ROOT));
      if (dataType != null) {
        sb.append('<').append(dataType.printName()).append('>');
      }
    } else {
      sb.append(dataType == null ? "?" : dataType.printName()).append(shape);
      if (lodLevel != 0) {
        sb.append(" lod=").append(lodLevel);
      }
    }
    if (persistable) {
      sb.append(" persistable");
    }
    return sb.toString();
  }

  /** A Builder collects the attributes of a Variable before it is created in a Block. */
  public static final class Builder {
    final String name;
    private VarType type = VarType.LOD_TENSOR;
    private @Nullable DataType dataType;
    private ImmutableList<Long> shape = ImmutableList.of();
    private int lodLevel;
    private boolean persistable;
    private boolean stopGradient;

    private Builder(String name) {
      Preconditions.checkArgument(!name.isEmpty(), "Variable names may not be empty");
      this.name = name;
    }

    @CanIgnoreReturnValue
    public Builder type(VarType type) {
      this.type = type;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder dataType(@Nullable DataType dataType) {
      this.dataType = dataType;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder shape(long... dims) {
      this.shape = ImmutableList.copyOf(Longs.asList(dims));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder shape(List<Long> dims) {
      this.shape = ImmutableList.copyOf(dims);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder lodLevel(int lodLevel) {
      Preconditions.checkArgument(lodLevel >= 0);
      this.lodLevel = lodLevel;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder persistable(boolean persistable) {
      this.persistable = persistable;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder stopGradient(boolean stopGradient) {
      this.stopGradient = stopGradient;
      return this;
    }

    /** Copies every attribute except the name from {@code other}. */
    @CanIgnoreReturnValue
    public Builder like(Variable other) {
      this.type = other.type;
      this.dataType = other.dataType;
      this.shape = other.shape;
      this.lodLevel = other.lodLevel;
      this.persistable = other.persistable;
      this.stopGradient = other.stopGradient;
      return this;
    }

    Variable build(int blockIndex) {
      return new Variable(this, blockIndex);
    }
  }
}
