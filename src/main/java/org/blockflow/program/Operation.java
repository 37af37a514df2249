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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * An Operation is one node of the dataflow graph: a type tag, named lists of input and output
 * variable names, and a map of attributes. Attribute values are Booleans, Numbers, Strings, lists
 * of those, or (for the composite operations emitted by control constructs) a {@link Block}.
 *
 * <p>Operations are immutable once built. Slots and attributes keep their insertion order, so two
 * programs built by the same sequence of calls print identically.
 */
public final class Operation {
  /** The attribute under which composite operations store their embedded Block. */
  public static final String SUB_BLOCK = "sub_block";

  private final String type;
  private final ImmutableMap<String, ImmutableList<String>> inputs;
  private final ImmutableMap<String, ImmutableList<String>> outputs;
  private final ImmutableMap<String, Object> attrs;

  private Operation(Builder builder) {
    this.type = builder.type;
    this.inputs = copySlots(builder.inputs);
    this.outputs = copySlots(builder.outputs);
    this.attrs = ImmutableMap.copyOf(builder.attrs);
  }

  private static ImmutableMap<String, ImmutableList<String>> copySlots(
      Map<String, List<String>> slots) {
    ImmutableMap.Builder<String, ImmutableList<String>> result = ImmutableMap.builder();
    slots.forEach((slot, names) -> result.put(slot, ImmutableList.copyOf(names)));
    return result.buildOrThrow();
  }

  /** Returns a Builder for an Operation with the given type tag. */
  public static Builder builder(String type) {
    return new Builder(type);
  }

  public String type() {
    return type;
  }

  public ImmutableMap<String, ImmutableList<String>> inputs() {
    return inputs;
  }

  public ImmutableMap<String, ImmutableList<String>> outputs() {
    return outputs;
  }

  public ImmutableMap<String, Object> attrs() {
    return attrs;
  }

  /** Returns the variable names bound to the given input slot (empty if there is no such slot). */
  public ImmutableList<String> input(String slot) {
    return inputs.getOrDefault(slot, ImmutableList.of());
  }

  /** Returns the variable names bound to the given output slot (empty if there is no such slot). */
  public ImmutableList<String> output(String slot) {
    return outputs.getOrDefault(slot, ImmutableList.of());
  }

  /** Returns every input variable name, in slot order. */
  public Stream<String> inputNames() {
    return inputs.values().stream().flatMap(List::stream);
  }

  /** Returns every output variable name, in slot order. */
  public Stream<String> outputNames() {
    return outputs.values().stream().flatMap(List::stream);
  }

  public @Nullable Object attr(String name) {
    return attrs.get(name);
  }

  /** Returns the embedded Block of a composite operation, or null for an ordinary operation. */
  public @Nullable Block subBlock() {
    return (Block) attrs.get(SUB_BLOCK);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(type).append('(');
    appendSlots(sb, inputs);
    sb.append(") -> (");
    appendSlots(sb, outputs);
    sb.append(')');
    if (!attrs.isEmpty()) {
      sb.append(" {");
      String sep = "";
      for (Map.Entry<String, Object> entry : attrs.entrySet()) {
        sb.append(sep).append(entry.getKey()).append('=');
        Object value = entry.getValue();
        if (value instanceof Block) {
          sb.append("block ").append(((Block) value).index());
        } else if (value instanceof String) {
          sb.append('"').append(value).append('"');
        } else {
          sb.append(value);
        }
        sep = ", ";
      }
      sb.append('}');
    }
    return sb.toString();
  }

  private static void appendSlots(StringBuilder sb, Map<String, ImmutableList<String>> slots) {
    String sep = "";
    for (Map.Entry<String, ImmutableList<String>> entry : slots.entrySet()) {
      sb.append(sep).append(entry.getKey()).append('=').append(entry.getValue());
      sep = ", ";
    }
  }

  /** Collects the slots and attributes of an Operation. */
  public static final class Builder {
    private final String type;
    private final Map<String, List<String>> inputs = new LinkedHashMap<>();
    private final Map<String, List<String>> outputs = new LinkedHashMap<>();
    private final Map<String, Object> attrs = new LinkedHashMap<>();

    private Builder(String type) {
      this.type = type;
    }

    @CanIgnoreReturnValue
    public Builder input(String slot, Variable... vars) {
      return input(slot, ImmutableList.copyOf(vars));
    }

    @CanIgnoreReturnValue
    public Builder input(String slot, List<Variable> vars) {
      return inputNames(slot, names(vars));
    }

    @CanIgnoreReturnValue
    public Builder inputNames(String slot, List<String> names) {
      Preconditions.checkArgument(
          inputs.put(slot, ImmutableList.copyOf(names)) == null, "Duplicate input slot %s", slot);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder output(String slot, Variable... vars) {
      return output(slot, ImmutableList.copyOf(vars));
    }

    @CanIgnoreReturnValue
    public Builder output(String slot, List<Variable> vars) {
      return outputNames(slot, names(vars));
    }

    @CanIgnoreReturnValue
    public Builder outputNames(String slot, List<String> names) {
      Preconditions.checkArgument(
          outputs.put(slot, ImmutableList.copyOf(names)) == null, "Duplicate output slot %s", slot);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder attr(String name, Object value) {
      Preconditions.checkNotNull(value, "Attribute %s may not be null", name);
      attrs.put(name, value);
      return this;
    }

    public Operation build() {
      return new Operation(this);
    }

    private static ImmutableList<String> names(List<Variable> vars) {
      return vars.stream().map(Variable::name).collect(ImmutableList.toImmutableList());
    }
  }
}
