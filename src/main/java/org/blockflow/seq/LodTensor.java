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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable batch of fixed-width rows of doubles, with zero or more levels of variable-length
 * grouping ("lod", level of detail).
 *
 * <p>Level 0 is the outermost. Each level is a list of offsets into the next level (or into the
 * rows, for the innermost level): sequence {@code i} at level {@code k} covers units {@code
 * lod[k][i]} (inclusive) to {@code lod[k][i + 1]} (exclusive) of level {@code k + 1}. Offsets start
 * at 0 and never decrease.
 *
 * <p>A <i>unit</i> at level {@code k} is one sequence of that level if {@code k < lodLevel()}, and
 * one row otherwise.
 */
public final class LodTensor {
  private final int width;
  private final double[] data;
  private final ImmutableList<ImmutableList<Integer>> lod;

  private LodTensor(int width, double[] data, ImmutableList<ImmutableList<Integer>> lod) {
    this.width = width;
    this.data = data;
    this.lod = lod;
  }

  /** Returns a LodTensor with the given rows (concatenated in {@code data}) and offsets. */
  public static LodTensor of(int width, double[] data, List<? extends List<Integer>> lod) {
    Preconditions.checkArgument(width > 0, "width must be positive");
    Preconditions.checkArgument(data.length % width == 0, "data is not a whole number of rows");
    ImmutableList.Builder<ImmutableList<Integer>> levels = ImmutableList.builder();
    for (int k = 0; k < lod.size(); k++) {
      List<Integer> offsets = lod.get(k);
      Preconditions.checkArgument(
          !offsets.isEmpty() && offsets.get(0) == 0, "level %s must start at 0", k);
      for (int i = 1; i < offsets.size(); i++) {
        Preconditions.checkArgument(
            offsets.get(i) >= offsets.get(i - 1), "level %s is not non-decreasing", k);
      }
      int last = offsets.get(offsets.size() - 1);
      int next = (k + 1 < lod.size()) ? lod.get(k + 1).size() - 1 : data.length / width;
      Preconditions.checkArgument(
          last == next, "level %s ends at %s but the next level has %s units", k, last, next);
      levels.add(ImmutableList.copyOf(offsets));
    }
    return new LodTensor(width, data.clone(), levels.build());
  }

  /** Returns a LodTensor with no grouping. */
  public static LodTensor rows(int width, double... data) {
    return of(width, data, ImmutableList.of());
  }

  /**
   * Returns a one-level LodTensor of width 1 whose sequences have the given lengths. Row {@code r}
   * holds the value {@code r}.
   */
  public static LodTensor withLengths(int... lengths) {
    List<Integer> offsets = new ArrayList<>();
    offsets.add(0);
    int total = 0;
    for (int length : lengths) {
      Preconditions.checkArgument(length >= 0);
      total += length;
      offsets.add(total);
    }
    double[] data = new double[total];
    Arrays.setAll(data, i -> i);
    return of(1, data, ImmutableList.of(offsets));
  }

  public int width() {
    return width;
  }

  public int numRows() {
    return data.length / width;
  }

  public int lodLevel() {
    return lod.size();
  }

  public ImmutableList<ImmutableList<Integer>> lod() {
    return lod;
  }

  /** Returns a copy of row {@code i}. */
  public double[] row(int i) {
    Preconditions.checkElementIndex(i, numRows());
    return Arrays.copyOfRange(data, i * width, (i + 1) * width);
  }

  /** Returns a copy of all rows, concatenated. */
  public double[] data() {
    return data.clone();
  }

  /** Returns the number of units at {@code level}. */
  public int numUnits(int level) {
    Preconditions.checkArgument(level >= 0);
    return (level < lod.size()) ? lod.get(level).size() - 1 : numRows();
  }

  /**
   * Returns the number of units at level {@code level + 1} (or rows) in each sequence at {@code
   * level}.
   */
  public ImmutableList<Integer> lengths(int level) {
    Preconditions.checkArgument(level >= 0 && level < lod.size(), "no lod level %s", level);
    ImmutableList<Integer> offsets = lod.get(level);
    ImmutableList.Builder<Integer> result = ImmutableList.builder();
    for (int i = 0; i + 1 < offsets.size(); i++) {
      result.add(offsets.get(i + 1) - offsets.get(i));
    }
    return result.build();
  }

  /**
   * Returns units {@code from} (inclusive) to {@code to} (exclusive) at {@code level}. The result
   * keeps the lod levels from {@code level} down, rebased to start at 0; the levels above {@code
   * level} are dropped.
   */
  public LodTensor slice(int level, int from, int to) {
    Preconditions.checkPositionIndexes(from, to, numUnits(level));
    ImmutableList.Builder<ImmutableList<Integer>> levels = ImmutableList.builder();
    for (int k = level; k < lod.size(); k++) {
      ImmutableList<Integer> offsets = lod.get(k);
      int base = offsets.get(from);
      ImmutableList.Builder<Integer> rebased = ImmutableList.builder();
      for (int i = from; i <= to; i++) {
        rebased.add(offsets.get(i) - base);
      }
      levels.add(rebased.build());
      to = offsets.get(to);
      from = base;
    }
    return new LodTensor(
        width, Arrays.copyOfRange(data, from * width, to * width), levels.build());
  }

  /**
   * Concatenates {@code parts}, each of which must have the given width and number of lod
   * levels; the units of each level are appended in order.
   */
  public static LodTensor concat(List<LodTensor> parts, int width, int lodLevel) {
    int numRows = 0;
    List<List<Integer>> levels = new ArrayList<>();
    for (int k = 0; k < lodLevel; k++) {
      List<Integer> offsets = new ArrayList<>();
      offsets.add(0);
      levels.add(offsets);
    }
    for (LodTensor part : parts) {
      Preconditions.checkArgument(part.width == width, "width mismatch");
      Preconditions.checkArgument(part.lodLevel() == lodLevel, "lod level mismatch");
      for (int k = 0; k < lodLevel; k++) {
        List<Integer> offsets = levels.get(k);
        int base = offsets.get(offsets.size() - 1);
        ImmutableList<Integer> partOffsets = part.lod.get(k);
        for (int i = 1; i < partOffsets.size(); i++) {
          offsets.add(base + partOffsets.get(i));
        }
      }
      numRows += part.numRows();
    }
    double[] data = new double[numRows * width];
    int pos = 0;
    for (LodTensor part : parts) {
      System.arraycopy(part.data, 0, data, pos, part.data.length);
      pos += part.data.length;
    }
    ImmutableList.Builder<ImmutableList<Integer>> lod = ImmutableList.builder();
    levels.forEach(offsets -> lod.add(ImmutableList.copyOf(offsets)));
    return new LodTensor(width, data, lod.build());
  }

  /** Returns a LodTensor with the same rows whose lod is {@code outer} followed by this one's. */
  LodTensor withOuterLevels(List<ImmutableList<Integer>> outer) {
    return of(
        width,
        data,
        ImmutableList.<ImmutableList<Integer>>builder().addAll(outer).addAll(lod).build());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof LodTensor other
        && width == other.width
        && Arrays.equals(data, other.data)
        && lod.equals(other.lod);
  }

  @Override
  public int hashCode() {
    return (Arrays.hashCode(data) * 31 + lod.hashCode()) * 31 + width;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("lod=").append(lod).append(" rows=[");
    for (int i = 0; i < numRows(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(Arrays.toString(row(i)));
    }
    return sb.append("]").toString();
  }
}
