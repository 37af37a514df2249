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
import java.util.List;

/**
 * Reference implementations of the sequence operations emitted by {@link
 * org.blockflow.layers.SequenceLayers}, on concrete values.
 */
public final class SequenceKernels {

  // Static methods only
  private SequenceKernels() {}

  /** The two halves of a batch split by a mask. */
  public record Split(LodTensor outTrue, LodTensor outFalse) {}

  /**
   * Splits the units of {@code x} at {@code level} into those whose mask entry is true and those
   * whose entry is false, keeping their relative order. Each half keeps the lod levels from
   * {@code level} down.
   */
  public static Split splitByMask(LodTensor x, List<Boolean> mask, int level) {
    int numUnits = x.numUnits(level);
    Preconditions.checkArgument(
        mask.size() == numUnits,
        "mask has %s entries but level %s has %s units",
        mask.size(),
        level,
        numUnits);
    List<LodTensor> trueParts = new ArrayList<>();
    List<LodTensor> falseParts = new ArrayList<>();
    for (int i = 0; i < numUnits; i++) {
      (mask.get(i) ? trueParts : falseParts).add(x.slice(level, i, i + 1));
    }
    int lodLevel = Math.max(x.lodLevel() - level, 0);
    return new Split(
        LodTensor.concat(trueParts, x.width(), lodLevel),
        LodTensor.concat(falseParts, x.width(), lodLevel));
  }

  /**
   * The inverse of {@link #splitByMask}: interleaves the units of {@code inTrue} and {@code
   * inFalse} according to {@code mask}. The lod levels above {@code level} are taken from {@code
   * reference}, normally the tensor that was split.
   */
  public static LodTensor mergeByMask(
      LodTensor inTrue, LodTensor inFalse, LodTensor reference, List<Boolean> mask, int level) {
    Preconditions.checkArgument(
        mask.size() == reference.numUnits(level),
        "mask has %s entries but level %s has %s units",
        mask.size(),
        level,
        reference.numUnits(level));
    Preconditions.checkArgument(inTrue.lodLevel() == inFalse.lodLevel(), "lod level mismatch");
    List<LodTensor> parts = new ArrayList<>();
    int nextTrue = 0;
    int nextFalse = 0;
    for (boolean m : mask) {
      if (m) {
        parts.add(inTrue.slice(0, nextTrue, nextTrue + 1));
        nextTrue++;
      } else {
        parts.add(inFalse.slice(0, nextFalse, nextFalse + 1));
        nextFalse++;
      }
    }
    Preconditions.checkArgument(
        nextTrue == inTrue.numUnits(0) && nextFalse == inFalse.numUnits(0),
        "mask does not match the number of units in each half");
    LodTensor merged = LodTensor.concat(parts, inTrue.width(), inTrue.lodLevel());
    int outer = Math.min(level, reference.lodLevel());
    return merged.withOuterLevels(reference.lod().subList(0, outer));
  }

  /**
   * Scatters {@code x} by step: element {@code t} of the result holds step {@code t} of each
   * sequence longer than {@code t}, in rank-table order.
   */
  public static TensorArray toArray(LodTensor x, RankTable table) {
    int level = table.level();
    checkMatches(x, table);
    ImmutableList<Integer> offsets = x.lod().get(level);
    int innerLevels = x.lodLevel() - level - 1;
    TensorArray result = new TensorArray();
    for (int t = 0; t < table.maxLength(); t++) {
      List<LodTensor> parts = new ArrayList<>();
      int active = table.activeCount(t);
      for (int r = 0; r < active; r++) {
        int start = offsets.get(table.items().get(r).index()) + t;
        parts.add(x.slice(level + 1, start, start + 1));
      }
      result.write(t, LodTensor.concat(parts, x.width(), innerLevels));
    }
    return result;
  }

  /** The inverse of {@link #toArray}. */
  public static LodTensor fromArray(TensorArray array, RankTable table) {
    Preconditions.checkArgument(
        array.length() == table.maxLength(),
        "array has %s steps but the longest sequence has %s",
        array.length(),
        table.maxLength());
    int width = array.length() == 0 ? 1 : array.read(0).width();
    int innerLevels = array.length() == 0 ? 0 : array.read(0).lodLevel();
    // rank position of each original sequence
    int[] rank = new int[table.size()];
    for (int r = 0; r < table.size(); r++) {
      rank[table.items().get(r).index()] = r;
    }
    int[] lengths = new int[table.size()];
    table.items().forEach(item -> lengths[item.index()] = item.length());
    List<LodTensor> steps = new ArrayList<>();
    List<Integer> offsets = new ArrayList<>();
    offsets.add(0);
    for (int i = 0; i < table.size(); i++) {
      for (int t = 0; t < lengths[i]; t++) {
        steps.add(array.read(t).slice(0, rank[i], rank[i] + 1));
      }
      offsets.add(offsets.get(i) + lengths[i]);
    }
    LodTensor gathered = LodTensor.concat(steps, width, innerLevels);
    return gathered.withOuterLevels(
        ImmutableList.<ImmutableList<Integer>>builder()
            .addAll(table.coarseLod())
            .add(ImmutableList.copyOf(offsets))
            .build());
  }

  /**
   * Returns the units of {@code x} at the table's level permuted into rank-table order. If
   * {@code x} has no lod at that level its rows are permuted instead.
   */
  public static LodTensor reorderByRank(LodTensor x, RankTable table) {
    int level = table.level();
    Preconditions.checkArgument(
        x.numUnits(level) == table.size(),
        "%s units at level %s but the rank table has %s entries",
        x.numUnits(level),
        level,
        table.size());
    List<LodTensor> parts = new ArrayList<>();
    for (RankTable.Item item : table.items()) {
      parts.add(x.slice(level, item.index(), item.index() + 1));
    }
    return LodTensor.concat(parts, x.width(), Math.max(x.lodLevel() - level, 0));
  }

  /**
   * Returns the leading units of {@code x} that belong to the sequences still active at {@code
   * step}. Throws IllegalStateException if more units are active than {@code x} holds, i.e. if the
   * active set would have to grow.
   */
  public static LodTensor shrink(LodTensor x, int step, RankTable table) {
    int active = table.activeCount(step);
    int available = x.numUnits(0);
    if (active > available) {
      throw new IllegalStateException(
          String.format(
              "%s sequences are active at step %s but only %s rows are present",
              active, step, available));
    }
    return x.slice(0, 0, active);
  }

  private static void checkMatches(LodTensor x, RankTable table) {
    int level = table.level();
    Preconditions.checkArgument(level < x.lodLevel(), "no lod level %s", level);
    Preconditions.checkArgument(
        x.lengths(level).size() == table.size(),
        "%s sequences at level %s but the rank table has %s entries",
        x.lengths(level).size(),
        level,
        table.size());
  }
}
