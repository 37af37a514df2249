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
import java.util.Comparator;
import java.util.List;

/**
 * The sequences of a batch ordered by descending length. Sequences of equal length keep their
 * original relative order.
 *
 * <p>Since the order is by descending length, the sequences still active at any step (those longer
 * than the step number) are always a prefix of the table.
 */
public final class RankTable {

  /** One sequence: its position in the original batch and its length. */
  public record Item(int index, int length) {}

  private final int level;
  private final ImmutableList<Item> items;

  /** The lod levels above {@link #level} of the tensor the table was built from. */
  private final ImmutableList<ImmutableList<Integer>> coarseLod;

  private RankTable(
      int level, ImmutableList<Item> items, ImmutableList<ImmutableList<Integer>> coarseLod) {
    this.level = level;
    this.items = items;
    this.coarseLod = coarseLod;
  }

  /** Builds a table of the sequences of {@code x} at {@code level}. */
  public static RankTable build(LodTensor x, int level) {
    ImmutableList<Integer> lengths = x.lengths(level);
    return new RankTable(level, sort(lengths), x.lod().subList(0, level));
  }

  /** Builds a level-0 table for sequences of the given lengths. */
  public static RankTable of(int... lengths) {
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    for (int length : lengths) {
      Preconditions.checkArgument(length >= 0);
      builder.add(length);
    }
    return new RankTable(0, sort(builder.build()), ImmutableList.of());
  }

  private static ImmutableList<Item> sort(List<Integer> lengths) {
    List<Item> items = new ArrayList<>();
    for (int i = 0; i < lengths.size(); i++) {
      items.add(new Item(i, lengths.get(i)));
    }
    // List.sort is stable
    items.sort(Comparator.comparingInt(Item::length).reversed());
    return ImmutableList.copyOf(items);
  }

  public int level() {
    return level;
  }

  public ImmutableList<Item> items() {
    return items;
  }

  public int size() {
    return items.size();
  }

  ImmutableList<ImmutableList<Integer>> coarseLod() {
    return coarseLod;
  }

  /** The length of the longest sequence, or 0 if the table is empty. */
  public int maxLength() {
    return items.isEmpty() ? 0 : items.get(0).length();
  }

  /** The number of sequences longer than {@code step}. */
  public int activeCount(int step) {
    int n = 0;
    while (n < items.size() && items.get(n).length() > step) {
      n++;
    }
    return n;
  }

  @Override
  public String toString() {
    return items.toString();
  }
}
