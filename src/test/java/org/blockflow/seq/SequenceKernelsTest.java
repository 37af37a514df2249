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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Booleans;
import java.util.List;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class SequenceKernelsTest {

  /**
   * Two outer sequences, holding two and one inner sequences; the inner sequences have 2, 3 and 1
   * rows of width 2.
   */
  private static final LodTensor NESTED =
      LodTensor.of(
          2,
          new double[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11},
          ImmutableList.of(ImmutableList.of(0, 2, 3), ImmutableList.of(0, 2, 5, 6)));

  private static List<Boolean> mask(boolean... values) {
    return Booleans.asList(values);
  }

  @Test
  public void splitSequences() {
    LodTensor x = LodTensor.withLengths(3, 1, 2);
    SequenceKernels.Split split = SequenceKernels.splitByMask(x, mask(true, false, true), 0);
    assertThat(split.outTrue())
        .isEqualTo(
            LodTensor.of(1, new double[] {0, 1, 2, 4, 5}, ImmutableList.of(List.of(0, 3, 5))));
    assertThat(split.outFalse())
        .isEqualTo(LodTensor.of(1, new double[] {3}, ImmutableList.of(List.of(0, 1))));
  }

  @Test
  public void splitRowsKeepsNoLod() {
    LodTensor x = LodTensor.rows(1, 7, 8, 9);
    SequenceKernels.Split split = SequenceKernels.splitByMask(x, mask(false, true, false), 0);
    assertThat(split.outTrue()).isEqualTo(LodTensor.rows(1, 8));
    assertThat(split.outFalse()).isEqualTo(LodTensor.rows(1, 7, 9));
  }

  @SuppressWarnings("unused") // used by JUnitParams
  private static Object[] splitCases() {
    return new Object[] {
      new Object[] {0, new boolean[] {true, false}},
      new Object[] {0, new boolean[] {false, false}},
      new Object[] {1, new boolean[] {false, true, true}},
      new Object[] {1, new boolean[] {true, true, true}},
      new Object[] {2, new boolean[] {true, false, false, true, true, false}},
      new Object[] {2, new boolean[] {false, true, false, true, false, true}},
    };
  }

  @Test
  @Parameters(method = "splitCases")
  public void mergeInvertsSplit(int level, boolean[] values) {
    List<Boolean> mask = mask(values);
    SequenceKernels.Split split = SequenceKernels.splitByMask(NESTED, mask, level);
    int trueCount = (int) mask.stream().filter(b -> b).count();
    assertThat(split.outTrue().numUnits(0)).isEqualTo(trueCount);
    assertThat(split.outFalse().numUnits(0)).isEqualTo(mask.size() - trueCount);
    LodTensor merged =
        SequenceKernels.mergeByMask(split.outTrue(), split.outFalse(), NESTED, mask, level);
    assertThat(merged).isEqualTo(NESTED);
  }

  @Test
  public void maskMustMatchUnits() {
    assertThrows(
        IllegalArgumentException.class,
        () -> SequenceKernels.splitByMask(NESTED, mask(true, false, true), 0));
  }

  @Test
  public void arrayRoundTrip() {
    LodTensor x = LodTensor.withLengths(4, 1, 2);
    RankTable table = RankTable.build(x, 0);
    TensorArray array = SequenceKernels.toArray(x, table);
    assertThat(array.length()).isEqualTo(4);
    assertThat(array.read(0)).isEqualTo(LodTensor.rows(1, 0, 5, 4));
    assertThat(array.read(1)).isEqualTo(LodTensor.rows(1, 1, 6));
    assertThat(array.read(2)).isEqualTo(LodTensor.rows(1, 2));
    assertThat(array.read(3)).isEqualTo(LodTensor.rows(1, 3));
    LodTensor gathered = SequenceKernels.fromArray(array, table);
    assertThat(gathered).isEqualTo(x);
    assertThat(gathered.lengths(0)).containsExactly(4, 1, 2).inOrder();
  }

  @Test
  public void arrayRoundTripAtInnerLevel() {
    RankTable table = RankTable.build(NESTED, 1);
    TensorArray array = SequenceKernels.toArray(NESTED, table);
    assertThat(array.length()).isEqualTo(3);
    assertThat(array.read(0).numRows()).isEqualTo(3);
    assertThat(SequenceKernels.fromArray(array, table)).isEqualTo(NESTED);
  }

  @Test
  public void reorder() {
    LodTensor x = LodTensor.withLengths(4, 1, 2);
    RankTable table = RankTable.build(x, 0);
    assertThat(SequenceKernels.reorderByRank(x, table))
        .isEqualTo(
            LodTensor.of(
                1, new double[] {0, 1, 2, 3, 5, 6, 4}, ImmutableList.of(List.of(0, 4, 6, 7))));
    assertThat(SequenceKernels.reorderByRank(LodTensor.rows(1, 10, 11, 12), table))
        .isEqualTo(LodTensor.rows(1, 10, 12, 11));
    assertThrows(
        IllegalArgumentException.class,
        () -> SequenceKernels.reorderByRank(LodTensor.rows(1, 10, 11), table));
  }

  @Test
  public void shrink() {
    RankTable table = RankTable.of(4, 1, 2);
    LodTensor memory = LodTensor.rows(1, 10, 12, 11);
    assertThat(SequenceKernels.shrink(memory, 0, table)).isEqualTo(memory);
    LodTensor shrunk = SequenceKernels.shrink(memory, 1, table);
    assertThat(shrunk).isEqualTo(LodTensor.rows(1, 10, 12));
    assertThat(SequenceKernels.shrink(shrunk, 2, table)).isEqualTo(LodTensor.rows(1, 10));
    // The active set can never grow back
    assertThrows(IllegalStateException.class, () -> SequenceKernels.shrink(shrunk, 0, table));
  }

  @Test
  public void tensorArray() {
    TensorArray array = new TensorArray();
    array.write(2, LodTensor.rows(1, 5));
    assertThat(array.length()).isEqualTo(3);
    assertThat(array.read(2)).isEqualTo(LodTensor.rows(1, 5));
    assertThrows(IllegalArgumentException.class, () -> array.read(0));
    assertThrows(IndexOutOfBoundsException.class, () -> array.read(3));
    array.write(0, LodTensor.rows(1, 6));
    assertThat(array.read(0)).isEqualTo(LodTensor.rows(1, 6));
  }

  @Test
  public void invalidLod() {
    assertThrows(
        IllegalArgumentException.class,
        () -> LodTensor.of(1, new double[3], ImmutableList.of(List.of(0, 2))));
    assertThrows(
        IllegalArgumentException.class,
        () -> LodTensor.of(1, new double[3], ImmutableList.of(List.of(0, 2, 1, 3))));
    assertThrows(IllegalArgumentException.class, () -> LodTensor.rows(2, 1, 2, 3));
  }
}
