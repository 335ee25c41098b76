package io.nosqlbench.csvprofile.accumulate;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the numeric accumulator and its summary.
 *
 * <h2>Properties Tested</h2>
 *
 * <ol>
 *   <li><b>Equivalence:</b> combine(acc([a,b]), acc([c,d])) == acc([a,b,c,d])</li>
 *   <li><b>Associativity:</b> merge(A, merge(B, C)) == merge(merge(A, B), C)</li>
 *   <li><b>Commutativity:</b> merge(A, B) == merge(B, A) for every statistic but the sample</li>
 * </ol>
 */
@Tag("accuracy")
@Tag("unit")
public class NumericAccumulatorTest {

    private static final long SEED = 42L;
    private static final double TOLERANCE = 1e-9;

    @Test
    void basicStatistics() {
        NumericAccumulator acc = new NumericAccumulator(100);
        acc.accept("10.5");
        acc.accept("20.0");
        acc.accept("");

        NumericSummary summary = acc.summarize();
        assertEquals(2, summary.count());
        assertEquals(1, summary.nullCount());
        assertEquals(30.5, summary.sum(), TOLERANCE);
        assertEquals(15.25, summary.mean().getAsDouble(), TOLERANCE);
        assertEquals(10.5, summary.min().getAsDouble());
        assertEquals(20.0, summary.max().getAsDouble());
        assertEquals(Math.sqrt(45.125), summary.stdDev().getAsDouble(), TOLERANCE);
        assertEquals(3, acc.rowsSeen());
        assertEquals(2, acc.presentCount());
    }

    @Test
    void emptyAccumulatorHasNoDerivedStatistics() {
        NumericSummary summary = new NumericAccumulator(10).summarize();
        assertEquals(0, summary.count());
        assertEquals(0.0, summary.sum());
        assertTrue(summary.mean().isEmpty());
        assertTrue(summary.min().isEmpty());
        assertTrue(summary.max().isEmpty());
        assertTrue(summary.stdDev().isEmpty());
        assertTrue(summary.median().isEmpty());
    }

    @Test
    void singleValueHasNoStandardDeviation() {
        NumericAccumulator acc = new NumericAccumulator(10);
        acc.accept("7");
        NumericSummary summary = acc.summarize();
        assertEquals(7.0, summary.mean().getAsDouble());
        assertTrue(summary.stdDev().isEmpty());
        assertEquals(7.0, summary.median().getAsDouble());
    }

    @Test
    void nonDecimalCellsAreRejected() {
        NumericAccumulator acc = new NumericAccumulator(10);
        acc.accept("abc");
        acc.accept("NaN");
        acc.accept("1e3");
        acc.accept("  ");

        assertEquals(1, acc.count());
        assertEquals(2, acc.rejectedCount());
        assertEquals(1, acc.missingCount());
        assertEquals(1000.0, acc.sum());
        assertEquals(2, acc.summarize().rejectedCount());
    }

    @Test
    void overflowingCellIsRejectedAndStatisticsStayFinite() {
        NumericAccumulator acc = new NumericAccumulator(10);
        acc.accept("1");
        acc.accept("1e999");
        acc.accept("3");

        assertEquals(2, acc.count());
        assertEquals(1, acc.rejectedCount());
        NumericSummary summary = acc.summarize();
        assertEquals(2.0, summary.mean().getAsDouble());
        assertEquals(Math.sqrt(2.0), summary.stdDev().getAsDouble(), TOLERANCE);
    }

    @Test
    void meanIsSumOverCount() {
        double[] values = {0.1, 0.2, 0.3, 0.7, 1e16, -1e16, 3.3};
        NumericAccumulator acc = new NumericAccumulator(10);
        for (double value : values) {
            acc.add(value);
        }

        NumericSummary summary = acc.summarize();
        assertEquals(values.length, summary.count());
        assertEquals(summary.sum() / summary.count(), summary.mean().getAsDouble());
    }

    @Test
    void quartilesInterpolateOverSortedSample() {
        NumericAccumulator acc = new NumericAccumulator(100);
        for (String v : new String[]{"5", "1", "4", "2", "3"}) {
            acc.accept(v);
        }
        NumericSummary summary = acc.summarize();
        assertEquals(2.0, summary.lowerQuartile().getAsDouble(), TOLERANCE);
        assertEquals(3.0, summary.median().getAsDouble(), TOLERANCE);
        assertEquals(4.0, summary.upperQuartile().getAsDouble(), TOLERANCE);

        acc.accept("6");
        summary = acc.summarize();
        assertEquals(2.25, summary.lowerQuartile().getAsDouble(), TOLERANCE);
        assertEquals(3.5, summary.median().getAsDouble(), TOLERANCE);
        assertEquals(4.75, summary.upperQuartile().getAsDouble(), TOLERANCE);
    }

    @Test
    void sampleKeepsFirstValuesUpToCap() {
        NumericAccumulator a = new NumericAccumulator(3);
        a.add(1);
        a.add(2);
        NumericAccumulator b = new NumericAccumulator(3);
        b.add(3);
        b.add(4);
        b.add(5);

        assertArrayEquals(new double[]{1, 2, 3}, ((NumericAccumulator) ColumnAccumulator.merge(a, b)).sample());
        assertArrayEquals(new double[]{3, 4, 5}, ((NumericAccumulator) ColumnAccumulator.merge(b, a)).sample());
        assertEquals(2, a.summarize().sampleSize());
    }

    @Test
    void zeroCapKeepsNoSample() {
        NumericAccumulator acc = new NumericAccumulator(0);
        acc.add(1);
        acc.add(2);
        NumericSummary summary = acc.summarize();
        assertEquals(0, summary.sampleSize());
        assertTrue(summary.median().isEmpty());
        assertEquals(1.5, summary.mean().getAsDouble(), TOLERANCE);
    }

    // ==================== Combination ====================

    @Test
    void combineEquivalentToSequential() {
        Random rng = new Random(SEED);
        NumericAccumulator sequential = new NumericAccumulator(0);
        NumericAccumulator first = new NumericAccumulator(0);
        NumericAccumulator second = new NumericAccumulator(0);
        for (int i = 0; i < 10_000; i++) {
            double v = rng.nextGaussian() * 50 + 1000;
            sequential.add(v);
            (i < 3_000 ? first : second).add(v);
        }
        first.combine(second);

        assertEquals(sequential.count(), first.count());
        assertEquals(sequential.min(), first.min());
        assertEquals(sequential.max(), first.max());
        assertEquals(sequential.runningMean(), first.runningMean(), TOLERANCE);
        assertEquals(sequential.m2(), first.m2(), sequential.m2() * 1e-9);
    }

    @Test
    void mergeIsAssociativeAndCommutative() {
        Random rng = new Random(SEED);
        NumericAccumulator a = randomAccumulator(rng, 100);
        NumericAccumulator b = randomAccumulator(rng, 1);
        NumericAccumulator c = randomAccumulator(rng, 2_500);

        NumericSummary left = ((NumericAccumulator) ColumnAccumulator.merge(ColumnAccumulator.merge(a, b), c)).summarize();
        NumericSummary right = ((NumericAccumulator) ColumnAccumulator.merge(a, ColumnAccumulator.merge(b, c))).summarize();
        NumericSummary swapped = ((NumericAccumulator) ColumnAccumulator.merge(c, ColumnAccumulator.merge(b, a))).summarize();

        for (NumericSummary other : new NumericSummary[]{right, swapped}) {
            assertEquals(left.count(), other.count());
            assertEquals(left.nullCount(), other.nullCount());
            assertEquals(left.sum(), other.sum(), TOLERANCE);
            assertEquals(left.mean().getAsDouble(), other.mean().getAsDouble(), TOLERANCE);
            assertEquals(left.stdDev().getAsDouble(), other.stdDev().getAsDouble(), TOLERANCE);
            assertEquals(left.min().getAsDouble(), other.min().getAsDouble());
            assertEquals(left.max().getAsDouble(), other.max().getAsDouble());
        }
    }

    @Test
    void mergeLeavesInputsUnchanged() {
        NumericAccumulator a = new NumericAccumulator(10);
        a.add(1);
        NumericAccumulator b = new NumericAccumulator(10);
        b.add(2);

        NumericAccumulator merged = (NumericAccumulator) ColumnAccumulator.merge(a, b);
        assertEquals(2, merged.count());
        assertEquals(1, a.count());
        assertEquals(1, b.count());
        assertArrayEquals(new double[]{1}, a.sample());
    }

    @Test
    void combineWithEmptyIsIdentity() {
        NumericAccumulator a = new NumericAccumulator(10);
        a.add(4);
        a.add(8);
        NumericAccumulator empty = new NumericAccumulator(10);
        empty.accept("");

        NumericAccumulator merged = (NumericAccumulator) ColumnAccumulator.merge(empty, a);
        assertEquals(2, merged.count());
        assertEquals(6.0, merged.summarize().mean().getAsDouble(), TOLERANCE);
        assertEquals(1, merged.missingCount());
        assertEquals(4.0, merged.min());
    }

    @Test
    void combineRejectsCategorical() {
        NumericAccumulator acc = new NumericAccumulator(10);
        assertThrows(IllegalArgumentException.class, () -> acc.combine(new CategoricalAccumulator()));
    }

    private static NumericAccumulator randomAccumulator(Random rng, int n) {
        NumericAccumulator acc = new NumericAccumulator(16);
        for (int i = 0; i < n; i++) {
            if (i % 10 == 9) {
                acc.accept("");
            } else {
                acc.add(rng.nextDouble() * 100 - 50);
            }
        }
        return acc;
    }
}
