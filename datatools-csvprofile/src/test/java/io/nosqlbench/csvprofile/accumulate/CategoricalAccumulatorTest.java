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

import io.nosqlbench.csvprofile.config.ProfileConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@Tag("unit")
public class CategoricalAccumulatorTest {

    private static CategoricalAccumulator of(String... values) {
        CategoricalAccumulator acc = new CategoricalAccumulator();
        for (String value : values) {
            acc.accept(value);
        }
        return acc;
    }

    @Test
    void countsValuesAndMissingCells() {
        CategoricalAccumulator acc = of("X", "", "Y", "X", null);
        assertThat(acc.counts()).containsExactly(entry("X", 2L), entry("Y", 1L));
        assertThat(acc.missingCount()).isEqualTo(2);
        assertThat(acc.rowsSeen()).isEqualTo(5);
        assertThat(acc.totalCount()).isEqualTo(3);
        assertThat(acc.count("Z")).isZero();
    }

    @Test
    void mergeAddsCountsPerValue() {
        CategoricalAccumulator a = of("X", "X", "X");
        CategoricalAccumulator b = of("X", "Y", "X");

        CategoricalAccumulator merged = (CategoricalAccumulator) ColumnAccumulator.merge(a, b);
        assertThat(merged.counts()).containsExactly(entry("X", 5L), entry("Y", 1L));
        assertThat(a.counts()).containsExactly(entry("X", 3L));
    }

    @Test
    void mergeIsAssociativeAndCommutativeOnCounts() {
        CategoricalAccumulator a = of("p", "q", "", "p");
        CategoricalAccumulator b = of("r");
        CategoricalAccumulator c = of("q", "r", "s", "");

        Map<String, Long> left = ((CategoricalAccumulator) ColumnAccumulator.merge(ColumnAccumulator.merge(a, b), c)).counts();
        Map<String, Long> right = ((CategoricalAccumulator) ColumnAccumulator.merge(a, ColumnAccumulator.merge(b, c))).counts();
        Map<String, Long> swapped = ((CategoricalAccumulator) ColumnAccumulator.merge(c, ColumnAccumulator.merge(a, b))).counts();

        assertThat(right).isEqualTo(left);
        assertThat(swapped).isEqualTo(left);
        assertThat(left).containsExactly(entry("p", 2L), entry("q", 2L), entry("r", 2L), entry("s", 1L));
    }

    @Test
    void topValuesBreakTiesByFirstSeen() {
        CategoricalAccumulator acc = of("b", "a", "a", "b", "c", "d", "d", "d");
        assertThat(acc.topValues(3)).containsExactly(
            new ValueCount("d", 3),
            new ValueCount("b", 2),
            new ValueCount("a", 2));
        assertThat(acc.topValues(10)).hasSize(4);
    }

    @Test
    void summaryReportsTopKAndTotals() {
        CategoricalSummary summary = of("X", "", "Y").summarize(5);
        assertThat(summary.uniqueCount()).isEqualTo(2);
        assertThat(summary.topValues()).containsExactly(new ValueCount("X", 1), new ValueCount("Y", 1));
        assertThat(summary.totalCount()).isEqualTo(2);
        assertThat(summary.nullCount()).isEqualTo(1);
        assertThat(summary.otherCount()).isZero();
        assertThatThrownBy(() -> of("X").summarize(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void distinctLimitCountsOverflowInOtherBucket() {
        CategoricalAccumulator acc = new CategoricalAccumulator(2);
        for (String value : List.of("a", "b", "c", "c", "a", "d")) {
            acc.accept(value);
        }
        assertThat(acc.counts()).containsExactly(entry("a", 2L), entry("b", 1L));
        assertThat(acc.otherCount()).isEqualTo(3);
        assertThat(acc.totalCount()).isEqualTo(6);
        assertThat(acc.distinctCount()).isEqualTo(2);

        CategoricalAccumulator other = new CategoricalAccumulator(2);
        other.accept("e");
        other.accept("a");
        acc.combine(other);
        assertThat(acc.count("a")).isEqualTo(3);
        assertThat(acc.otherCount()).isEqualTo(4);
        assertThat(acc.totalCount()).isEqualTo(8);
    }

    @Test
    void copyIsIndependent() {
        CategoricalAccumulator acc = of("x");
        CategoricalAccumulator copy = acc.copy();
        copy.accept("x");
        assertThat(acc.count("x")).isEqualTo(1);
        assertThat(copy.count("x")).isEqualTo(2);
    }

    @Test
    void forKindHonorsConfiguration() {
        ProfileConfig config = ProfileConfig.builder().maxDistinctValues(1).numericSampleCap(4).build();
        ColumnAccumulator categorical = ColumnAccumulator.forKind(ColumnKind.CATEGORICAL, config);
        categorical.accept("a");
        categorical.accept("b");
        assertThat(((CategoricalAccumulator) categorical).otherCount()).isEqualTo(1);

        ColumnAccumulator numeric = ColumnAccumulator.forKind(ColumnKind.NUMERIC, config);
        assertThat(numeric.kind()).isEqualTo(ColumnKind.NUMERIC);
        assertThat(((NumericAccumulator) numeric).sampleCap()).isEqualTo(4);
    }

    @Test
    void combineRejectsNumeric() {
        assertThatThrownBy(() -> of("x").combine(new NumericAccumulator(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
