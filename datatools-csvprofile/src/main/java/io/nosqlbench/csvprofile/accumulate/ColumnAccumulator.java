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

/// Running statistics for one column, numeric or categorical.
///
/// ## Lifecycle
///
/// ```
/// ColumnAccumulator acc = ColumnAccumulator.forKind(kind, config);
/// for (RowBatch batch : batches) {
///     for (String[] row : batch.rows()) {
///         acc.accept(row[column]);
///     }
/// }
/// ColumnAccumulator total = ColumnAccumulator.merge(shardA, shardB);
/// ```
///
/// Missing cells are counted but otherwise ignored, so after any number of
/// calls `missingCount() + presentCount() == rowsSeen()`.
///
/// ## Thread Safety
///
/// Implementations are **not thread-safe**. Use one accumulator per worker and
/// combine them afterwards.
public sealed interface ColumnAccumulator permits NumericAccumulator, CategoricalAccumulator {

    ColumnKind kind();

    /// Folds one normalized cell into the running statistics.
    void accept(String cell);

    /// @return every cell handed to [#accept], missing ones included
    long rowsSeen();

    long missingCount();

    /// @return the non-missing cells seen
    default long presentCount() {
        return rowsSeen() - missingCount();
    }

    /// Adds the state of another accumulator of the same kind into this one.
    ///
    /// @throws IllegalArgumentException if the kinds differ
    void combine(ColumnAccumulator other);

    /// @return an independent accumulator with the same state
    ColumnAccumulator copy();

    /// Creates an empty accumulator for a column kind.
    static ColumnAccumulator forKind(ColumnKind kind, ProfileConfig config) {
        return switch (kind) {
            case NUMERIC -> new NumericAccumulator(config.getNumericSampleCap());
            case CATEGORICAL -> new CategoricalAccumulator(config.getMaxDistinctValues());
        };
    }

    /// Combines two accumulators without modifying either.
    ///
    /// For counts, sums, extremes and frequency maps the result is independent of
    /// grouping and order. Sample reservoirs and the iteration order of frequency
    /// maps follow the argument order.
    static ColumnAccumulator merge(ColumnAccumulator a, ColumnAccumulator b) {
        ColumnAccumulator merged = a.copy();
        merged.combine(b);
        return merged;
    }
}
