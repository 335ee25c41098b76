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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Streaming frequency table for a categorical column.
///
/// Values are kept in first-seen order with their occurrence counts. Combining
/// adds counts key by key; keys of this accumulator keep their position and new
/// keys are appended in the other accumulator's order.
///
/// ## Distinct Value Limit
///
/// With `maxDistinct > 0`, once that many distinct values are tracked any new
/// value is counted in a single `other` bucket. Counts of tracked values stay
/// exact. Which values end up tracked depends on the order values arrive in, so
/// with a limit in effect only the total count is independent of chunking.
public final class CategoricalAccumulator implements ColumnAccumulator {

    private final int maxDistinct;
    private final LinkedHashMap<String, Long> counts = new LinkedHashMap<>();
    private long rowsSeen;
    private long missing;
    private long other;

    /// Creates an accumulator without a distinct value limit.
    public CategoricalAccumulator() {
        this(0);
    }

    /// @param maxDistinct maximum number of tracked values, 0 for unlimited
    public CategoricalAccumulator(int maxDistinct) {
        if (maxDistinct < 0) {
            throw new IllegalArgumentException("maxDistinct must be non-negative: " + maxDistinct);
        }
        this.maxDistinct = maxDistinct;
    }

    @Override
    public ColumnKind kind() {
        return ColumnKind.CATEGORICAL;
    }

    @Override
    public void accept(String cell) {
        rowsSeen++;
        if (CellValues.isMissing(cell)) {
            missing++;
            return;
        }
        add(cell, 1);
    }

    private void add(String value, long n) {
        Long current = counts.get(value);
        if (current != null) {
            counts.put(value, current + n);
        } else if (maxDistinct > 0 && counts.size() >= maxDistinct) {
            other += n;
        } else {
            counts.put(value, n);
        }
    }

    @Override
    public void combine(ColumnAccumulator other) {
        if (!(other instanceof CategoricalAccumulator)) {
            throw new IllegalArgumentException("Cannot combine categorical accumulator with " + other.kind());
        }
        CategoricalAccumulator that = (CategoricalAccumulator) other;
        rowsSeen += that.rowsSeen;
        missing += that.missing;
        this.other += that.other;
        for (Map.Entry<String, Long> entry : that.counts.entrySet()) {
            add(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public CategoricalAccumulator copy() {
        CategoricalAccumulator copy = new CategoricalAccumulator(maxDistinct);
        copy.counts.putAll(counts);
        copy.rowsSeen = rowsSeen;
        copy.missing = missing;
        copy.other = other;
        return copy;
    }

    /// Finalizes the table, keeping the `topK` most frequent values.
    ///
    /// Ties are broken by first-seen order.
    public CategoricalSummary summarize(int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        return new CategoricalSummary(
            counts.size(),
            topValues(topK),
            totalCount(),
            missing,
            other);
    }

    /// @return the `k` most frequent values, count descending, ties in first-seen order
    public List<ValueCount> topValues(int k) {
        List<ValueCount> all = new ArrayList<>(counts.size());
        counts.forEach((value, count) -> all.add(new ValueCount(value, count)));
        // List.sort is stable
        all.sort(Comparator.comparingLong(ValueCount::count).reversed());
        return all.subList(0, Math.min(k, all.size()));
    }

    /// @return an unmodifiable view of the tracked values in first-seen order
    public Map<String, Long> counts() {
        return Collections.unmodifiableMap(counts);
    }

    public long count(String value) {
        return counts.getOrDefault(value, 0L);
    }

    /// @return non-missing cells counted, the `other` bucket included
    public long totalCount() {
        long total = other;
        for (long c : counts.values()) {
            total += c;
        }
        return total;
    }

    public long otherCount() {
        return other;
    }

    public int distinctCount() {
        return counts.size();
    }

    @Override
    public long rowsSeen() {
        return rowsSeen;
    }

    @Override
    public long missingCount() {
        return missing;
    }

    @Override
    public String toString() {
        return "CategoricalAccumulator[distinct=" + counts.size() + ", total=" + totalCount()
            + ", missing=" + missing + ", other=" + other + "]";
    }
}
