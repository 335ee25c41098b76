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

import java.util.Arrays;

/// Streaming accumulator for a numeric column.
///
/// ## State
///
/// Tracks count, sum, min and max exactly, and variance with Welford's online
/// algorithm. The running mean below only feeds `M2`; the reported mean is
/// `sum / count`.
///
/// ```
/// For each new value x:
///   n++
///   delta = x - mean
///   mean += delta / n
///   M2 += delta * (x - mean)
/// ```
///
/// Combining two accumulators uses Chan's parallel formula for `M2`, so the
/// result matches a single stream over both inputs up to floating point rounding.
///
/// The first `cap` values seen are kept as a sample for quartile estimates. A
/// combined sample is the concatenation of both samples, truncated to `cap`.
///
/// ## Rejected Values
///
/// Non-missing cells that are not decimal numbers are counted as rejected and
/// contribute nothing else. With column kinds inferred over the whole file this
/// only happens when the file changes between passes.
///
/// @see NumericSummary
public final class NumericAccumulator implements ColumnAccumulator {

    private final int cap;
    private long rowsSeen;
    private long missing;
    private long rejected;
    private long count;
    private double sum;
    private double mean;
    private double m2;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double[] sample = new double[0];
    private int sampleSize;

    /// @param cap maximum number of values retained for quartile estimates, 0 for none
    public NumericAccumulator(int cap) {
        if (cap < 0) {
            throw new IllegalArgumentException("cap must be non-negative: " + cap);
        }
        this.cap = cap;
    }

    @Override
    public ColumnKind kind() {
        return ColumnKind.NUMERIC;
    }

    @Override
    public void accept(String cell) {
        rowsSeen++;
        if (CellValues.isMissing(cell)) {
            missing++;
            return;
        }
        if (!CellValues.isNumber(cell)) {
            rejected++;
            return;
        }
        add(CellValues.parseNumber(cell));
    }

    /// Adds a parsed value. Does not count toward [#rowsSeen()].
    public void add(double value) {
        if (value < min) min = value;
        if (value > max) max = value;
        count++;
        sum += value;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
        if (sampleSize < cap) {
            appendSample(value);
        }
    }

    private void appendSample(double value) {
        if (sampleSize == sample.length) {
            sample = Arrays.copyOf(sample, Math.min(cap, Math.max(16, sample.length * 2)));
        }
        sample[sampleSize++] = value;
    }

    @Override
    public void combine(ColumnAccumulator other) {
        if (!(other instanceof NumericAccumulator)) {
            throw new IllegalArgumentException("Cannot combine numeric accumulator with " + other.kind());
        }
        NumericAccumulator that = (NumericAccumulator) other;
        rowsSeen += that.rowsSeen;
        missing += that.missing;
        rejected += that.rejected;
        for (int i = 0; i < that.sampleSize && sampleSize < cap; i++) {
            appendSample(that.sample[i]);
        }
        if (that.count == 0) {
            return;
        }
        if (count == 0) {
            count = that.count;
            sum = that.sum;
            mean = that.mean;
            m2 = that.m2;
            min = that.min;
            max = that.max;
            return;
        }

        // Chan et al. parallel combination
        double nA = count;
        double nB = that.count;
        double nAB = nA + nB;
        double delta = that.mean - mean;
        m2 = m2 + that.m2 + delta * delta * nA * nB / nAB;
        mean = mean + delta * nB / nAB;
        count += that.count;
        sum += that.sum;
        min = Math.min(min, that.min);
        max = Math.max(max, that.max);
    }

    @Override
    public NumericAccumulator copy() {
        NumericAccumulator copy = new NumericAccumulator(cap);
        copy.rowsSeen = rowsSeen;
        copy.missing = missing;
        copy.rejected = rejected;
        copy.count = count;
        copy.sum = sum;
        copy.mean = mean;
        copy.m2 = m2;
        copy.min = min;
        copy.max = max;
        copy.sample = Arrays.copyOf(sample, sample.length);
        copy.sampleSize = sampleSize;
        return copy;
    }

    /// Finalizes the accumulated state.
    public NumericSummary summarize() {
        return NumericSummary.of(this);
    }

    @Override
    public long rowsSeen() {
        return rowsSeen;
    }

    @Override
    public long missingCount() {
        return missing;
    }

    public long rejectedCount() {
        return rejected;
    }

    public long count() {
        return count;
    }

    public double sum() {
        return sum;
    }

    /// @return the running mean, 0 when nothing was added
    double runningMean() {
        return mean;
    }

    double m2() {
        return m2;
    }

    /// @return the minimum, or positive infinity when nothing was added
    public double min() {
        return min;
    }

    /// @return the maximum, or negative infinity when nothing was added
    public double max() {
        return max;
    }

    public int sampleCap() {
        return cap;
    }

    /// @return a copy of the retained sample in insertion order
    public double[] sample() {
        return Arrays.copyOf(sample, sampleSize);
    }

    @Override
    public String toString() {
        return String.format("NumericAccumulator[count=%d, missing=%d, rejected=%d, sum=%.4f, min=%.4f, max=%.4f, sample=%d/%d]",
            count, missing, rejected, sum, min, max, sampleSize, cap);
    }
}
