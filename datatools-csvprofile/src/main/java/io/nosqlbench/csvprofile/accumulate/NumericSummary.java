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

import com.google.gson.annotations.SerializedName;

import java.util.Arrays;
import java.util.OptionalDouble;

/// Final statistics of a numeric column.
///
/// Values that are undefined for the column are absent rather than zero or NaN:
/// the mean, min and max need one value, the standard deviation and quartiles
/// need enough values to be meaningful. Absent values are omitted from JSON.
///
/// The mean is `sum / count`, so it always agrees with the reported sum.
///
/// Quartiles are estimated from the retained sample with linear interpolation
/// between closest ranks. They are exact when the sample cap is at least the count.
public final class NumericSummary {

    @SerializedName("count")
    private final long count;

    @SerializedName("null_count")
    private final long nullCount;

    @SerializedName("rejected_count")
    private final long rejectedCount;

    @SerializedName("sum")
    private final double sum;

    @SerializedName("mean")
    private final Double mean;

    @SerializedName("min")
    private final Double min;

    @SerializedName("max")
    private final Double max;

    @SerializedName("std_dev")
    private final Double stdDev;

    @SerializedName("q25")
    private final Double lowerQuartile;

    @SerializedName("median")
    private final Double median;

    @SerializedName("q75")
    private final Double upperQuartile;

    @SerializedName("sample_size")
    private final int sampleSize;

    private final transient double[] sample;

    private NumericSummary(NumericAccumulator acc) {
        this.count = acc.count();
        this.nullCount = acc.missingCount();
        this.rejectedCount = acc.rejectedCount();
        this.sum = acc.sum();
        this.sample = acc.sample();
        this.sampleSize = sample.length;
        if (count > 0) {
            this.mean = sum / count;
            this.min = acc.min();
            this.max = acc.max();
        } else {
            this.mean = null;
            this.min = null;
            this.max = null;
        }
        // sample standard deviation, n - 1 denominator
        this.stdDev = count > 1 ? Math.sqrt(acc.m2() / (count - 1)) : null;

        double[] sorted = Arrays.copyOf(sample, sample.length);
        Arrays.sort(sorted);
        this.lowerQuartile = quantile(sorted, 0.25);
        this.median = quantile(sorted, 0.5);
        this.upperQuartile = quantile(sorted, 0.75);
    }

    static NumericSummary of(NumericAccumulator acc) {
        return new NumericSummary(acc);
    }

    static Double quantile(double[] sorted, double q) {
        if (sorted.length == 0) {
            return null;
        }
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    private static OptionalDouble optional(Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public long count() {
        return count;
    }

    /// @return rows whose cell was missing
    public long nullCount() {
        return nullCount;
    }

    public long rejectedCount() {
        return rejectedCount;
    }

    public double sum() {
        return sum;
    }

    /// @return the mean, empty when the column has no values
    public OptionalDouble mean() {
        return optional(mean);
    }

    public OptionalDouble min() {
        return optional(min);
    }

    public OptionalDouble max() {
        return optional(max);
    }

    /// @return the sample standard deviation, empty with fewer than two values
    public OptionalDouble stdDev() {
        return optional(stdDev);
    }

    public OptionalDouble lowerQuartile() {
        return optional(lowerQuartile);
    }

    public OptionalDouble median() {
        return optional(median);
    }

    public OptionalDouble upperQuartile() {
        return optional(upperQuartile);
    }

    public int sampleSize() {
        return sampleSize;
    }

    /// @return the retained values in file order, empty after JSON deserialization
    public double[] sample() {
        return sample == null ? new double[0] : Arrays.copyOf(sample, sample.length);
    }

    @Override
    public String toString() {
        return "NumericSummary[count=" + count + ", nullCount=" + nullCount + ", sum=" + sum
            + ", mean=" + mean + ", min=" + min + ", max=" + max + ", stdDev=" + stdDev + "]";
    }
}
