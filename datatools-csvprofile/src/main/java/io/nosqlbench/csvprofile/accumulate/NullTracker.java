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

/// Missing-value counts per column over well-formed rows.
///
/// For every column `nullCount(c) + nonNullCount(c) == rowsProcessed()`.
public final class NullTracker {

    private final long[] missing;
    private long rows;

    public NullTracker(int columns) {
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be positive: " + columns);
        }
        this.missing = new long[columns];
    }

    /// Counts the missing cells of one well-formed row.
    public void accept(String[] row) {
        if (row.length != missing.length) {
            throw new IllegalArgumentException("row has " + row.length + " cells, expected " + missing.length);
        }
        rows++;
        for (int i = 0; i < row.length; i++) {
            if (CellValues.isMissing(row[i])) {
                missing[i]++;
            }
        }
    }

    public void combine(NullTracker other) {
        if (other.missing.length != missing.length) {
            throw new IllegalArgumentException(
                "Cannot combine trackers for " + missing.length + " and " + other.missing.length + " columns");
        }
        rows += other.rows;
        for (int i = 0; i < missing.length; i++) {
            missing[i] += other.missing[i];
        }
    }

    public NullTracker copy() {
        NullTracker copy = new NullTracker(missing.length);
        System.arraycopy(missing, 0, copy.missing, 0, missing.length);
        copy.rows = rows;
        return copy;
    }

    public static NullTracker merge(NullTracker a, NullTracker b) {
        NullTracker merged = a.copy();
        merged.combine(b);
        return merged;
    }

    public int columnCount() {
        return missing.length;
    }

    public long rowsProcessed() {
        return rows;
    }

    public long nullCount(int column) {
        return missing[column];
    }

    public long nonNullCount(int column) {
        return rows - missing[column];
    }

    /// @return missing cells as a percentage of rows processed, 0 when no rows were processed
    public double nullPercentage(int column) {
        return rows == 0 ? 0.0 : 100.0 * missing[column] / rows;
    }

    @Override
    public String toString() {
        return "NullTracker[rows=" + rows + ", missing=" + Arrays.toString(missing) + "]";
    }
}
