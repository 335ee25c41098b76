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
import java.util.Arrays;
import java.util.List;

/// Infers one [ColumnKind] per column from every non-missing value of the file.
///
/// A column is [ColumnKind#NUMERIC] when it has at least one non-missing value and
/// all of them are decimal numbers; otherwise it is [ColumnKind#CATEGORICAL].
/// Combining is a per-column logical AND, so the outcome does not depend on how
/// the rows were chunked.
public final class ColumnTypeTracker {

    private final boolean[] allNumeric;
    private final long[] present;

    public ColumnTypeTracker(int columns) {
        if (columns < 1) {
            throw new IllegalArgumentException("columns must be positive: " + columns);
        }
        this.allNumeric = new boolean[columns];
        this.present = new long[columns];
        Arrays.fill(allNumeric, true);
    }

    public void accept(String[] row) {
        if (row.length != allNumeric.length) {
            throw new IllegalArgumentException("row has " + row.length + " cells, expected " + allNumeric.length);
        }
        for (int i = 0; i < row.length; i++) {
            String cell = row[i];
            if (CellValues.isMissing(cell)) {
                continue;
            }
            present[i]++;
            if (allNumeric[i] && !CellValues.isNumber(cell)) {
                allNumeric[i] = false;
            }
        }
    }

    public void combine(ColumnTypeTracker other) {
        if (other.allNumeric.length != allNumeric.length) {
            throw new IllegalArgumentException(
                "Cannot combine trackers for " + allNumeric.length + " and " + other.allNumeric.length + " columns");
        }
        for (int i = 0; i < allNumeric.length; i++) {
            allNumeric[i] &= other.allNumeric[i];
            present[i] += other.present[i];
        }
    }

    public ColumnKind kind(int column) {
        return allNumeric[column] && present[column] > 0 ? ColumnKind.NUMERIC : ColumnKind.CATEGORICAL;
    }

    /// @return the inferred kinds in column order
    public List<ColumnKind> kinds() {
        List<ColumnKind> kinds = new ArrayList<>(allNumeric.length);
        for (int i = 0; i < allNumeric.length; i++) {
            kinds.add(kind(i));
        }
        return List.copyOf(kinds);
    }

    public int columnCount() {
        return allNumeric.length;
    }
}
