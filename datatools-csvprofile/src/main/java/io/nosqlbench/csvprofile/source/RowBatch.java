package io.nosqlbench.csvprofile.source;

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

import java.util.List;

/// A bounded group of consecutive data rows, folded into accumulators and then discarded.
///
/// Well-formed rows hold exactly one normalized cell per schema column.
/// Malformed rows are only described, never carried.
///
/// @param firstRowNumber 1-based number of the first row of the batch within its pass
/// @param rows well-formed rows in file order
/// @param malformed rows skipped for a field-count mismatch
/// @param undecodableRows numbers of the rows, well-formed or not, whose bytes
///     were not valid in the file encoding and were decoded with replacement characters
public record RowBatch(
    long firstRowNumber,
    List<String[]> rows,
    List<MalformedRow> malformed,
    List<Long> undecodableRows
) {

    public RowBatch {
        rows = List.copyOf(rows);
        malformed = List.copyOf(malformed);
        undecodableRows = List.copyOf(undecodableRows);
    }

    public RowBatch(long firstRowNumber, List<String[]> rows, List<MalformedRow> malformed) {
        this(firstRowNumber, rows, malformed, List.of());
    }

    /// @return every row read into this batch, malformed ones included
    public int rowCount() {
        return rows.size() + malformed.size();
    }

    public boolean isEmpty() {
        return rowCount() == 0;
    }
}
