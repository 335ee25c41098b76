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

import java.util.regex.Pattern;

/// Classification of single cell values shared by every tracker and accumulator.
///
/// ## Missing Values
///
/// Cells arrive normalized by [io.nosqlbench.csvprofile.source.RowSplitter], so a
/// value is missing when it is null or blank. Placeholders such as `NA` or `null`
/// are ordinary values.
///
/// ## Numbers
///
/// Only plain decimal notation is numeric: an optional sign, digits with an
/// optional fraction, and an optional exponent. `NaN`, `Infinity`, hex floats and
/// the `d`/`f` suffixes accepted by [Double#parseDouble] are not. A value whose
/// magnitude overflows a double, such as `1e999`, is not a number either.
public final class CellValues {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private CellValues() {
    }

    public static boolean isMissing(String cell) {
        return cell == null || cell.isBlank();
    }

    public static boolean isNumber(String cell) {
        if (cell == null) {
            return false;
        }
        String trimmed = cell.trim();
        return DECIMAL.matcher(trimmed).matches() && Double.isFinite(Double.parseDouble(trimmed));
    }

    /// Parses a decimal number.
    ///
    /// @throws NumberFormatException if the cell is not in decimal notation
    public static double parseNumber(String cell) {
        if (!isNumber(cell)) {
            throw new NumberFormatException("not a decimal number: '" + cell + "'");
        }
        return Double.parseDouble(cell.trim());
    }
}
