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

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.ICSVParser;
import io.nosqlbench.csvprofile.RowDecodeException;

import java.io.IOException;

/// Splits one physical line into cells with an opencsv [CSVParser] and trims
/// every cell.
///
/// Quoting follows RFC 4180 within a line: a quoted cell may contain the
/// separator, and doubled quotes inside it stand for one quote:
///
/// ```text
///   1,"Smith, John",3      → 1 | Smith, John | 3
///   "say ""hi""",x         → say "hi" | x
///   a,"",                  → a | (empty) | (empty)
/// ```
///
/// Backslash has no special meaning. A quoted cell is never continued on the
/// next line, since every row must start on its own line for byte ranges to
/// stay row-aligned; a line that ends inside quotes is rejected.
///
/// Instances hold parser state and are not thread-safe.
public final class RowSplitter {

    private final char separator;
    private final CSVParser parser;

    public RowSplitter(char separator) {
        this.separator = separator;
        this.parser = new CSVParserBuilder()
            .withSeparator(separator)
            .withQuoteChar(ICSVParser.DEFAULT_QUOTE_CHARACTER)
            .withEscapeChar(ICSVParser.NULL_CHARACTER)
            .build();
    }

    public char getSeparator() {
        return separator;
    }

    /// Splits a line into trimmed cells; trailing empty cells are kept.
    ///
    /// @throws RowDecodeException if a quoted cell is not closed before the end of the line
    public String[] split(String line) throws RowDecodeException {
        String[] cells;
        try {
            cells = parser.parseLine(line);
        } catch (IOException e) {
            throw new RowDecodeException("unterminated quoted cell: " + e.getMessage(),
                rawFieldCount(line), -1);
        }
        if (cells == null) {
            return new String[]{""};
        }
        for (int i = 0; i < cells.length; i++) {
            cells[i] = normalize(cells[i]);
        }
        return cells;
    }

    /// Splits a data row and checks its width against the header.
    ///
    /// @throws RowDecodeException if the row does not have `expectedFields` cells
    ///     or ends inside a quoted cell
    public String[] splitRow(String line, int expectedFields) throws RowDecodeException {
        String[] cells;
        try {
            cells = split(line);
        } catch (RowDecodeException e) {
            throw new RowDecodeException(e.getMessage(), e.getFieldCount(), expectedFields);
        }
        if (cells.length != expectedFields) {
            throw new RowDecodeException(cells.length, expectedFields);
        }
        return cells;
    }

    /// Trims a parsed cell; null cells become empty.
    public static String normalize(String cell) {
        return cell == null ? "" : cell.trim();
    }

    private int rawFieldCount(String line) {
        int fields = 1;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == separator) {
                fields++;
            }
        }
        return fields;
    }
}
