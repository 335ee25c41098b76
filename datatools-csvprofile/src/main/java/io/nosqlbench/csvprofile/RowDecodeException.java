package io.nosqlbench.csvprofile;

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

/// Raised when a data row does not have as many fields as the header, or ends
/// inside a quoted cell.
///
/// Row sources recover from this by recording the row as malformed; it never
/// aborts a pass.
public class RowDecodeException extends CsvProfileException {

    private final int fieldCount;
    private final int expectedFieldCount;

    public RowDecodeException(int fieldCount, int expectedFieldCount) {
        super("row has " + fieldCount + " fields, header has " + expectedFieldCount);
        this.fieldCount = fieldCount;
        this.expectedFieldCount = expectedFieldCount;
    }

    /// @param fieldCount fields found by splitting on the bare separator
    /// @param expectedFieldCount fields in the header, or -1 when not known yet
    public RowDecodeException(String message, int fieldCount, int expectedFieldCount) {
        super(message);
        this.fieldCount = fieldCount;
        this.expectedFieldCount = expectedFieldCount;
    }

    public int getFieldCount() {
        return fieldCount;
    }

    public int getExpectedFieldCount() {
        return expectedFieldCount;
    }
}
