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

import com.google.gson.annotations.SerializedName;

/// A data row skipped because its field count differs from the header's.
///
/// @param rowNumber 1-based row number within the pass, header excluded
/// @param fieldCount fields found on the row
/// @param expectedFieldCount fields in the header
public record MalformedRow(
    @SerializedName("row_number") long rowNumber,
    @SerializedName("field_count") int fieldCount,
    @SerializedName("expected_field_count") int expectedFieldCount
) {
}
