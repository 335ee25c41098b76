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

import java.util.List;

/// Final statistics of a categorical column.
///
/// @param uniqueCount distinct values tracked
/// @param topValues most frequent values, count descending, ties in first-seen order
/// @param totalCount non-missing cells
/// @param nullCount missing cells
/// @param otherCount cells counted past the distinct value limit
public record CategoricalSummary(
    @SerializedName("unique_count") int uniqueCount,
    @SerializedName("top_values") List<ValueCount> topValues,
    @SerializedName("total_count") long totalCount,
    @SerializedName("null_count") long nullCount,
    @SerializedName("other_count") long otherCount
) {

    public CategoricalSummary {
        topValues = List.copyOf(topValues);
    }
}
