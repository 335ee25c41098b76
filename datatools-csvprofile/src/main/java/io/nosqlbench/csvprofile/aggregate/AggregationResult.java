package io.nosqlbench.csvprofile.aggregate;

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
import io.nosqlbench.csvprofile.accumulate.CategoricalSummary;
import io.nosqlbench.csvprofile.accumulate.ColumnKind;
import io.nosqlbench.csvprofile.accumulate.NumericSummary;
import io.nosqlbench.csvprofile.config.ProfileGsonConfig;
import io.nosqlbench.csvprofile.sniff.FileProfile;
import io.nosqlbench.csvprofile.source.ColumnSchema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The complete, immutable outcome of one profiling run.
 *
 * <h2>Contents</h2>
 *
 * <p>Every per-column map is keyed by column name and iterates in column order.
 * A column appears in exactly one of {@link #getNumericStats()} and
 * {@link #getCategoricalStats()}, matching its entry in {@link #getColumnKinds()}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * AggregationResult result = new StreamingAggregator(config).run(path);
 *
 * NumericSummary amount = result.getNumericStats().get("amount");
 * amount.mean().ifPresent(mean -> System.out.println("mean " + mean));
 *
 * // Export
 * String json = result.toJson();
 * }</pre>
 *
 * @see StreamingAggregator
 */
public final class AggregationResult {

    @SerializedName("total_rows")
    private final long totalRows;

    @SerializedName("malformed_rows")
    private final long malformedRows;

    @SerializedName("decode_errors")
    private final long decodeErrors;

    @SerializedName("file_profile")
    private final FileProfile fileProfile;

    @SerializedName("columns")
    private final List<String> columns;

    @SerializedName("column_kinds")
    private final Map<String, ColumnKind> columnKinds;

    @SerializedName("numeric_stats")
    private final Map<String, NumericSummary> numericStats;

    @SerializedName("categorical_stats")
    private final Map<String, CategoricalSummary> categoricalStats;

    @SerializedName("null_counts")
    private final Map<String, Long> nullCounts;

    @SerializedName("null_percentages")
    private final Map<String, Double> nullPercentages;

    @SerializedName("sample_rows")
    private final List<List<String>> sampleRows;

    @SerializedName("elapsed_millis")
    private final long elapsedMillis;

    AggregationResult(
        long totalRows,
        long malformedRows,
        long decodeErrors,
        FileProfile fileProfile,
        ColumnSchema schema,
        Map<String, ColumnKind> columnKinds,
        Map<String, NumericSummary> numericStats,
        Map<String, CategoricalSummary> categoricalStats,
        Map<String, Long> nullCounts,
        Map<String, Double> nullPercentages,
        List<String[]> sampleRows,
        long elapsedMillis
    ) {
        this.totalRows = totalRows;
        this.malformedRows = malformedRows;
        this.decodeErrors = decodeErrors;
        this.fileProfile = Objects.requireNonNull(fileProfile, "fileProfile cannot be null");
        this.columns = schema.names();
        this.columnKinds = Collections.unmodifiableMap(new LinkedHashMap<>(columnKinds));
        this.numericStats = Collections.unmodifiableMap(new LinkedHashMap<>(numericStats));
        this.categoricalStats = Collections.unmodifiableMap(new LinkedHashMap<>(categoricalStats));
        this.nullCounts = Collections.unmodifiableMap(new LinkedHashMap<>(nullCounts));
        this.nullPercentages = Collections.unmodifiableMap(new LinkedHashMap<>(nullPercentages));
        List<List<String>> rows = new ArrayList<>(sampleRows.size());
        for (String[] row : sampleRows) {
            rows.add(List.copyOf(Arrays.asList(row)));
        }
        this.sampleRows = Collections.unmodifiableList(rows);
        this.elapsedMillis = elapsedMillis;
    }

    /// @return data rows in the file, malformed rows included
    public long getTotalRows() {
        return totalRows;
    }

    public long getMalformedRows() {
        return malformedRows;
    }

    /// @return rows holding bytes invalid in the detected encoding, profiled with U+FFFD in their place
    public long getDecodeErrors() {
        return decodeErrors;
    }

    /// @return rows that contributed to column statistics
    public long getRowsProcessed() {
        return totalRows - malformedRows;
    }

    public FileProfile getFileProfile() {
        return fileProfile;
    }

    public ColumnSchema getSchema() {
        return new ColumnSchema(columns);
    }

    public Map<String, ColumnKind> getColumnKinds() {
        return columnKinds;
    }

    public Map<String, NumericSummary> getNumericStats() {
        return numericStats;
    }

    public Map<String, CategoricalSummary> getCategoricalStats() {
        return categoricalStats;
    }

    public Map<String, Long> getNullCounts() {
        return nullCounts;
    }

    /// @return missing cells per column as a percentage of well-formed rows
    public Map<String, Double> getNullPercentages() {
        return nullPercentages;
    }

    /// @return the first well-formed rows of the file, cells normalized
    public List<List<String>> getSampleRows() {
        return sampleRows;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /// Serializes the result with the pretty-printing profile Gson.
    public String toJson() {
        return ProfileGsonConfig.gson().toJson(this);
    }

    @Override
    public String toString() {
        return "AggregationResult[totalRows=" + totalRows + ", malformedRows=" + malformedRows
            + ", decodeErrors=" + decodeErrors
            + ", columns=" + columns.size() + ", elapsedMillis=" + elapsedMillis + "]";
    }
}
