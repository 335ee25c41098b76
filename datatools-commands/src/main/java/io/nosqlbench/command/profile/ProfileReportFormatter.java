package io.nosqlbench.command.profile;

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

import io.nosqlbench.csvprofile.accumulate.CategoricalSummary;
import io.nosqlbench.csvprofile.accumulate.NumericSummary;
import io.nosqlbench.csvprofile.accumulate.ValueCount;
import io.nosqlbench.csvprofile.aggregate.AggregationResult;
import io.nosqlbench.csvprofile.sniff.FileProfile;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/// Renders an [AggregationResult] as a plain text report.
///
/// ## Layout
///
/// ```text
/// ================================================================================
/// CSV PROFILE REPORT
/// ================================================================================
///
/// FILE INFORMATION:        path, encoding, separator, row and column counts
/// COLUMN INFORMATION:      kind of every column
/// SAMPLE ROWS:             the first rows of the file
/// NULL VALUE ANALYSIS:     columns with missing values
/// DESCRIPTIVE STATISTICS:  numeric and categorical summaries
/// ```
///
/// With charts enabled, numeric columns get a histogram sparkline of their
/// retained sample and categorical top values get proportional bars.
public final class ProfileReportFormatter {

    private static final String RULE = "=".repeat(80);
    private static final String SECTION_RULE = "-".repeat(40);
    private static final int BAR_WIDTH = 20;

    private final boolean charts;

    public ProfileReportFormatter(boolean charts) {
        this.charts = charts;
    }

    /// @param source the name of the profiled file, as shown in the report
    /// @param result the finished run
    /// @return the report, lines separated by `\n`
    public String format(String source, AggregationResult result) {
        StringBuilder sb = new StringBuilder();
        line(sb, RULE);
        line(sb, "CSV PROFILE REPORT");
        line(sb, RULE);
        line(sb, "");
        appendFileInformation(sb, source, result);
        appendColumnInformation(sb, result);
        appendSampleRows(sb, result);
        appendNullAnalysis(sb, result);
        appendStatistics(sb, result);
        return sb.toString();
    }

    private void appendFileInformation(StringBuilder sb, String source, AggregationResult result) {
        FileProfile profile = result.getFileProfile();
        section(sb, "FILE INFORMATION");
        line(sb, "File path: " + source);
        line(sb, fmt("Encoding: %s (confidence %.2f%s)",
            profile.encoding(), profile.encodingConfidence(), profile.encodingFallback() ? ", fallback" : ""));
        line(sb, "Separator: '" + profile.separatorLabel() + "'");
        line(sb, fmt("Total rows: %,d", result.getTotalRows()));
        line(sb, fmt("Malformed rows: %,d", result.getMalformedRows()));
        line(sb, fmt("Undecodable rows: %,d", result.getDecodeErrors()));
        line(sb, "Total columns: " + result.getSchema().size());
        line(sb, fmt("File size: %.1f MB", profile.fileSizeBytes() / (1024.0 * 1024.0)));
        line(sb, fmt("Elapsed: %,d ms", result.getElapsedMillis()));
        line(sb, "");
    }

    private void appendColumnInformation(StringBuilder sb, AggregationResult result) {
        section(sb, "COLUMN INFORMATION");
        result.getColumnKinds().forEach((column, kind) -> line(sb, column + ": " + kind.name().toLowerCase(Locale.ROOT)));
        line(sb, "");
    }

    private void appendSampleRows(StringBuilder sb, AggregationResult result) {
        List<List<String>> rows = result.getSampleRows();
        if (rows.isEmpty()) {
            return;
        }
        section(sb, "SAMPLE ROWS");
        line(sb, "  " + String.join(" | ", result.getSchema().names()));
        for (List<String> row : rows) {
            line(sb, "  " + String.join(" | ", row));
        }
        line(sb, "");
    }

    private void appendNullAnalysis(StringBuilder sb, AggregationResult result) {
        section(sb, "NULL VALUE ANALYSIS");
        boolean any = false;
        for (Map.Entry<String, Double> entry : result.getNullPercentages().entrySet()) {
            if (entry.getValue() > 0) {
                any = true;
                line(sb, fmt("%s: %.2f%% null values (%,d)",
                    entry.getKey(), entry.getValue(), result.getNullCounts().get(entry.getKey())));
            }
        }
        if (!any) {
            line(sb, "No null values");
        }
        line(sb, "");
    }

    private void appendStatistics(StringBuilder sb, AggregationResult result) {
        section(sb, "DESCRIPTIVE STATISTICS");
        if (!result.getNumericStats().isEmpty()) {
            line(sb, "Numeric Columns:");
            result.getNumericStats().forEach((column, stats) -> appendNumeric(sb, column, stats));
        }
        if (!result.getCategoricalStats().isEmpty()) {
            if (!result.getNumericStats().isEmpty()) {
                line(sb, "");
            }
            line(sb, "Categorical Columns:");
            result.getCategoricalStats().forEach((column, stats) -> appendCategorical(sb, column, stats));
        }
    }

    private void appendNumeric(StringBuilder sb, String column, NumericSummary stats) {
        line(sb, "  " + column + ":");
        line(sb, fmt("    Count: %,d", stats.count()));
        line(sb, "    Sum: " + number(OptionalDouble.of(stats.sum())));
        line(sb, "    Mean: " + number(stats.mean()));
        line(sb, "    Std dev: " + number(stats.stdDev()));
        line(sb, "    Min: " + number(stats.min()));
        line(sb, "    Max: " + number(stats.max()));
        line(sb, "    Quartiles: " + number(stats.lowerQuartile()) + " / "
            + number(stats.median()) + " / " + number(stats.upperQuartile()));
        if (stats.rejectedCount() > 0) {
            line(sb, fmt("    Rejected: %,d", stats.rejectedCount()));
        }
        if (charts && stats.sampleSize() > 0) {
            line(sb, "    Distribution: " + Sparkline.histogram(stats.sample(), Sparkline.DEFAULT_WIDTH));
        }
    }

    private void appendCategorical(StringBuilder sb, String column, CategoricalSummary stats) {
        line(sb, "  " + column + ":");
        line(sb, fmt("    Unique values: %,d", stats.uniqueCount()));
        if (stats.otherCount() > 0) {
            line(sb, fmt("    Untracked values: %,d", stats.otherCount()));
        }
        List<ValueCount> top = stats.topValues();
        if (top.isEmpty()) {
            return;
        }
        line(sb, "    Top " + top.size() + " values:");
        long maxCount = top.get(0).count();
        for (ValueCount entry : top) {
            String text = fmt("      %s: %,d", entry.value(), entry.count());
            if (charts) {
                text += "  " + Sparkline.bar(entry.count(), maxCount, BAR_WIDTH);
            }
            line(sb, text);
        }
    }

    private static String number(OptionalDouble value) {
        return value.isPresent() ? fmt("%.4f", value.getAsDouble()) : "undefined";
    }

    private static void section(StringBuilder sb, String title) {
        line(sb, title + ":");
        line(sb, SECTION_RULE);
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(text).append('\n');
    }

    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
