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

import io.nosqlbench.csvprofile.aggregate.AggregationResult;
import io.nosqlbench.csvprofile.aggregate.StreamingAggregator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ProfileReportFormatterTest {

    @TempDir
    Path tempDir;

    private AggregationResult profile(String content) throws Exception {
        Path file = tempDir.resolve("data.csv");
        Files.writeString(file, content);
        return new StreamingAggregator().run(file);
    }

    @Test
    void sectionsAppearInOrder() throws Exception {
        String report = new ProfileReportFormatter(false)
            .format("data.csv", profile("id,amount,category\n1,10.5,X\n2,,Y\n3,20.0,\n"));

        assertThat(report).startsWith("=".repeat(80) + "\nCSV PROFILE REPORT\n");
        assertThat(report).containsSubsequence(
            "FILE INFORMATION:",
            "COLUMN INFORMATION:",
            "SAMPLE ROWS:",
            "NULL VALUE ANALYSIS:",
            "DESCRIPTIVE STATISTICS:",
            "Numeric Columns:",
            "Categorical Columns:");
        assertThat(report)
            .contains("File path: data.csv")
            .contains("Separator: ','")
            .contains("Total columns: 3")
            .contains("Undecodable rows: 0")
            .contains("  1 | 10.5 | X")
            .contains("    Sum: 30.5000")
            .contains("    Std dev: 6.7175")
            .contains("    Quartiles: 12.8750 / 15.2500 / 17.6250")
            .contains("      X: 1")
            .doesNotContain("Distribution:")
            .doesNotContain("\u2588");
    }

    @Test
    void undefinedStatisticsAreSpelledOut() throws Exception {
        String report = new ProfileReportFormatter(true).format("one.csv", profile("v\n4\n"));
        assertThat(report)
            .contains("    Mean: 4.0000")
            .contains("    Std dev: undefined")
            .contains("No null values")
            .contains("    Distribution: ");
    }

    @Test
    void chartsAddBarsToTopValues() throws Exception {
        String report = new ProfileReportFormatter(true).format("c.csv", profile("c\na\na\nb\n"));
        assertThat(report)
            .contains("      a: 2  " + "\u2588".repeat(20))
            .contains("      b: 1  " + "\u2588".repeat(10));
    }

    @Test
    void tabSeparatorIsSpelledOut() throws Exception {
        String report = new ProfileReportFormatter(false).format("t.tsv", profile("a\tb\n1\t2\n"));
        assertThat(report).contains("Separator: '\\t'");
    }
}
