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

import io.nosqlbench.csvprofile.FileAccessException;
import io.nosqlbench.csvprofile.FormatDetectionException;
import io.nosqlbench.csvprofile.aggregate.AggregationResult;
import io.nosqlbench.csvprofile.aggregate.StreamingAggregator;
import io.nosqlbench.csvprofile.config.ProfileConfig;
import io.nosqlbench.csvprofile.observe.LoggingProfileObserver;
import io.nosqlbench.csvprofile.observe.NdjsonProfileObserver;
import io.nosqlbench.csvprofile.observe.ProfileObserver;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Profile the columns of a delimited text file.
///
/// Detects the encoding and separator of the file, then streams it in chunks to
/// compute null rates, numeric statistics and categorical frequency tables
/// without loading the file into memory.
///
/// ## Usage
///
/// ```bash
/// # Print a report
/// csvprofile profile --input data.csv
///
/// # Four worker threads, JSON and report files, event trace
/// csvprofile profile -i data.csv --parallelism 4 --json profile.json \
///     --report report.txt --trace events.ndjson
///
/// # Settings from a file, overridden on the command line
/// csvprofile profile -i data.csv --config profile.json --chunk-size 50000
/// ```
@CommandLine.Command(
    name = "profile",
    header = "Profile the columns of a delimited text file",
    description = "Detects encoding and separator, then computes per-column null rates, numeric statistics "
        + "and categorical frequencies in bounded memory.",
    mixinStandardHelpOptions = true,
    exitCodeList = {
        "0: Success",
        "1: Error reading or profiling the file",
        "2: Invalid options or settings"
    }
)
public class CMD_profile implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_profile.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    @CommandLine.Option(
        names = {"--input", "-i"},
        description = "Path to the delimited text file",
        required = true
    )
    private Path inputPath;

    @CommandLine.Option(
        names = {"--config"},
        description = "JSON settings file (snake_case keys, all optional)"
    )
    private Path configPath;

    @CommandLine.Option(
        names = {"--chunk-size"},
        description = "Rows per batch, overriding the settings file"
    )
    private Integer chunkSize;

    @CommandLine.Option(
        names = {"--parallelism"},
        description = "Worker threads for reading byte ranges of the file"
    )
    private Integer parallelism;

    @CommandLine.Option(
        names = {"--top-k"},
        description = "Most frequent values reported per categorical column"
    )
    private Integer topK;

    @CommandLine.Option(
        names = {"--max-distinct"},
        description = "Distinct values tracked per categorical column, 0 for unlimited"
    )
    private Integer maxDistinct;

    @CommandLine.Option(
        names = {"--json"},
        description = "Write the full result as JSON to this file"
    )
    private Path jsonPath;

    @CommandLine.Option(
        names = {"--report"},
        description = "Write the text report to this file"
    )
    private Path reportPath;

    @CommandLine.Option(
        names = {"--trace"},
        description = "Write run events as NDJSON to this file"
    )
    private Path tracePath;

    @CommandLine.Option(
        names = {"--no-charts"},
        description = "Leave distribution sparklines and bars out of the report"
    )
    private boolean noCharts = false;

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    /// Run CMD_profile
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_profile()).execute(args));
    }

    @Override
    public Integer call() {
        if (verbose && quiet) {
            System.err.println("Error: Cannot specify both --verbose and --quiet options");
            return EXIT_USAGE;
        }
        configureLogging();

        ProfileConfig config;
        try {
            config = resolveConfig();
        } catch (IOException e) {
            logger.error("Failed to load settings from {}", configPath, e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            for (String problem : problems) {
                System.err.println("Error: " + problem);
            }
            return EXIT_USAGE;
        }

        try (NdjsonProfileObserver trace = tracePath != null ? new NdjsonProfileObserver(tracePath) : null) {
            ProfileObserver observer = trace != null
                ? ProfileObserver.of(new LoggingProfileObserver(), trace)
                : new LoggingProfileObserver();

            AggregationResult result = new StreamingAggregator(config, observer).run(inputPath);

            String report = new ProfileReportFormatter(!noCharts).format(inputPath.toString(), result);
            if (!quiet) {
                System.out.print(report);
            }
            if (reportPath != null) {
                Files.writeString(reportPath, report, StandardCharsets.UTF_8);
                logger.info("Report written to {}", reportPath);
            }
            if (jsonPath != null) {
                Files.writeString(jsonPath, result.toJson(), StandardCharsets.UTF_8);
                logger.info("JSON result written to {}", jsonPath);
            }
            return EXIT_OK;
        } catch (FormatDetectionException e) {
            logger.error("Could not detect the format of {}: {}", inputPath, e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (FileAccessException e) {
            logger.error("Could not read {}", e.getPath(), e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Error writing output", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private ProfileConfig resolveConfig() throws IOException {
        ProfileConfig base = configPath != null ? ProfileConfig.load(configPath) : ProfileConfig.defaults();
        ProfileConfig.Builder builder = base.toBuilder();
        if (chunkSize != null) {
            builder.chunkSize(chunkSize);
        }
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        if (topK != null) {
            builder.topK(topK);
        }
        if (maxDistinct != null) {
            builder.maxDistinctValues(maxDistinct);
        }
        return builder.build();
    }

    private void configureLogging() {
        if (verbose) {
            Configurator.setLevel("io.nosqlbench", Level.DEBUG);
        } else if (quiet) {
            Configurator.setLevel("io.nosqlbench", Level.WARN);
        }
    }
}
