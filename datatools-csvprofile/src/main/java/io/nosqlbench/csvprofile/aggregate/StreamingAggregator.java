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

import io.nosqlbench.csvprofile.FileAccessException;
import io.nosqlbench.csvprofile.FormatDetectionException;
import io.nosqlbench.csvprofile.accumulate.CategoricalAccumulator;
import io.nosqlbench.csvprofile.accumulate.CategoricalSummary;
import io.nosqlbench.csvprofile.accumulate.ColumnAccumulator;
import io.nosqlbench.csvprofile.accumulate.ColumnKind;
import io.nosqlbench.csvprofile.accumulate.NullTracker;
import io.nosqlbench.csvprofile.accumulate.NumericAccumulator;
import io.nosqlbench.csvprofile.accumulate.NumericSummary;
import io.nosqlbench.csvprofile.config.ProfileConfig;
import io.nosqlbench.csvprofile.observe.ProfileObserver;
import io.nosqlbench.csvprofile.sniff.FileProfile;
import io.nosqlbench.csvprofile.sniff.FormatSniffer;
import io.nosqlbench.csvprofile.source.ByteRange;
import io.nosqlbench.csvprofile.source.ByteRangeSplitter;
import io.nosqlbench.csvprofile.source.ChunkedRowSource;
import io.nosqlbench.csvprofile.source.ColumnSchema;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Profiles a delimited file in a fixed number of streaming passes.
 *
 * <h2>Passes</h2>
 *
 * <pre>{@code
 *   sniff ──► FileProfile
 *     │
 *     ▼
 *   COUNT       total rows, malformed rows, sample rows
 *     │
 *     ▼
 *   PROFILE     missing values, column kinds
 *     │
 *     ▼
 *   STATISTICS  numeric and categorical accumulators
 *     │
 *     ▼
 *   AggregationResult
 * }</pre>
 *
 * <p>Every pass reopens the file and reads it from the first data row; batches
 * are discarded as soon as they are folded. Column kinds are fixed for the whole
 * file before the statistics pass starts.
 *
 * <h2>Concurrency Model</h2>
 *
 * <p>With {@code parallelism > 1} and an encoding whose line feed is a single
 * byte, every pass is split into byte ranges read by a pool owned by the run.
 * Shard states are merged in range order, so the result equals the sequential
 * one. Other encodings are always read sequentially.
 *
 * <h2>Error Handling</h2>
 *
 * <p>Malformed rows are counted and reported, never fatal. A file that cannot be
 * read, or whose row count changes between passes, fails the run with
 * {@link FileAccessException}. A failed run returns nothing: open cursors are
 * closed, the pool is shut down and partial state is dropped.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ProfileConfig config = ProfileConfig.builder().chunkSize(5_000).build();
 * AggregationResult result = new StreamingAggregator(config, new LoggingProfileObserver())
 *     .run(Path.of("data.csv"));
 * }</pre>
 *
 * <p>An aggregator holds no state between runs and may be reused.
 */
public final class StreamingAggregator {

    private final ProfileConfig config;
    private final ProfileObserver observer;
    private final FormatSniffer sniffer;

    /**
     * Creates an aggregator with default settings and no observer.
     */
    public StreamingAggregator() {
        this(ProfileConfig.defaults());
    }

    /**
     * Creates an aggregator without an observer.
     *
     * @param config the run settings
     * @throws IllegalArgumentException if the settings are invalid
     */
    public StreamingAggregator(ProfileConfig config) {
        this(config, ProfileObserver.NOOP);
    }

    /**
     * Creates an aggregator reporting to an observer.
     *
     * @param config the run settings
     * @param observer receiver of run events
     * @throws IllegalArgumentException if the settings are invalid
     */
    public StreamingAggregator(ProfileConfig config, ProfileObserver observer) {
        this.config = Objects.requireNonNull(config, "config cannot be null").requireValid();
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
        this.sniffer = new FormatSniffer(this.config);
    }

    /**
     * Profiles a file.
     *
     * @param path the delimited file
     * @return the complete result
     * @throws FormatDetectionException if the file is empty or its format cannot be detected
     * @throws FileAccessException if the file cannot be read or changes during the run
     */
    public AggregationResult run(Path path) throws FormatDetectionException {
        long startTime = System.currentTimeMillis();
        FileProfile profile = sniffer.sniff(path);
        observer.onFormatDetected(path.toString(), profile);
        return run(ChunkedRowSource.open(path, profile), startTime);
    }

    /**
     * Profiles an already opened source, skipping format detection.
     *
     * @param source the source to profile
     * @return the complete result
     * @throws FileAccessException if the file cannot be read or changes during the run
     */
    public AggregationResult run(ChunkedRowSource source) {
        return run(source, System.currentTimeMillis());
    }

    private AggregationResult run(ChunkedRowSource source, long startTime) {
        List<ChunkedRowSource> shards = shardsOf(source);
        ColumnSchema schema = source.getSchema();
        ExecutorService executor = shards.size() > 1 ? Executors.newFixedThreadPool(shards.size()) : null;
        try {
            PassRunner runner = new PassRunner(executor, config.getChunkSize(), observer);

            CountingPass.State counts = runner.run(new CountingPass(config.getSampleRows(), observer), shards);

            ProfilingPass.State profiled = runner.run(new ProfilingPass(schema.size()), shards);
            requireSameRows(source, PassKind.PROFILE, counts.rows(), profiled.rows());
            List<ColumnKind> kinds = profiled.types().kinds();

            StatisticsPass.State stats = runner.run(new StatisticsPass(kinds, config), shards);
            requireSameRows(source, PassKind.STATISTICS, counts.rows(), stats.rows());

            AggregationResult result = buildResult(
                source, counts, profiled.nulls(), kinds, stats, System.currentTimeMillis() - startTime);
            observer.onRunComplete(result);
            return result;
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    private List<ChunkedRowSource> shardsOf(ChunkedRowSource source) {
        int parallelism = config.getParallelism();
        if (parallelism <= 1 || !source.supportsByteRanges() || source.getRange() != null) {
            return List.of(source);
        }
        List<ChunkedRowSource> shards = new ArrayList<>(parallelism);
        for (ByteRange range : ByteRangeSplitter.split(source, parallelism)) {
            shards.add(source.withRange(range));
        }
        return shards;
    }

    private static void requireSameRows(ChunkedRowSource source, PassKind pass, long expected, long actual) {
        if (expected != actual) {
            throw new FileAccessException(source.getPath(),
                "File changed between passes: count pass saw " + expected + " rows, "
                    + pass.label() + " pass saw " + actual);
        }
    }

    private AggregationResult buildResult(
        ChunkedRowSource source,
        CountingPass.State counts,
        NullTracker nulls,
        List<ColumnKind> kinds,
        StatisticsPass.State stats,
        long elapsedMillis
    ) {
        ColumnSchema schema = source.getSchema();
        Map<String, ColumnKind> columnKinds = new LinkedHashMap<>();
        Map<String, NumericSummary> numeric = new LinkedHashMap<>();
        Map<String, CategoricalSummary> categorical = new LinkedHashMap<>();
        Map<String, Long> nullCounts = new LinkedHashMap<>();
        Map<String, Double> nullPercentages = new LinkedHashMap<>();

        for (int i = 0; i < schema.size(); i++) {
            String name = schema.name(i);
            columnKinds.put(name, kinds.get(i));
            nullCounts.put(name, nulls.nullCount(i));
            nullPercentages.put(name, nulls.nullPercentage(i));

            ColumnAccumulator column = stats.column(i);
            if (column instanceof NumericAccumulator) {
                numeric.put(name, ((NumericAccumulator) column).summarize());
            } else {
                categorical.put(name, ((CategoricalAccumulator) column).summarize(config.getTopK()));
            }
        }

        return new AggregationResult(
            counts.rows(),
            counts.malformed(),
            counts.decodeErrors(),
            source.getProfile(),
            schema,
            columnKinds,
            numeric,
            categorical,
            nullCounts,
            nullPercentages,
            counts.sample(),
            elapsedMillis);
    }

    public ProfileConfig getConfig() {
        return config;
    }
}
