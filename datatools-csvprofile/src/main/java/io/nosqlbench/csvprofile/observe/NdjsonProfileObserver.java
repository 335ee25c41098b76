package io.nosqlbench.csvprofile.observe;

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
import io.nosqlbench.csvprofile.aggregate.PassKind;
import io.nosqlbench.csvprofile.sniff.FileProfile;
import io.nosqlbench.csvprofile.source.MalformedRow;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/// ProfileObserver that writes NDJSON (newline-delimited JSON) trace files.
///
/// ## Output Format
///
/// Each line is a JSON object representing an event:
///
/// ```json
/// {"event":"format_detected","source":"data.csv","profile":{...},"timestamp":1234567890}
/// {"event":"pass_start","pass":"count","shards":1,"timestamp":1234567891}
/// {"event":"batch_folded","pass":"count","shard":"data.csv","first_row":1,"rows":10000,"timestamp":1234567892}
/// {"event":"malformed_row","shard":"data.csv","row":{...},"timestamp":1234567893}
/// {"event":"decode_error","shard":"data.csv","row":1204,"timestamp":1234567893}
/// {"event":"pass_complete","pass":"count","rows":25000,"elapsed_ms":42,"timestamp":1234567894}
/// {"event":"run_complete","total_rows":25000,"malformed_rows":3,"decode_errors":1,"elapsed_ms":131,"timestamp":1234567895}
/// ```
///
/// ## Usage
///
/// ```java
/// try (NdjsonProfileObserver observer = new NdjsonProfileObserver(Path.of("trace.ndjson"))) {
///     AggregationResult result = new StreamingAggregator(config, observer).run(path);
/// }
/// ```
///
/// ## Thread Safety
///
/// This implementation synchronizes writes to ensure thread-safe output.
///
/// @see ProfileObserver
public final class NdjsonProfileObserver implements ProfileObserver, Closeable {

    private final BufferedWriter writer;
    private final Object writeLock = new Object();

    /// Creates an NDJSON trace observer that writes to a file.
    ///
    /// @param outputPath path to write trace output
    /// @throws IOException if the file cannot be opened for writing
    public NdjsonProfileObserver(Path outputPath) throws IOException {
        this.writer = Files.newBufferedWriter(outputPath,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
    }

    /// Creates an NDJSON trace observer that writes to a Writer.
    ///
    /// @param writer the writer to use (caller retains ownership)
    public NdjsonProfileObserver(Writer writer) {
        this.writer = (writer instanceof BufferedWriter bw)
            ? bw
            : new BufferedWriter(writer);
    }

    @Override
    public void onFormatDetected(String sourceId, FileProfile profile) {
        writeEvent(Map.of(
            "event", "format_detected",
            "source", sourceId,
            "profile", profile,
            "timestamp", System.currentTimeMillis()
        ));
    }

    @Override
    public void onPassStart(PassKind pass, int shards) {
        writeEvent(Map.of(
            "event", "pass_start",
            "pass", pass.label(),
            "shards", shards,
            "timestamp", System.currentTimeMillis()
        ));
    }

    @Override
    public void onBatchFolded(PassKind pass, String shardId, long firstRowNumber, int rows) {
        writeEvent(Map.of(
            "event", "batch_folded",
            "pass", pass.label(),
            "shard", shardId,
            "first_row", firstRowNumber,
            "rows", rows,
            "timestamp", System.currentTimeMillis()
        ));
    }

    @Override
    public void onMalformedRow(String shardId, MalformedRow row) {
        writeEvent(Map.of(
            "event", "malformed_row",
            "shard", shardId,
            "row", row,
            "timestamp", System.currentTimeMillis()
        ));
    }

    @Override
    public void onDecodeError(String shardId, long rowNumber) {
        writeEvent(Map.of(
            "event", "decode_error",
            "shard", shardId,
            "row", rowNumber,
            "timestamp", System.currentTimeMillis()
        ));
    }

    @Override
    public void onPassComplete(PassKind pass, long rows, long elapsedMillis) {
        writeEvent(Map.of(
            "event", "pass_complete",
            "pass", pass.label(),
            "rows", rows,
            "elapsed_ms", elapsedMillis,
            "timestamp", System.currentTimeMillis()
        ));
    }

    @Override
    public void onRunComplete(AggregationResult result) {
        writeEvent(Map.of(
            "event", "run_complete",
            "total_rows", result.getTotalRows(),
            "malformed_rows", result.getMalformedRows(),
            "decode_errors", result.getDecodeErrors(),
            "elapsed_ms", result.getElapsedMillis(),
            "timestamp", System.currentTimeMillis()
        ));
    }

    private void writeEvent(Map<String, Object> event) {
        synchronized (writeLock) {
            try {
                writer.write(ProfileObserver.toCompactJson(event));
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write trace event", e);
            }
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
