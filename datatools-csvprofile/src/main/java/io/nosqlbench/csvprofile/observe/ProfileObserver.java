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
import io.nosqlbench.csvprofile.config.ProfileGsonConfig;
import io.nosqlbench.csvprofile.sniff.FileProfile;
import io.nosqlbench.csvprofile.source.MalformedRow;

import java.util.List;

/// Observer interface for monitoring a profiling run.
///
/// ## Purpose
///
/// The aggregation engine has no logger of its own. Everything a caller may want
/// to see about a run is delivered here as an explicit event:
///
/// ```text
///   onFormatDetected ──► once, after sniffing
///
///   For each pass COUNT, PROFILE, STATISTICS:
///
///   ┌─────────────┐
///   │ onPassStart │
///   └─────────────┘
///          │
///          ▼
///   ┌────────────────┐   ┌────────────────┐
///   │ onBatchFolded  │ + │ onMalformedRow │ ──► COUNT pass only
///   │ (per batch)    │   │ onDecodeError  │
///   └────────────────┘   └────────────────┘
///          │
///          ▼
///   ┌────────────────┐
///   │ onPassComplete │
///   └────────────────┘
///
///   onRunComplete ──► once, with the finished result
/// ```
///
/// ## Thread Safety
///
/// With `parallelism > 1`, [#onBatchFolded], [#onMalformedRow] and
/// [#onDecodeError] are called from worker threads concurrently. Implementations must be thread-safe. The
/// default NOOP observer is inherently thread-safe.
///
/// @see LoggingProfileObserver
/// @see NdjsonProfileObserver
public interface ProfileObserver {

    /// No-op observer that does nothing.
    ///
    /// Use this as a default when no observation is needed.
    ProfileObserver NOOP = new ProfileObserver() {
        @Override
        public void onFormatDetected(String sourceId, FileProfile profile) {
            // No-op
        }

        @Override
        public void onPassStart(PassKind pass, int shards) {
            // No-op
        }

        @Override
        public void onBatchFolded(PassKind pass, String shardId, long firstRowNumber, int rows) {
            // No-op
        }

        @Override
        public void onMalformedRow(String shardId, MalformedRow row) {
            // No-op
        }

        @Override
        public void onDecodeError(String shardId, long rowNumber) {
            // No-op
        }

        @Override
        public void onPassComplete(PassKind pass, long rows, long elapsedMillis) {
            // No-op
        }

        @Override
        public void onRunComplete(AggregationResult result) {
            // No-op
        }
    };

    /// Called once the encoding and separator of the input are known.
    ///
    /// @param sourceId the file being profiled
    /// @param profile the detected format
    void onFormatDetected(String sourceId, FileProfile profile);

    /// Called before the first batch of a pass is read.
    ///
    /// @param pass the pass starting
    /// @param shards the number of byte ranges read for this pass, 1 when sequential
    void onPassStart(PassKind pass, int shards);

    /// Called after a batch has been folded into its pass state and released.
    ///
    /// @param pass the running pass
    /// @param shardId the source or byte range the batch came from
    /// @param firstRowNumber row number of the first row in the batch, relative to the shard
    /// @param rows rows in the batch, malformed rows included
    void onBatchFolded(PassKind pass, String shardId, long firstRowNumber, int rows);

    /// Called for each row skipped for a field count mismatch.
    ///
    /// @param shardId the source or byte range the row came from
    /// @param row the malformed row, numbered relative to the shard
    void onMalformedRow(String shardId, MalformedRow row);

    /// Called for each row whose bytes are not valid in the detected encoding.
    ///
    /// The row is still profiled, with U+FFFD in place of the invalid bytes.
    ///
    /// @param shardId the source or byte range the row came from
    /// @param rowNumber the row number, relative to the shard
    void onDecodeError(String shardId, long rowNumber);

    /// Called once every shard of a pass has been read and merged.
    ///
    /// @param pass the finished pass
    /// @param rows rows seen by the pass, malformed rows included
    /// @param elapsedMillis wall time of the pass
    void onPassComplete(PassKind pass, long rows, long elapsedMillis);

    /// Called once with the finished result of a successful run.
    ///
    /// @param result the result returned to the caller
    void onRunComplete(AggregationResult result);

    /// Creates an observer that forwards every event to each given observer in order.
    ///
    /// @param observers the observers to notify
    /// @return a composite observer
    static ProfileObserver of(ProfileObserver... observers) {
        List<ProfileObserver> targets = List.of(observers);
        if (targets.isEmpty()) {
            return NOOP;
        }
        if (targets.size() == 1) {
            return targets.get(0);
        }
        return new CompositeProfileObserver(targets);
    }

    /// Formats an object as a compact (non-pretty-printed) JSON string.
    ///
    /// Useful for NDJSON output where each record should be on a single line.
    ///
    /// @param state the object to format
    /// @return compact JSON string representation
    static String toCompactJson(Object state) {
        return ProfileGsonConfig.compactGson().toJson(state);
    }
}
