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

import io.nosqlbench.csvprofile.observe.ProfileObserver;
import io.nosqlbench.csvprofile.source.MalformedRow;
import io.nosqlbench.csvprofile.source.RowBatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Counts rows, malformed rows and undecodable rows, and keeps the first
/// well-formed rows as a sample.
///
/// Malformed and undecodable rows are reported to the observer here and only
/// here, so each one is reported once per run.
public final class CountingPass implements AggregationPass<CountingPass.State> {

    private final int sampleRows;
    private final ProfileObserver observer;

    public CountingPass(int sampleRows, ProfileObserver observer) {
        if (sampleRows < 0) {
            throw new IllegalArgumentException("sampleRows must be non-negative: " + sampleRows);
        }
        this.sampleRows = sampleRows;
        this.observer = observer;
    }

    @Override
    public PassKind kind() {
        return PassKind.COUNT;
    }

    @Override
    public State newState() {
        return new State();
    }

    @Override
    public void fold(State state, RowBatch batch, String shardId) {
        state.rows += batch.rowCount();
        state.malformed += batch.malformed().size();
        state.decodeErrors += batch.undecodableRows().size();
        for (String[] row : batch.rows()) {
            if (state.sample.size() >= sampleRows) {
                break;
            }
            state.sample.add(Arrays.copyOf(row, row.length));
        }
        for (MalformedRow row : batch.malformed()) {
            observer.onMalformedRow(shardId, row);
        }
        for (Long rowNumber : batch.undecodableRows()) {
            observer.onDecodeError(shardId, rowNumber);
        }
    }

    @Override
    public void combine(State into, State from) {
        into.rows += from.rows;
        into.malformed += from.malformed;
        into.decodeErrors += from.decodeErrors;
        for (String[] row : from.sample) {
            if (into.sample.size() >= sampleRows) {
                break;
            }
            into.sample.add(row);
        }
    }

    @Override
    public long rowsSeen(State state) {
        return state.rows;
    }

    /// Row totals of one shard.
    public static final class State {
        private long rows;
        private long malformed;
        private long decodeErrors;
        private final List<String[]> sample = new ArrayList<>();

        /// @return rows read, malformed rows included
        public long rows() {
            return rows;
        }

        public long malformed() {
            return malformed;
        }

        /// @return rows holding bytes that are invalid in the file encoding
        public long decodeErrors() {
            return decodeErrors;
        }

        /// @return the first well-formed rows in file order
        public List<String[]> sample() {
            return sample;
        }
    }
}
