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

import io.nosqlbench.csvprofile.accumulate.ColumnTypeTracker;
import io.nosqlbench.csvprofile.accumulate.NullTracker;
import io.nosqlbench.csvprofile.source.RowBatch;

/// Counts missing values and infers the kind of every column.
public final class ProfilingPass implements AggregationPass<ProfilingPass.State> {

    private final int columns;

    public ProfilingPass(int columns) {
        this.columns = columns;
    }

    @Override
    public PassKind kind() {
        return PassKind.PROFILE;
    }

    @Override
    public State newState() {
        return new State(new NullTracker(columns), new ColumnTypeTracker(columns));
    }

    @Override
    public void fold(State state, RowBatch batch, String shardId) {
        state.rows += batch.rowCount();
        for (String[] row : batch.rows()) {
            state.nulls.accept(row);
            state.types.accept(row);
        }
    }

    @Override
    public void combine(State into, State from) {
        into.rows += from.rows;
        into.nulls.combine(from.nulls);
        into.types.combine(from.types);
    }

    @Override
    public long rowsSeen(State state) {
        return state.rows;
    }

    /// Missing counts and kind evidence of one shard.
    public static final class State {
        private final NullTracker nulls;
        private final ColumnTypeTracker types;
        private long rows;

        State(NullTracker nulls, ColumnTypeTracker types) {
            this.nulls = nulls;
            this.types = types;
        }

        /// @return rows read, malformed rows included
        public long rows() {
            return rows;
        }

        public NullTracker nulls() {
            return nulls;
        }

        public ColumnTypeTracker types() {
            return types;
        }
    }
}
