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

import io.nosqlbench.csvprofile.accumulate.ColumnAccumulator;
import io.nosqlbench.csvprofile.accumulate.ColumnKind;
import io.nosqlbench.csvprofile.config.ProfileConfig;
import io.nosqlbench.csvprofile.source.RowBatch;

import java.util.List;

/// Folds every cell into the accumulator chosen for its column kind.
public final class StatisticsPass implements AggregationPass<StatisticsPass.State> {

    private final List<ColumnKind> kinds;
    private final ProfileConfig config;

    public StatisticsPass(List<ColumnKind> kinds, ProfileConfig config) {
        this.kinds = List.copyOf(kinds);
        this.config = config;
    }

    @Override
    public PassKind kind() {
        return PassKind.STATISTICS;
    }

    @Override
    public State newState() {
        ColumnAccumulator[] columns = new ColumnAccumulator[kinds.size()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = ColumnAccumulator.forKind(kinds.get(i), config);
        }
        return new State(columns);
    }

    @Override
    public void fold(State state, RowBatch batch, String shardId) {
        state.rows += batch.rowCount();
        ColumnAccumulator[] columns = state.columns;
        for (String[] row : batch.rows()) {
            for (int i = 0; i < columns.length; i++) {
                columns[i].accept(row[i]);
            }
        }
    }

    @Override
    public void combine(State into, State from) {
        into.rows += from.rows;
        for (int i = 0; i < into.columns.length; i++) {
            into.columns[i].combine(from.columns[i]);
        }
    }

    @Override
    public long rowsSeen(State state) {
        return state.rows;
    }

    /// Column accumulators of one shard.
    public static final class State {
        private final ColumnAccumulator[] columns;
        private long rows;

        State(ColumnAccumulator[] columns) {
            this.columns = columns;
        }

        /// @return rows read, malformed rows included
        public long rows() {
            return rows;
        }

        public ColumnAccumulator column(int index) {
            return columns[index];
        }

        public int columnCount() {
            return columns.length;
        }
    }
}
