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

import io.nosqlbench.csvprofile.source.RowBatch;

/// One full read of the input, folding every batch into a mergeable state.
///
/// ## Lifecycle
///
/// ```
/// 1. newState()                 - once per shard
/// 2. fold(state, batch, shard)  - for each batch of that shard, in file order
/// 3. combine(into, from)        - once per extra shard, in range order
/// ```
///
/// A state is confined to the thread reading its shard, so implementations need
/// no synchronization. `combine` must give the same result as folding the
/// batches of both shards into one state in file order.
///
/// @param <S> the per-shard state
/// @see PassRunner
public interface AggregationPass<S> {

    PassKind kind();

    /// @return an empty state
    S newState();

    /// Folds one batch into a state. The batch is not retained.
    ///
    /// @param state the state of the shard the batch came from
    /// @param batch the batch to fold
    /// @param shardId identifier of the shard, for events
    void fold(S state, RowBatch batch, String shardId);

    /// Adds the state of a later shard into the state of an earlier one.
    void combine(S into, S from);

    /// @return rows folded into the state, malformed rows included
    long rowsSeen(S state);
}
