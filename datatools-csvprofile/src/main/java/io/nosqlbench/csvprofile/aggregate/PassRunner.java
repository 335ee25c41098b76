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
import io.nosqlbench.csvprofile.source.RowBatch;
import io.nosqlbench.csvprofile.source.RowCursor;
import io.nosqlbench.csvprofile.source.RowSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs one {@link AggregationPass} over a list of shards.
 *
 * <h2>Concurrency Model</h2>
 *
 * <p>A single shard is read on the calling thread. With several shards and an
 * executor, each shard is folded into its own state by a separate task, and the
 * caller merges the states in shard order once they are all done:
 * <pre>{@code
 *   shard 0 ──► task ──► state 0 ─┐
 *   shard 1 ──► task ──► state 1 ─┼──► combine in order ──► pass result
 *   shard 2 ──► task ──► state 2 ─┘
 * }</pre>
 *
 * <h2>Error Handling</h2>
 *
 * <p>Fail-fast: the first failing shard cancels the others, every cursor is
 * closed as its task unwinds, and the failure is rethrown unchanged when it is
 * unchecked. No partial state escapes.
 */
final class PassRunner {

    private final ExecutorService executor;
    private final int chunkSize;
    private final ProfileObserver observer;

    /**
     * @param executor the pool for multi-shard passes, or null to read shards on the calling thread
     * @param chunkSize rows per batch
     * @param observer receiver of pass and batch events
     */
    PassRunner(ExecutorService executor, int chunkSize, ProfileObserver observer) {
        this.executor = executor;
        this.chunkSize = chunkSize;
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
    }

    /**
     * Reads every shard once and returns the merged state.
     *
     * @param pass the pass to run
     * @param shards sources in file order
     * @param <S> the pass state
     * @return the state of all shards combined in order
     */
    <S> S run(AggregationPass<S> pass, List<? extends RowSource> shards) {
        if (shards.isEmpty()) {
            throw new IllegalArgumentException("at least one shard is required");
        }
        long startTime = System.currentTimeMillis();
        observer.onPassStart(pass.kind(), shards.size());

        S merged;
        if (shards.size() == 1 || executor == null) {
            merged = foldShard(pass, shards.get(0));
            for (int i = 1; i < shards.size(); i++) {
                pass.combine(merged, foldShard(pass, shards.get(i)));
            }
        } else {
            merged = runConcurrently(pass, shards);
        }

        observer.onPassComplete(pass.kind(), pass.rowsSeen(merged), System.currentTimeMillis() - startTime);
        return merged;
    }

    private <S> S runConcurrently(AggregationPass<S> pass, List<? extends RowSource> shards) {
        List<Future<S>> futures = new ArrayList<>(shards.size());
        for (RowSource shard : shards) {
            futures.add(executor.submit(() -> foldShard(pass, shard)));
        }

        S merged = null;
        try {
            for (Future<S> future : futures) {
                S state = future.get();
                if (merged == null) {
                    merged = state;
                } else {
                    pass.combine(merged, state);
                }
            }
            return merged;
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(pass.kind().label() + " pass failed", cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during " + pass.kind().label() + " pass");
        }
    }

    private <S> S foldShard(AggregationPass<S> pass, RowSource shard) {
        S state = pass.newState();
        String shardId = shard.getId();
        try (RowCursor cursor = shard.openPass(chunkSize)) {
            while (cursor.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Cancelled while reading " + shardId);
                }
                RowBatch batch = cursor.next();
                pass.fold(state, batch, shardId);
                observer.onBatchFolded(pass.kind(), shardId, batch.firstRowNumber(), batch.rowCount());
            }
        }
        return state;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
