package io.nosqlbench.csvprofile.source;

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

import java.util.function.Consumer;

/**
 * Abstraction for a source of delimited rows that can be streamed in batches.
 *
 * <h2>Passes</h2>
 *
 * <p>Every call to {@link #openPass(int)} starts an independent pass from the
 * first data row. Nothing is cached between passes, so a source can be read
 * any number of times while holding at most one batch per open cursor:
 *
 * <pre>{@code
 * RowSource source = ChunkedRowSource.open(path, profile);
 * ColumnSchema schema = source.getSchema();
 *
 * try (RowCursor cursor = source.openPass(10_000)) {
 *     while (cursor.hasNext()) {
 *         RowBatch batch = cursor.next();
 *         fold(batch);
 *     }
 * }
 *
 * // Or with callback
 * source.forEachBatch(10_000, batch -> fold(batch));
 * }</pre>
 *
 * @see ChunkedRowSource
 */
public interface RowSource {

    /**
     * Returns the schema read from the header row.
     *
     * @return the column schema
     */
    ColumnSchema getSchema();

    /**
     * Opens a fresh pass over the rows of this source.
     *
     * @param chunkSize the maximum number of rows per batch, malformed rows included
     * @return a cursor that must be closed by the caller
     * @throws IllegalArgumentException if chunkSize is not positive
     * @throws io.nosqlbench.csvprofile.FileAccessException if the file cannot be opened
     */
    RowCursor openPass(int chunkSize);

    /**
     * Runs one complete pass, handing each batch to the consumer.
     *
     * @param chunkSize the maximum number of rows per batch
     * @param consumer callback receiving each batch in file order
     */
    default void forEachBatch(int chunkSize, Consumer<RowBatch> consumer) {
        try (RowCursor cursor = openPass(chunkSize)) {
            while (cursor.hasNext()) {
                consumer.accept(cursor.next());
            }
        }
    }

    /**
     * Returns an identifier for this source, used in events and log messages.
     *
     * @return an identifier, or "anonymous" if not set
     */
    default String getId() {
        return "anonymous";
    }
}
