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

import java.util.Iterator;

/// One forward-only pass over the row batches of a [RowSource].
///
/// A cursor holds an open file handle until it is exhausted or closed. It cannot
/// be rewound; a new pass needs a new cursor from [RowSource#openPass(int)].
public interface RowCursor extends Iterator<RowBatch>, AutoCloseable {

    /// Releases the file handle. Safe to call more than once.
    @Override
    void close();
}
