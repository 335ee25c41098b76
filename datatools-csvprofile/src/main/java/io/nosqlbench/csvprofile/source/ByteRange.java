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

/// Half-open byte interval `[start, end)` of a file.
///
/// A range owns every line whose first byte lies inside it, so adjacent ranges
/// partition the rows of a file without splitting any row.
///
/// @param start first byte offset, inclusive
/// @param end last byte offset, exclusive
public record ByteRange(long start, long end) {

    public ByteRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative, got: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("end must not precede start: [" + start + ", " + end + ")");
        }
    }

    public long length() {
        return end - start;
    }

    public boolean contains(long offset) {
        return offset >= start && offset < end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
