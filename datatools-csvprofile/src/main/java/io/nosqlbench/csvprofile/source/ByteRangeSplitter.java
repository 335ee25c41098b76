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

import java.util.ArrayList;
import java.util.List;

/// Divides the data region of a [ChunkedRowSource] into contiguous byte ranges.
///
/// Boundaries fall at arbitrary bytes; row alignment comes from the ownership
/// rule of [ChunkedRowSource#withRange(ByteRange)], so the ranges of one split
/// together yield every row exactly once.
public final class ByteRangeSplitter {

    private ByteRangeSplitter() {
    }

    /// Splits the data region into at most `parts` ranges of near-equal length.
    ///
    /// @param source a source with byte range support
    /// @param parts the desired number of ranges, at least 1
    /// @return ranges in file order covering `[dataStartOffset, fileSize)`
    public static List<ByteRange> split(ChunkedRowSource source, int parts) {
        if (!source.supportsByteRanges()) {
            throw new IllegalArgumentException("source " + source.getId() + " does not support byte ranges");
        }
        return split(source.dataStartOffset(), source.fileSize(), parts);
    }

    static List<ByteRange> split(long start, long end, int parts) {
        if (parts < 1) {
            throw new IllegalArgumentException("parts must be at least 1, got: " + parts);
        }
        long length = Math.max(0, end - start);
        int count = (int) Math.max(1, Math.min(parts, length));
        List<ByteRange> ranges = new ArrayList<>(count);
        long rangeStart = start;
        for (int i = 1; i <= count; i++) {
            long rangeEnd = i == count ? Math.max(start, end) : start + (length * i) / count;
            ranges.add(new ByteRange(rangeStart, rangeEnd));
            rangeStart = rangeEnd;
        }
        return ranges;
    }
}
