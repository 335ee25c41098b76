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
import io.nosqlbench.csvprofile.sniff.FileProfile;
import io.nosqlbench.csvprofile.source.MalformedRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/// ProfileObserver that reports run progress through log4j.
///
/// | Event           | Level                                   |
/// |-----------------|-----------------------------------------|
/// | format detected | INFO                                    |
/// | pass start      | DEBUG                                   |
/// | batch folded    | TRACE                                   |
/// | malformed row   | WARN for the first few, DEBUG afterwards |
/// | decode error    | WARN for the first few, DEBUG afterwards |
/// | pass complete   | INFO                                    |
/// | run complete    | INFO                                    |
public final class LoggingProfileObserver implements ProfileObserver {

    private static final Logger logger = LogManager.getLogger(LoggingProfileObserver.class);

    /// Malformed rows reported at WARN before switching to DEBUG.
    public static final int DEFAULT_MALFORMED_WARN_LIMIT = 10;

    private final int malformedWarnLimit;
    private final AtomicLong malformedSeen = new AtomicLong();
    private final AtomicLong decodeErrorsSeen = new AtomicLong();

    public LoggingProfileObserver() {
        this(DEFAULT_MALFORMED_WARN_LIMIT);
    }

    public LoggingProfileObserver(int malformedWarnLimit) {
        this.malformedWarnLimit = malformedWarnLimit;
    }

    @Override
    public void onFormatDetected(String sourceId, FileProfile profile) {
        logger.info("Detected format of {}: encoding={} (confidence {}{}), separator='{}', columns={}",
            sourceId,
            profile.encoding(),
            String.format("%.2f", profile.encodingConfidence()),
            profile.encodingFallback() ? ", fallback" : "",
            profile.separatorLabel(),
            profile.columnCount());
    }

    @Override
    public void onPassStart(PassKind pass, int shards) {
        logger.debug("Starting {} pass over {} shard(s)", pass.label(), shards);
    }

    @Override
    public void onBatchFolded(PassKind pass, String shardId, long firstRowNumber, int rows) {
        logger.trace("{} pass: folded rows {}..{} of {}",
            pass.label(), firstRowNumber, firstRowNumber + rows - 1, shardId);
    }

    @Override
    public void onMalformedRow(String shardId, MalformedRow row) {
        long seen = malformedSeen.incrementAndGet();
        if (seen <= malformedWarnLimit) {
            logger.warn("Skipping malformed row {} of {}: {} fields, expected {}",
                row.rowNumber(), shardId, row.fieldCount(), row.expectedFieldCount());
            if (seen == malformedWarnLimit) {
                logger.warn("Further malformed rows are logged at DEBUG level");
            }
        } else {
            logger.debug("Skipping malformed row {} of {}: {} fields, expected {}",
                row.rowNumber(), shardId, row.fieldCount(), row.expectedFieldCount());
        }
    }

    @Override
    public void onDecodeError(String shardId, long rowNumber) {
        long seen = decodeErrorsSeen.incrementAndGet();
        if (seen <= malformedWarnLimit) {
            logger.warn("Row {} of {} holds bytes invalid in the detected encoding; they were replaced",
                rowNumber, shardId);
            if (seen == malformedWarnLimit) {
                logger.warn("Further undecodable rows are logged at DEBUG level");
            }
        } else {
            logger.debug("Row {} of {} holds bytes invalid in the detected encoding; they were replaced",
                rowNumber, shardId);
        }
    }

    @Override
    public void onPassComplete(PassKind pass, long rows, long elapsedMillis) {
        logger.info("Completed {} pass: {} rows in {} ms", pass.label(), rows, elapsedMillis);
    }

    @Override
    public void onRunComplete(AggregationResult result) {
        logger.info("Profiled {} rows ({} malformed, {} undecodable) across {} columns in {} ms",
            result.getTotalRows(),
            result.getMalformedRows(),
            result.getDecodeErrors(),
            result.getSchema().size(),
            result.getElapsedMillis());
    }

    /// @return malformed rows reported so far
    public long getMalformedSeen() {
        return malformedSeen.get();
    }

    /// @return undecodable rows reported so far
    public long getDecodeErrorsSeen() {
        return decodeErrorsSeen.get();
    }
}
