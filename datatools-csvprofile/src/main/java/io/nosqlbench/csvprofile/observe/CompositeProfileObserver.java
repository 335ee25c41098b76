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

import java.util.List;

/// Fans events out to several observers. Created by [ProfileObserver#of].
final class CompositeProfileObserver implements ProfileObserver {

    private final List<ProfileObserver> observers;

    CompositeProfileObserver(List<ProfileObserver> observers) {
        this.observers = List.copyOf(observers);
    }

    @Override
    public void onFormatDetected(String sourceId, FileProfile profile) {
        for (ProfileObserver observer : observers) {
            observer.onFormatDetected(sourceId, profile);
        }
    }

    @Override
    public void onPassStart(PassKind pass, int shards) {
        for (ProfileObserver observer : observers) {
            observer.onPassStart(pass, shards);
        }
    }

    @Override
    public void onBatchFolded(PassKind pass, String shardId, long firstRowNumber, int rows) {
        for (ProfileObserver observer : observers) {
            observer.onBatchFolded(pass, shardId, firstRowNumber, rows);
        }
    }

    @Override
    public void onMalformedRow(String shardId, MalformedRow row) {
        for (ProfileObserver observer : observers) {
            observer.onMalformedRow(shardId, row);
        }
    }

    @Override
    public void onDecodeError(String shardId, long rowNumber) {
        for (ProfileObserver observer : observers) {
            observer.onDecodeError(shardId, rowNumber);
        }
    }

    @Override
    public void onPassComplete(PassKind pass, long rows, long elapsedMillis) {
        for (ProfileObserver observer : observers) {
            observer.onPassComplete(pass, rows, elapsedMillis);
        }
    }

    @Override
    public void onRunComplete(AggregationResult result) {
        for (ProfileObserver observer : observers) {
            observer.onRunComplete(result);
        }
    }
}
