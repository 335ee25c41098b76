package io.nosqlbench.csvprofile.accumulate;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class NullTrackerTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    void countsMissingCellsPerColumn() {
        NullTracker tracker = new NullTracker(3);
        tracker.accept(new String[]{"1", "10.5", "X"});
        tracker.accept(new String[]{"2", "", "Y"});
        tracker.accept(new String[]{"3", "20.0", " "});
        tracker.accept(new String[]{"4", "", ""});

        assertEquals(4, tracker.rowsProcessed());
        assertEquals(0, tracker.nullCount(0));
        assertEquals(2, tracker.nullCount(1));
        assertEquals(2, tracker.nonNullCount(1));
        assertEquals(0.0, tracker.nullPercentage(0), TOLERANCE);
        assertEquals(50.0, tracker.nullPercentage(1), TOLERANCE);
        assertEquals(50.0, tracker.nullPercentage(2), TOLERANCE);
    }

    @Test
    void noRowsMeansZeroPercent() {
        NullTracker tracker = new NullTracker(2);
        assertEquals(0, tracker.rowsProcessed());
        assertEquals(0.0, tracker.nullPercentage(1));
    }

    @Test
    void mergeMatchesSequential() {
        String[][] rows = {
            {"a", ""}, {"", ""}, {"b", "c"}, {"", "d"}, {"e", ""}
        };
        NullTracker sequential = new NullTracker(2);
        NullTracker first = new NullTracker(2);
        NullTracker second = new NullTracker(2);
        for (int i = 0; i < rows.length; i++) {
            sequential.accept(rows[i]);
            (i < 2 ? first : second).accept(rows[i]);
        }

        NullTracker merged = NullTracker.merge(first, second);
        assertEquals(sequential.rowsProcessed(), merged.rowsProcessed());
        for (int c = 0; c < 2; c++) {
            assertEquals(sequential.nullCount(c), merged.nullCount(c));
            assertEquals(sequential.nullPercentage(c), merged.nullPercentage(c), TOLERANCE);
        }
        assertEquals(2, first.rowsProcessed(), "merge leaves its inputs unchanged");
    }

    @Test
    void mismatchedWidthIsRejected() {
        NullTracker tracker = new NullTracker(2);
        assertThrows(IllegalArgumentException.class, () -> tracker.accept(new String[]{"x"}));
        assertThrows(IllegalArgumentException.class, () -> tracker.combine(new NullTracker(3)));
    }
}
