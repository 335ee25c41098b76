package io.nosqlbench.command.profile;

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
public class SparklineTest {

    private static final String FULL = "\u2588";

    @Test
    void histogramHasRequestedWidth() {
        double[] data = {1, 2, 2, 3, 3, 3, 4, 4, 5};
        assertEquals(Sparkline.DEFAULT_WIDTH, Sparkline.histogram(data, Sparkline.DEFAULT_WIDTH).length());
        assertEquals(3, Sparkline.histogram(data, 3).length());
    }

    @Test
    void histogramScalesToTallestBin() {
        assertEquals(FULL + FULL, Sparkline.histogram(new double[]{0, 10}, 2));
        assertEquals(FULL + "\u2582", Sparkline.histogram(new double[]{0, 0, 0, 10}, 2));
    }

    @Test
    void histogramEdgeCases() {
        assertEquals("    ", Sparkline.histogram(new double[0], 4));
        assertEquals("  ", Sparkline.histogram(null, 2));
        assertEquals("\u2584\u2584\u2584", Sparkline.histogram(new double[]{7, 7}, 3));
        assertEquals(FULL + FULL, Sparkline.histogram(new double[]{Double.NaN, 0, 1}, 2), "non-finite values are skipped");
        assertThrows(IllegalArgumentException.class, () -> Sparkline.histogram(new double[]{1}, 0));
    }

    @Test
    void barIsProportional() {
        assertEquals(FULL.repeat(5), Sparkline.bar(120, 480, 20));
        assertEquals(FULL.repeat(20), Sparkline.bar(480, 480, 20));
        assertEquals(FULL, Sparkline.bar(1, 1_000_000, 20), "non-zero counts get one block");
        assertEquals("", Sparkline.bar(0, 480, 20));
    }
}
