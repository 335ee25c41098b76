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

/**
 * Renders value distributions and counts as Unicode block characters.
 *
 * <h2>Block Characters</h2>
 * <pre>
 * ▁ U+2581 LOWER ONE EIGHTH BLOCK
 * ▂ U+2582 LOWER ONE QUARTER BLOCK
 * ▃ U+2583 LOWER THREE EIGHTHS BLOCK
 * ▄ U+2584 LOWER HALF BLOCK
 * ▅ U+2585 LOWER FIVE EIGHTHS BLOCK
 * ▆ U+2586 LOWER THREE QUARTERS BLOCK
 * ▇ U+2587 LOWER SEVEN EIGHTHS BLOCK
 * █ U+2588 FULL BLOCK
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * double[] sample = summary.sample();
 *
 * // Histogram of the values, one character per bin
 * String histogram = Sparkline.histogram(sample, 20);
 * // Output: "▁▂▄▇█▇▄▂▁▁▁▁▁▁▁▁▁▁▁▁"
 *
 * // Horizontal bar for a count relative to the largest count
 * String bar = Sparkline.bar(120, 480, 20);
 * // Output: "█████"
 * }</pre>
 */
public final class Sparkline {

    /** Unicode block characters from lowest to highest */
    private static final char[] BLOCKS = {
        ' ',      // 0/8 - empty (for zero counts)
        '\u2581', // 1/8 ▁
        '\u2582', // 2/8 ▂
        '\u2583', // 3/8 ▃
        '\u2584', // 4/8 ▄
        '\u2585', // 5/8 ▅
        '\u2586', // 6/8 ▆
        '\u2587', // 7/8 ▇
        '\u2588'  // 8/8 █
    };

    /** Default histogram width */
    public static final int DEFAULT_WIDTH = 20;

    private Sparkline() {}

    /**
     * Generates a histogram sparkline of the finite values in the data.
     *
     * @param data the data values
     * @param width number of bins/characters in the sparkline
     * @return Unicode sparkline string of exactly {@code width} characters
     */
    public static String histogram(double[] data, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        if (data != null) {
            for (double v : data) {
                if (Double.isFinite(v)) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
        }
        if (min > max) {
            return " ".repeat(width);
        }
        if (min == max) {
            // All values identical - show flat line at middle height
            return String.valueOf(BLOCKS[4]).repeat(width);
        }

        int[] bins = new int[width];
        double binWidth = (max - min) / width;
        for (double v : data) {
            if (Double.isFinite(v)) {
                int bin = (int) ((v - min) / binWidth);
                if (bin >= width) bin = width - 1; // Handle max value
                bins[bin]++;
            }
        }

        int maxCount = 0;
        for (int count : bins) {
            maxCount = Math.max(maxCount, count);
        }

        StringBuilder sb = new StringBuilder(width);
        for (int count : bins) {
            int level = count * 8 / maxCount;
            if (level == 0 && count > 0) {
                level = 1;
            }
            sb.append(BLOCKS[level]);
        }
        return sb.toString();
    }

    /**
     * Generates a horizontal bar of full blocks proportional to a count.
     *
     * <p>Non-zero counts always get at least one block.
     *
     * @param count the count to draw
     * @param maxCount the count drawn at full width
     * @param width the full width in characters
     * @return a string of 0 to {@code width} full blocks
     */
    public static String bar(long count, long maxCount, int width) {
        if (count <= 0 || maxCount <= 0) {
            return "";
        }
        int blocks = (int) Math.max(1, Math.round((double) Math.min(count, maxCount) * width / maxCount));
        return String.valueOf(BLOCKS[8]).repeat(blocks);
    }
}
