package io.nosqlbench.csvprofile.sniff;

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
import java.util.Comparator;
import java.util.List;

/// Statistical byte-frequency classifier for the encoding of a text sample.
///
/// ## Decision Order
///
/// ```text
///   1. Byte order mark          → UTF-8 / UTF-16LE / UTF-16BE, confidence 1.0
///   2. Only 7-bit bytes         → US-ASCII, confidence 1.0
///   3. NUL bytes on one parity  → UTF-16LE / UTF-16BE (ASCII text without BOM)
///   4. Otherwise score every candidate:
///        UTF-8         valid multi-byte sequences, no invalid ones
///        windows-1252  plausibility of each high byte as Western text
///        ISO-8859-1    same, with C1 control bytes (0x80-0x9F) implausible
/// ```
///
/// The UTF-8 confidence follows the shape used by common detectors: each valid
/// multi-byte character halves the remaining doubt, capped at 0.99 after six.
/// Single-byte scores are capped at 0.73 since any byte sequence decodes in
/// those charsets.
///
/// A multi-byte sequence cut off by the end of the sample is neither valid nor
/// invalid; the sample is usually a prefix of a larger file.
///
/// This class is stateless and thread-safe.
public final class EncodingClassifier {

    public static final String US_ASCII = "US-ASCII";
    public static final String UTF_8 = "UTF-8";
    public static final String UTF_16LE = "UTF-16LE";
    public static final String UTF_16BE = "UTF-16BE";
    public static final String WINDOWS_1252 = "windows-1252";
    public static final String ISO_8859_1 = "ISO-8859-1";

    private static final double UTF8_MAX_CONFIDENCE = 0.99;
    private static final double SINGLE_BYTE_MAX_CONFIDENCE = 0.73;
    private static final double UTF16_NUL_RATIO = 0.3;

    /// Classifies a sample and ranks every plausible encoding.
    ///
    /// @param sample the raw bytes, usually the first few kilobytes of a file
    /// @param length the number of valid bytes in `sample`
    /// @return guesses ordered by descending confidence; empty when `length` is 0
    public List<EncodingGuess> classify(byte[] sample, int length) {
        if (length < 0 || length > sample.length) {
            throw new IllegalArgumentException("length out of range: " + length);
        }
        List<EncodingGuess> guesses = new ArrayList<>();
        if (length == 0) {
            return guesses;
        }

        EncodingGuess bom = byteOrderMark(sample, length);
        if (bom != null) {
            guesses.add(bom);
            return guesses;
        }

        int highBytes = 0;
        int evenNuls = 0;
        int oddNuls = 0;
        for (int i = 0; i < length; i++) {
            int b = sample[i] & 0xFF;
            if (b >= 0x80) {
                highBytes++;
            } else if (b == 0) {
                if ((i & 1) == 0) evenNuls++;
                else oddNuls++;
            }
        }

        if (highBytes == 0 && evenNuls == 0 && oddNuls == 0) {
            guesses.add(new EncodingGuess(US_ASCII, 1.0));
            return guesses;
        }

        double pairs = Math.max(1, length / 2);
        if (oddNuls / pairs > UTF16_NUL_RATIO && evenNuls < oddNuls / 10) {
            guesses.add(new EncodingGuess(UTF_16LE, Math.min(UTF8_MAX_CONFIDENCE, oddNuls / pairs)));
        } else if (evenNuls / pairs > UTF16_NUL_RATIO && oddNuls < evenNuls / 10) {
            guesses.add(new EncodingGuess(UTF_16BE, Math.min(UTF8_MAX_CONFIDENCE, evenNuls / pairs)));
        }

        double utf8 = utf8Confidence(sample, length);
        if (utf8 > 0.0) {
            guesses.add(new EncodingGuess(UTF_8, utf8));
        }
        if (highBytes > 0) {
            guesses.add(new EncodingGuess(WINDOWS_1252, singleByteConfidence(sample, length, true)));
            guesses.add(new EncodingGuess(ISO_8859_1, singleByteConfidence(sample, length, false)));
        }

        // stable: equal confidences keep candidate order
        guesses.sort(Comparator.comparingDouble(EncodingGuess::confidence).reversed());
        return guesses;
    }

    private static EncodingGuess byteOrderMark(byte[] sample, int length) {
        if (length >= 3
            && (sample[0] & 0xFF) == 0xEF
            && (sample[1] & 0xFF) == 0xBB
            && (sample[2] & 0xFF) == 0xBF) {
            return new EncodingGuess(UTF_8, 1.0);
        }
        if (length >= 2) {
            int b0 = sample[0] & 0xFF;
            int b1 = sample[1] & 0xFF;
            if (b0 == 0xFF && b1 == 0xFE) {
                return new EncodingGuess(UTF_16LE, 1.0);
            }
            if (b0 == 0xFE && b1 == 0xFF) {
                return new EncodingGuess(UTF_16BE, 1.0);
            }
        }
        return null;
    }

    /// Scores the sample as UTF-8.
    ///
    /// @return 0 when any invalid sequence is present or no multi-byte character occurs
    static double utf8Confidence(byte[] sample, int length) {
        int multiByteChars = 0;
        int i = 0;
        while (i < length) {
            int b = sample[i] & 0xFF;
            int continuation;
            if (b < 0x80) {
                i++;
                continue;
            } else if (b >= 0xC2 && b <= 0xDF) {
                continuation = 1;
            } else if (b >= 0xE0 && b <= 0xEF) {
                continuation = 2;
            } else if (b >= 0xF0 && b <= 0xF4) {
                continuation = 3;
            } else {
                return 0.0;
            }
            if (i + continuation >= length) {
                // truncated by the end of the sample, check what is there
                for (int j = i + 1; j < length; j++) {
                    if ((sample[j] & 0xC0) != 0x80) {
                        return 0.0;
                    }
                }
                break;
            }
            for (int j = 1; j <= continuation; j++) {
                if ((sample[i + j] & 0xC0) != 0x80) {
                    return 0.0;
                }
            }
            multiByteChars++;
            i += continuation + 1;
        }
        if (multiByteChars == 0) {
            return 0.0;
        }
        if (multiByteChars >= 6) {
            return UTF8_MAX_CONFIDENCE;
        }
        return 1.0 - UTF8_MAX_CONFIDENCE * Math.pow(0.5, multiByteChars);
    }

    /// Scores the sample as Western single-byte text by the average plausibility
    /// of its high bytes.
    static double singleByteConfidence(byte[] sample, int length, boolean windows1252) {
        double plausibility = 0.0;
        int highBytes = 0;
        for (int i = 0; i < length; i++) {
            int b = sample[i] & 0xFF;
            if (b < 0x80) {
                continue;
            }
            highBytes++;
            plausibility += highBytePlausibility(b, windows1252);
        }
        if (highBytes == 0) {
            return 0.0;
        }
        return SINGLE_BYTE_MAX_CONFIDENCE * (plausibility / highBytes);
    }

    private static double highBytePlausibility(int b, boolean windows1252) {
        if (b <= 0x9F) {
            if (!windows1252) {
                return 0.0;
            }
            // undefined in windows-1252
            if (b == 0x81 || b == 0x8D || b == 0x8F || b == 0x90 || b == 0x9D) {
                return 0.0;
            }
            return 0.75;
        }
        if (b >= 0xC0) {
            // multiplication and division signs sit among the letters
            return (b == 0xD7 || b == 0xF7) ? 0.5 : 1.0;
        }
        return 0.5;
    }
}
