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

import io.nosqlbench.csvprofile.FileAccessException;
import io.nosqlbench.csvprofile.FormatDetectionException;
import io.nosqlbench.csvprofile.config.ProfileConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/// Infers the encoding and field separator of a delimited text file.
///
/// ## Encoding
///
/// The first `sniff_bytes` bytes are ranked by [EncodingClassifier]. The best
/// guess is used when its confidence reaches the configured threshold and it
/// decodes the sample; otherwise each configured fallback encoding is tried in
/// order and the first that decodes the sample wins.
///
/// ## Separator
///
/// The header line is split on every candidate separator. The candidate giving
/// the most fields wins; on a tie the earlier candidate wins:
///
/// ```text
///   "a,b;c,d,e"   ','  → 4 fields   ← chosen
///                 ';'  → 2 fields
///                 '\t' → 1 field
///                 '|'  → 1 field
/// ```
///
/// Quoting is not considered, so a quoted separator inside a header name counts
/// as a field boundary.
///
/// Both detection methods are pure functions of their input.
public final class FormatSniffer {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final EncodingClassifier classifier = new EncodingClassifier();
    private final char[] separators;
    private final List<String> fallbacks;
    private final double confidenceThreshold;
    private final int sniffBytes;

    public FormatSniffer() {
        this(ProfileConfig.defaults());
    }

    public FormatSniffer(ProfileConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.separators = config.getSeparatorChars();
        this.fallbacks = config.getEncodingFallbacks();
        this.confidenceThreshold = config.getEncodingConfidenceThreshold();
        this.sniffBytes = config.getSniffBytes();
    }

    /// Detects the encoding of a byte sample.
    ///
    /// @param sample raw bytes from the start of the file
    /// @return the chosen encoding and its confidence
    /// @throws FormatDetectionException if the sample is empty or no candidate decodes it
    public EncodingGuess detect(byte[] sample) throws FormatDetectionException {
        return detect(sample, sample.length);
    }

    /// Detects the encoding of the first `length` bytes of `sample`.
    public EncodingGuess detect(byte[] sample, int length) throws FormatDetectionException {
        if (length == 0) {
            throw new FormatDetectionException("Cannot detect encoding of an empty sample");
        }
        List<EncodingGuess> ranked = classifier.classify(sample, length);
        if (!ranked.isEmpty()) {
            EncodingGuess best = ranked.get(0);
            if (best.confidence() >= confidenceThreshold && decodesCleanly(sample, length, best.charset())) {
                return best;
            }
        }
        for (String fallback : fallbacks) {
            Charset charset = Charset.forName(fallback);
            if (decodesCleanly(sample, length, charset)) {
                double confidence = 0.0;
                for (EncodingGuess guess : ranked) {
                    if (Charset.forName(guess.encoding()).equals(charset)) {
                        confidence = guess.confidence();
                        break;
                    }
                }
                return new EncodingGuess(fallback, confidence, true);
            }
        }
        throw new FormatDetectionException(
            "No candidate encoding decodes the sample; tried " + (ranked.isEmpty() ? "" : ranked.get(0).encoding() + ", ")
                + String.join(", ", fallbacks));
    }

    /// Picks the separator that splits a header line into the most fields.
    ///
    /// @param firstLine the decoded header line, without line terminator
    /// @return the separator and the number of fields it yields
    public SeparatorGuess detectSeparator(String firstLine) {
        Objects.requireNonNull(firstLine, "firstLine cannot be null");
        char best = separators[0];
        int bestCount = 0;
        for (char candidate : separators) {
            int count = countFields(firstLine, candidate);
            if (count > bestCount) {
                bestCount = count;
                best = candidate;
            }
        }
        return new SeparatorGuess(best, bestCount);
    }

    /// Reads the head of a file and infers its complete [FileProfile].
    ///
    /// @param path the delimited file
    /// @return the inferred profile
    /// @throws FormatDetectionException if the file is empty, has no header, or cannot be decoded
    /// @throws FileAccessException if the file is missing or unreadable
    public FileProfile sniff(Path path) throws FormatDetectionException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new FileAccessException(path, "File not found or not readable");
        }
        try {
            long size = Files.size(path);
            if (size == 0) {
                throw new FormatDetectionException("File is empty: " + path);
            }

            byte[] sample;
            try (InputStream in = Files.newInputStream(path)) {
                sample = in.readNBytes(sniffBytes);
            }
            EncodingGuess encoding = detect(sample, sample.length);

            String header;
            try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(path), encoding.charset()))) {
                header = reader.readLine();
            }
            header = stripByteOrderMark(header);
            if (header == null || header.isBlank()) {
                throw new FormatDetectionException("File has no header line: " + path);
            }

            return FileProfile.of(encoding, detectSeparator(header), size);
        } catch (IOException e) {
            throw new FileAccessException(path, "Failed to read file head", e);
        }
    }

    /// Removes a leading byte order mark left in place by the decoder.
    public static String stripByteOrderMark(String line) {
        if (line != null && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
            return line.substring(1);
        }
        return line;
    }

    static int countFields(String line, char separator) {
        int fields = 1;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == separator) {
                fields++;
            }
        }
        return fields;
    }

    /// A trailing incomplete multi-byte sequence is left undecoded rather than
    /// reported, since the sample is a prefix of the file.
    static boolean decodesCleanly(byte[] sample, int length, Charset charset) {
        CharsetDecoder decoder = charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(sample, 0, length);
        CharBuffer out = CharBuffer.allocate(length * 2 + 16);
        CoderResult result = decoder.decode(in, out, false);
        return !result.isError();
    }
}
