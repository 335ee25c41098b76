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

import com.google.gson.annotations.SerializedName;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// Inferred physical format of a delimited file.
///
/// Produced once by [FormatSniffer#sniff] and required before any row can be
/// parsed.
///
/// @param encoding charset name of the file contents
/// @param encodingConfidence classifier confidence in `[0,1]`
/// @param separator field separator
/// @param columnCount number of fields in the header line
/// @param encodingFallback true when the encoding came from the fallback list
/// @param fileSizeBytes size of the file when it was sniffed
public record FileProfile(
    @SerializedName("encoding") String encoding,
    @SerializedName("encoding_confidence") double encodingConfidence,
    @SerializedName("separator") char separator,
    @SerializedName("column_count") int columnCount,
    @SerializedName("encoding_fallback") boolean encodingFallback,
    @SerializedName("file_size_bytes") long fileSizeBytes
) {

    public FileProfile {
        Objects.requireNonNull(encoding, "encoding cannot be null");
        if (columnCount < 1) {
            throw new IllegalArgumentException("columnCount must be positive, got: " + columnCount);
        }
        if (fileSizeBytes < 0) {
            throw new IllegalArgumentException("fileSizeBytes must be non-negative, got: " + fileSizeBytes);
        }
    }

    /// Combines the two halves of format detection.
    public static FileProfile of(EncodingGuess encoding, SeparatorGuess separator, long fileSizeBytes) {
        return new FileProfile(
            encoding.encoding(),
            encoding.confidence(),
            separator.separator(),
            separator.columnCount(),
            encoding.fallback(),
            fileSizeBytes);
    }

    /// The charset rows are decoded with.
    ///
    /// A file whose sample was pure ASCII is read as UTF-8, its superset, so that
    /// non-ASCII text past the sample still decodes.
    public Charset charset() {
        if (EncodingClassifier.US_ASCII.equals(encoding)) {
            return StandardCharsets.UTF_8;
        }
        return Charset.forName(encoding);
    }

    /// @return the separator rendered for display, with tab spelled out
    public String separatorLabel() {
        return separator == '\t' ? "\\t" : String.valueOf(separator);
    }

    @Override
    public String toString() {
        return String.format("FileProfile[encoding=%s (%.2f%s), separator='%s', columns=%d, size=%d]",
            encoding, encodingConfidence, encodingFallback ? ", fallback" : "",
            separatorLabel(), columnCount, fileSizeBytes);
    }
}
