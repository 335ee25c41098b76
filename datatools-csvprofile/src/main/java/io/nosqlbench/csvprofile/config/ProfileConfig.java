package io.nosqlbench.csvprofile.config;

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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * JSON-serializable settings for a profiling run.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every key is optional; absent keys keep their defaults:
 * <pre>{@code
 * {
 *   "chunk_size": 10000,
 *   "numeric_sample_cap": 10000,
 *   "top_k": 5,
 *   "separators": [",", ";", "\t", "|"],
 *   "encoding_fallbacks": ["windows-1252", "ISO-8859-1"],
 *   "encoding_confidence_threshold": 0.5,
 *   "sniff_bytes": 10240,
 *   "sample_rows": 5,
 *   "max_distinct_values": 0,
 *   "parallelism": 1
 * }
 * }</pre>
 *
 * <p>Instances are immutable. Use {@link #builder()} or {@link #toBuilder()} to
 * derive a modified copy, and {@link #validate()} to list every invalid setting.
 */
public final class ProfileConfig {

    public static final int DEFAULT_CHUNK_SIZE = 10_000;
    public static final int DEFAULT_NUMERIC_SAMPLE_CAP = 10_000;
    public static final int DEFAULT_TOP_K = 5;
    public static final int DEFAULT_SNIFF_BYTES = 10 * 1024;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5;

    @SerializedName("chunk_size")
    private int chunkSize = DEFAULT_CHUNK_SIZE;

    @SerializedName("numeric_sample_cap")
    private int numericSampleCap = DEFAULT_NUMERIC_SAMPLE_CAP;

    @SerializedName("top_k")
    private int topK = DEFAULT_TOP_K;

    /** Candidate separators in priority order, one character each */
    @SerializedName("separators")
    private List<String> separators = List.of(",", ";", "\t", "|");

    /** Encodings tried in order when the classifier is not confident */
    @SerializedName("encoding_fallbacks")
    private List<String> encodingFallbacks = List.of("windows-1252", "ISO-8859-1");

    @SerializedName("encoding_confidence_threshold")
    private double encodingConfidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;

    @SerializedName("sniff_bytes")
    private int sniffBytes = DEFAULT_SNIFF_BYTES;

    @SerializedName("sample_rows")
    private int sampleRows = 5;

    /** Distinct values tracked per categorical column, 0 for unlimited */
    @SerializedName("max_distinct_values")
    private int maxDistinctValues = 0;

    @SerializedName("parallelism")
    private int parallelism = 1;

    private ProfileConfig() {
    }

    /// @return the default configuration
    public static ProfileConfig defaults() {
        return new ProfileConfig();
    }

    public static Builder builder() {
        return new Builder(new ProfileConfig());
    }

    /// Loads a configuration file; keys missing from the file keep their defaults.
    ///
    /// @param path JSON file to read
    /// @return the parsed configuration, not yet validated
    /// @throws IOException if the file cannot be read or is not valid JSON
    public static ProfileConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ProfileConfig config = ProfileGsonConfig.gson().fromJson(reader, ProfileConfig.class);
            if (config == null) {
                return defaults();
            }
            return config.normalized();
        } catch (JsonParseException e) {
            throw new IOException("Invalid profile configuration " + path + ": " + e.getMessage(), e);
        }
    }

    /// Parses a configuration from a JSON string.
    public static ProfileConfig fromJson(String json) {
        ProfileConfig config = ProfileGsonConfig.gson().fromJson(json, ProfileConfig.class);
        return config == null ? defaults() : config.normalized();
    }

    public String toJson() {
        return ProfileGsonConfig.gson().toJson(this);
    }

    // Gson assigns null to list keys given as null
    private ProfileConfig normalized() {
        if (separators == null) {
            separators = defaults().separators;
        }
        if (encodingFallbacks == null) {
            encodingFallbacks = defaults().encodingFallbacks;
        }
        separators = Collections.unmodifiableList(new ArrayList<>(separators));
        encodingFallbacks = Collections.unmodifiableList(new ArrayList<>(encodingFallbacks));
        return this;
    }

    /// Checks every setting and reports all problems at once.
    ///
    /// @return a list of error messages, empty when the configuration is usable
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (chunkSize <= 0) {
            errors.add("chunk_size must be positive, got: " + chunkSize);
        }
        if (numericSampleCap < 0) {
            errors.add("numeric_sample_cap must be non-negative, got: " + numericSampleCap);
        }
        if (topK <= 0) {
            errors.add("top_k must be positive, got: " + topK);
        }
        if (separators.isEmpty()) {
            errors.add("separators must not be empty");
        }
        for (String separator : separators) {
            if (separator == null || separator.length() != 1) {
                errors.add("separators must be single characters, got: '" + separator + "'");
            }
        }
        for (String encoding : encodingFallbacks) {
            if (!isSupportedCharset(encoding)) {
                errors.add("unsupported fallback encoding: " + encoding);
            }
        }
        if (encodingConfidenceThreshold < 0.0 || encodingConfidenceThreshold > 1.0) {
            errors.add("encoding_confidence_threshold must be within [0,1], got: " + encodingConfidenceThreshold);
        }
        if (sniffBytes <= 0) {
            errors.add("sniff_bytes must be positive, got: " + sniffBytes);
        }
        if (sampleRows < 0) {
            errors.add("sample_rows must be non-negative, got: " + sampleRows);
        }
        if (maxDistinctValues < 0) {
            errors.add("max_distinct_values must be non-negative, got: " + maxDistinctValues);
        }
        if (parallelism <= 0) {
            errors.add("parallelism must be positive, got: " + parallelism);
        }
        return errors;
    }

    private static boolean isSupportedCharset(String name) {
        if (name == null) {
            return false;
        }
        try {
            return Charset.isSupported(name);
        } catch (IllegalCharsetNameException e) {
            return false;
        }
    }

    /// @throws IllegalArgumentException listing every invalid setting
    public ProfileConfig requireValid() {
        List<String> errors = validate();
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid profile configuration: " + String.join("; ", errors));
        }
        return this;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getNumericSampleCap() {
        return numericSampleCap;
    }

    public int getTopK() {
        return topK;
    }

    public List<String> getSeparators() {
        return separators;
    }

    /// @return the candidate separators as characters, in priority order
    public char[] getSeparatorChars() {
        char[] chars = new char[separators.size()];
        for (int i = 0; i < chars.length; i++) {
            chars[i] = separators.get(i).charAt(0);
        }
        return chars;
    }

    public List<String> getEncodingFallbacks() {
        return encodingFallbacks;
    }

    public double getEncodingConfidenceThreshold() {
        return encodingConfidenceThreshold;
    }

    public int getSniffBytes() {
        return sniffBytes;
    }

    public int getSampleRows() {
        return sampleRows;
    }

    public int getMaxDistinctValues() {
        return maxDistinctValues;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Builder toBuilder() {
        return new Builder(copy());
    }

    private ProfileConfig copy() {
        ProfileConfig copy = new ProfileConfig();
        copy.chunkSize = chunkSize;
        copy.numericSampleCap = numericSampleCap;
        copy.topK = topK;
        copy.separators = separators;
        copy.encodingFallbacks = encodingFallbacks;
        copy.encodingConfidenceThreshold = encodingConfidenceThreshold;
        copy.sniffBytes = sniffBytes;
        copy.sampleRows = sampleRows;
        copy.maxDistinctValues = maxDistinctValues;
        copy.parallelism = parallelism;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("ProfileConfig[chunkSize=%d, sampleCap=%d, topK=%d, separators=%s, fallbacks=%s, parallelism=%d]",
            chunkSize, numericSampleCap, topK, separators, encodingFallbacks, parallelism);
    }

    /// Fluent builder; {@link #build()} does not validate.
    public static final class Builder {
        private final ProfileConfig config;

        private Builder(ProfileConfig config) {
            this.config = config;
        }

        public Builder chunkSize(int chunkSize) {
            config.chunkSize = chunkSize;
            return this;
        }

        public Builder numericSampleCap(int cap) {
            config.numericSampleCap = cap;
            return this;
        }

        public Builder topK(int topK) {
            config.topK = topK;
            return this;
        }

        public Builder separators(List<String> separators) {
            config.separators = List.copyOf(separators);
            return this;
        }

        public Builder encodingFallbacks(List<String> encodings) {
            config.encodingFallbacks = List.copyOf(encodings);
            return this;
        }

        public Builder encodingConfidenceThreshold(double threshold) {
            config.encodingConfidenceThreshold = threshold;
            return this;
        }

        public Builder sniffBytes(int sniffBytes) {
            config.sniffBytes = sniffBytes;
            return this;
        }

        public Builder sampleRows(int sampleRows) {
            config.sampleRows = sampleRows;
            return this;
        }

        public Builder maxDistinctValues(int maxDistinctValues) {
            config.maxDistinctValues = maxDistinctValues;
            return this;
        }

        public Builder parallelism(int parallelism) {
            config.parallelism = parallelism;
            return this;
        }

        public ProfileConfig build() {
            return config.copy();
        }
    }
}
