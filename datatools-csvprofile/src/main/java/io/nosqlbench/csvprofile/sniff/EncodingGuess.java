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

import java.nio.charset.Charset;
import java.util.Objects;

/// An encoding label with the classifier's confidence in it.
///
/// @param encoding a charset name usable with [Charset#forName(String)]
/// @param confidence classifier confidence in `[0,1]`
/// @param fallback true when the label came from the fallback list rather than the classifier's best guess
public record EncodingGuess(String encoding, double confidence, boolean fallback) {

    public EncodingGuess {
        Objects.requireNonNull(encoding, "encoding cannot be null");
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0,1], got: " + confidence);
        }
    }

    public EncodingGuess(String encoding, double confidence) {
        this(encoding, confidence, false);
    }

    public Charset charset() {
        return Charset.forName(encoding);
    }

    /// @return a copy of this guess marked as chosen from the fallback list
    public EncodingGuess asFallback() {
        return new EncodingGuess(encoding, confidence, true);
    }
}
