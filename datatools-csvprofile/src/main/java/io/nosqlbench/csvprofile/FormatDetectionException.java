package io.nosqlbench.csvprofile;

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

/// Raised when the encoding or layout of a file cannot be inferred.
///
/// This is fatal for a profiling run: it is thrown before any row pass starts,
/// for an empty file, a file without a header line, or a sample that none of the
/// candidate encodings can decode.
public class FormatDetectionException extends CsvProfileException {

    public FormatDetectionException(String message) {
        super(message);
    }

    public FormatDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
