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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/// Raised when the input file is missing, unreadable, or changes between passes.
///
/// Unchecked because it surfaces from inside batch iterators. A run that sees
/// this exception never returns a partial result.
public class FileAccessException extends UncheckedIOException {

    private final Path path;

    public FileAccessException(Path path, String message, IOException cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public FileAccessException(Path path, String message) {
        this(path, message, new IOException(message));
    }

    /// @return the file that could not be read
    public Path getPath() {
        return path;
    }
}
