package io.nosqlbench.csvprofile.aggregate;

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

/// The passes of a profiling run, in execution order.
public enum PassKind {
    /// Counts rows and malformed rows, keeps the first few rows as a sample.
    COUNT("count"),
    /// Counts missing values and infers column kinds.
    PROFILE("profile"),
    /// Accumulates per-column statistics.
    STATISTICS("statistics");

    private final String label;

    PassKind(String label) {
        this.label = label;
    }

    /// @return the lowercase name used in events and reports
    public String label() {
        return label;
    }
}
