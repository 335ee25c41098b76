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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for configuration files, result export and traces.
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled (not in compact) | Human-readable result files |
/// | Serialize nulls | Disabled | Undefined statistics are omitted |
/// | HTML escaping | Disabled | Category values are written verbatim |
/// | Special floats | Enabled | NaN and infinities survive export |
///
/// The returned instances are thread-safe and shared.
public final class ProfileGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private ProfileGsonConfig() {
        // Utility class
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Single-line output, for NDJSON traces.
    ///
    /// @return the shared compact Gson instance
    public static Gson compactGson() {
        return COMPACT;
    }

    /// @return a new builder with the profile defaults, for callers that need more adapters
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
