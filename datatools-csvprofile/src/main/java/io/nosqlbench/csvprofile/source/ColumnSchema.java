package io.nosqlbench.csvprofile.source;

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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Ordered, unique column names taken from the header row.
///
/// Defines the index to name mapping shared by every accumulator of a run.
///
/// ## Header Normalization
///
/// [#fromHeader] makes raw header cells usable as unique names:
///
/// ```text
///   raw:    id | name |      | name | name
///   names:  id | name | Unnamed: 2 | name.1 | name.2
/// ```
///
/// @param names column names in file order
public record ColumnSchema(List<String> names) {

    public ColumnSchema {
        names = List.copyOf(names);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("schema must have at least one column");
        }
        if (new HashSet<>(names).size() != names.size()) {
            throw new IllegalArgumentException("column names must be unique: " + names);
        }
    }

    /// Builds a schema from already split and trimmed header cells.
    ///
    /// Blank names become `Unnamed: <index>` and repeated names get `.1`, `.2`, …
    /// suffixes in order of appearance.
    public static ColumnSchema fromHeader(String[] cells) {
        List<String> names = new ArrayList<>(cells.length);
        Set<String> taken = new HashSet<>();
        Map<String, Integer> repeats = new HashMap<>();
        for (int i = 0; i < cells.length; i++) {
            String base = cells[i] == null || cells[i].isBlank() ? "Unnamed: " + i : cells[i];
            String name = base;
            while (taken.contains(name)) {
                int n = repeats.merge(base, 1, Integer::sum);
                name = base + "." + n;
            }
            taken.add(name);
            names.add(name);
        }
        return new ColumnSchema(names);
    }

    public int size() {
        return names.size();
    }

    public String name(int index) {
        return names.get(index);
    }

    /// @return the index of the column, or -1 if absent
    public int indexOf(String name) {
        return names.indexOf(name);
    }
}
