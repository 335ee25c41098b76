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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ColumnSchemaTest {

    @Test
    void blankNamesArePositional() {
        ColumnSchema schema = ColumnSchema.fromHeader(new String[]{"id", "", " "});
        assertThat(schema.names()).containsExactly("id", "Unnamed: 1", "Unnamed: 2");
    }

    @Test
    void repeatedNamesGetSuffixes() {
        ColumnSchema schema = ColumnSchema.fromHeader(new String[]{"a", "b", "a", "a"});
        assertThat(schema.names()).containsExactly("a", "b", "a.1", "a.2");
        assertThat(schema.indexOf("a.2")).isEqualTo(3);
        assertThat(schema.indexOf("missing")).isEqualTo(-1);
    }

    @Test
    void suffixSkipsNamesAlreadyInHeader() {
        ColumnSchema schema = ColumnSchema.fromHeader(new String[]{"a", "a.1", "a"});
        assertThat(schema.names()).containsExactly("a", "a.1", "a.2");
    }

    @Test
    void schemaRequiresUniqueNonEmptyNames() {
        assertThatThrownBy(() -> new ColumnSchema(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ColumnSchema(List.of("x", "x")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unique");
    }

    @Test
    void namesAreImmutable() {
        ColumnSchema schema = new ColumnSchema(List.of("x", "y"));
        assertThat(schema.size()).isEqualTo(2);
        assertThat(schema.name(1)).isEqualTo("y");
        assertThatThrownBy(() -> schema.names().add("z"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
