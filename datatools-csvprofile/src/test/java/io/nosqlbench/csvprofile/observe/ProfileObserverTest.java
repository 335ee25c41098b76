package io.nosqlbench.csvprofile.observe;

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

import io.nosqlbench.csvprofile.aggregate.PassKind;
import io.nosqlbench.csvprofile.aggregate.StreamingAggregator;
import io.nosqlbench.csvprofile.config.ProfileConfig;
import io.nosqlbench.csvprofile.source.MalformedRow;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ProfileObserverTest {

    @TempDir
    Path tempDir;

    @Test
    void ofCollapsesTrivialCases() {
        LoggingProfileObserver logging = new LoggingProfileObserver();
        assertThat(ProfileObserver.of()).isSameAs(ProfileObserver.NOOP);
        assertThat(ProfileObserver.of(logging)).isSameAs(logging);
    }

    @Test
    void compositeForwardsToEveryObserver() {
        StringWriter first = new StringWriter();
        StringWriter second = new StringWriter();
        ProfileObserver composite = ProfileObserver.of(new NdjsonProfileObserver(first), new NdjsonProfileObserver(second));

        composite.onPassStart(PassKind.PROFILE, 1);
        composite.onPassComplete(PassKind.PROFILE, 5, 1);

        for (StringWriter out : new StringWriter[]{first, second}) {
            assertThat(out.toString().lines()).hasSize(2);
            assertThat(out.toString()).contains("\"event\":\"pass_start\"").contains("\"event\":\"pass_complete\"");
        }
    }

    @Test
    void loggingObserverCountsMalformedRows() throws Exception {
        LoggingProfileObserver logging = new LoggingProfileObserver(2);
        for (int i = 1; i <= 5; i++) {
            logging.onMalformedRow("shard", new MalformedRow(i, 1, 2));
        }
        assertThat(logging.getMalformedSeen()).isEqualTo(5);

        Path file = tempDir.resolve("data.csv");
        Files.writeString(file, "a,b\n1,2\n3\n");
        LoggingProfileObserver runLogging = new LoggingProfileObserver();
        new StreamingAggregator(ProfileConfig.defaults(), runLogging).run(file);
        assertThat(runLogging.getMalformedSeen()).isEqualTo(1);
    }

    @Test
    void loggingObserverCountsDecodeErrors() {
        LoggingProfileObserver logging = new LoggingProfileObserver(1);
        logging.onDecodeError("shard", 3);
        logging.onDecodeError("shard", 8);
        assertThat(logging.getDecodeErrorsSeen()).isEqualTo(2);
        assertThat(logging.getMalformedSeen()).isZero();
    }

    @Test
    void compositeForwardsDecodeErrors() {
        StringWriter out = new StringWriter();
        ProfileObserver composite = ProfileObserver.of(new NdjsonProfileObserver(out), ProfileObserver.NOOP);
        composite.onDecodeError("data.csv", 4);
        assertThat(out.toString()).contains("\"event\":\"decode_error\"").contains("\"row\":4");
    }

    @Test
    void compactJsonIsSingleLine() {
        String json = ProfileObserver.toCompactJson(Map.of("event", "x", "rows", 3));
        assertThat(json).doesNotContain("\n").contains("\"event\":\"x\"");
    }
}
