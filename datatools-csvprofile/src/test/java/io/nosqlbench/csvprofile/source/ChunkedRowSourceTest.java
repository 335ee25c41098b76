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

import io.nosqlbench.csvprofile.sniff.FileProfile;
import io.nosqlbench.csvprofile.sniff.FormatSniffer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for chunked reading of data rows, whole-file and by byte range.
 */
@Tag("unit")
public class ChunkedRowSourceTest {

    private static final String SAMPLE = "id,amount,category\n1,10.5,X\n2,,Y\n3,20.0,\n";

    @TempDir
    Path tempDir;

    private ChunkedRowSource open(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        FileProfile profile = new FormatSniffer().sniff(file);
        return ChunkedRowSource.open(file, profile);
    }

    private static List<String> readAll(RowSource source, int chunkSize) {
        List<String> rows = new ArrayList<>();
        source.forEachBatch(chunkSize, batch -> {
            for (String[] row : batch.rows()) {
                rows.add(String.join("|", row));
            }
        });
        return rows;
    }

    @Test
    void headerBecomesSchema() throws Exception {
        ChunkedRowSource source = open("schema.csv", SAMPLE);
        assertEquals(List.of("id", "amount", "category"), source.getSchema().names());
        assertTrue(source.supportsByteRanges());
        assertEquals("id,amount,category\n".length(), source.dataStartOffset());
    }

    @Test
    void batchesHoldAtMostChunkSizeRows() throws Exception {
        ChunkedRowSource source = open("batches.csv", SAMPLE);
        List<RowBatch> batches = new ArrayList<>();
        try (RowCursor cursor = source.openPass(2)) {
            while (cursor.hasNext()) {
                batches.add(cursor.next());
            }
            assertThrows(NoSuchElementException.class, cursor::next);
        }

        assertEquals(2, batches.size());
        assertEquals(1, batches.get(0).firstRowNumber());
        assertEquals(2, batches.get(0).rowCount());
        assertEquals(3, batches.get(1).firstRowNumber());
        assertEquals(1, batches.get(1).rowCount());
        assertArrayEquals(new String[]{"2", "", "Y"}, batches.get(0).rows().get(1));
    }

    @Test
    void everyPassRestartsAtFirstDataRow() throws Exception {
        ChunkedRowSource source = open("repeat.csv", SAMPLE);
        List<String> first = readAll(source, 10);
        List<String> second = readAll(source, 1);
        assertEquals(List.of("1|10.5|X", "2||Y", "3|20.0|"), first);
        assertEquals(first, second);
    }

    @Test
    void malformedRowsAreNumberedAndSkipped() throws Exception {
        ChunkedRowSource source = open("malformed.csv", "a,b\n1,2\n1,2,3\n\n   \n4,5\n6\n");
        List<MalformedRow> malformed = new ArrayList<>();
        List<String> rows = new ArrayList<>();
        source.forEachBatch(100, batch -> {
            malformed.addAll(batch.malformed());
            batch.rows().forEach(row -> rows.add(String.join("|", row)));
        });

        assertEquals(List.of("1|2", "4|5"), rows);
        assertEquals(List.of(new MalformedRow(2, 3, 2), new MalformedRow(4, 1, 2)), malformed);
    }

    @Test
    void crlfAndQuotedCells() throws Exception {
        ChunkedRowSource source = open("crlf.csv", "name,quote\r\n\"Ann\",\"say \"\"hi\"\"\"\r\n Bob , x \r\n");
        assertEquals(List.of("name", "quote"), source.getSchema().names());
        assertEquals(List.of("Ann|say \"hi\"", "Bob|x"), readAll(source, 5));
    }

    @Test
    void quotedSeparatorStaysInItsCell() throws Exception {
        ChunkedRowSource source = open("names.csv", "id,name,n\n1,\"Smith, John\",3\n2,Bob,4\n");
        List<MalformedRow> malformed = new ArrayList<>();
        source.forEachBatch(10, batch -> malformed.addAll(batch.malformed()));

        assertEquals(List.of("1|Smith, John|3", "2|Bob|4"), readAll(source, 10));
        assertTrue(malformed.isEmpty());
    }

    @Test
    void asciiProfileReadsUtf8AndListsUndecodableRows() throws Exception {
        Path file = tempDir.resolve("ascii.csv");
        byte[] head = "id,city\n1,Z\u00FCrich\n2,".getBytes(StandardCharsets.UTF_8);
        byte[] tail = {'M', (byte) 0xFC, 'n', 'c', 'h', 'e', 'n', '\n', '3', ',', 'B', 'e', 'r', 'n', '\n'};
        byte[] content = new byte[head.length + tail.length];
        System.arraycopy(head, 0, content, 0, head.length);
        System.arraycopy(tail, 0, content, head.length, tail.length);
        Files.write(file, content);
        FileProfile ascii = new FileProfile("US-ASCII", 1.0, ',', 2, false, content.length);

        ChunkedRowSource source = ChunkedRowSource.open(file, ascii);
        List<Long> undecodable = new ArrayList<>();
        source.forEachBatch(2, batch -> undecodable.addAll(batch.undecodableRows()));

        assertEquals(List.of("1|Z\u00FCrich", "2|M\uFFFDnchen", "3|Bern"), readAll(source, 10));
        assertEquals(List.of(2L), undecodable);
    }

    @Test
    void lastLineWithoutTerminator() throws Exception {
        ChunkedRowSource source = open("noeol.csv", "a,b\n1,2\n3,4");
        assertEquals(List.of("1|2", "3|4"), readAll(source, 10));
    }

    @Test
    void splitAtEveryOffsetYieldsEachRowOnce() throws Exception {
        ChunkedRowSource source = open("split.csv", "id,v\n1,a\n22,bb\n\n333,ccc\n4,d\r\n55,e");
        List<String> expected = readAll(source, 3);
        long start = source.dataStartOffset();
        long end = source.fileSize();

        for (long cut = start; cut <= end; cut++) {
            List<String> rows = new ArrayList<>();
            rows.addAll(readAll(source.withRange(new ByteRange(start, cut)), 2));
            rows.addAll(readAll(source.withRange(new ByteRange(cut, end)), 2));
            assertEquals(expected, rows, "split at byte " + cut);
        }
    }

    @Test
    void splitterRangesYieldEachRowOnce() throws Exception {
        StringBuilder content = new StringBuilder("n,square\n");
        for (int i = 0; i < 200; i++) {
            content.append(i).append(',').append(i * i).append('\n');
        }
        ChunkedRowSource source = open("many.csv", content.toString());
        List<String> expected = readAll(source, 64);
        assertEquals(200, expected.size());

        for (int parts : new int[]{1, 2, 3, 7, 16, 64}) {
            List<String> rows = new ArrayList<>();
            for (ByteRange range : ByteRangeSplitter.split(source, parts)) {
                rows.addAll(readAll(source.withRange(range), 13));
            }
            assertEquals(expected, rows, parts + " parts");
        }
    }

    @Test
    void rangeShardsCarryTheirRangeInId() throws Exception {
        ChunkedRowSource source = open("id.csv", SAMPLE);
        ChunkedRowSource shard = source.withRange(new ByteRange(source.dataStartOffset(), source.fileSize()));
        assertNull(source.getRange());
        assertEquals(source.getPath().toString(), source.getId());
        assertTrue(shard.getId().endsWith("[" + source.dataStartOffset() + ", " + source.fileSize() + ")"));
        assertSame(source.getSchema(), shard.getSchema());
    }

    @Test
    void rangeBeforeDataRegionIsRejected() throws Exception {
        ChunkedRowSource source = open("before.csv", SAMPLE);
        assertThrows(IllegalArgumentException.class, () -> source.withRange(new ByteRange(0, 5)));
    }

    @Test
    void utf16IsReadSequentiallyOnly() throws Exception {
        Path file = tempDir.resolve("utf16.csv");
        Files.write(file, "\uFEFFa,b\n1,2\n3,4\n".getBytes(StandardCharsets.UTF_16LE));
        ChunkedRowSource source = ChunkedRowSource.open(file, new FormatSniffer().sniff(file));

        assertFalse(source.supportsByteRanges());
        assertEquals(-1, source.dataStartOffset());
        assertEquals(List.of("a", "b"), source.getSchema().names());
        assertEquals(List.of("1|2", "3|4"), readAll(source, 1));
        assertThrows(IllegalStateException.class, () -> source.withRange(new ByteRange(0, 1)));
        assertThrows(IllegalArgumentException.class, () -> ByteRangeSplitter.split(source, 2));
    }

    @Test
    void chunkSizeMustBePositive() throws Exception {
        ChunkedRowSource source = open("chunk.csv", SAMPLE);
        assertThrows(IllegalArgumentException.class, () -> source.openPass(0));
    }
}
