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

import io.nosqlbench.csvprofile.FileAccessException;
import io.nosqlbench.csvprofile.RowDecodeException;
import io.nosqlbench.csvprofile.sniff.FileProfile;
import io.nosqlbench.csvprofile.sniff.FormatSniffer;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A {@link RowSource} that streams a delimited file in bounded batches.
 *
 * <p>The header is read once by {@link #open(Path, FileProfile)}. Each pass
 * reopens the file, so no decoded rows are held between passes and the only
 * state kept by the source itself is the schema and a few offsets.
 *
 * <h2>Byte Ranges</h2>
 *
 * <p>For encodings where a line feed is the single byte {@code 0x0A}, the data
 * region {@code [dataStartOffset, fileSize)} can be split into ranges with
 * {@link ByteRangeSplitter} and each range read independently through
 * {@link #withRange(ByteRange)}. A range yields exactly the lines whose first
 * byte lies inside it:
 *
 * <pre>
 *   header\n | r1,a\n | r2,b\n | r3,c\n
 *            ^dataStart        ^split at any byte of "r3,c" hands r3 to the next range
 * </pre>
 *
 * <p>Empty and whitespace-only lines are not rows. Undecodable bytes are replaced
 * rather than rejected, and every row that needed a replacement is listed in
 * {@link RowBatch#undecodableRows()}.
 */
public final class ChunkedRowSource implements RowSource {

    private static final int READ_BUFFER_SIZE = 64 * 1024;
    private static final char REPLACEMENT_CHARACTER = '\uFFFD';

    private final Path path;
    private final FileProfile profile;
    private final ColumnSchema schema;
    private final boolean byteAddressable;
    private final long dataStartOffset;
    private final long fileSize;
    private final ByteRange range;

    private ChunkedRowSource(
        Path path,
        FileProfile profile,
        ColumnSchema schema,
        boolean byteAddressable,
        long dataStartOffset,
        long fileSize,
        ByteRange range
    ) {
        this.path = path;
        this.profile = profile;
        this.schema = schema;
        this.byteAddressable = byteAddressable;
        this.dataStartOffset = dataStartOffset;
        this.fileSize = fileSize;
        this.range = range;
    }

    /**
     * Opens a file with a previously sniffed profile and reads its header.
     *
     * @param path the delimited file
     * @param profile the detected format of the file
     * @return a source over every data row of the file
     * @throws FileAccessException if the file cannot be read or has no header
     */
    public static ChunkedRowSource open(Path path, FileProfile profile) {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(profile, "profile cannot be null");
        Charset charset = profile.charset();
        boolean byteAddressable = isLineFeedSingleByte(charset);
        try {
            long size = Files.size(path);
            String header;
            long dataStart;
            if (byteAddressable) {
                try (ByteLineReader reader = new ByteLineReader(Files.newByteChannel(path), 0, Long.MAX_VALUE)) {
                    byte[] line = reader.readLine();
                    header = line == null ? null : new String(line, charset);
                    dataStart = reader.position();
                }
            } else {
                try (BufferedReader reader = newCharReader(path, charset)) {
                    header = reader.readLine();
                }
                dataStart = -1;
            }
            header = FormatSniffer.stripByteOrderMark(header);
            if (header == null || header.isBlank()) {
                throw new FileAccessException(path, "File has no header line");
            }
            ColumnSchema schema = ColumnSchema.fromHeader(new RowSplitter(profile.separator()).split(header));
            return new ChunkedRowSource(path, profile, schema, byteAddressable, dataStart, size, null);
        } catch (RowDecodeException e) {
            throw new FileAccessException(path, "Header line cannot be parsed", new IOException(e.getMessage(), e));
        } catch (IOException e) {
            throw new FileAccessException(path, "Failed to open file", e);
        }
    }

    /**
     * Returns a view of this source restricted to the rows that start inside the range.
     *
     * @param range a range within {@code [dataStartOffset, fileSize]}
     * @return a source sharing this source's schema
     * @throws IllegalStateException if the encoding does not support byte ranges
     */
    public ChunkedRowSource withRange(ByteRange range) {
        Objects.requireNonNull(range, "range cannot be null");
        if (!byteAddressable) {
            throw new IllegalStateException("byte ranges are not supported for encoding " + profile.encoding());
        }
        if (range.start() < dataStartOffset) {
            throw new IllegalArgumentException("range " + range + " starts before the data region at " + dataStartOffset);
        }
        return new ChunkedRowSource(path, profile, schema, true, dataStartOffset, fileSize, range);
    }

    @Override
    public ColumnSchema getSchema() {
        return schema;
    }

    public FileProfile getProfile() {
        return profile;
    }

    public Path getPath() {
        return path;
    }

    /// @return true when the source can be split with [#withRange(ByteRange)]
    public boolean supportsByteRanges() {
        return byteAddressable;
    }

    /// @return the offset of the first byte after the header line, or -1 without byte range support
    public long dataStartOffset() {
        return dataStartOffset;
    }

    /// @return the file size observed when the source was opened
    public long fileSize() {
        return fileSize;
    }

    /// @return the range this source is restricted to, or null for the whole file
    public ByteRange getRange() {
        return range;
    }

    @Override
    public String getId() {
        return range == null ? path.toString() : path + range.toString();
    }

    @Override
    public RowCursor openPass(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
        }
        try {
            return new BatchCursor(openLines(), chunkSize);
        } catch (IOException e) {
            throw new FileAccessException(path, "Failed to open file for reading", e);
        }
    }

    private LineReader openLines() throws IOException {
        Charset charset = profile.charset();
        if (byteAddressable) {
            long start = range == null ? dataStartOffset : range.start();
            long end = range == null ? Long.MAX_VALUE : range.end();
            SeekableByteChannel channel = Files.newByteChannel(path);
            ByteLineReader reader;
            try {
                if (start > dataStartOffset) {
                    // the line crossing the range start belongs to the previous range
                    reader = new ByteLineReader(channel, start - 1, end);
                    reader.skipLine();
                } else {
                    reader = new ByteLineReader(channel, start, end);
                }
            } catch (IOException e) {
                channel.close();
                throw e;
            }
            ByteLineReader lines = reader;
            CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
            return new LineReader() {
                private boolean undecodable;

                @Override
                public String readLine() throws IOException {
                    undecodable = false;
                    if (lines.position() >= lines.limit()) {
                        return null;
                    }
                    byte[] line = lines.readLine();
                    if (line == null) {
                        return null;
                    }
                    try {
                        return decoder.decode(ByteBuffer.wrap(line)).toString();
                    } catch (CharacterCodingException e) {
                        undecodable = true;
                        return new String(line, charset);
                    }
                }

                @Override
                public boolean lastLineUndecodable() {
                    return undecodable;
                }

                @Override
                public void close() throws IOException {
                    lines.close();
                }
            };
        }
        BufferedReader reader = newCharReader(path, charset);
        reader.readLine();
        return new LineReader() {
            private boolean undecodable;

            @Override
            public String readLine() throws IOException {
                String line = reader.readLine();
                // the reader's decoder substitutes U+FFFD for bad input
                undecodable = line != null && line.indexOf(REPLACEMENT_CHARACTER) >= 0;
                return line;
            }

            @Override
            public boolean lastLineUndecodable() {
                return undecodable;
            }

            @Override
            public void close() throws IOException {
                reader.close();
            }
        };
    }

    static boolean isLineFeedSingleByte(Charset charset) {
        return Arrays.equals("\n".getBytes(charset), new byte[]{'\n'})
            && Arrays.equals("\r".getBytes(charset), new byte[]{'\r'});
    }

    private static BufferedReader newCharReader(Path path, Charset charset) throws IOException {
        return new BufferedReader(new InputStreamReader(Files.newInputStream(path), charset), READ_BUFFER_SIZE);
    }

    private interface LineReader extends AutoCloseable {
        String readLine() throws IOException;

        /// @return true when the line last returned contained bytes invalid in the charset
        boolean lastLineUndecodable();

        @Override
        void close() throws IOException;
    }

    private final class BatchCursor implements RowCursor {

        private final LineReader lines;
        private final RowSplitter splitter = new RowSplitter(profile.separator());
        private final int chunkSize;
        private final int expectedFields;
        private long rowNumber;
        private RowBatch pending;
        private boolean exhausted;
        private boolean closed;

        BatchCursor(LineReader lines, int chunkSize) {
            this.lines = lines;
            this.chunkSize = chunkSize;
            this.expectedFields = schema.size();
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !exhausted) {
                pending = readBatch();
            }
            return pending != null;
        }

        @Override
        public RowBatch next() {
            if (!hasNext()) {
                throw new NoSuchElementException("pass over " + getId() + " is exhausted");
            }
            RowBatch batch = pending;
            pending = null;
            return batch;
        }

        private RowBatch readBatch() {
            if (closed) {
                exhausted = true;
                return null;
            }
            long first = rowNumber + 1;
            List<String[]> rows = new ArrayList<>(Math.min(chunkSize, 1024));
            List<MalformedRow> malformed = new ArrayList<>();
            List<Long> undecodable = new ArrayList<>();
            try {
                while (rows.size() + malformed.size() < chunkSize) {
                    String line = lines.readLine();
                    if (line == null) {
                        exhausted = true;
                        break;
                    }
                    if (line.isBlank()) {
                        continue;
                    }
                    rowNumber++;
                    if (lines.lastLineUndecodable()) {
                        undecodable.add(rowNumber);
                    }
                    try {
                        rows.add(splitter.splitRow(line, expectedFields));
                    } catch (RowDecodeException e) {
                        malformed.add(new MalformedRow(rowNumber, e.getFieldCount(), e.getExpectedFieldCount()));
                    }
                }
            } catch (IOException e) {
                close();
                throw new FileAccessException(path, "Failed to read rows", e);
            }
            if (exhausted) {
                close();
            }
            if (rows.isEmpty() && malformed.isEmpty()) {
                return null;
            }
            return new RowBatch(first, rows, malformed, undecodable);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            exhausted = true;
            try {
                lines.close();
            } catch (IOException e) {
                throw new FileAccessException(path, "Failed to close file", e);
            }
        }
    }

    /// Reads raw lines from a channel, stopping before any line that starts at or after the limit.
    static final class ByteLineReader implements AutoCloseable {

        private final InputStream in;
        private final long limit;
        private long position;
        private byte[] buffer = new byte[256];

        ByteLineReader(SeekableByteChannel channel, long start, long limit) throws IOException {
            channel.position(start);
            this.in = new BufferedInputStream(Channels.newInputStream(channel), READ_BUFFER_SIZE);
            this.position = start;
            this.limit = limit;
        }

        long position() {
            return position;
        }

        long limit() {
            return limit;
        }

        /// Consumes bytes through the next line feed.
        void skipLine() throws IOException {
            int b;
            while ((b = in.read()) != -1) {
                position++;
                if (b == '\n') {
                    return;
                }
            }
        }

        /// @return the next line without its terminator, or null at end of file
        byte[] readLine() throws IOException {
            int length = 0;
            int b = in.read();
            if (b == -1) {
                return null;
            }
            while (b != -1) {
                position++;
                if (b == '\n') {
                    break;
                }
                if (length == buffer.length) {
                    buffer = Arrays.copyOf(buffer, buffer.length * 2);
                }
                buffer[length++] = (byte) b;
                b = in.read();
            }
            if (length > 0 && buffer[length - 1] == '\r') {
                length--;
            }
            return Arrays.copyOf(buffer, length);
        }

        @Override
        public void close() throws IOException {
            in.close();
        }
    }
}
