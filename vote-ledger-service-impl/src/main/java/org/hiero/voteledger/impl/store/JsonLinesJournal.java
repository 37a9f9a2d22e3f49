// SPDX-License-Identifier: Apache-2.0
package org.hiero.voteledger.impl.store;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * An append-only file of JSON records, one per line.
 *
 * <p>A record is acknowledged only once its whole line, newline included, has been written (and forced to the
 * device when {@code fsync} is set). A trailing line without its newline is the remains of an interrupted append;
 * both {@link #readAll()} and {@link #append(Object)} truncate it away so no record is ever glued onto it.</p>
 *
 * @param <T> the record type
 */
public class JsonLinesJournal<T> {
    private static final Logger log = LogManager.getLogger(JsonLinesJournal.class);

    private static final byte NEWLINE = '\n';
    private static final int TAIL_CHUNK_SIZE = 4096;

    private final Path file;
    private final Class<T> type;
    private final ObjectMapper mapper;
    private final boolean fsync;

    public JsonLinesJournal(
            @NonNull final Path file,
            @NonNull final Class<T> type,
            @NonNull final ObjectMapper mapper,
            final boolean fsync) {
        this.file = requireNonNull(file, "file must not be null");
        this.type = requireNonNull(type, "type must not be null");
        this.mapper = requireNonNull(mapper, "mapper must not be null");
        this.fsync = fsync;
    }

    /**
     * Reads every complete record, dropping an incomplete trailing line.
     *
     * @return the records in append order, empty if the file does not exist
     * @throws IOException if the file cannot be read or a complete line does not parse
     */
    @NonNull
    public synchronized List<T> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        final byte[] bytes = Files.readAllBytes(file);
        final List<T> records = new ArrayList<>();
        int lineStart = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == NEWLINE) {
                if (i > lineStart) {
                    records.add(mapper.readValue(bytes, lineStart, i - lineStart, type));
                }
                lineStart = i + 1;
            }
        }
        if (lineStart < bytes.length) {
            log.warn(
                    "Discarding {} bytes of an interrupted append at the end of {}", bytes.length - lineStart, file);
            try (final FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
                channel.truncate(lineStart);
                channel.force(true);
            }
        }
        return records;
    }

    /**
     * Appends one record. A write that fails partway is cut back off the file before the failure is reported, and
     * any incomplete line already at the end of the file is cut off before writing, so a record always starts on a
     * line of its own.
     *
     * @param record the record
     * @throws IOException if the record cannot be written
     */
    public synchronized void append(@NonNull final T record) throws IOException {
        requireNonNull(record, "record must not be null");
        final byte[] json = serialize(record);
        final ByteBuffer buffer = ByteBuffer.allocate(json.length + 1);
        buffer.put(json).put(NEWLINE).flip();
        final Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (final FileChannel channel = FileChannel.open(
                file, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            final long start = endOfLastCompleteLine(channel);
            if (start < channel.size()) {
                log.warn("Discarding {} bytes of an interrupted append at the end of {}", channel.size() - start, file);
                channel.truncate(start);
            }
            channel.position(start);
            try {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                if (fsync) {
                    channel.force(false);
                }
            } catch (IOException e) {
                try {
                    channel.truncate(start);
                } catch (IOException truncateFailure) {
                    e.addSuppressed(truncateFailure);
                }
                throw e;
            }
        }
    }

    private static long endOfLastCompleteLine(final FileChannel channel) throws IOException {
        final ByteBuffer chunk = ByteBuffer.allocate(TAIL_CHUNK_SIZE);
        long end = channel.size();
        while (end > 0) {
            final long from = Math.max(0, end - TAIL_CHUNK_SIZE);
            chunk.clear().limit((int) (end - from));
            while (chunk.hasRemaining()) {
                if (channel.read(chunk, from + chunk.position()) < 0) {
                    throw new IOException("Unexpected end of file");
                }
            }
            for (int i = chunk.limit() - 1; i >= 0; i--) {
                if (chunk.get(i) == NEWLINE) {
                    return from + i + 1;
                }
            }
            end = from;
        }
        return 0;
    }

    /**
     * @return the journal file
     */
    @NonNull
    public Path file() {
        return file;
    }

    private byte[] serialize(final T record) throws JsonProcessingException {
        final String json = mapper.writeValueAsString(record);
        if (json.indexOf('\n') >= 0) {
            throw new IllegalStateException("Serialized record spans lines");
        }
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
