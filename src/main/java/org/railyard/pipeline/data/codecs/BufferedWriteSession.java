package org.railyard.pipeline.data.codecs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

import org.railyard.pipeline.api.data.IChunkWriteSession;

/**
 * Write session for whole-file formats: chunks are kept in memory, ordered by start row,
 * and written in one go when the session is finalized.
 *
 * @param <T> payload type
 */
final class BufferedWriteSession<T> implements IChunkWriteSession<T> {

    @FunctionalInterface
    interface Writer<T> {
        void write(T data, Path path) throws IOException;
    }

    private final Path path;
    private final long totalLength;
    private final T template;
    private final Function<List<T>, T> concat;
    private final Writer<T> writer;
    private final TreeMap<Long, T> chunks = new TreeMap<>();
    private final TreeMap<Long, Long> ends = new TreeMap<>();
    private boolean finalized;

    BufferedWriteSession(Path path, long totalLength, T template, Function<List<T>, T> concat, Writer<T> writer) {
        this.path = path;
        this.totalLength = totalLength;
        this.template = template;
        this.concat = concat;
        this.writer = writer;
    }

    @Override
    public void writeChunk(T data, long start, long end) {
        if (finalized) {
            throw new IllegalStateException("Write session for " + path + " is already finalized");
        }
        BinaryFiles.checkedRows(start, end, totalLength, path);
        chunks.put(start, data);
        ends.put(start, end);
    }

    @Override
    public void finalizeWrite() throws IOException {
        if (finalized) {
            return;
        }
        long expected = 0;
        for (Map.Entry<Long, Long> range : ends.entrySet()) {
            if (range.getKey() != expected) {
                throw new IOException(String.format("Rows [%d, %d) of %s were never written", expected, range.getKey(), path));
            }
            expected = range.getValue();
        }
        if (expected != totalLength) {
            throw new IOException(String.format("Rows [%d, %d) of %s were never written", expected, totalLength, path));
        }
        List<T> parts = new ArrayList<>(chunks.values());
        writer.write(parts.isEmpty() ? template : concat.apply(parts), path);
        finalized = true;
        chunks.clear();
    }

    @Override
    public boolean isFinalized() {
        return finalized;
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public long getTotalLength() {
        return totalLength;
    }
}
