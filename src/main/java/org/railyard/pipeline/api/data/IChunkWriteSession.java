package org.railyard.pipeline.api.data;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An open, streamed write to one backing file.
 * <p>
 * Chunks may arrive in any order and from any cooperating worker, as long as their
 * ranges do not overlap. {@link #finalizeWrite()} closes the session; calling it again
 * has no effect.
 *
 * @param <T> payload type
 */
public interface IChunkWriteSession<T> {

    /**
     * Writes the payload into rows {@code [start, end)} of the file.
     *
     * @throws IllegalStateException if the session was finalized
     * @throws IOException           if the write fails
     */
    void writeChunk(T data, long start, long end) throws IOException;

    /**
     * Flushes and closes the session. Idempotent.
     *
     * @throws IOException if flushing fails
     */
    void finalizeWrite() throws IOException;

    boolean isFinalized();

    Path getPath();

    long getTotalLength();
}
