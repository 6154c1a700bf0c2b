package org.railyard.pipeline.api.data;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.railyard.pipeline.api.comm.ICommunicator;

/**
 * Reads and writes one on-disk format for one payload type.
 * <p>
 * Implementations must be stateless and thread-safe: state of a streamed write lives in
 * the returned {@link IChunkWriteSession}, and every read opens the file anew.
 *
 * @param <T> payload type
 */
public interface IDataCodec<T> {

    /**
     * @return short format name used in diagnostics
     */
    String getName();

    /**
     * @return file name suffix without the dot
     */
    String getFileExtension();

    Class<T> getDataType();

    /**
     * Reads the whole file.
     */
    T read(Path path) throws IOException;

    /**
     * Writes the whole payload, replacing any existing file.
     */
    void write(T data, Path path) throws IOException;

    /**
     * Returns the number of rows without reading the payload.
     */
    long length(Path path) throws IOException;

    /**
     * Reads rows {@code [start, end)}.
     */
    T readRange(Path path, long start, long end) throws IOException;

    /**
     * Opens the raw file.
     */
    default InputStream open(Path path) throws IOException {
        return Files.newInputStream(path);
    }

    /**
     * Opens a streamed write sized for {@code totalLength} rows.
     * <p>
     * With a communicator of more than one worker this is a collective call: rank 0
     * creates and sizes the file, all workers then open it for chunk writes.
     *
     * @param path        target file
     * @param template    payload describing the layout (columns, grid); its rows are ignored
     * @param totalLength number of rows the finished file will hold
     * @param comm        communicator, or {@code null} for a single worker
     */
    IChunkWriteSession<T> initializeWrite(Path path, T template, long totalLength, ICommunicator comm) throws IOException;

    /**
     * @return {@code true} if {@link #readRange} is supported
     */
    default boolean supportsChunkedRead() {
        return true;
    }

    /**
     * @return {@code true} if several workers may write chunks to one session concurrently
     */
    default boolean supportsParallelWrite() {
        return true;
    }

    /**
     * Reads only the column names from the file header.
     *
     * @throws UnsupportedOperationException if the format has no columns
     */
    default List<String> readColumnNames(Path path) throws IOException {
        throw new UnsupportedOperationException(getName() + " files have no columns");
    }
}
