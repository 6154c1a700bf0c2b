package org.railyard.pipeline.data;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.Chunk;
import org.railyard.pipeline.api.data.IChunkWriteSession;
import org.railyard.pipeline.api.data.IDataCodec;
import org.railyard.pipeline.api.data.InvalidHandleOperationException;
import org.railyard.pipeline.utils.DataRanges;
import org.railyard.pipeline.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps one data product: its tag, an optional in-memory payload, an optional backing file
 * and the name of the stage that produced it.
 * <p>
 * A handle materializes its payload lazily ({@link #read()}), writes it whole
 * ({@link #write()}) or in chunks through a write session
 * ({@link #initializeWrite(long, ICommunicator)}, {@link #writeChunk(long, long)},
 * {@link #finalizeWrite()}), and reports its size without reading where the format allows.
 * <p>
 * The on-disk format is delegated to an {@link IDataCodec}; subclasses bind the payload type
 * and provide payload slicing and concatenation.
 * <p>
 * Handles are not thread-safe. Each worker owns its own handles.
 *
 * @param <T> payload type
 */
public abstract class DataHandle<T> {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());

    private final String tag;
    private final IDataCodec<T> codec;
    private String path;
    private String creator;
    private T data;
    private boolean partial;
    private Long length;
    private IChunkWriteSession<T> session;

    protected DataHandle(String tag, IDataCodec<T> codec, String path, String creator) {
        this.tag = tag;
        this.codec = codec;
        this.path = path;
        this.creator = creator;
    }

    /**
     * @return the payload type name used in the handle registry
     */
    public abstract String getTypeName();

    /**
     * @return number of rows of a payload
     */
    protected abstract long dataSize(T payload);

    /**
     * Returns rows {@code [start, end)} of a payload.
     */
    protected T slice(T payload, long start, long end) {
        throw new InvalidHandleOperationException(tag, path, getTypeName() + " payloads cannot be sliced");
    }

    /**
     * Concatenates payload chunks in the given order.
     */
    public T concat(List<T> parts) {
        throw new InvalidHandleOperationException(tag, path, getTypeName() + " payloads cannot be concatenated");
    }

    public String getTag() {
        return tag;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getCreator() {
        return creator;
    }

    public void setCreator(String creator) {
        this.creator = creator;
    }

    /**
     * @return the in-memory payload without reading, or {@code null}
     */
    public T getData() {
        return data;
    }

    public IDataCodec<T> getCodec() {
        return codec;
    }

    public Class<T> getDataType() {
        return codec.getDataType();
    }

    /**
     * @return {@code false} for input-only handle types
     */
    public boolean isWritable() {
        return true;
    }

    public boolean isPartial() {
        return partial;
    }

    public boolean hasData() {
        return data != null;
    }

    public boolean hasPath() {
        return path != null;
    }

    /**
     * @return {@code true} if the backing file exists, regardless of the in-memory payload
     */
    public boolean isWritten() {
        return path != null && Files.exists(resolvedPath());
    }

    /**
     * @return the backing path with environment variables expanded
     * @throws InvalidHandleOperationException if no path is set
     */
    public Path resolvedPath() {
        if (path == null) {
            throw new InvalidHandleOperationException(tag, null, "No path given");
        }
        return Paths.get(PathExpansion.expandPath(path));
    }

    /**
     * Opens the backing file for raw reading without caching anything.
     *
     * @throws InvalidHandleOperationException if no path is set
     */
    public InputStream open() throws IOException {
        if (path == null) {
            throw new InvalidHandleOperationException(tag, null, "Cannot open a handle without a path");
        }
        return codec.open(resolvedPath());
    }

    /**
     * Equivalent to {@code read(false)}.
     */
    public T read() throws IOException {
        return read(false);
    }

    /**
     * Returns the payload, reading and caching it from the backing file if necessary.
     *
     * @param force re-read from disk even if a payload is cached
     * @throws InvalidHandleOperationException if there is neither a payload nor a path
     */
    public T read(boolean force) throws IOException {
        if (data != null && !force) {
            return data;
        }
        if (path == null) {
            throw new InvalidHandleOperationException(tag, null, "Cannot read a handle with no data and no path");
        }
        Path resolved = resolvedPath();
        log.debug("Reading '{}' from {}", tag, resolved);
        data = readFromPath(resolved);
        partial = false;
        length = null;
        return data;
    }

    /**
     * Reads the backing file. Subclasses may add caching.
     */
    protected T readFromPath(Path resolved) throws IOException {
        return codec.read(resolved);
    }

    /**
     * Writes the whole in-memory payload to the backing path, creating parent directories.
     *
     * @throws InvalidHandleOperationException if the payload or the path is missing
     */
    public void write() throws IOException {
        if (data == null) {
            throw new InvalidHandleOperationException(tag, path, "Cannot write a handle with no data");
        }
        if (path == null) {
            throw new InvalidHandleOperationException(tag, null, "Cannot write a handle with no path");
        }
        Path resolved = resolvedPath();
        createParentDirectories(resolved);
        try {
            codec.write(data, resolved);
        } catch (UnsupportedOperationException e) {
            throw new InvalidHandleOperationException(tag, path, "Handle type " + getTypeName() + " cannot be written", e);
        }
        log.debug("Wrote '{}' to {}", tag, resolved);
    }

    /**
     * Opens a streamed write session sized for {@code totalLength} rows. The current payload
     * serves as the layout template.
     *
     * @param comm communicator, or {@code null}; collective when it spans more than one worker
     * @throws InvalidHandleOperationException if the payload or path is missing, a session is
     *                                         already open, or the format cannot be streamed
     */
    public void initializeWrite(long totalLength, ICommunicator comm) throws IOException {
        if (data == null) {
            throw new InvalidHandleOperationException(tag, path, "Cannot initialize a write without template data");
        }
        if (path == null) {
            throw new InvalidHandleOperationException(tag, null, "Cannot initialize a write without a path");
        }
        if (session != null && !session.isFinalized()) {
            throw new InvalidHandleOperationException(tag, path, "A write session is already open");
        }
        if (comm != null && comm.size() > 1 && !codec.supportsParallelWrite()) {
            throw new InvalidHandleOperationException(tag, path,
                    "Format " + codec.getName() + " does not support writing from " + comm.size() + " workers");
        }
        Path resolved = resolvedPath();
        if (comm == null || comm.rank() == 0) {
            createParentDirectories(resolved);
        }
        try {
            session = codec.initializeWrite(resolved, data, totalLength, comm);
        } catch (UnsupportedOperationException e) {
            throw new InvalidHandleOperationException(tag, path, "Handle type " + getTypeName() + " cannot be written in chunks", e);
        }
        length = totalLength;
        log.debug("Opened write session for '{}' at {} ({} rows)", tag, resolved, totalLength);
    }

    /**
     * Writes the currently attached payload into rows {@code [start, end)} of the open session.
     * Callers attach each chunk with {@link #setData(Object, boolean)} before calling this.
     *
     * @throws InvalidHandleOperationException if no session is open or no payload is attached
     */
    public void writeChunk(long start, long end) throws IOException {
        if (session == null || session.isFinalized()) {
            throw new InvalidHandleOperationException(tag, path, "writeChunk called without an open write session");
        }
        if (data == null) {
            throw new InvalidHandleOperationException(tag, path, "Cannot write a chunk with no data");
        }
        session.writeChunk(data, start, end);
        log.debug("Wrote rows [{}, {}) of '{}'", start, end, tag);
    }

    /**
     * Closes the write session. A second call on a finalized session does nothing.
     *
     * @throws InvalidHandleOperationException if no session was ever opened
     */
    public void finalizeWrite() throws IOException {
        if (session == null) {
            throw new InvalidHandleOperationException(tag, path, "finalizeWrite called without a write session");
        }
        if (session.isFinalized()) {
            log.debug("Write session for '{}' already finalized", tag);
            return;
        }
        session.finalizeWrite();
        log.debug("Finalized write session for '{}'", tag);
    }

    /**
     * @return {@code true} if a write session is open and not yet finalized
     */
    public boolean hasOpenSession() {
        return session != null && !session.isFinalized();
    }

    /**
     * @return {@code true} if a write session was opened at some point
     */
    public boolean wasStreamed() {
        return session != null;
    }

    /**
     * Attaches a payload.
     *
     * @param payload the payload, must be an instance of {@link #getDataType()}
     * @param partial {@code true} if the payload is one chunk of a larger whole
     * @throws IllegalArgumentException if the payload has the wrong type
     */
    public void setData(Object payload, boolean partial) {
        if (payload != null && !getDataType().isInstance(payload)) {
            throw new IllegalArgumentException(String.format("Handle '%s' of type %s cannot hold a %s",
                    tag, getTypeName(), payload.getClass().getName()));
        }
        this.data = getDataType().cast(payload);
        this.partial = partial;
        if (!partial) {
            this.length = null;
        }
    }

    /**
     * Drops the in-memory payload; the handle falls back to its backing file.
     */
    public void clearData() {
        this.data = null;
        this.partial = false;
    }

    /**
     * Returns the number of rows, preferring the cached length, then the in-memory payload,
     * then the backing file.
     *
     * @throws InvalidHandleOperationException if there is neither a payload nor a path
     */
    public long size() throws IOException {
        if (length != null) {
            return length;
        }
        if (data != null && !partial) {
            return dataSize(data);
        }
        if (path != null) {
            return codec.length(resolvedPath());
        }
        if (data != null) {
            return dataSize(data);
        }
        throw new InvalidHandleOperationException(tag, null, "Cannot determine the size of a handle with no data and no path");
    }

    /**
     * @return rows in the in-memory payload
     * @throws InvalidHandleOperationException if no payload is attached
     */
    public long dataSize() {
        if (data == null) {
            throw new InvalidHandleOperationException(tag, path, "No data attached");
        }
        return dataSize(data);
    }

    /**
     * Returns the column names, from the payload if one is attached, else from the file header.
     */
    public List<String> columnNames() throws IOException {
        if (data != null) {
            return columnNames(data);
        }
        if (path == null) {
            throw new InvalidHandleOperationException(tag, null, "Cannot list columns of a handle with no data and no path");
        }
        try {
            return codec.readColumnNames(resolvedPath());
        } catch (UnsupportedOperationException e) {
            throw new InvalidHandleOperationException(tag, path, getTypeName() + " payloads have no columns", e);
        }
    }

    protected List<String> columnNames(T payload) {
        throw new InvalidHandleOperationException(tag, path, getTypeName() + " payloads have no columns");
    }

    /**
     * Reads rows {@code [start, end)}, slicing the payload if it is fully materialized.
     * Formats without ranged reads are read completely on the first call and cached.
     */
    public T readChunk(long start, long end) throws IOException {
        if (data != null && !partial) {
            return slice(data, start, end);
        }
        if (path == null) {
            throw new InvalidHandleOperationException(tag, null, "Cannot read a chunk of a handle with no data and no path");
        }
        if (!codec.supportsChunkedRead()) {
            log.debug("Format {} of '{}' has no ranged reads; reading the whole file once", codec.getName(), tag);
            return slice(read(), start, end);
        }
        return codec.readRange(resolvedPath(), start, end);
    }

    /**
     * Returns a lazy iterator over this worker's chunks.
     * <p>
     * Chunks of {@code chunkSize} rows are dealt out round-robin over {@code parallelSize}
     * workers; the chunks of one worker come in ascending order. A fully materialized payload
     * is sliced in memory, otherwise each chunk is read from the backing file when reached.
     * A handle with neither payload nor path yields no chunks.
     */
    public Iterator<Chunk<T>> iterator(long chunkSize, int rank, int parallelSize) throws IOException {
        if (data == null && path == null) {
            return Collections.emptyIterator();
        }
        List<DataRanges.Range> ranges = DataRanges.byRank(size(), chunkSize, parallelSize, rank);
        Iterator<DataRanges.Range> it = ranges.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Chunk<T> next() {
                if (!it.hasNext()) {
                    throw new NoSuchElementException();
                }
                DataRanges.Range range = it.next();
                try {
                    return new Chunk<>(range.start(), range.end(), readChunk(range.start(), range.end()));
                } catch (IOException e) {
                    throw new UncheckedIOException(
                            String.format("Failed to read rows [%d, %d) of '%s'", range.start(), range.end(), tag), e);
                }
            }
        };
    }

    private static void createParentDirectories(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    @Override
    public String toString() {
        return String.format("%s[tag=%s, path=%s, creator=%s, hasData=%s, partial=%s]",
                getClass().getSimpleName(), tag, path, creator, data != null, partial);
    }
}
