package org.railyard.pipeline.data.codecs;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.IChunkWriteSession;
import org.railyard.pipeline.api.data.IDataCodec;
import org.railyard.pipeline.utils.compression.CompressionCodecFactory;
import org.railyard.pipeline.utils.compression.ICompressionCodec;

/**
 * Stores one Java-serialized object, optionally compressed.
 * <p>
 * The compression used on write is configurable; on read it is detected from the file's
 * leading bytes, so files written with any supported codec stay readable.
 *
 * @param <T> payload type
 */
public final class SerializedObjectCodec<T extends Serializable> implements IDataCodec<T> {

    private final Class<T> type;
    private final ICompressionCodec compression;

    public SerializedObjectCodec(Class<T> type, ICompressionCodec compression) {
        this.type = type;
        this.compression = compression;
    }

    @Override
    public String getName() {
        return "serialized";
    }

    @Override
    public String getFileExtension() {
        return "ser";
    }

    @Override
    public Class<T> getDataType() {
        return type;
    }

    public ICompressionCodec getCompression() {
        return compression;
    }

    @Override
    public T read(Path path) throws IOException {
        ICompressionCodec detected = CompressionCodecFactory.detectFromMagicBytes(BinaryFiles.peek(path, 4));
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(path));
             ObjectInputStream in = new ObjectInputStream(new BufferedInputStream(detected.wrapInputStream(raw)))) {
            Object value = in.readObject();
            if (!type.isInstance(value)) {
                throw new InvalidObjectException(String.format("%s holds a %s, expected %s",
                        path, value == null ? "null" : value.getClass().getName(), type.getName()));
            }
            return type.cast(value);
        } catch (ClassNotFoundException e) {
            throw new IOException("Cannot deserialize " + path + ": class not found", e);
        }
    }

    @Override
    public void write(T data, Path path) throws IOException {
        try (ObjectOutputStream out = new ObjectOutputStream(new BufferedOutputStream(
                compression.wrapOutputStream(Files.newOutputStream(path))))) {
            out.writeObject(data);
        }
    }

    /**
     * A serialized object counts as a single row.
     */
    @Override
    public long length(Path path) {
        return 1;
    }

    @Override
    public T readRange(Path path, long start, long end) {
        throw new UnsupportedOperationException("Serialized objects cannot be read in chunks");
    }

    @Override
    public IChunkWriteSession<T> initializeWrite(Path path, T template, long totalLength, ICommunicator comm) {
        throw new UnsupportedOperationException("Serialized objects cannot be written in chunks");
    }

    @Override
    public boolean supportsChunkedRead() {
        return false;
    }

    @Override
    public boolean supportsParallelWrite() {
        return false;
    }
}
