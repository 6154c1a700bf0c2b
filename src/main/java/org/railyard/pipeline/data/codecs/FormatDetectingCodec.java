package org.railyard.pipeline.data.codecs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.IChunkWriteSession;
import org.railyard.pipeline.api.data.IDataCodec;

/**
 * Read-only codec that accepts either a table or an ensemble file and dispatches on the
 * file's leading bytes. Payloads are {@link org.railyard.pipeline.api.data.Table} or
 * {@link org.railyard.pipeline.api.data.Ensemble}.
 */
public final class FormatDetectingCodec implements IDataCodec<Object> {

    private final ColumnarTableCodec tables = new ColumnarTableCodec();
    private final EnsembleCodec ensembles = new EnsembleCodec();
    private final JsonTableCodec json = new JsonTableCodec();

    @Override
    public String getName() {
        return "ensemble-or-table";
    }

    @Override
    public String getFileExtension() {
        return "rtab";
    }

    @Override
    public Class<Object> getDataType() {
        return Object.class;
    }

    /**
     * Chooses the codec matching the file's format.
     *
     * @throws IOException if the format is not recognized
     */
    public IDataCodec<?> detect(Path path) throws IOException {
        byte[] header = BinaryFiles.peek(path, 4);
        if (Arrays.equals(header, ColumnarTableCodec.MAGIC)) {
            return tables;
        }
        if (Arrays.equals(header, EnsembleCodec.MAGIC)) {
            return ensembles;
        }
        for (byte b : header) {
            if (!Character.isWhitespace(b)) {
                if (b == '{') {
                    return json;
                }
                break;
            }
        }
        throw new IOException("Cannot detect the format of " + path + ": neither a table nor an ensemble file");
    }

    @Override
    public Object read(Path path) throws IOException {
        return detect(path).read(path);
    }

    @Override
    public void write(Object data, Path path) {
        throw new UnsupportedOperationException(getName() + " handles are input only");
    }

    @Override
    public long length(Path path) throws IOException {
        return detect(path).length(path);
    }

    @Override
    public Object readRange(Path path, long start, long end) throws IOException {
        return detect(path).readRange(path, start, end);
    }

    @Override
    public List<String> readColumnNames(Path path) throws IOException {
        return detect(path).readColumnNames(path);
    }

    @Override
    public IChunkWriteSession<Object> initializeWrite(Path path, Object template, long totalLength, ICommunicator comm) {
        throw new UnsupportedOperationException(getName() + " handles are input only");
    }

    @Override
    public boolean supportsParallelWrite() {
        return false;
    }
}
