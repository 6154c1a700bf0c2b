package org.railyard.pipeline.data.codecs;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.EnsembleDict;
import org.railyard.pipeline.api.data.IChunkWriteSession;
import org.railyard.pipeline.api.data.IDataCodec;
import org.railyard.pipeline.utils.compression.CompressionCodecFactory;
import org.railyard.pipeline.utils.compression.ICompressionCodec;

/**
 * Named-ensemble dictionary format ({@code .rensd}): a compressed stream of
 * {@code "RNSD" | int count | count x (string name, rens payload)}.
 * <p>
 * The length of a dictionary is its number of entries. The format is whole-file only.
 */
public final class EnsembleDictCodec implements IDataCodec<EnsembleDict> {

    public static final byte[] MAGIC = BinaryFiles.magic("RNSD");

    private final ICompressionCodec compression;

    public EnsembleDictCodec() {
        this(CompressionCodecFactory.create("zstd", CompressionCodecFactory.DEFAULT_ZSTD_LEVEL));
    }

    public EnsembleDictCodec(ICompressionCodec compression) {
        this.compression = compression;
    }

    @Override
    public String getName() {
        return "rensd";
    }

    @Override
    public String getFileExtension() {
        return "rensd";
    }

    @Override
    public Class<EnsembleDict> getDataType() {
        return EnsembleDict.class;
    }

    @Override
    public EnsembleDict read(Path path) throws IOException {
        try (DataInputStream in = openData(path)) {
            BinaryFiles.checkMagic(in, MAGIC, path);
            int count = in.readInt();
            Map<String, Ensemble> entries = new LinkedHashMap<>();
            for (int i = 0; i < count; i++) {
                String name = BinaryFiles.readString(in);
                entries.put(name, EnsembleCodec.readFrom(in, path));
            }
            return new EnsembleDict(entries);
        }
    }

    @Override
    public void write(EnsembleDict data, Path path) throws IOException {
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(
                compression.wrapOutputStream(Files.newOutputStream(path))))) {
            out.write(MAGIC);
            out.writeInt(data.size());
            for (Map.Entry<String, Ensemble> e : data.asMap().entrySet()) {
                BinaryFiles.writeString(out, e.getKey());
                EnsembleCodec.writeTo(out, e.getValue());
            }
        }
    }

    @Override
    public long length(Path path) throws IOException {
        try (DataInputStream in = openData(path)) {
            BinaryFiles.checkMagic(in, MAGIC, path);
            return in.readInt();
        }
    }

    @Override
    public EnsembleDict readRange(Path path, long start, long end) {
        throw new UnsupportedOperationException("rensd files cannot be read in chunks");
    }

    @Override
    public IChunkWriteSession<EnsembleDict> initializeWrite(Path path, EnsembleDict template, long totalLength,
                                                           ICommunicator comm) {
        throw new UnsupportedOperationException("rensd files cannot be written in chunks");
    }

    @Override
    public boolean supportsChunkedRead() {
        return false;
    }

    @Override
    public boolean supportsParallelWrite() {
        return false;
    }

    private static DataInputStream openData(Path path) throws IOException {
        ICompressionCodec detected = CompressionCodecFactory.detectFromMagicBytes(BinaryFiles.peek(path, 4));
        InputStream raw = Files.newInputStream(path);
        try {
            return new DataInputStream(new BufferedInputStream(detected.wrapInputStream(raw)));
        } catch (IOException e) {
            raw.close();
            throw e;
        }
    }
}
