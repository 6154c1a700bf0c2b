package org.railyard.pipeline.utils.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

/**
 * Zstandard compression backed by zstd-jni.
 */
public final class ZstdCodec implements ICompressionCodec {

    /** Frame magic number, little-endian {@code 0xFD2FB528}. */
    static final byte[] MAGIC = {(byte) 0x28, (byte) 0xB5, (byte) 0x2F, (byte) 0xFD};

    private final int level;

    /**
     * Creates a codec with the given compression level.
     *
     * @param level zstd level, 1 (fastest) to 22 (smallest)
     * @throws IllegalArgumentException if the level is out of range
     */
    public ZstdCodec(int level) {
        if (level < 1 || level > 22) {
            throw new IllegalArgumentException("zstd level must be in [1, 22], got " + level);
        }
        this.level = level;
    }

    @Override
    public String getName() {
        return "zstd";
    }

    @Override
    public int getLevel() {
        return level;
    }

    @Override
    public String getFileExtension() {
        return ".zst";
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new ZstdOutputStream(out, level);
    }

    @Override
    public InputStream wrapInputStream(InputStream in) throws IOException {
        return new ZstdInputStream(in);
    }
}
