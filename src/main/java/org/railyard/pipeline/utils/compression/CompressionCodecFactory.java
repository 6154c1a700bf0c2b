package org.railyard.pipeline.utils.compression;

import java.util.Arrays;

import com.typesafe.config.Config;

/**
 * Creates {@link ICompressionCodec} instances from configuration and detects the codec
 * of existing data.
 * <p>
 * Configuration layout:
 * <pre>
 * compression {
 *   codec = "zstd"   # or "none"
 *   level = 3
 * }
 * </pre>
 */
public final class CompressionCodecFactory {

    /** Level used when the configuration does not name one. */
    public static final int DEFAULT_ZSTD_LEVEL = 3;

    private CompressionCodecFactory() {
    }

    /**
     * Creates a codec from an options block that may contain a {@code compression} section.
     * A missing section yields {@link NoneCodec}.
     *
     * @param options the component options
     * @return the configured codec
     * @throws IllegalArgumentException if the codec name is unknown
     */
    public static ICompressionCodec create(Config options) {
        if (!options.hasPath("compression")) {
            return new NoneCodec();
        }
        Config compression = options.getConfig("compression");
        String name = compression.hasPath("codec") ? compression.getString("codec") : "zstd";
        int level = compression.hasPath("level") ? compression.getInt("level") : DEFAULT_ZSTD_LEVEL;
        return create(name, level);
    }

    /**
     * Creates a codec by name.
     *
     * @param name  {@code "zstd"} or {@code "none"}
     * @param level compression level, ignored by {@code "none"}
     * @return the codec
     * @throws IllegalArgumentException if the codec name is unknown
     */
    public static ICompressionCodec create(String name, int level) {
        switch (name.toLowerCase()) {
            case "zstd":
                return new ZstdCodec(level);
            case "none":
                return new NoneCodec();
            default:
                throw new IllegalArgumentException("Unknown compression codec: '" + name + "'. Supported: zstd, none");
        }
    }

    /**
     * Detects the codec from the leading bytes of a blob or file.
     *
     * @param header at least the first four bytes of the data (shorter arrays are treated as uncompressed)
     * @return {@link ZstdCodec} if the zstd frame magic is present, {@link NoneCodec} otherwise
     */
    public static ICompressionCodec detectFromMagicBytes(byte[] header) {
        if (header != null && header.length >= ZstdCodec.MAGIC.length
                && Arrays.equals(Arrays.copyOf(header, ZstdCodec.MAGIC.length), ZstdCodec.MAGIC)) {
            return new ZstdCodec(DEFAULT_ZSTD_LEVEL);
        }
        return new NoneCodec();
    }

    /**
     * Detects the codec from a file name extension.
     *
     * @param path file name or path
     * @return {@link ZstdCodec} for {@code .zst} files, {@link NoneCodec} otherwise
     */
    public static ICompressionCodec detectFromExtension(String path) {
        if (path != null && path.endsWith(".zst")) {
            return new ZstdCodec(DEFAULT_ZSTD_LEVEL);
        }
        return new NoneCodec();
    }
}
