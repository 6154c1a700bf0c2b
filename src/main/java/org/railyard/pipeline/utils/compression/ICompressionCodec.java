package org.railyard.pipeline.utils.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stream compression used by the whole-file codecs (models, ensemble dictionaries).
 * <p>
 * Implementations must be stateless and thread-safe; every call to a wrap method returns
 * a fresh stream that owns (and closes) the wrapped stream.
 */
public interface ICompressionCodec {

    /**
     * @return codec name as used in configuration (e.g. {@code "zstd"}, {@code "none"})
     */
    String getName();

    /**
     * @return compression level, or 0 where the codec has none
     */
    int getLevel();

    /**
     * @return file name extension appended to compressed files, including the dot, or an empty string
     */
    String getFileExtension();

    /**
     * Wraps an output stream so that bytes written to the result are compressed.
     *
     * @param out the raw destination
     * @return the compressing stream
     * @throws IOException if the codec cannot initialize
     */
    OutputStream wrapOutputStream(OutputStream out) throws IOException;

    /**
     * Wraps an input stream so that bytes read from the result are decompressed.
     *
     * @param in the raw source
     * @return the decompressing stream
     * @throws IOException if the codec cannot initialize
     */
    InputStream wrapInputStream(InputStream in) throws IOException;
}
