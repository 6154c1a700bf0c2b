package org.railyard.pipeline.utils.compression;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Pass-through codec.
 */
public final class NoneCodec implements ICompressionCodec {

    @Override
    public String getName() {
        return "none";
    }

    @Override
    public int getLevel() {
        return 0;
    }

    @Override
    public String getFileExtension() {
        return "";
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) {
        return out;
    }

    @Override
    public InputStream wrapInputStream(InputStream in) {
        return in;
    }
}
