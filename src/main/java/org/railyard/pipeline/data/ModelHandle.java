package org.railyard.pipeline.data;

import java.io.IOException;
import java.nio.file.Path;

import org.railyard.pipeline.api.data.Model;
import org.railyard.pipeline.data.codecs.SerializedObjectCodec;
import org.railyard.pipeline.utils.compression.ICompressionCodec;

/**
 * Handle for trained models. Reads go through a {@link ModelCache}; {@code read(true)}
 * bypasses it and refreshes the cached entry.
 */
public class ModelHandle extends DataHandle<Model> {

    public static final String TYPE = "model";

    private final ModelCache cache;
    private boolean forceNextRead;

    public ModelHandle(String tag, String path, String creator, ModelCache cache, ICompressionCodec compression) {
        super(tag, new SerializedObjectCodec<>(Model.class, compression), path, creator);
        this.cache = cache;
    }

    @Override
    public String getTypeName() {
        return TYPE;
    }

    @Override
    protected long dataSize(Model payload) {
        return 1;
    }

    @Override
    public Model read(boolean force) throws IOException {
        forceNextRead = force;
        try {
            return super.read(force);
        } finally {
            forceNextRead = false;
        }
    }

    @Override
    protected Model readFromPath(Path resolved) throws IOException {
        if (forceNextRead) {
            cache.invalidate(resolved);
        }
        return cache.get(resolved, getCodec()::read);
    }

    @Override
    public void write() throws IOException {
        super.write();
        cache.put(resolvedPath(), getData());
    }
}
