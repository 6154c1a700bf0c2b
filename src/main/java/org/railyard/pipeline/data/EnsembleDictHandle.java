package org.railyard.pipeline.data;

import org.railyard.pipeline.api.data.EnsembleDict;
import org.railyard.pipeline.data.codecs.EnsembleDictCodec;

/**
 * Handle for a dictionary of named ensembles, read and written whole.
 */
public class EnsembleDictHandle extends DataHandle<EnsembleDict> {

    public static final String TYPE = "rensd";

    public EnsembleDictHandle(String tag, String path, String creator) {
        super(tag, new EnsembleDictCodec(), path, creator);
    }

    @Override
    public String getTypeName() {
        return TYPE;
    }

    @Override
    protected long dataSize(EnsembleDict payload) {
        return payload.size();
    }
}
