package org.railyard.pipeline.data;

import java.util.List;

import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.data.codecs.EnsembleCodec;

/**
 * Handle for ensembles of gridded distributions. Columns are the ancillary columns.
 */
public class EnsembleHandle extends DataHandle<Ensemble> {

    public static final String TYPE = "rens";

    public EnsembleHandle(String tag, String path, String creator) {
        super(tag, new EnsembleCodec(), path, creator);
    }

    @Override
    public String getTypeName() {
        return TYPE;
    }

    @Override
    protected long dataSize(Ensemble payload) {
        return payload.size();
    }

    @Override
    protected Ensemble slice(Ensemble payload, long start, long end) {
        return payload.slice(Math.toIntExact(start), Math.toIntExact(end));
    }

    @Override
    public Ensemble concat(List<Ensemble> parts) {
        return Ensemble.concat(parts);
    }

    @Override
    protected List<String> columnNames(Ensemble payload) {
        return payload.ancilColumns();
    }
}
