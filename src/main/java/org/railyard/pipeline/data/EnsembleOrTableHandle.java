package org.railyard.pipeline.data;

import java.util.ArrayList;
import java.util.List;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.InvalidHandleOperationException;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.data.codecs.FormatDetectingCodec;

/**
 * Input-only handle accepting either a table or an ensemble. The file format is detected
 * when the file is read; every write operation fails.
 */
public class EnsembleOrTableHandle extends DataHandle<Object> {

    public static final String TYPE = "ensembleOrTable";

    public EnsembleOrTableHandle(String tag, String path, String creator) {
        super(tag, new FormatDetectingCodec(), path, creator);
    }

    @Override
    public String getTypeName() {
        return TYPE;
    }

    @Override
    public void setData(Object payload, boolean partial) {
        if (payload != null && !(payload instanceof Table) && !(payload instanceof Ensemble)) {
            throw new IllegalArgumentException(String.format(
                    "Handle '%s' accepts tables or ensembles, not %s", getTag(), payload.getClass().getName()));
        }
        super.setData(payload, partial);
    }

    @Override
    public boolean isWritable() {
        return false;
    }

    @Override
    public void write() {
        throw new InvalidHandleOperationException(getTag(), getPath(), "Handle type " + TYPE + " is input only");
    }

    @Override
    public void initializeWrite(long totalLength, ICommunicator comm) {
        throw new InvalidHandleOperationException(getTag(), getPath(), "Handle type " + TYPE + " is input only");
    }

    @Override
    protected long dataSize(Object payload) {
        return payload instanceof Table table ? table.numRows() : ((Ensemble) payload).size();
    }

    @Override
    protected Object slice(Object payload, long start, long end) {
        int from = Math.toIntExact(start);
        int to = Math.toIntExact(end);
        return payload instanceof Table table ? table.slice(from, to) : ((Ensemble) payload).slice(from, to);
    }

    @Override
    public Object concat(List<Object> parts) {
        if (parts.get(0) instanceof Table) {
            List<Table> tables = new ArrayList<>();
            parts.forEach(p -> tables.add((Table) p));
            return Table.concat(tables);
        }
        List<Ensemble> ensembles = new ArrayList<>();
        parts.forEach(p -> ensembles.add((Ensemble) p));
        return Ensemble.concat(ensembles);
    }

    @Override
    protected List<String> columnNames(Object payload) {
        return payload instanceof Table table ? table.columnNames() : ((Ensemble) payload).ancilColumns();
    }
}
