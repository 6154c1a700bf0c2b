package org.railyard.pipeline.data;

import java.util.List;

import org.railyard.pipeline.api.data.IDataCodec;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.data.codecs.ColumnarTableCodec;

/**
 * Handle for tables stored in the binary columnar format. Supports parallel chunked writes.
 */
public class TableHandle extends DataHandle<Table> {

    public static final String TYPE = "rtab";

    public TableHandle(String tag, String path, String creator) {
        this(tag, new ColumnarTableCodec(), path, creator);
    }

    protected TableHandle(String tag, IDataCodec<Table> codec, String path, String creator) {
        super(tag, codec, path, creator);
    }

    @Override
    public String getTypeName() {
        return TYPE;
    }

    @Override
    protected long dataSize(Table payload) {
        return payload.numRows();
    }

    @Override
    protected Table slice(Table payload, long start, long end) {
        return payload.slice(Math.toIntExact(start), Math.toIntExact(end));
    }

    @Override
    public Table concat(List<Table> parts) {
        return Table.concat(parts);
    }

    @Override
    protected List<String> columnNames(Table payload) {
        return payload.columnNames();
    }
}
