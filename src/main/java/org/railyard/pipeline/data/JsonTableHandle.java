package org.railyard.pipeline.data;

import org.railyard.pipeline.data.codecs.JsonTableCodec;

/**
 * Handle for small tables stored as key-columnar JSON. Chunked writes are buffered and
 * limited to a single worker.
 */
public class JsonTableHandle extends TableHandle {

    public static final String TYPE = "json";

    public JsonTableHandle(String tag, String path, String creator) {
        super(tag, new JsonTableCodec(), path, creator);
    }

    @Override
    public String getTypeName() {
        return TYPE;
    }
}
