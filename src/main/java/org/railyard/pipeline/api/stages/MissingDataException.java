package org.railyard.pipeline.api.stages;

import org.railyard.pipeline.api.data.DataLookupException;

/**
 * Thrown when a stage looks up data that nobody has provided.
 */
public class MissingDataException extends DataLookupException {

    private final String stageName;
    private final String tag;
    private final String storeKey;

    public MissingDataException(String stageName, String tag, String storeKey) {
        super(tag.equals(storeKey)
                ? String.format("Stage '%s': data '%s' not found in the data store", stageName, tag)
                : String.format("Stage '%s': data '%s' (aliased to '%s') not found in the data store", stageName, tag, storeKey));
        this.stageName = stageName;
        this.tag = tag;
        this.storeKey = storeKey;
    }

    public String getStageName() {
        return stageName;
    }

    public String getTag() {
        return tag;
    }

    public String getStoreKey() {
        return storeKey;
    }
}
