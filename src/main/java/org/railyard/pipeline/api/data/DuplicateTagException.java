package org.railyard.pipeline.api.data;

/**
 * Thrown when a tag that already holds a handle is set again while overwriting is disabled.
 */
public class DuplicateTagException extends RuntimeException {

    private final String tag;
    private final String previousCreator;

    public DuplicateTagException(String tag, String previousCreator) {
        super(String.format("Tag '%s' already present in the data store, created by %s", tag, previousCreator));
        this.tag = tag;
        this.previousCreator = previousCreator;
    }

    public String getTag() {
        return tag;
    }

    public String getPreviousCreator() {
        return previousCreator;
    }
}
