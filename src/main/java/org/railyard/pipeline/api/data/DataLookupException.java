package org.railyard.pipeline.api.data;

/**
 * Thrown when a named entity cannot be found: an unknown store tag, handle type or stage type.
 */
public class DataLookupException extends RuntimeException {

    public DataLookupException(String message) {
        super(message);
    }
}
