package org.railyard.pipeline.api.data;

/**
 * One unit of streamed work: the rows {@code [start, end)} of a data product and their payload.
 *
 * @param start first row, inclusive
 * @param end   last row, exclusive
 * @param data  payload holding exactly {@code end - start} rows
 * @param <T>   payload type
 */
public record Chunk<T>(long start, long end, T data) {

    public Chunk {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid chunk range [" + start + ", " + end + ")");
        }
    }

    /**
     * @return number of rows in this chunk
     */
    public long length() {
        return end - start;
    }
}
