package org.railyard.pipeline.utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the chunk boundaries a worker processes during a chunked pass.
 * <p>
 * Chunks of {@code chunkSize} rows are numbered from zero and dealt out round-robin:
 * chunk {@code i} belongs to rank {@code i % parallelSize}. The union over all ranks is
 * therefore an exact partition of {@code [0, totalLength)}, and every rank sees its own
 * chunks in ascending order.
 */
public final class DataRanges {

    private DataRanges() {
    }

    /**
     * Half-open row range {@code [start, end)}.
     *
     * @param start first row, inclusive
     * @param end   last row, exclusive
     */
    public record Range(long start, long end) {

        public Range {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
            }
        }

        /**
         * @return number of rows covered by this range
         */
        public long length() {
            return end - start;
        }
    }

    /**
     * Returns the number of chunks needed to cover {@code totalLength} rows.
     *
     * @param totalLength number of rows
     * @param chunkSize   rows per chunk, must be positive
     * @return {@code ceil(totalLength / chunkSize)}
     */
    public static long chunkCount(long totalLength, long chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        return totalLength / chunkSize + (totalLength % chunkSize == 0 ? 0 : 1);
    }

    /**
     * Returns the ranges assigned to one rank.
     *
     * @param totalLength  number of rows in the data product
     * @param chunkSize    rows per chunk, must be positive
     * @param parallelSize number of cooperating workers, must be positive
     * @param rank         this worker's rank in {@code [0, parallelSize)}
     * @return ascending, non-overlapping ranges for this rank
     */
    public static List<Range> byRank(long totalLength, long chunkSize, int parallelSize, int rank) {
        if (parallelSize <= 0) {
            throw new IllegalArgumentException("parallelSize must be positive, got " + parallelSize);
        }
        if (rank < 0 || rank >= parallelSize) {
            throw new IllegalArgumentException("rank " + rank + " outside [0, " + parallelSize + ")");
        }
        long chunks = chunkCount(totalLength, chunkSize);
        List<Range> ranges = new ArrayList<>();
        for (long i = rank; i < chunks; i += parallelSize) {
            long start = i * chunkSize;
            ranges.add(new Range(start, start + Math.min(chunkSize, totalLength - start)));
        }
        return ranges;
    }

    /**
     * Chooses a chunk size that hands every worker at least one chunk.
     * <p>
     * If {@code ceil(totalLength / chunkSize)} is already at least {@code parallelSize}
     * the requested size is kept. Otherwise the size is reduced to
     * {@code max(1, totalLength / parallelSize)}, which yields at least
     * {@code parallelSize} chunks whenever {@code totalLength >= parallelSize}.
     *
     * @param totalLength  number of rows
     * @param chunkSize    requested rows per chunk
     * @param parallelSize number of cooperating workers
     * @return the effective chunk size
     */
    public static long balancedChunkSize(long totalLength, long chunkSize, int parallelSize) {
        if (chunkCount(totalLength, chunkSize) >= parallelSize) {
            return chunkSize;
        }
        return Math.max(1L, totalLength / parallelSize);
    }
}
