package org.railyard.pipeline.api.data;

import java.util.Collections;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A lazy, finite, one-pass sequence of chunks handed to one worker.
 * <p>
 * Besides the chunks themselves the sequence records the worker's {@code rank}, the
 * number of cooperating workers and the effective chunk size, so stages can log and
 * size their outputs without recomputing the partition.
 *
 * @param <T> payload type
 */
public final class ChunkSequence<T> implements Iterable<Chunk<T>> {

    private final Iterator<Chunk<T>> chunks;
    private final int rank;
    private final int parallelSize;
    private final long chunkSize;
    private final long totalLength;
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    public ChunkSequence(Iterator<Chunk<T>> chunks, int rank, int parallelSize, long chunkSize, long totalLength) {
        this.chunks = chunks;
        this.rank = rank;
        this.parallelSize = parallelSize;
        this.chunkSize = chunkSize;
        this.totalLength = totalLength;
    }

    /**
     * Creates a sequence that yields no chunks.
     */
    public static <T> ChunkSequence<T> empty(int rank, int parallelSize) {
        return new ChunkSequence<>(Collections.emptyIterator(), rank, parallelSize, 0, 0);
    }

    /**
     * Returns the underlying iterator. May only be called once.
     *
     * @throws IllegalStateException on a second call
     */
    @Override
    public Iterator<Chunk<T>> iterator() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("ChunkSequence can only be iterated once");
        }
        return chunks;
    }

    public int getRank() {
        return rank;
    }

    public int getParallelSize() {
        return parallelSize;
    }

    public long getChunkSize() {
        return chunkSize;
    }

    public long getTotalLength() {
        return totalLength;
    }
}
