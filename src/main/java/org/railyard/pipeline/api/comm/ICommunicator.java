package org.railyard.pipeline.api.comm;

import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Collective communication between cooperating workers of one run.
 * <p>
 * Every operation is <strong>collective</strong>: it blocks until all workers have made
 * the matching call, and all workers must issue the same collective calls in the same
 * order. A worker that skips a call deadlocks the run; there is no timeout.
 * <p>
 * Stages receive a {@code null} communicator when running single-worker and must then
 * issue no collective calls at all.
 */
public interface ICommunicator {

    /**
     * @return this worker's index in {@code [0, size())}
     */
    int rank();

    /**
     * @return number of cooperating workers
     */
    int size();

    /**
     * Blocks until every worker has reached the barrier.
     */
    void barrier();

    /**
     * Distributes a value from the root to every worker.
     *
     * @param value value to send, only meaningful on the root
     * @param root  rank of the sending worker
     * @return the root's value, on every worker
     */
    <T> T bcast(T value, int root);

    /**
     * Collects one value from every worker on the root.
     *
     * @param value this worker's contribution
     * @param root  rank of the collecting worker
     * @return on the root, the contributions ordered by rank; {@code null} elsewhere
     */
    <T> List<T> gather(T value, int root);

    /**
     * Combines one value from every worker on the root, folding in rank order.
     *
     * @param value this worker's contribution
     * @param op    associative combine operation
     * @param root  rank of the collecting worker
     * @return on the root, the combined value; {@code null} elsewhere
     */
    <T> T reduce(T value, BinaryOperator<T> op, int root);

    /**
     * @return {@code true} if this worker is rank 0
     */
    default boolean isRoot() {
        return rank() == 0;
    }
}
