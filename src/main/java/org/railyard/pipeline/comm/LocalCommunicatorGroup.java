package org.railyard.pipeline.comm;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BinaryOperator;

import org.railyard.pipeline.api.comm.CommunicationException;
import org.railyard.pipeline.api.comm.ICommunicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A group of cooperating workers inside one JVM that communicate by message passing.
 * <p>
 * Every ordered pair of ranks has its own unbounded FIFO inbox. Collective operations are
 * built from point-to-point sends and blocking receives, so they share no mutable state
 * beyond the queues and behave like their distributed counterparts: every rank must issue
 * the same collectives in the same order, and a missing participant blocks the others
 * until they are interrupted.
 */
public final class LocalCommunicatorGroup {

    private static final Logger log = LoggerFactory.getLogger(LocalCommunicatorGroup.class);

    /** Wraps payloads so that {@code null} can travel through the queues. */
    private record Envelope(Object payload) {
    }

    /**
     * Work executed by one rank.
     *
     * @param <R> result type
     */
    @FunctionalInterface
    public interface WorkerTask<R> {
        R run(ICommunicator comm) throws Exception;
    }

    private final int size;
    private final List<List<BlockingQueue<Envelope>>> inbox;
    private final List<ICommunicator> communicators;

    /**
     * @param size number of ranks, at least 1
     */
    public LocalCommunicatorGroup(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Group size must be at least 1, got " + size);
        }
        this.size = size;
        this.inbox = new ArrayList<>(size);
        for (int dest = 0; dest < size; dest++) {
            List<BlockingQueue<Envelope>> fromSources = new ArrayList<>(size);
            for (int src = 0; src < size; src++) {
                fromSources.add(new LinkedBlockingQueue<>());
            }
            inbox.add(fromSources);
        }
        this.communicators = new ArrayList<>(size);
        for (int rank = 0; rank < size; rank++) {
            communicators.add(new LocalCommunicator(rank));
        }
    }

    public int size() {
        return size;
    }

    /**
     * @return the communicator used by the given rank
     */
    public ICommunicator communicator(int rank) {
        return communicators.get(rank);
    }

    /**
     * Runs one task per rank, each on its own thread, and returns the results ordered by rank.
     * <p>
     * If any worker fails, the remaining workers are interrupted, which releases them from
     * blocked collectives, and the first failure to complete is rethrown.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public <R> List<R> runWorkers(WorkerTask<R> task) throws InterruptedException {
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "worker-" + threadIndex.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        try {
            CompletionService<Integer> completion = new ExecutorCompletionService<>(executor);
            List<Future<Integer>> futures = new ArrayList<>(size);
            List<R> results = new ArrayList<>(Collections.nCopies(size, null));
            for (int rank = 0; rank < size; rank++) {
                ICommunicator comm = communicators.get(rank);
                int index = rank;
                futures.add(completion.submit(() -> {
                    results.set(index, task.run(comm));
                    return index;
                }));
            }
            for (int done = 0; done < size; done++) {
                Future<Integer> finished = completion.take();
                try {
                    finished.get();
                } catch (ExecutionException e) {
                    log.debug("A worker failed, interrupting the group", e.getCause());
                    futures.forEach(f -> f.cancel(true));
                    throw rethrow(e.getCause());
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static RuntimeException rethrow(Throwable failure) {
        if (failure instanceof RuntimeException runtime) {
            return runtime;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure instanceof IOException io) {
            return new UncheckedIOException(io);
        }
        return new CommunicationException("Worker failed", failure);
    }

    private final class LocalCommunicator implements ICommunicator {

        private final int rank;

        LocalCommunicator(int rank) {
            this.rank = rank;
        }

        @Override
        public int rank() {
            return rank;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public void barrier() {
            gather(Boolean.TRUE, 0);
            bcast(Boolean.TRUE, 0);
        }

        @Override
        public <T> T bcast(T value, int root) {
            checkRoot(root);
            if (rank == root) {
                for (int dest = 0; dest < size; dest++) {
                    if (dest != root) {
                        send(dest, value);
                    }
                }
                return value;
            }
            return receive(root);
        }

        @Override
        public <T> List<T> gather(T value, int root) {
            checkRoot(root);
            if (rank != root) {
                send(root, value);
                return null;
            }
            List<T> values = new ArrayList<>(size);
            for (int src = 0; src < size; src++) {
                values.add(src == root ? value : receive(src));
            }
            return values;
        }

        @Override
        public <T> T reduce(T value, BinaryOperator<T> op, int root) {
            List<T> values = gather(value, root);
            if (values == null) {
                return null;
            }
            T result = values.get(0);
            for (int i = 1; i < values.size(); i++) {
                result = op.apply(result, values.get(i));
            }
            return result;
        }

        private void send(int dest, Object value) {
            inbox.get(dest).get(rank).add(new Envelope(value));
        }

        @SuppressWarnings("unchecked")
        private <T> T receive(int src) {
            try {
                return (T) inbox.get(rank).get(src).take().payload();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CommunicationException(String.format("Rank %d interrupted while waiting for rank %d", rank, src), e);
            }
        }

        private void checkRoot(int root) {
            if (root < 0 || root >= size) {
                throw new IllegalArgumentException("Root " + root + " outside [0, " + size + ")");
            }
        }

        @Override
        public String toString() {
            return "LocalCommunicator[rank=" + rank + ", size=" + size + "]";
        }
    }
}
