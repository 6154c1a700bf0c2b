package org.railyard.pipeline.stages;

import java.nio.file.Path;
import java.util.Objects;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.data.DataStore;
import org.railyard.pipeline.data.HandleRegistry;

/**
 * What a stage needs from its surroundings: the worker's data store, the handle types of
 * the run, the communicator (absent for single-worker runs) and the output directory.
 */
public final class StageContext {

    private final DataStore dataStore;
    private final HandleRegistry handleRegistry;
    private final ICommunicator comm;
    private final Path outputDirectory;

    public StageContext(DataStore dataStore, HandleRegistry handleRegistry, ICommunicator comm, Path outputDirectory) {
        this.dataStore = Objects.requireNonNull(dataStore, "dataStore");
        this.handleRegistry = Objects.requireNonNull(handleRegistry, "handleRegistry");
        this.comm = comm;
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    }

    /**
     * Creates a single-worker context with a fresh store and the built-in handle types.
     */
    public static StageContext local(Path outputDirectory) {
        return new StageContext(new DataStore(), HandleRegistry.withDefaults(), null, outputDirectory);
    }

    /**
     * Returns a context for another worker sharing the handle types and output directory.
     */
    public StageContext forWorker(DataStore store, ICommunicator workerComm) {
        return new StageContext(store, handleRegistry, workerComm, outputDirectory);
    }

    public DataStore getDataStore() {
        return dataStore;
    }

    public HandleRegistry getHandleRegistry() {
        return handleRegistry;
    }

    /**
     * @return the communicator, or {@code null} when running single-worker
     */
    public ICommunicator getComm() {
        return comm;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public int rank() {
        return comm == null ? 0 : comm.rank();
    }

    public int parallelSize() {
        return comm == null ? 1 : comm.size();
    }

    public boolean isCoordinator() {
        return rank() == 0;
    }
}
