package org.railyard.pipeline.stages;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

import org.railyard.pipeline.api.comm.ICommunicator;
import org.railyard.pipeline.api.data.ChunkSequence;
import org.railyard.pipeline.api.data.DataLookupException;
import org.railyard.pipeline.api.data.InvalidHandleOperationException;
import org.railyard.pipeline.api.data.MissingColumnsException;
import org.railyard.pipeline.api.data.Model;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.ConfigurationException;
import org.railyard.pipeline.api.stages.MissingDataException;
import org.railyard.pipeline.api.stages.OutputMode;
import org.railyard.pipeline.api.stages.StageConfig;
import org.railyard.pipeline.api.stages.StageParameter;
import org.railyard.pipeline.api.stages.StageParameters;
import org.railyard.pipeline.api.stages.StageState;
import org.railyard.pipeline.data.DataHandle;
import org.railyard.pipeline.data.DataStore;
import org.railyard.pipeline.data.HandleType;
import org.railyard.pipeline.utils.DataRanges;
import org.railyard.pipeline.utils.PathExpansion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of all pipeline stages, providing parameter validation, tag aliasing, data
 * access through the {@link DataStore}, chunked input iteration and output finalization.
 * Subclasses declare their ports and implement {@link #run()}.
 * <p>
 * <strong>Aliasing:</strong> every store access goes through {@link #resolveAlias(String)},
 * which maps the logical tags a stage class uses ("input", "model", "output") to the store
 * keys of this instance. Two instances of the same class therefore coexist in one store as
 * long as their tags are aliased to distinct keys. Aliases come from {@link #setAlias},
 * from the reserved {@code aliases} option, or from {@link #connectInput}.
 * <p>
 * <strong>Lifecycle:</strong> {@link #execute()} moves the stage through
 * {@code IDLE -> VALIDATING -> RUNNING -> FINALIZING -> DONE}. Any failure moves it to
 * {@code FAILED} and propagates; there is no retry.
 * <p>
 * <strong>Outputs:</strong> in {@link OutputMode#DEFAULT} mode, chunked outputs stream to
 * an {@code inprogress_} file that is moved to its final name when the stage finalizes,
 * and whole outputs are written once by rank 0. In {@link OutputMode#RETURN} mode nothing is
 * written: chunks are buffered by start row and concatenated into the output handle, on
 * rank 0 when several workers cooperate.
 * <p>
 * <strong>Parallelism:</strong> when the context carries a communicator, the chunk loop of
 * each worker sees a disjoint share of the input, and finalization is collective. Every
 * worker must therefore call {@link #initializeOutput} for the same outputs.
 */
public abstract class AbstractStage {

    /** Reserved option holding a map of logical tag to store key. */
    public static final String ALIASES_OPTION = "aliases";

    public static final StageParameter<String> OUTPUT_MODE =
            StageParameter.optional("outputMode", String.class, "default", "Either 'default' (write to disk) or 'return' (keep in memory)");

    private static final String IN_PROGRESS_PREFIX = "inprogress_";

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String instanceName;
    protected final StageConfig config;
    protected final StageContext context;
    private final OutputMode outputMode;
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final AtomicReference<StageState> currentState = new AtomicReference<>(StageState.IDLE);
    private final Set<String> streamedOutputs = new LinkedHashSet<>();
    private final Map<String, TreeMap<Long, Object>> returnBuffers = new HashMap<>();
    private final Map<String, Object> returnTemplates = new HashMap<>();

    /**
     * Constructs a stage and validates its options.
     *
     * @param instanceName unique name of this instance in the pipeline
     * @param parameters   parameters declared by the concrete class
     * @param options      supplied values, optionally including {@value #ALIASES_OPTION}
     * @param context      store, handle types, communicator and output directory
     * @throws ConfigurationException if the options do not validate
     */
    protected AbstractStage(String instanceName, StageParameters parameters, Map<String, Object> options, StageContext context) {
        this.instanceName = instanceName;
        this.context = context;
        Map<String, Object> supplied = new LinkedHashMap<>(options);
        Object aliasOption = supplied.remove(ALIASES_OPTION);
        StageParameters declared = StageParameters.builder().add(OUTPUT_MODE).addAll(parameters).build();
        this.config = new StageConfig(instanceName, declared, supplied);
        this.outputMode = OutputMode.parse(config.getString(OUTPUT_MODE.getName()));
        if (aliasOption != null) {
            if (!(aliasOption instanceof Map<?, ?> aliasMap)) {
                throw new ConfigurationException(String.format("%s: option '%s' must be a map, got %s",
                        instanceName, ALIASES_OPTION, aliasOption));
            }
            aliasMap.forEach((tag, key) -> setAlias(String.valueOf(tag), String.valueOf(key)));
        }
    }

    /**
     * Returns the inputs this stage class consumes. Called from the constructor, so
     * implementations return a constant.
     */
    public abstract List<StagePort> getInputs();

    /**
     * Returns the outputs this stage class produces. Called from the constructor, so
     * implementations return a constant.
     */
    public abstract List<StagePort> getOutputs();

    /**
     * Stage-specific work. Called once, after {@link #validate()}.
     */
    protected abstract void run() throws IOException;

    /**
     * Checks preconditions before running. The default requires every declared input to be
     * present in the store.
     */
    protected void validate() throws IOException {
        for (StagePort port : getInputs()) {
            getHandle(port.tag());
        }
    }

    /**
     * Runs the stage: validate, run, finalize outputs.
     *
     * @throws IllegalStateException if the stage was already executed
     */
    public final void execute() throws IOException {
        if (!currentState.compareAndSet(StageState.IDLE, StageState.VALIDATING)) {
            throw new IllegalStateException(String.format("Cannot execute stage '%s' as it is in state %s",
                    instanceName, currentState.get()));
        }
        log.info("Executing stage '{}' (rank {} of {}, output mode {})",
                instanceName, context.rank(), context.parallelSize(), outputMode);
        try {
            validate();
            currentState.set(StageState.RUNNING);
            run();
            currentState.set(StageState.FINALIZING);
            finalizeStage();
            currentState.set(StageState.DONE);
            log.info("Stage '{}' done", instanceName);
        } catch (IOException | RuntimeException e) {
            StageState failedIn = currentState.getAndSet(StageState.FAILED);
            log.error("Stage '{}' failed while {}: {}", instanceName, failedIn, e.getMessage());
            log.debug("Stage '{}' failure details", instanceName, e);
            if (e instanceof InvalidHandleOperationException handleError && handleError.getStage() == null) {
                throw handleError.inStage(instanceName);
            }
            throw e;
        }
    }

    public StageState getCurrentState() {
        return currentState.get();
    }

    public String getInstanceName() {
        return instanceName;
    }

    public StageConfig getConfig() {
        return config;
    }

    public OutputMode getOutputMode() {
        return outputMode;
    }

    // ---------------------------------------------------------------- aliasing

    /**
     * Maps a logical tag of this stage to a store key.
     *
     * @throws DataLookupException if the tag is not a declared port
     */
    public void setAlias(String tag, String storeKey) {
        findPort(tag);
        aliases.put(tag, storeKey);
        log.debug("Stage '{}': '{}' aliased to '{}'", instanceName, tag, storeKey);
    }

    /**
     * @return the store key for a logical tag: its alias if set, otherwise the tag itself
     */
    public String resolveAlias(String tag) {
        return aliases.getOrDefault(tag, tag);
    }

    public Map<String, String> getAliases() {
        return Collections.unmodifiableMap(aliases);
    }

    // ---------------------------------------------------------------- handles and data

    /**
     * Equivalent to {@code getHandle(tag, false)}.
     */
    public DataHandle<?> getHandle(String tag) {
        return getHandle(tag, false);
    }

    /**
     * Looks up the handle of a logical tag.
     *
     * @param allowMissing create and register an empty handle if none exists
     * @throws MissingDataException if absent and {@code allowMissing} is false
     */
    public DataHandle<?> getHandle(String tag, boolean allowMissing) {
        String key = resolveAlias(tag);
        DataHandle<?> handle = store().get(key);
        if (handle != null) {
            return handle;
        }
        if (!allowMissing) {
            throw new MissingDataException(instanceName, tag, key);
        }
        return store().addHandle(key, handleType(tag), defaultPath(tag), instanceName);
    }

    /**
     * Looks up a handle and checks its payload type.
     *
     * @throws IllegalArgumentException if the handle carries another payload type
     */
    @SuppressWarnings("unchecked")
    protected <T> DataHandle<T> getHandle(String tag, Class<T> type) {
        DataHandle<?> handle = getHandle(tag);
        if (!type.isAssignableFrom(handle.getDataType())) {
            throw new IllegalArgumentException(String.format("Stage '%s': '%s' holds %s, expected %s",
                    instanceName, tag, handle.getDataType().getSimpleName(), type.getSimpleName()));
        }
        return (DataHandle<T>) handle;
    }

    /**
     * Returns the data of a tag, reading it if necessary.
     */
    public Object getData(String tag) throws IOException {
        return getHandle(tag).read();
    }

    /**
     * Returns the data of a tag as the expected type.
     *
     * @throws IllegalArgumentException if the data has another type
     */
    public <T> T getData(String tag, Class<T> type) throws IOException {
        Object data = getData(tag);
        if (!type.isInstance(data)) {
            throw new IllegalArgumentException(String.format("Stage '%s': '%s' holds a %s, expected %s",
                    instanceName, tag, data == null ? "null" : data.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(data);
    }

    /**
     * Equivalent to {@code setData(tag, value, true)}.
     */
    public Object setData(String tag, Object value) throws IOException {
        return setData(tag, value, true);
    }

    /**
     * Provides data for a tag.
     * <ul>
     *   <li>A {@link DataHandle} (typically another stage's output) is connected: the tag is
     *       aliased to the handle's store key, and the handle is read if {@code doRead}.</li>
     *   <li>A {@link String} or {@link Path} names a file, which must exist; it is attached
     *       and read if {@code doRead}.</li>
     *   <li>Anything else is attached as in-memory data, replacing any previous path.</li>
     * </ul>
     *
     * @return the data now attached, or {@code null} if nothing was read
     * @throws FileNotFoundException    if a path is given that does not exist
     * @throws IllegalArgumentException if the data does not fit the tag's handle type
     */
    public Object setData(String tag, Object value, boolean doRead) throws IOException {
        if (value instanceof DataHandle<?> other) {
            setAlias(tag, other.getTag());
            if (!store().contains(other.getTag())) {
                store().set(other.getTag(), other);
            }
            DataHandle<?> handle = store().get(other.getTag());
            if (doRead && (handle.hasData() || handle.hasPath())) {
                return handle.read();
            }
            return handle.getData();
        }
        if (value instanceof String || value instanceof Path) {
            String path = value.toString();
            Path resolved = Paths.get(PathExpansion.expandPath(path));
            if (!Files.exists(resolved)) {
                throw new FileNotFoundException(String.format("Stage '%s': file %s for '%s' not found",
                        instanceName, resolved, tag));
            }
            DataHandle<?> handle = getHandle(tag, true);
            handle.clearData();
            handle.setPath(path);
            return doRead ? handle.read(true) : null;
        }
        DataHandle<?> handle = getHandle(tag, true);
        handle.setPath(null);
        handle.setData(value, false);
        return value;
    }

    /**
     * Connects an output of another stage as an input of this one, without reading it.
     * The input tag is aliased to the other stage's output key; a path the upstream handle
     * already carries is thereby visible here too.
     *
     * @return the shared handle
     */
    public DataHandle<?> connectInput(AbstractStage other, String inputTag, String outputTag) {
        DataHandle<?> handle = other.getHandle(outputTag, true);
        setAlias(inputTag, handle.getTag());
        if (!store().contains(handle.getTag())) {
            store().set(handle.getTag(), handle);
        }
        log.debug("Stage '{}': input '{}' connected to '{}' of stage '{}'",
                instanceName, inputTag, outputTag, other.getInstanceName());
        return handle;
    }

    /**
     * Connects the first output of another stage to the first input of this one.
     */
    public DataHandle<?> connectInput(AbstractStage other) {
        return connectInput(other, getInputs().get(0).tag(), other.getOutputs().get(0).tag());
    }

    /**
     * Loads the model input. Accepts a {@link Model}, a path, a {@link DataHandle}, or
     * {@code null} to use whatever is already attached to {@code tag}.
     */
    protected Model openModel(String tag, Object model) throws IOException {
        if (model != null) {
            setData(tag, model, false);
        }
        return getData(tag, Model.class);
    }

    /**
     * Checks that the data of a tag has the given columns. A file-backed handle without
     * materialized data only has its header read.
     *
     * @throws MissingColumnsException listing every missing column
     */
    protected void checkColumnNames(String tag, Collection<String> required) throws IOException {
        List<String> present = getHandle(tag).columnNames();
        reportMissing(String.format("Stage '%s' input '%s'", instanceName, tag), present, required);
    }

    /**
     * Checks that a table has the given columns.
     *
     * @throws MissingColumnsException listing every missing column
     */
    protected void checkColumnNames(Table table, Collection<String> required) {
        reportMissing("Stage '" + instanceName + "'", table.columnNames(), required);
    }

    private static void reportMissing(String owner, List<String> present, Collection<String> required) {
        TreeSet<String> missing = new TreeSet<>(required);
        missing.removeAll(present);
        if (!missing.isEmpty()) {
            throw new MissingColumnsException(owner, missing);
        }
    }

    // ---------------------------------------------------------------- chunked input

    /**
     * Iterates this worker's share of an input using the configured {@code chunkSize}.
     */
    protected <T> ChunkSequence<T> inputIterator(String tag, Class<T> type) throws IOException {
        return inputIterator(tag, type, config.getLong(SharedParameters.CHUNK_SIZE.getName()));
    }

    /**
     * Iterates this worker's share of an input.
     * <p>
     * If the input has fewer chunks than there are workers, the chunk size is reduced so
     * that every worker receives at least one chunk. A handle with neither data nor path
     * yields an empty sequence.
     */
    protected <T> ChunkSequence<T> inputIterator(String tag, Class<T> type, long chunkSize) throws IOException {
        DataHandle<T> handle = getHandle(tag, type);
        int rank = context.rank();
        int size = context.parallelSize();
        if (!handle.hasPath() && !handle.hasData()) {
            log.debug("Stage '{}': '{}' has no data and no path, nothing to iterate", instanceName, tag);
            return ChunkSequence.empty(rank, size);
        }
        long total = handle.size();
        long effective = total > 0 ? DataRanges.balancedChunkSize(total, chunkSize, size) : chunkSize;
        if (effective != chunkSize) {
            log.warn("Stage '{}': {} rows of '{}' give fewer than {} chunks of {} rows; reducing chunk size to {}",
                    instanceName, total, tag, size, chunkSize, effective);
        }
        log.debug("Stage '{}': iterating '{}' ({} rows, chunk size {}, rank {} of {})",
                instanceName, tag, total, effective, rank, size);
        return new ChunkSequence<>(handle.iterator(effective, rank, size), rank, size, effective, total);
    }

    // ---------------------------------------------------------------- outputs

    /**
     * Attaches a complete output payload. It is written when the stage finalizes.
     */
    protected DataHandle<?> addData(String tag, Object data) {
        DataHandle<?> handle = outputHandle(tag);
        handle.setData(data, false);
        return handle;
    }

    /**
     * Prepares a chunked output of {@code totalLength} rows. Collective: every worker must call it.
     *
     * @param template payload describing the layout (columns, grid); its rows are ignored
     */
    protected void initializeOutput(String tag, Object template, long totalLength) throws IOException {
        DataHandle<?> handle = outputHandle(tag);
        handle.setData(template, true);
        if (outputMode == OutputMode.RETURN) {
            returnBuffers.put(tag, new TreeMap<>());
            returnTemplates.put(tag, template);
            return;
        }
        handle.setPath(inProgressPath(tag).toString());
        handle.initializeWrite(totalLength, context.getComm());
        streamedOutputs.add(tag);
    }

    /**
     * Delivers rows {@code [start, end)} of a chunked output.
     *
     * @throws IllegalStateException if {@link #initializeOutput} was not called for the tag
     */
    protected void writeOutputChunk(String tag, Object data, long start, long end) throws IOException {
        DataHandle<?> handle = getHandle(tag);
        if (outputMode == OutputMode.RETURN) {
            TreeMap<Long, Object> buffer = returnBuffers.get(tag);
            if (buffer == null) {
                throw new IllegalStateException(String.format("Stage '%s': output '%s' was not initialized", instanceName, tag));
            }
            handle.setData(data, true);
            buffer.put(start, data);
            return;
        }
        if (!streamedOutputs.contains(tag)) {
            throw new IllegalStateException(String.format("Stage '%s': output '%s' was not initialized", instanceName, tag));
        }
        handle.setData(data, true);
        handle.writeChunk(start, end);
    }

    /**
     * Finalizes every declared output. Collective.
     */
    protected void finalizeStage() throws IOException {
        for (StagePort port : getOutputs()) {
            finalizeTag(port.tag());
        }
    }

    /**
     * Finalizes one output. Collective: every worker calls it for the same tags in the same order.
     */
    protected void finalizeTag(String tag) throws IOException {
        DataHandle<?> handle = store().get(resolveAlias(tag));
        if (outputMode == OutputMode.RETURN) {
            finalizeReturned(tag, handle);
            return;
        }
        boolean streamed = streamedOutputs.contains(tag);
        if (streamed) {
            handle.finalizeWrite();
        }
        barrier();
        if (context.isCoordinator() && handle != null && instanceName.equals(handle.getCreator())) {
            if (streamed) {
                Path finalPath = outputPath(tag);
                Files.move(inProgressPath(tag), finalPath, StandardCopyOption.REPLACE_EXISTING);
                log.info("Stage '{}': wrote '{}' to {}", instanceName, handle.getTag(), finalPath);
            } else if (handle.hasData() && !handle.isPartial() && handle.hasPath()) {
                handle.write();
                log.info("Stage '{}': wrote '{}' to {}", instanceName, handle.getTag(), handle.getPath());
            }
        }
        barrier();
        if (streamed) {
            handle.setPath(outputPath(tag).toString());
            handle.clearData();
            streamedOutputs.remove(tag);
        }
    }

    private void finalizeReturned(String tag, DataHandle<?> handle) {
        TreeMap<Long, Object> buffer = returnBuffers.get(tag);
        if (buffer == null) {
            return;
        }
        ICommunicator comm = context.getComm();
        Object assembled;
        if (comm != null && comm.size() > 1) {
            // every rank receives the whole output so downstream chunking covers all rows
            List<TreeMap<Long, Object>> all = comm.gather(buffer, 0);
            Object local = null;
            if (all != null) {
                TreeMap<Long, Object> merged = new TreeMap<>();
                for (TreeMap<Long, Object> part : all) {
                    merged.putAll(part);
                }
                local = assemble(tag, handle, merged);
            }
            assembled = comm.bcast(local, 0);
        } else {
            assembled = assemble(tag, handle, buffer);
        }
        handle.setPath(null);
        handle.setData(assembled, false);
        log.debug("Stage '{}': assembled '{}' ({} local chunks)", instanceName, handle.getTag(), buffer.size());
    }

    private Object assemble(String tag, DataHandle<?> handle, TreeMap<Long, Object> chunks) {
        if (chunks.isEmpty()) {
            return returnTemplates.get(tag);
        }
        return concat(handle, new ArrayList<>(chunks.values()));
    }

    @SuppressWarnings("unchecked")
    private static <T> T concat(DataHandle<T> handle, List<Object> parts) {
        return handle.concat((List<T>) parts);
    }

    /**
     * @return final location of an output in {@link OutputMode#DEFAULT} mode
     */
    public Path outputPath(String tag) {
        return context.getOutputDirectory().resolve(handleType(tag).makeFileName(resolveAlias(tag)));
    }

    /**
     * @return location an output is streamed to before it is finalized
     */
    public Path inProgressPath(String tag) {
        return context.getOutputDirectory().resolve(IN_PROGRESS_PREFIX + handleType(tag).makeFileName(resolveAlias(tag)));
    }

    private DataHandle<?> outputHandle(String tag) {
        String key = resolveAlias(tag);
        DataHandle<?> existing = store().get(key);
        if (existing != null && instanceName.equals(existing.getCreator())) {
            return existing;
        }
        DataHandle<?> handle = handleType(tag).create(key, defaultPath(tag), instanceName);
        store().set(key, handle);
        return handle;
    }

    private String defaultPath(String tag) {
        if (isOutput(tag) && outputMode == OutputMode.DEFAULT) {
            return outputPath(tag).toString();
        }
        return null;
    }

    private boolean isOutput(String tag) {
        return getOutputs().stream().anyMatch(p -> p.tag().equals(tag));
    }

    private StagePort findPort(String tag) {
        for (StagePort port : getInputs()) {
            if (port.tag().equals(tag)) {
                return port;
            }
        }
        for (StagePort port : getOutputs()) {
            if (port.tag().equals(tag)) {
                return port;
            }
        }
        throw new DataLookupException(String.format("Stage '%s' (%s) has no input or output '%s'",
                instanceName, getClass().getSimpleName(), tag));
    }

    private HandleType<?> handleType(String tag) {
        return context.getHandleRegistry().get(findPort(tag).handleType());
    }

    private void barrier() {
        ICommunicator comm = context.getComm();
        if (comm != null && comm.size() > 1) {
            comm.barrier();
        }
    }

    protected DataStore store() {
        return context.getDataStore();
    }

    /**
     * @return rank of this worker, 0 when running single-worker
     */
    protected int rank() {
        return context.rank();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + instanceName + ", " + currentState.get() + "]";
    }
}
