package org.railyard.pipeline.data;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.railyard.pipeline.api.data.DataLookupException;
import org.railyard.pipeline.api.data.DuplicateTagException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the data products of one run, mapping tags to handles.
 * <p>
 * A tag has at most one producer: setting a tag that already holds a handle fails with a
 * {@link DuplicateTagException} naming the earlier creator, unless overwriting was enabled.
 * One store is created per worker and passed to every stage explicitly; {@link #clear()}
 * resets it between runs.
 */
public class DataStore {

    private static final Logger log = LoggerFactory.getLogger(DataStore.class);

    private final Map<String, DataHandle<?>> handles = new LinkedHashMap<>();
    private boolean allowOverwrite;

    public DataStore() {
        this(false);
    }

    public DataStore(boolean allowOverwrite) {
        this.allowOverwrite = allowOverwrite;
    }

    public boolean isAllowOverwrite() {
        return allowOverwrite;
    }

    public void setAllowOverwrite(boolean allowOverwrite) {
        this.allowOverwrite = allowOverwrite;
    }

    /**
     * Registers a handle under a tag.
     *
     * @param tag   store key
     * @param value must be a {@link DataHandle}
     * @throws IllegalArgumentException if {@code value} is not a handle
     * @throws DuplicateTagException    if the tag is taken and overwriting is disabled
     */
    public void set(String tag, Object value) {
        if (!(value instanceof DataHandle<?> handle)) {
            throw new IllegalArgumentException(String.format("Only DataHandles can be added to the data store, got %s for '%s'",
                    value == null ? "null" : value.getClass().getName(), tag));
        }
        DataHandle<?> existing = handles.get(tag);
        if (existing != null && existing != handle && !allowOverwrite) {
            throw new DuplicateTagException(tag, existing.getCreator());
        }
        handles.put(tag, handle);
        log.debug("Registered '{}' ({}) created by {}", tag, handle.getTypeName(), handle.getCreator());
    }

    /**
     * @return the handle for a tag, or {@code null}
     */
    public DataHandle<?> get(String tag) {
        return handles.get(tag);
    }

    /**
     * @throws DataLookupException if the tag is unknown
     */
    public DataHandle<?> getRequired(String tag) {
        DataHandle<?> handle = handles.get(tag);
        if (handle == null) {
            throw new DataLookupException("Tag '" + tag + "' not found in the data store. Known tags: " + handles.keySet());
        }
        return handle;
    }

    public boolean contains(String tag) {
        return handles.containsKey(tag);
    }

    public Set<String> tags() {
        return Collections.unmodifiableSet(handles.keySet());
    }

    public Map<String, DataHandle<?>> asMap() {
        return Collections.unmodifiableMap(handles);
    }

    public int size() {
        return handles.size();
    }

    /**
     * Creates a handle holding in-memory data and registers it.
     */
    public DataHandle<?> addData(String tag, Object data, HandleType<?> type, String path, String creator) {
        DataHandle<?> handle = type.create(tag, path, creator);
        handle.setData(data, false);
        set(tag, handle);
        return handle;
    }

    /**
     * Creates a handle backed by a file (or nothing yet) and registers it.
     */
    public DataHandle<?> addHandle(String tag, HandleType<?> type, String path, String creator) {
        DataHandle<?> handle = type.create(tag, path, creator);
        set(tag, handle);
        return handle;
    }

    /**
     * Registers a handle for an existing file and reads it.
     */
    public DataHandle<?> readFile(String tag, HandleType<?> type, String path, String creator) throws IOException {
        DataHandle<?> handle = addHandle(tag, type, path, creator);
        handle.read();
        return handle;
    }

    /**
     * Reads the data of a tag.
     *
     * @throws DataLookupException if the tag is unknown
     */
    public Object read(String tag) throws IOException {
        return getRequired(tag).read();
    }

    /**
     * Opens the backing file of a tag.
     *
     * @throws DataLookupException if the tag is unknown
     */
    public InputStream open(String tag) throws IOException {
        return getRequired(tag).open();
    }

    /**
     * Writes the data of a tag.
     *
     * @throws DataLookupException if the tag is unknown
     */
    public void write(String tag) throws IOException {
        getRequired(tag).write();
    }

    /**
     * Writes every writable handle holding complete data. Handles already on disk are skipped unless {@code force}.
     */
    public void writeAll(boolean force) throws IOException {
        for (DataHandle<?> handle : handles.values()) {
            if (!handle.hasData() || !handle.hasPath() || handle.isPartial() || !handle.isWritable()) {
                continue;
            }
            if (handle.isWritten() && !force) {
                log.debug("Skipping '{}', already written to {}", handle.getTag(), handle.getPath());
                continue;
            }
            handle.write();
        }
    }

    /**
     * Removes every handle.
     */
    public void clear() {
        handles.clear();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DataStore{\n");
        handles.forEach((tag, handle) -> sb.append("  ").append(tag).append(": ").append(handle).append('\n'));
        return sb.append('}').toString();
    }
}
