package org.railyard.pipeline.data;

import java.util.Objects;

/**
 * A registered kind of handle: its name, payload type and a factory for empty instances.
 *
 * @param <T> payload type
 */
public final class HandleType<T> {

    /**
     * Creates an empty handle.
     */
    @FunctionalInterface
    public interface Factory<T> {
        DataHandle<T> create(String tag, String path, String creator);
    }

    private final String name;
    private final Class<T> dataType;
    private final String fileExtension;
    private final Factory<T> factory;

    public HandleType(String name, Class<T> dataType, String fileExtension, Factory<T> factory) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataType = Objects.requireNonNull(dataType, "dataType");
        this.fileExtension = Objects.requireNonNull(fileExtension, "fileExtension");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public String getName() {
        return name;
    }

    public Class<T> getDataType() {
        return dataType;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public DataHandle<T> create(String tag, String path, String creator) {
        return factory.create(tag, path, creator);
    }

    /**
     * Builds a file name for a tag: {@code <base>.<extension>}.
     */
    public String makeFileName(String base) {
        return base + "." + fileExtension;
    }

    @Override
    public String toString() {
        return "HandleType[" + name + "]";
    }
}
