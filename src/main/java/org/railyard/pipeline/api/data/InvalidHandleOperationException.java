package org.railyard.pipeline.api.data;

/**
 * Thrown when a handle is asked to do something its state or format does not allow,
 * e.g. writing without data, writing a chunk before a write session exists, or writing
 * through an input-only handle.
 * <p>
 * Raised by the handle itself without a stage; a stage failing on it rethrows a copy
 * carrying its instance name (see {@link #inStage(String)}).
 */
public class InvalidHandleOperationException extends IllegalStateException {

    private final String stage;
    private final String tag;
    private final String path;
    private final String detail;

    public InvalidHandleOperationException(String tag, String path, String message) {
        this(null, tag, path, message);
    }

    public InvalidHandleOperationException(String tag, String path, String message, Throwable cause) {
        this(null, tag, path, message);
        initCause(cause);
    }

    private InvalidHandleOperationException(String stage, String tag, String path, String detail) {
        super(stage == null
                ? String.format("%s (handle '%s', path %s)", detail, tag, path)
                : String.format("Stage '%s': %s (handle '%s', path %s)", stage, detail, tag, path));
        this.stage = stage;
        this.tag = tag;
        this.path = path;
        this.detail = detail;
    }

    /**
     * Returns a copy attributed to a stage instance, with this exception as its cause.
     */
    public InvalidHandleOperationException inStage(String stageName) {
        InvalidHandleOperationException attributed = new InvalidHandleOperationException(stageName, tag, path, detail);
        attributed.initCause(this);
        return attributed;
    }

    /**
     * @return the stage instance the failure happened in, or {@code null} if raised outside a stage
     */
    public String getStage() {
        return stage;
    }

    public String getTag() {
        return tag;
    }

    public String getPath() {
        return path;
    }
}
