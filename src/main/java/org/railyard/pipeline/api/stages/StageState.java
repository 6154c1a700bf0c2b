package org.railyard.pipeline.api.stages;

/**
 * Lifecycle of one stage invocation.
 * <pre>
 * IDLE -> VALIDATING -> RUNNING -> FINALIZING -> DONE
 *               \___________\___________\______-> FAILED
 * </pre>
 */
public enum StageState {
    IDLE,
    VALIDATING,
    RUNNING,
    FINALIZING,
    DONE,
    FAILED
}
