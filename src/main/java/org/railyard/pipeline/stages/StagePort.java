package org.railyard.pipeline.stages;

/**
 * A declared input or output of a stage class: its logical tag and the name of the handle
 * type that carries it.
 *
 * @param tag        logical tag, fixed by the stage class
 * @param handleType handle type name in the {@link org.railyard.pipeline.data.HandleRegistry}
 */
public record StagePort(String tag, String handleType) {
}
