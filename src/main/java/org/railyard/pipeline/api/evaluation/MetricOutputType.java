package org.railyard.pipeline.api.evaluation;

/**
 * Shape of a metric's result, which decides how an evaluator computes it.
 */
public enum MetricOutputType {

    /** One value per object; computed per chunk and streamed. */
    ONE_VALUE_PER_DISTRIBUTION,

    /** One number for the whole input; accumulated over chunks, then finalized. */
    SINGLE_VALUE,

    /** One distribution (a table) for the whole input; accumulated over chunks, then finalized. */
    SINGLE_DISTRIBUTION;

    /**
     * @return {@code true} if results span the whole input rather than single objects
     */
    public boolean isAggregate() {
        return this != ONE_VALUE_PER_DISTRIBUTION;
    }
}
