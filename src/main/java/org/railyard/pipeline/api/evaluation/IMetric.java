package org.railyard.pipeline.api.evaluation;

import java.util.Map;

/**
 * A named quantity computed from evaluation data.
 *
 * @param <E> evaluation data type (e.g. paired estimates and truths)
 */
public interface IMetric<E> {

    String getName();

    MetricOutputType getOutputType();

    /**
     * Applies metric options. Options a metric does not know are ignored, since general
     * options are shared by all metrics.
     */
    default void configure(Map<String, Object> options) {
    }

    /**
     * Computes the metric from all of its data at once.
     */
    MetricResult evaluate(E data);
}
