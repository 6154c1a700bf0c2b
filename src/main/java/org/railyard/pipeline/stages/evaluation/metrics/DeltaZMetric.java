package org.railyard.pipeline.stages.evaluation.metrics;

import org.railyard.pipeline.api.evaluation.IMetric;
import org.railyard.pipeline.api.evaluation.MetricOutputType;
import org.railyard.pipeline.api.evaluation.MetricResult;

/**
 * Per-object scaled residual {@code (zEstimate - zTrue) / (1 + zTrue)}.
 */
public class DeltaZMetric implements IMetric<PointData> {

    public static final String NAME = "delta_z";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public MetricOutputType getOutputType() {
        return MetricOutputType.ONE_VALUE_PER_DISTRIBUTION;
    }

    @Override
    public MetricResult evaluate(PointData data) {
        return MetricResult.perObject(PointMetrics.deltaZ(data));
    }
}
