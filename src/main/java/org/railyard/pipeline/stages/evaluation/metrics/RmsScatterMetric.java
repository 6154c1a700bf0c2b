package org.railyard.pipeline.stages.evaluation.metrics;

import java.util.List;

import org.railyard.pipeline.api.evaluation.IAccumulatingMetric;
import org.railyard.pipeline.api.evaluation.MetricOutputType;
import org.railyard.pipeline.api.evaluation.MetricResult;

/**
 * Standard deviation of the scaled residuals.
 */
public class RmsScatterMetric implements IAccumulatingMetric<PointData, PointMetrics.Moments> {

    public static final String NAME = "rms_scatter";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public MetricOutputType getOutputType() {
        return MetricOutputType.SINGLE_VALUE;
    }

    @Override
    public MetricResult evaluate(PointData data) {
        return MetricResult.value(PointMetrics.Moments.of(PointMetrics.deltaZ(data)).standardDeviation());
    }

    @Override
    public PointMetrics.Moments accumulate(PointData chunk) {
        return PointMetrics.Moments.of(PointMetrics.deltaZ(chunk));
    }

    @Override
    public MetricResult finalizeResult(List<PointMetrics.Moments> partials) {
        return MetricResult.value(PointMetrics.Moments.merge(partials).standardDeviation());
    }
}
