package org.railyard.pipeline.stages.evaluation.metrics;

import org.railyard.pipeline.api.evaluation.IMetric;
import org.railyard.pipeline.api.evaluation.MetricOutputType;
import org.railyard.pipeline.api.evaluation.MetricResult;

/**
 * Scaled median absolute deviation of the residuals, {@code 1.4826 * median(|dz - median(dz)|)}.
 * <p>
 * Medians do not decompose over chunks, so this metric is only available when all data
 * is evaluated at once.
 */
public class SigmaMadMetric implements IMetric<PointData> {

    public static final String NAME = "sigma_mad";

    static final double MAD_TO_SIGMA = 1.4826;

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
        double[] dz = PointMetrics.deltaZ(data);
        double median = PointMetrics.median(dz);
        double[] deviations = new double[dz.length];
        for (int i = 0; i < dz.length; i++) {
            deviations[i] = Math.abs(dz[i] - median);
        }
        return MetricResult.value(MAD_TO_SIGMA * PointMetrics.median(deviations));
    }
}
