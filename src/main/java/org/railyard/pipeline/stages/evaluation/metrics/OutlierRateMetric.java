package org.railyard.pipeline.stages.evaluation.metrics;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.evaluation.IAccumulatingMetric;
import org.railyard.pipeline.api.evaluation.MetricOutputType;
import org.railyard.pipeline.api.evaluation.MetricResult;

/**
 * Fraction of objects whose absolute scaled residual exceeds {@code outlierCut} (default 0.15).
 */
public class OutlierRateMetric implements IAccumulatingMetric<PointData, OutlierRateMetric.Counts> {

    public static final String NAME = "outlier_rate";

    /**
     * Outliers and objects seen in one chunk.
     */
    public record Counts(long outliers, long total) implements Serializable {
    }

    private double outlierCut = 0.15;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public MetricOutputType getOutputType() {
        return MetricOutputType.SINGLE_VALUE;
    }

    @Override
    public void configure(Map<String, Object> options) {
        outlierCut = PointMetrics.getDouble(options, "outlierCut", outlierCut, this);
    }

    public double getOutlierCut() {
        return outlierCut;
    }

    @Override
    public MetricResult evaluate(PointData data) {
        return finalizeResult(List.of(accumulate(data)));
    }

    @Override
    public Counts accumulate(PointData chunk) {
        long outliers = 0;
        for (double dz : PointMetrics.deltaZ(chunk)) {
            if (Math.abs(dz) > outlierCut) {
                outliers++;
            }
        }
        return new Counts(outliers, chunk.size());
    }

    @Override
    public MetricResult finalizeResult(List<Counts> partials) {
        long outliers = 0;
        long total = 0;
        for (Counts c : partials) {
            outliers += c.outliers();
            total += c.total();
        }
        return MetricResult.value(total == 0 ? Double.NaN : (double) outliers / total);
    }
}
