package org.railyard.pipeline.stages.evaluation.metrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.evaluation.IAccumulatingMetric;
import org.railyard.pipeline.api.evaluation.MetricOutputType;
import org.railyard.pipeline.api.evaluation.MetricResult;
import org.railyard.pipeline.api.stages.ConfigurationException;

/**
 * Histogram of the scaled residuals over {@code [histMin, histMax)} with {@code nBins}
 * equal bins (defaults: -0.5, 0.5, 20). Residuals outside the range are not counted.
 * The result has the columns {@code binLow}, {@code binHigh} and {@code count}.
 */
public class ResidualHistogramMetric implements IAccumulatingMetric<PointData, long[]> {

    public static final String NAME = "residual_histogram";

    private double histMin = -0.5;
    private double histMax = 0.5;
    private int nBins = 20;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public MetricOutputType getOutputType() {
        return MetricOutputType.SINGLE_DISTRIBUTION;
    }

    @Override
    public void configure(Map<String, Object> options) {
        histMin = PointMetrics.getDouble(options, "histMin", histMin, this);
        histMax = PointMetrics.getDouble(options, "histMax", histMax, this);
        nBins = PointMetrics.getInt(options, "nBins", nBins, this);
        if (nBins < 1 || histMax <= histMin) {
            throw new ConfigurationException(String.format("Metric '%s': invalid histogram [%s, %s) with %d bins",
                    NAME, histMin, histMax, nBins));
        }
    }

    @Override
    public MetricResult evaluate(PointData data) {
        return finalizeResult(List.of(accumulate(data)));
    }

    @Override
    public long[] accumulate(PointData chunk) {
        long[] counts = new long[nBins];
        double width = (histMax - histMin) / nBins;
        for (double dz : PointMetrics.deltaZ(chunk)) {
            if (dz >= histMin && dz < histMax) {
                int bin = Math.min(nBins - 1, (int) ((dz - histMin) / width));
                counts[bin]++;
            }
        }
        return counts;
    }

    @Override
    public MetricResult finalizeResult(List<long[]> partials) {
        double[] counts = new double[nBins];
        for (long[] part : partials) {
            for (int i = 0; i < nBins; i++) {
                counts[i] += part[i];
            }
        }
        double width = (histMax - histMin) / nBins;
        double[] low = new double[nBins];
        double[] high = new double[nBins];
        for (int i = 0; i < nBins; i++) {
            low[i] = histMin + i * width;
            high[i] = histMin + (i + 1) * width;
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("binLow", low);
        columns.put("binHigh", high);
        columns.put("count", counts);
        return MetricResult.distribution(Table.of(columns));
    }
}
