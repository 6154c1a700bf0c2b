package org.railyard.pipeline.stages.evaluation.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.evaluation.IAccumulatingMetric;
import org.railyard.pipeline.api.evaluation.MetricResult;
import org.railyard.pipeline.api.stages.ConfigurationException;

@Tag("unit")
class PointMetricsTest {

    private static PointData sample(int n, long seed) {
        Random random = new Random(seed);
        double[] truths = new double[n];
        double[] estimates = new double[n];
        for (int i = 0; i < n; i++) {
            truths[i] = 3.0 * random.nextDouble();
            double scatter = random.nextDouble() < 0.1 ? 0.5 : 0.05;
            estimates[i] = truths[i] + scatter * random.nextGaussian() * (1 + truths[i]);
        }
        return new PointData(estimates, truths);
    }

    private static List<PointData> split(PointData data, int chunkSize) {
        List<PointData> chunks = new ArrayList<>();
        for (int start = 0; start < data.size(); start += chunkSize) {
            int end = Math.min(start + chunkSize, data.size());
            chunks.add(new PointData(Arrays.copyOfRange(data.estimates(), start, end), Arrays.copyOfRange(data.truths(), start, end)));
        }
        return chunks;
    }

    private static <S> MetricResult accumulated(IAccumulatingMetric<PointData, S> metric, List<PointData> chunks) {
        List<S> partials = new ArrayList<>();
        chunks.forEach(c -> partials.add(metric.accumulate(c)));
        return metric.finalizeResult(partials);
    }

    @Test
    void deltaZ_scalesByOnePlusTruth() {
        double[] dz = PointMetrics.deltaZ(new PointData(new double[] {1.1, 0.5}, new double[] {1.0, 0.5}));

        assertThat(dz).containsExactly(new double[] {0.05, 0.0}, within(1e-12));
    }

    @Test
    void pointData_requiresAlignedArrays() {
        assertThatThrownBy(() -> new PointData(new double[2], new double[3])).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void moments_mergeMatchesWholeArray() {
        double[] values = {1, 2, 3, 4, 10};
        PointMetrics.Moments merged = PointMetrics.Moments.merge(List.of(
                PointMetrics.Moments.of(new double[] {1, 2}), PointMetrics.Moments.of(new double[] {3, 4, 10})));

        assertThat(merged).isEqualTo(PointMetrics.Moments.of(values));
        assertThat(merged.mean()).isEqualTo(4.0);
        assertThat(merged.standardDeviation()).isCloseTo(Math.sqrt(10.0), within(1e-12));
        assertThat(PointMetrics.Moments.of(new double[0]).mean()).isNaN();
    }

    @Test
    void median_handlesEvenAndOddLengths() {
        assertThat(PointMetrics.median(new double[] {3, 1, 2})).isEqualTo(2.0);
        assertThat(PointMetrics.median(new double[] {4, 1, 3, 2})).isEqualTo(2.5);
        assertThat(PointMetrics.median(new double[0])).isNaN();
    }

    @Test
    void accumulatingMetrics_chunksMatchWholeEvaluation() {
        PointData data = sample(1000, 42);
        List<PointData> chunks = split(data, 100);

        MeanBiasMetric bias = new MeanBiasMetric();
        RmsScatterMetric scatter = new RmsScatterMetric();
        OutlierRateMetric outliers = new OutlierRateMetric();
        ResidualHistogramMetric histogram = new ResidualHistogramMetric();

        assertThat(accumulated(bias, chunks).getValue()).isCloseTo(bias.evaluate(data).getValue(), within(1e-12));
        assertThat(accumulated(scatter, chunks).getValue()).isCloseTo(scatter.evaluate(data).getValue(), within(1e-12));
        assertThat(accumulated(outliers, chunks).getValue()).isEqualTo(outliers.evaluate(data).getValue());
        assertThat(accumulated(histogram, chunks).getDistribution()).isEqualTo(histogram.evaluate(data).getDistribution());
    }

    @Test
    void outlierRate_usesConfiguredCut() {
        PointData data = new PointData(new double[] {0.1, 0.3, 0.0, 1.0}, new double[] {0.0, 0.0, 0.0, 0.0});
        OutlierRateMetric metric = new OutlierRateMetric();

        assertThat(metric.evaluate(data).getValue()).isEqualTo(0.5);
        metric.configure(Map.of("outlierCut", 0.05));
        assertThat(metric.evaluate(data).getValue()).isEqualTo(0.75);
        assertThat(metric.finalizeResult(List.of()).getValue()).isNaN();
    }

    @Test
    void metricOptions_mustBeNumbers() {
        OutlierRateMetric metric = new OutlierRateMetric();

        assertThatThrownBy(() -> metric.configure(Map.of("outlierCut", "wide")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("outlier_rate");
    }

    @Test
    void residualHistogram_countsInRangeResidualsOnly() {
        ResidualHistogramMetric metric = new ResidualHistogramMetric();
        metric.configure(Map.of("histMin", -1.0, "histMax", 1.0, "nBins", 4L));
        PointData data = new PointData(new double[] {-0.9, -0.1, 0.2, 0.7, 0.99, 5.0, -1.5}, new double[7]);

        Table histogram = metric.evaluate(data).getDistribution();

        assertThat(histogram.columnNames()).containsExactly("binLow", "binHigh", "count");
        assertThat(histogram.column("binLow")).containsExactly(-1.0, -0.5, 0.0, 0.5);
        assertThat(histogram.column("count")).containsExactly(1, 1, 1, 2);
    }

    @Test
    void residualHistogram_rejectsInvalidBinning() {
        assertThatThrownBy(() -> new ResidualHistogramMetric().configure(Map.of("nBins", 0L)))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new ResidualHistogramMetric().configure(Map.of("nBins", 2.5)))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new ResidualHistogramMetric().configure(Map.of("histMin", 1.0, "histMax", 0.0)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void sigmaMad_scalesMedianAbsoluteDeviation() {
        PointData data = new PointData(new double[] {0.0, 0.1, 0.2, 0.3, 1.0}, new double[5]);

        assertThat(new SigmaMadMetric().evaluate(data).getValue()).isCloseTo(0.14826, within(1e-9));
    }

    @Test
    void deltaZ_isPerObject() {
        MetricResult result = new DeltaZMetric().evaluate(new PointData(new double[] {2.0}, new double[] {1.0}));

        assertThat(result.getPerObject()).containsExactly(0.5);
        assertThatThrownBy(result::getValue).isInstanceOf(IllegalStateException.class);
    }
}
