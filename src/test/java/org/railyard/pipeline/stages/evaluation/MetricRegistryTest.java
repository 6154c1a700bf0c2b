package org.railyard.pipeline.stages.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.railyard.pipeline.api.data.DataLookupException;
import org.railyard.pipeline.stages.evaluation.metrics.MeanBiasMetric;
import org.railyard.pipeline.stages.evaluation.metrics.PointData;

@Tag("unit")
class MetricRegistryTest {

    @Test
    void createsFreshInstances() {
        MetricRegistry<PointData> registry = PointToPointEvaluator.defaultMetrics();

        assertThat(registry.create(MeanBiasMetric.NAME)).isNotSameAs(registry.create(MeanBiasMetric.NAME));
        assertThat(registry.names()).containsExactly(
                "delta_z", "mean_bias", "rms_scatter", "outlier_rate", "sigma_mad", "residual_histogram");
    }

    @Test
    void rejectsDuplicateNames() {
        MetricRegistry<PointData> registry = new MetricRegistry<PointData>().register(MeanBiasMetric.NAME, MeanBiasMetric::new);

        assertThatThrownBy(() -> registry.register(MeanBiasMetric.NAME, MeanBiasMetric::new))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownNamesFailLookup() {
        assertThatThrownBy(() -> new MetricRegistry<PointData>().create("nope"))
                .isInstanceOf(DataLookupException.class)
                .hasMessageContaining("nope");
    }
}
