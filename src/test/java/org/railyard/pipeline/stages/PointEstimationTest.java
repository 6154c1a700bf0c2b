package org.railyard.pipeline.stages;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.ConfigurationException;

@Tag("unit")
class PointEstimationTest {

    private static final double[] GRID = {0, 1, 2, 3, 4};

    private static Ensemble triangles() {
        return new Ensemble(GRID, new double[][] {{0, 1, 2, 1, 0}, {0, 0, 1, 2, 1}});
    }

    @Test
    void apply_addsRequestedColumns() {
        Ensemble result = new PointEstimation(List.of("mean", "MODE", "median")).apply(triangles());

        assertThat(result.ancilColumns()).containsExactly("zmean", "zmode", "zmedian");
        assertThat(result.getAncil().get("zmean", 0)).isCloseTo(2.0, within(1e-12));
        assertThat(result.getAncil().get("zmedian", 0)).isCloseTo(2.0, within(1e-12));
        assertThat(result.getAncil().column("zmode")).containsExactly(2, 3);
    }

    @Test
    void apply_keepsExistingEstimates() {
        Ensemble withMode = triangles().withAncil(Table.of("zmode", 9, 9));

        Ensemble result = new PointEstimation(List.of("mode", "mean")).apply(withMode);

        assertThat(result.getAncil().column("zmode")).containsExactly(9, 9);
        assertThat(result.ancilColumns()).containsExactly("zmode", "zmean");
    }

    @Test
    void apply_withoutEstimatesReturnsInput() {
        Ensemble input = triangles();

        assertThat(new PointEstimation(List.of()).apply(input)).isSameAs(input);
    }

    @Test
    void rejectsUnknownEstimates() {
        assertThatThrownBy(() -> new PointEstimation(List.of("mean", "mostLikely")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("mostLikely");
    }

    @Test
    void columnNames_prefixEstimates() {
        assertThat(new PointEstimation(List.of("median")).columnNames()).containsExactly("zmedian");
    }
}
