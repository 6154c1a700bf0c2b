package org.railyard.pipeline.stages.evaluation;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.MissingColumnsException;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.StageParameter;
import org.railyard.pipeline.api.stages.StageParameters;
import org.railyard.pipeline.data.EnsembleOrTableHandle;
import org.railyard.pipeline.data.TableHandle;
import org.railyard.pipeline.stages.PointEstimation;
import org.railyard.pipeline.stages.SharedParameters;
import org.railyard.pipeline.stages.StageContext;
import org.railyard.pipeline.stages.StagePort;
import org.railyard.pipeline.stages.evaluation.metrics.DeltaZMetric;
import org.railyard.pipeline.stages.evaluation.metrics.MeanBiasMetric;
import org.railyard.pipeline.stages.evaluation.metrics.OutlierRateMetric;
import org.railyard.pipeline.stages.evaluation.metrics.PointData;
import org.railyard.pipeline.stages.evaluation.metrics.ResidualHistogramMetric;
import org.railyard.pipeline.stages.evaluation.metrics.RmsScatterMetric;
import org.railyard.pipeline.stages.evaluation.metrics.SigmaMadMetric;

/**
 * Compares point estimates with true redshifts.
 * <p>
 * The {@value #INPUT} input is either a table holding the {@code pointEstimate} column or an
 * ensemble. For an ensemble the column is taken from its ancillary table, or computed when
 * it names a supported estimate ({@code zmean}, {@code zmode}, {@code zmedian}). True values
 * come from the {@code redshiftCol} column of {@value #TRUTH}, row-aligned with the input.
 */
public class PointToPointEvaluator extends AbstractEvaluator<PointData> {

    public static final String TRUTH = "truth";

    public static final StageParameter<String> POINT_ESTIMATE =
            StageParameter.optional("pointEstimate", String.class, "zmode", "Column holding the point estimates");

    private static final StageParameters PARAMETERS = StageParameters.builder()
            .add(SharedParameters.REDSHIFT_COL)
            .add(POINT_ESTIMATE)
            .build();

    private static final List<StagePort> INPUTS = List.of(
            new StagePort(INPUT, EnsembleOrTableHandle.TYPE),
            new StagePort(TRUTH, TableHandle.TYPE));

    public PointToPointEvaluator(String name, Map<String, Object> options, StageContext context) {
        super(name, PARAMETERS, options, context, defaultMetrics());
    }

    /**
     * @return a registry of the point-estimate metrics
     */
    public static MetricRegistry<PointData> defaultMetrics() {
        return new MetricRegistry<PointData>()
                .register(DeltaZMetric.NAME, DeltaZMetric::new)
                .register(MeanBiasMetric.NAME, MeanBiasMetric::new)
                .register(RmsScatterMetric.NAME, RmsScatterMetric::new)
                .register(OutlierRateMetric.NAME, OutlierRateMetric::new)
                .register(SigmaMadMetric.NAME, SigmaMadMetric::new)
                .register(ResidualHistogramMetric.NAME, ResidualHistogramMetric::new);
    }

    @Override
    public List<StagePort> getInputs() {
        return INPUTS;
    }

    @Override
    protected void validate() throws IOException {
        super.validate();
        checkColumnNames(TRUTH, List.of(redshiftCol()));
        long inputRows = getHandle(INPUT).size();
        long truthRows = getHandle(TRUTH).size();
        if (inputRows != truthRows) {
            throw new IllegalArgumentException(String.format("Stage '%s': '%s' has %d rows but '%s' has %d",
                    instanceName, INPUT, inputRows, TRUTH, truthRows));
        }
    }

    @Override
    protected PointData prepareChunk(Object chunkData, long start, long end) throws IOException {
        Table truth = getHandle(TRUTH, Table.class).readChunk(start, end);
        return new PointData(pointEstimates(chunkData), truth.column(redshiftCol()));
    }

    @Override
    protected PointData readAll() throws IOException {
        Table truth = getData(TRUTH, Table.class);
        return new PointData(pointEstimates(getData(INPUT)), truth.column(redshiftCol()));
    }

    private double[] pointEstimates(Object data) {
        String column = config.getString(POINT_ESTIMATE.getName());
        if (data instanceof Table table) {
            checkColumnNames(table, List.of(column));
            return table.column(column);
        }
        Ensemble ensemble = (Ensemble) data;
        if (ensemble.hasAncil() && ensemble.getAncil().hasColumn(column)) {
            return ensemble.getAncil().column(column);
        }
        for (String estimate : List.of("mean", "mode", "median")) {
            if (PointEstimation.columnName(estimate).equals(column)) {
                return new PointEstimation(List.of(estimate)).apply(ensemble).getAncil().column(column);
            }
        }
        throw new MissingColumnsException(String.format("Stage '%s' input '%s'", instanceName, INPUT), List.of(column));
    }

    private String redshiftCol() {
        return config.getString(SharedParameters.REDSHIFT_COL.getName());
    }
}
