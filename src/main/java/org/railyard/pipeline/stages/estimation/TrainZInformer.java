package org.railyard.pipeline.stages.estimation;

import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.data.Model;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.StageParameters;
import org.railyard.pipeline.stages.SharedParameters;
import org.railyard.pipeline.stages.StageContext;

/**
 * Trains the simplest possible redshift model: the normalized histogram of the training
 * redshifts on the configured grid. Redshifts outside the grid are ignored.
 */
public class TrainZInformer extends AbstractInformer {

    static final int MODEL_VERSION = 1;

    private static final StageParameters PARAMETERS = StageParameters.builder()
            .add(SharedParameters.Z_MIN)
            .add(SharedParameters.Z_MAX)
            .add(SharedParameters.NZ_BINS)
            .add(SharedParameters.REDSHIFT_COL)
            .build();

    public TrainZInformer(String name, Map<String, Object> options, StageContext context) {
        super(name, PARAMETERS, options, context);
    }

    @Override
    protected Model inform(Table training) {
        String redshiftCol = config.getString(SharedParameters.REDSHIFT_COL.getName());
        checkColumnNames(training, List.of(redshiftCol));
        double zMin = config.getDouble(SharedParameters.Z_MIN.getName());
        double zMax = config.getDouble(SharedParameters.Z_MAX.getName());
        double[] grid = SharedParameters.grid(zMin, zMax, config.getInt(SharedParameters.NZ_BINS.getName()));
        double step = grid[1] - grid[0];

        double[] counts = new double[grid.length];
        long used = 0;
        for (double z : training.column(redshiftCol)) {
            long bin = Math.round((z - zMin) / step);
            if (bin >= 0 && bin < grid.length) {
                counts[(int) bin]++;
                used++;
            }
        }
        int mode = 0;
        for (int i = 0; i < counts.length; i++) {
            counts[i] = used > 0 ? counts[i] / (used * step) : 0.0;
            if (counts[i] > counts[mode]) {
                mode = i;
            }
        }
        if (used < training.numRows()) {
            log.debug("Stage '{}': {} of {} training redshifts fall outside [{}, {}]",
                    instanceName, training.numRows() - used, training.numRows(), zMin, zMax);
        }
        return new Model(new TrainZModel(grid, counts, grid[mode]), TrainZInformer.class.getName(), MODEL_VERSION,
                Map.of("stage", instanceName, "trainingRows", String.valueOf(training.numRows())));
    }
}
