package org.railyard.pipeline.stages.estimation;

import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.Model;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.StageParameters;
import org.railyard.pipeline.stages.SharedParameters;
import org.railyard.pipeline.stages.StageContext;

/**
 * Assigns the training-set redshift distribution to every input row. The object id
 * column, if configured, is carried into the ancillary table.
 */
public class TrainZEstimator extends AbstractEstimator {

    private static final StageParameters PARAMETERS = StageParameters.builder()
            .add(SharedParameters.ID_COL)
            .build();

    private TrainZModel model;

    public TrainZEstimator(String name, Map<String, Object> options, StageContext context) {
        super(name, PARAMETERS, options, context);
    }

    @Override
    protected void loadModel(Model trained) {
        trained.validate(TrainZInformer.class.getName(), TrainZInformer.MODEL_VERSION);
        this.model = trained.getPayload(TrainZModel.class);
    }

    @Override
    protected List<String> requiredColumns() {
        String idCol = idCol();
        return idCol.isEmpty() ? List.of() : List.of(idCol);
    }

    @Override
    protected Ensemble emptyOutput() {
        return Ensemble.empty(model.getGrid(), requiredColumns());
    }

    @Override
    protected Ensemble estimate(Table chunk) {
        double[] density = model.getDensity();
        double[][] densities = new double[chunk.numRows()][];
        for (int i = 0; i < densities.length; i++) {
            densities[i] = density;
        }
        String idCol = idCol();
        Table ancil = idCol.isEmpty() ? null : Table.of(idCol, chunk.column(idCol));
        return new Ensemble(model.getGrid(), densities, ancil);
    }

    private String idCol() {
        return config.getString(SharedParameters.ID_COL.getName());
    }
}
