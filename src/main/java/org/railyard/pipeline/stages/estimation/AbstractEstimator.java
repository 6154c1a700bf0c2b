package org.railyard.pipeline.stages.estimation;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.data.Chunk;
import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.Model;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.StageParameters;
import org.railyard.pipeline.data.EnsembleHandle;
import org.railyard.pipeline.data.ModelHandle;
import org.railyard.pipeline.data.TableHandle;
import org.railyard.pipeline.stages.AbstractStage;
import org.railyard.pipeline.stages.PointEstimation;
import org.railyard.pipeline.stages.SharedParameters;
import org.railyard.pipeline.stages.StageContext;
import org.railyard.pipeline.stages.StagePort;

/**
 * Base class of stages that apply a trained model to a table, chunk by chunk, producing
 * one distribution per input row.
 * <p>
 * The output ensemble is streamed; requested point estimates
 * ({@code calculatedPointEstimates}) are added to its ancillary table by a
 * {@link PointEstimation}.
 */
public abstract class AbstractEstimator extends AbstractStage {

    public static final String INPUT = "input";
    public static final String MODEL = "model";
    public static final String OUTPUT = "output";

    private static final StageParameters BASE_PARAMETERS = StageParameters.builder()
            .add(SharedParameters.CHUNK_SIZE)
            .add(SharedParameters.CALCULATED_POINT_ESTIMATES)
            .build();

    private static final List<StagePort> INPUTS = List.of(
            new StagePort(INPUT, TableHandle.TYPE),
            new StagePort(MODEL, ModelHandle.TYPE));
    private static final List<StagePort> OUTPUTS = List.of(new StagePort(OUTPUT, EnsembleHandle.TYPE));

    private final PointEstimation pointEstimation;

    protected AbstractEstimator(String name, StageParameters parameters, Map<String, Object> options, StageContext context) {
        super(name, StageParameters.builder().addAll(BASE_PARAMETERS).addAll(parameters).build(), options, context);
        this.pointEstimation = new PointEstimation(config.getStringList(SharedParameters.CALCULATED_POINT_ESTIMATES.getName()));
    }

    @Override
    public List<StagePort> getInputs() {
        return INPUTS;
    }

    @Override
    public List<StagePort> getOutputs() {
        return OUTPUTS;
    }

    @Override
    protected void run() throws IOException {
        loadModel(openModel(MODEL, null));
        checkColumnNames(INPUT, requiredColumns());

        Ensemble template = pointEstimation.apply(emptyOutput());
        initializeOutput(OUTPUT, template, getHandle(INPUT).size());
        int chunks = 0;
        for (Chunk<Table> chunk : inputIterator(INPUT, Table.class)) {
            Ensemble estimated = pointEstimation.apply(estimate(chunk.data()));
            writeOutputChunk(OUTPUT, estimated, chunk.start(), chunk.end());
            chunks++;
        }
        log.debug("Stage '{}': estimated {} chunks", instanceName, chunks);
    }

    /**
     * Accepts the trained model before any chunk is processed.
     *
     * @throws IllegalArgumentException if the model is not usable by this estimator
     */
    protected abstract void loadModel(Model model);

    /**
     * @return input columns the estimator reads
     */
    protected abstract List<String> requiredColumns();

    /**
     * @return an ensemble with the output grid and ancillary columns and no distributions
     */
    protected abstract Ensemble emptyOutput();

    /**
     * Produces one distribution per row of the chunk.
     */
    protected abstract Ensemble estimate(Table chunk);
}
