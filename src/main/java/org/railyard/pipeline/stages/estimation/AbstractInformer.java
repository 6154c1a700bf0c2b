package org.railyard.pipeline.stages.estimation;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.data.Model;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.StageParameters;
import org.railyard.pipeline.data.ModelHandle;
import org.railyard.pipeline.data.TableHandle;
import org.railyard.pipeline.stages.AbstractStage;
import org.railyard.pipeline.stages.StageContext;
import org.railyard.pipeline.stages.StagePort;

/**
 * Base class of stages that train a model from a table of training data.
 * <p>
 * Training reads the whole input; the resulting {@link Model} is the {@code model} output.
 */
public abstract class AbstractInformer extends AbstractStage {

    public static final String INPUT = "input";
    public static final String MODEL = "model";

    private static final List<StagePort> INPUTS = List.of(new StagePort(INPUT, TableHandle.TYPE));
    private static final List<StagePort> OUTPUTS = List.of(new StagePort(MODEL, ModelHandle.TYPE));

    protected AbstractInformer(String name, StageParameters parameters, Map<String, Object> options, StageContext context) {
        super(name, parameters, options, context);
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
        Table training = getData(INPUT, Table.class);
        Model model = inform(training);
        addData(MODEL, model);
        log.debug("Stage '{}': trained {} on {} rows", instanceName, model.getCreatorClass(), training.numRows());
    }

    /**
     * Trains the model.
     */
    protected abstract Model inform(Table training);
}
