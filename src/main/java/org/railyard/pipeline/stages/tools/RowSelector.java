package org.railyard.pipeline.stages.tools;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.ConfigurationException;
import org.railyard.pipeline.api.stages.StageParameter;
import org.railyard.pipeline.api.stages.StageParameters;
import org.railyard.pipeline.data.DataHandle;
import org.railyard.pipeline.data.TableHandle;
import org.railyard.pipeline.stages.AbstractStage;
import org.railyard.pipeline.stages.StageContext;
import org.railyard.pipeline.stages.StagePort;

/**
 * Keeps the rows {@code [start, stop)} of a table. A negative {@code stop} means the end of the table.
 */
public class RowSelector extends AbstractStage {

    public static final String INPUT = "input";
    public static final String OUTPUT = "output";

    static final StageParameter<Long> START = StageParameter.optional("start", Long.class, 0L, "First row to keep");
    static final StageParameter<Long> STOP = StageParameter.optional("stop", Long.class, -1L, "Row after the last row to keep");

    private static final StageParameters PARAMETERS = StageParameters.builder().add(START).add(STOP).build();

    private static final List<StagePort> INPUTS = List.of(new StagePort(INPUT, TableHandle.TYPE));
    private static final List<StagePort> OUTPUTS = List.of(new StagePort(OUTPUT, TableHandle.TYPE));

    public RowSelector(String name, Map<String, Object> options, StageContext context) {
        super(name, PARAMETERS, options, context);
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
        DataHandle<Table> input = getHandle(INPUT, Table.class);
        long total = input.size();
        long start = config.getLong(START.getName());
        long stop = config.getLong(STOP.getName());
        long end = stop < 0 ? total : Math.min(stop, total);
        if (start < 0 || start > end) {
            throw new ConfigurationException(String.format("%s: cannot select rows [%d, %d) of %d", instanceName, start, stop, total));
        }
        log.debug("Stage '{}': selecting rows [{}, {}) of {}", instanceName, start, end, total);
        addData(OUTPUT, input.readChunk(start, end));
    }
}
