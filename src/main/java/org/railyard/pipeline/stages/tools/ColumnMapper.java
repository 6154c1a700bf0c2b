package org.railyard.pipeline.stages.tools;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.railyard.pipeline.api.data.Chunk;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.api.stages.StageParameter;
import org.railyard.pipeline.api.stages.StageParameters;
import org.railyard.pipeline.data.TableHandle;
import org.railyard.pipeline.stages.AbstractStage;
import org.railyard.pipeline.stages.SharedParameters;
import org.railyard.pipeline.stages.StageContext;
import org.railyard.pipeline.stages.StagePort;

/**
 * Renames table columns, streaming the input chunk by chunk.
 * <pre>
 * options {
 *   columns { mag_u_lsst = "u", mag_g_lsst = "g" }
 *   chunkSize = 100000
 * }
 * </pre>
 */
public class ColumnMapper extends AbstractStage {

    public static final String INPUT = "input";
    public static final String OUTPUT = "output";

    static final StageParameter<Map<String, ?>> COLUMNS =
            StageParameter.requiredMap("columns", "Map of input column name to output column name");

    private static final StageParameters PARAMETERS = StageParameters.builder()
            .add(COLUMNS)
            .add(SharedParameters.CHUNK_SIZE)
            .build();

    private static final List<StagePort> INPUTS = List.of(new StagePort(INPUT, TableHandle.TYPE));
    private static final List<StagePort> OUTPUTS = List.of(new StagePort(OUTPUT, TableHandle.TYPE));

    public ColumnMapper(String name, Map<String, Object> options, StageContext context) {
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
        Map<String, String> mapping = new LinkedHashMap<>();
        config.getMap(COLUMNS.getName()).forEach((from, to) -> mapping.put(from, String.valueOf(to)));
        checkColumnNames(INPUT, mapping.keySet());

        Table template = Table.empty(getHandle(INPUT).columnNames()).rename(mapping);
        initializeOutput(OUTPUT, template, getHandle(INPUT).size());
        for (Chunk<Table> chunk : inputIterator(INPUT, Table.class)) {
            writeOutputChunk(OUTPUT, chunk.data().rename(mapping), chunk.start(), chunk.end());
        }
    }
}
