package org.railyard.pipeline.stages;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.railyard.pipeline.api.data.DataLookupException;
import org.railyard.pipeline.stages.estimation.TrainZEstimator;
import org.railyard.pipeline.stages.estimation.TrainZInformer;
import org.railyard.pipeline.stages.evaluation.PointToPointEvaluator;
import org.railyard.pipeline.stages.tools.ColumnMapper;
import org.railyard.pipeline.stages.tools.RowSelector;

/**
 * Explicit directory of stage types, keyed by a stable type name.
 */
public final class StageRegistry {

    private final Map<String, IStageFactory> factories = new LinkedHashMap<>();

    /**
     * Creates a registry holding the built-in stages.
     */
    public static StageRegistry withDefaults() {
        StageRegistry registry = new StageRegistry();
        registry.register("columnMapper", ColumnMapper::new);
        registry.register("rowSelector", RowSelector::new);
        registry.register("trainZInformer", TrainZInformer::new);
        registry.register("trainZEstimator", TrainZEstimator::new);
        registry.register("pointToPointEvaluator", PointToPointEvaluator::new);
        return registry;
    }

    /**
     * @throws IllegalArgumentException if the name is taken
     */
    public void register(String typeName, IStageFactory factory) {
        if (factories.putIfAbsent(typeName, factory) != null) {
            throw new IllegalArgumentException("Stage type '" + typeName + "' is already registered");
        }
    }

    /**
     * @throws DataLookupException if no stage type of that name exists
     */
    public IStageFactory get(String typeName) {
        IStageFactory factory = factories.get(typeName);
        if (factory == null) {
            throw new DataLookupException("Unknown stage type '" + typeName + "'. Known types: " + factories.keySet());
        }
        return factory;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
