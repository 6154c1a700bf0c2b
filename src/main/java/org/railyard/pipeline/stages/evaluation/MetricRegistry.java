package org.railyard.pipeline.stages.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.railyard.pipeline.api.data.DataLookupException;
import org.railyard.pipeline.api.evaluation.IMetric;

/**
 * Metrics an evaluator can compute, keyed by metric name, in registration order.
 * <p>
 * Metrics carry their own configuration, so the registry holds factories and every
 * evaluator instance creates fresh metric objects.
 *
 * @param <E> evaluation data type
 */
public final class MetricRegistry<E> {

    private final Map<String, Supplier<? extends IMetric<E>>> factories = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if the name is taken
     */
    public MetricRegistry<E> register(String name, Supplier<? extends IMetric<E>> factory) {
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Metric '" + name + "' is already registered");
        }
        return this;
    }

    /**
     * @throws DataLookupException if no metric of that name exists
     */
    public IMetric<E> create(String name) {
        Supplier<? extends IMetric<E>> factory = factories.get(name);
        if (factory == null) {
            throw new DataLookupException("Unknown metric '" + name + "'. Known metrics: " + factories.keySet());
        }
        return factory.get();
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
