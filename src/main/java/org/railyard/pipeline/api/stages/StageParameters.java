package org.railyard.pipeline.api.stages;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The ordered set of parameters a stage class declares.
 */
public final class StageParameters {

    private final LinkedHashMap<String, StageParameter<?>> parameters;

    private StageParameters(LinkedHashMap<String, StageParameter<?>> parameters) {
        this.parameters = parameters;
    }

    public static Builder builder() {
        return new Builder();
    }

    public StageParameter<?> get(String name) {
        return parameters.get(name);
    }

    public boolean contains(String name) {
        return parameters.containsKey(name);
    }

    public Collection<StageParameter<?>> all() {
        return Collections.unmodifiableCollection(parameters.values());
    }

    public Map<String, StageParameter<?>> asMap() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * Accumulates declarations. A later declaration of the same name replaces the earlier
     * one, so subclasses can override the defaults of inherited parameters.
     */
    public static final class Builder {

        private final LinkedHashMap<String, StageParameter<?>> parameters = new LinkedHashMap<>();

        public Builder add(StageParameter<?> parameter) {
            parameters.put(parameter.getName(), parameter);
            return this;
        }

        public Builder addAll(StageParameters other) {
            other.parameters.values().forEach(this::add);
            return this;
        }

        public StageParameters build() {
            return new StageParameters(new LinkedHashMap<>(parameters));
        }
    }
}
