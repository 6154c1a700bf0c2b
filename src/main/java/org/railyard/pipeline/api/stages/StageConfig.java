package org.railyard.pipeline.api.stages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Validated parameter values of one stage instance.
 * <p>
 * Construction is strict: every supplied key must be declared, every required parameter
 * must be supplied, and every value must match its declared type. Parameters that were not
 * supplied take their declared default.
 */
public final class StageConfig {

    private final String owner;
    private final StageParameters declared;
    private final Map<String, Object> values;

    /**
     * @param owner    stage instance name, used in error messages
     * @param declared parameter declarations of the stage class
     * @param supplied user-supplied values
     * @throws ConfigurationException if validation fails
     */
    public StageConfig(String owner, StageParameters declared, Map<String, ?> supplied) {
        this.owner = owner;
        this.declared = declared;
        TreeSet<String> unknown = new TreeSet<>(supplied.keySet());
        unknown.removeAll(declared.asMap().keySet());
        if (!unknown.isEmpty()) {
            throw new ConfigurationException(String.format("%s: unknown parameters %s. Known parameters: %s",
                    owner, unknown, declared.asMap().keySet()));
        }
        LinkedHashMap<String, Object> resolved = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (StageParameter<?> parameter : declared.all()) {
            Object value = supplied.get(parameter.getName());
            if (value == null) {
                if (parameter.isRequired()) {
                    missing.add(parameter.getName());
                    continue;
                }
                value = parameter.getDefaultValue();
            }
            resolved.put(parameter.getName(), parameter.coerce(value, owner));
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException(String.format("%s: missing required parameters %s", owner, missing));
        }
        this.values = Collections.unmodifiableMap(resolved);
    }

    public String getOwner() {
        return owner;
    }

    public StageParameters getDeclared() {
        return declared;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    /**
     * Returns a value as the requested type.
     *
     * @throws ConfigurationException if the parameter is undeclared or of another type
     */
    public <V> V get(String name, Class<V> type) {
        if (!declared.contains(name)) {
            throw new ConfigurationException(String.format("%s: parameter '%s' is not declared", owner, name));
        }
        Object value = values.get(name);
        if (value != null && !type.isInstance(value)) {
            throw new ConfigurationException(String.format("%s: parameter '%s' is a %s, not a %s",
                    owner, name, value.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(value);
    }

    public String getString(String name) {
        return get(name, String.class);
    }

    public long getLong(String name) {
        return get(name, Long.class);
    }

    public int getInt(String name) {
        return Math.toIntExact(getLong(name));
    }

    public double getDouble(String name) {
        return get(name, Double.class);
    }

    public boolean getBoolean(String name) {
        return get(name, Boolean.class);
    }

    /**
     * Returns a list parameter with every element converted to a string.
     */
    public List<String> getStringList(String name) {
        List<?> raw = get(name, List.class);
        if (raw == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>(raw.size());
        raw.forEach(v -> result.add(String.valueOf(v)));
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns a map parameter, or an empty map.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String name) {
        Map<String, Object> raw = get(name, Map.class);
        return raw == null ? Map.of() : Collections.unmodifiableMap(raw);
    }

    @Override
    public String toString() {
        return owner + values;
    }
}
