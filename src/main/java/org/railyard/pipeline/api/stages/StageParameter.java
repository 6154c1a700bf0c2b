package org.railyard.pipeline.api.stages;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declaration of one stage parameter: name, type, default, whether it is required, and a description.
 * <p>
 * Supported types are {@link String}, {@link Long}, {@link Double}, {@link Boolean},
 * {@link List} and {@link Map}. Integral values are accepted for {@code Long} and
 * {@code Double} parameters, floating point values only for {@code Double}.
 *
 * @param <V> value type
 */
public final class StageParameter<V> {

    private static final Set<Class<?>> SUPPORTED = Set.of(String.class, Long.class, Double.class, Boolean.class, List.class, Map.class);

    private final String name;
    private final Class<V> type;
    private final V defaultValue;
    private final boolean required;
    private final String description;

    private StageParameter(String name, Class<V> type, V defaultValue, boolean required, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        if (!SUPPORTED.contains(type)) {
            throw new ConfigurationException(String.format("Parameter '%s' has unsupported type %s", name, type.getName()));
        }
        if (defaultValue != null && !type.isInstance(defaultValue)) {
            throw new ConfigurationException(String.format("Parameter '%s' is declared as %s but its default %s is a %s",
                    name, type.getSimpleName(), defaultValue, defaultValue.getClass().getSimpleName()));
        }
        this.defaultValue = defaultValue;
        this.required = required;
        this.description = description;
    }

    /**
     * Declares an optional parameter.
     */
    public static <V> StageParameter<V> optional(String name, Class<V> type, V defaultValue, String description) {
        return new StageParameter<>(name, type, defaultValue, false, description);
    }

    /**
     * Declares a required parameter.
     */
    public static <V> StageParameter<V> required(String name, Class<V> type, String description) {
        return new StageParameter<>(name, type, null, true, description);
    }

    /**
     * Declares an optional list parameter.
     */
    public static StageParameter<List<?>> list(String name, List<?> defaultValue, String description) {
        return new StageParameter<>(name, collectionType(List.class), defaultValue, false, description);
    }

    /**
     * Declares an optional map parameter with string keys.
     */
    public static StageParameter<Map<String, ?>> map(String name, Map<String, ?> defaultValue, String description) {
        return new StageParameter<>(name, collectionType(Map.class), defaultValue, false, description);
    }

    /**
     * Declares a required map parameter with string keys.
     */
    public static StageParameter<Map<String, ?>> requiredMap(String name, String description) {
        return new StageParameter<>(name, collectionType(Map.class), null, true, description);
    }

    @SuppressWarnings("unchecked")
    private static <C> Class<C> collectionType(Class<?> raw) {
        return (Class<C>) raw;
    }

    /**
     * Returns a copy with a different default, e.g. a stage-specific override of a shared parameter.
     */
    public StageParameter<V> withDefault(V newDefault) {
        return new StageParameter<>(name, type, newDefault, false, description);
    }

    /**
     * Converts a raw configuration value to this parameter's type.
     *
     * @throws ConfigurationException if the value cannot be converted without loss
     */
    public V coerce(Object value, String owner) {
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        if (type == Long.class && value instanceof Number n && isIntegral(n)) {
            return type.cast(n.longValue());
        }
        if (type == Double.class && value instanceof Number n) {
            return type.cast(n.doubleValue());
        }
        throw new ConfigurationException(String.format("%s: parameter '%s' expects %s, got %s (%s)",
                owner, name, type.getSimpleName(), value, value.getClass().getSimpleName()));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    public String getName() {
        return name;
    }

    public Class<V> getType() {
        return type;
    }

    public V getDefaultValue() {
        return defaultValue;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return String.format("%s (%s%s, default=%s): %s", name, type.getSimpleName(),
                required ? ", required" : "", defaultValue, description);
    }
}
