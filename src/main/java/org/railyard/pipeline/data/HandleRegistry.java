package org.railyard.pipeline.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.railyard.pipeline.api.data.DataLookupException;
import org.railyard.pipeline.api.data.Ensemble;
import org.railyard.pipeline.api.data.EnsembleDict;
import org.railyard.pipeline.api.data.Model;
import org.railyard.pipeline.api.data.Table;
import org.railyard.pipeline.utils.compression.ICompressionCodec;
import org.railyard.pipeline.utils.compression.NoneCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit directory of the handle types available to a run, keyed by type name.
 * <p>
 * Built once at startup, usually through {@link #withDefaults()}, and shared read-only by
 * the stages of the run.
 */
public final class HandleRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandleRegistry.class);

    private final Map<String, HandleType<?>> types = new LinkedHashMap<>();
    private final ModelCache modelCache;

    public HandleRegistry(ModelCache modelCache) {
        this.modelCache = modelCache;
    }

    /**
     * Creates a registry holding every built-in handle type, with uncompressed models.
     */
    public static HandleRegistry withDefaults() {
        return withDefaults(new NoneCodec());
    }

    /**
     * Creates a registry holding every built-in handle type.
     *
     * @param modelCompression compression used when writing models
     */
    public static HandleRegistry withDefaults(ICompressionCodec modelCompression) {
        HandleRegistry registry = new HandleRegistry(new ModelCache());
        registry.register(new HandleType<>(TableHandle.TYPE, Table.class, "rtab", TableHandle::new));
        registry.register(new HandleType<>(JsonTableHandle.TYPE, Table.class, "json", JsonTableHandle::new));
        registry.register(new HandleType<>(EnsembleHandle.TYPE, Ensemble.class, "rens", EnsembleHandle::new));
        registry.register(new HandleType<>(EnsembleDictHandle.TYPE, EnsembleDict.class, "rensd", EnsembleDictHandle::new));
        ModelCache cache = registry.modelCache;
        registry.register(new HandleType<>(ModelHandle.TYPE, Model.class, "ser" + modelCompression.getFileExtension(),
                (tag, path, creator) -> new ModelHandle(tag, path, creator, cache, modelCompression)));
        registry.register(new HandleType<>(EnsembleOrTableHandle.TYPE, Object.class, "rtab", EnsembleOrTableHandle::new));
        return registry;
    }

    /**
     * Registers a handle type.
     *
     * @throws IllegalArgumentException if the name is taken
     */
    public void register(HandleType<?> type) {
        if (types.putIfAbsent(type.getName(), type) != null) {
            throw new IllegalArgumentException("Handle type '" + type.getName() + "' is already registered");
        }
        log.debug("Registered handle type '{}'", type.getName());
    }

    /**
     * @throws DataLookupException if no type of that name exists
     */
    public HandleType<?> get(String name) {
        HandleType<?> type = types.get(name);
        if (type == null) {
            throw new DataLookupException("Unknown handle type '" + name + "'. Known types: " + types.keySet());
        }
        return type;
    }

    /**
     * Finds the first registered type whose payload type accepts the given value.
     *
     * @throws DataLookupException if no type accepts it
     */
    public HandleType<?> forData(Object data) {
        for (HandleType<?> type : types.values()) {
            if (type.getDataType() != Object.class && type.getDataType().isInstance(data)) {
                return type;
            }
        }
        throw new DataLookupException("No handle type accepts data of type " + data.getClass().getName());
    }

    public boolean contains(String name) {
        return types.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(types.keySet());
    }

    public ModelCache getModelCache() {
        return modelCache;
    }
}
