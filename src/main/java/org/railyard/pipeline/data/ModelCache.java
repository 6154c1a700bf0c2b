package org.railyard.pipeline.data;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.railyard.pipeline.api.data.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches models by normalized absolute path, so several estimators reading the same
 * model file deserialize it once.
 */
public final class ModelCache {

    private static final Logger log = LoggerFactory.getLogger(ModelCache.class);

    @FunctionalInterface
    public interface Loader {
        Model load(Path path) throws IOException;
    }

    private final Map<Path, Model> models = new ConcurrentHashMap<>();

    /**
     * Returns the cached model for a path, loading it on first access.
     */
    public Model get(Path path, Loader loader) throws IOException {
        Path key = path.toAbsolutePath().normalize();
        Model cached = models.get(key);
        if (cached != null) {
            log.debug("Model cache hit for {}", key);
            return cached;
        }
        Model loaded = loader.load(key);
        Model previous = models.putIfAbsent(key, loaded);
        return previous != null ? previous : loaded;
    }

    /**
     * Records a model that was just written to {@code path}.
     */
    public void put(Path path, Model model) {
        models.put(path.toAbsolutePath().normalize(), model);
    }

    public void invalidate(Path path) {
        models.remove(path.toAbsolutePath().normalize());
    }

    public void clear() {
        models.clear();
    }

    public int size() {
        return models.size();
    }
}
