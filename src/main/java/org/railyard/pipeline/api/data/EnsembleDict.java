package org.railyard.pipeline.api.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered, immutable mapping from names to ensembles, persisted as one file.
 */
public final class EnsembleDict {

    private final LinkedHashMap<String, Ensemble> entries;

    public EnsembleDict(Map<String, Ensemble> entries) {
        this.entries = new LinkedHashMap<>(entries);
    }

    public Ensemble get(String name) {
        return entries.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<String, Ensemble> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EnsembleDict other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }

    @Override
    public String toString() {
        return "EnsembleDict" + entries.keySet();
    }
}
