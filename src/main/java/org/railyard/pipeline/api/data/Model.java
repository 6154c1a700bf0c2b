package org.railyard.pipeline.api.data;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A trained model as exchanged between an informer and an estimator.
 * <p>
 * Besides the payload the model records the class that created it and a format version,
 * so a consumer can reject models it does not understand via {@link #validate(String, int)}.
 */
public final class Model implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Serializable payload;
    private final String creatorClass;
    private final int version;
    private final LinkedHashMap<String, String> provenance;

    public Model(Serializable payload, String creatorClass, int version, Map<String, String> provenance) {
        this.payload = Objects.requireNonNull(payload, "payload");
        this.creatorClass = Objects.requireNonNull(creatorClass, "creatorClass");
        this.version = version;
        this.provenance = new LinkedHashMap<>(provenance);
    }

    public Serializable getPayload() {
        return payload;
    }

    /**
     * Returns the payload cast to the expected type.
     *
     * @throws IllegalArgumentException if the payload has a different type
     */
    public <P> P getPayload(Class<P> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalArgumentException(String.format(
                    "Model payload is a %s, expected %s", payload.getClass().getName(), type.getName()));
        }
        return type.cast(payload);
    }

    public String getCreatorClass() {
        return creatorClass;
    }

    public int getVersion() {
        return version;
    }

    public Map<String, String> getProvenance() {
        return Collections.unmodifiableMap(provenance);
    }

    /**
     * Checks that this model was produced by the expected creator in the expected version.
     *
     * @throws IllegalArgumentException on mismatch
     */
    public void validate(String expectedCreatorClass, int expectedVersion) {
        if (!creatorClass.equals(expectedCreatorClass)) {
            throw new IllegalArgumentException(String.format(
                    "Model was created by %s, expected %s", creatorClass, expectedCreatorClass));
        }
        if (version != expectedVersion) {
            throw new IllegalArgumentException(String.format(
                    "Model version %d is not supported, expected %d", version, expectedVersion));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Model other)) {
            return false;
        }
        return version == other.version
                && creatorClass.equals(other.creatorClass)
                && payload.equals(other.payload)
                && provenance.equals(other.provenance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payload, creatorClass, version, provenance);
    }
}
