package com.anomalywatch.scoring.registry;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.scoring.exception.ArtifactUnavailableException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Artifacts loaded at startup, keyed by logical name.
 *
 * <p>Immutable once constructed; request threads only read from it, so it
 * needs no synchronization. Missing entries affect only the capabilities
 * that {@link #require} them.
 */
public final class ModelRegistry {

    private final Map<ArtifactKey, Object> artifacts;

    public ModelRegistry(Map<ArtifactKey, ?> artifacts) {
        EnumMap<ArtifactKey, Object> copy = new EnumMap<>(ArtifactKey.class);
        artifacts.forEach((key, artifact) -> {
            if (!key.artifactType().isInstance(artifact)) {
                throw new IllegalArgumentException("Artifact " + key.logicalName() + " is a "
                        + artifact.getClass().getName() + ", expected " + key.artifactType().getName());
            }
            copy.put(key, artifact);
        });
        this.artifacts = Collections.unmodifiableMap(copy);
    }

    public static ModelRegistry empty() {
        return new ModelRegistry(Map.of());
    }

    public boolean isLoaded(ArtifactKey key) {
        return artifacts.containsKey(key);
    }

    public Set<ArtifactKey> loadedKeys() {
        return artifacts.keySet();
    }

    /**
     * Logical names of the loaded artifacts, in key declaration order.
     */
    public List<String> loadedNames() {
        return artifacts.keySet().stream().map(ArtifactKey::logicalName).collect(Collectors.toList());
    }

    /**
     * @throws ArtifactUnavailableException when the artifact is not loaded
     */
    public <T> T require(ArtifactKey key, Class<T> type) {
        Object artifact = artifacts.get(key);
        if (artifact == null) {
            throw new ArtifactUnavailableException(key, String.format(
                    "Artifact '%s' is not loaded. Run the model training service to produce %s, then restart.",
                    key.logicalName(), key.fileName()));
        }
        return type.cast(artifact);
    }
}
