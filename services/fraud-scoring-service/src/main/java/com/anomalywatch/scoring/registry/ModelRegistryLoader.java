package com.anomalywatch.scoring.registry;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.common.artifact.ArtifactStore;
import com.anomalywatch.common.exception.ArtifactStoreException;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads every known artifact once. Each key is loaded independently, so an
 * absent or unreadable artifact is logged and skipped instead of failing
 * startup.
 */
@Slf4j
public final class ModelRegistryLoader {

    private ModelRegistryLoader() {
    }

    public static ModelRegistry load(ArtifactStore store) {
        log.info("Loading models from {} ...", store.location());
        Map<ArtifactKey, Object> loaded = new EnumMap<>(ArtifactKey.class);
        for (ArtifactKey key : ArtifactKey.values()) {
            try {
                Optional<Object> artifact = store.load(key);
                if (artifact.isEmpty()) {
                    log.warn("Model file not found: {} (artifact '{}')", key.fileName(), key.logicalName());
                } else if (!key.artifactType().isInstance(artifact.get())) {
                    log.error("Artifact '{}' has unexpected type {}, expected {}", key.logicalName(),
                            artifact.get().getClass().getName(), key.artifactType().getSimpleName());
                } else {
                    loaded.put(key, artifact.get());
                    log.info("Loaded {}", key.logicalName());
                }
            } catch (ArtifactStoreException e) {
                log.error("Failed to load artifact '{}'", key.logicalName(), e);
            }
        }

        ModelRegistry registry = new ModelRegistry(loaded);
        log.info("Models loaded: {}", registry.loadedNames());
        return registry;
    }
}
