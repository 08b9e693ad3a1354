package com.anomalywatch.common.artifact;

import java.io.Serializable;
import java.util.Optional;

/**
 * Addressable holder of trained models and encoders, keyed by {@link ArtifactKey}.
 */
public interface ArtifactStore {

    /**
     * Stores the artifact under the key, atomically replacing any previous one.
     */
    void save(ArtifactKey key, Serializable artifact);

    /**
     * Reads the artifact stored under the key.
     *
     * @return empty when nothing has been stored under the key
     * @throws com.anomalywatch.common.exception.ArtifactStoreException when the stored artifact cannot be read
     */
    Optional<Object> load(ArtifactKey key);

    boolean contains(ArtifactKey key);

    /**
     * Human readable location, for logs and remediation messages.
     */
    String location();
}
