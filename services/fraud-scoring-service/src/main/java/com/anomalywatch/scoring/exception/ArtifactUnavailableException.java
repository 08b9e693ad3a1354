package com.anomalywatch.scoring.exception;

import com.anomalywatch.common.artifact.ArtifactKey;

/**
 * A capability was requested whose artifact is not loaded.
 */
public class ArtifactUnavailableException extends RuntimeException {

    private final ArtifactKey key;

    public ArtifactUnavailableException(ArtifactKey key, String message) {
        super(message);
        this.key = key;
    }

    public ArtifactKey getKey() {
        return key;
    }
}
