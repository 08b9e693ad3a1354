package com.anomalywatch.common.exception;

/**
 * Exception thrown when a model artifact cannot be written to or read from the artifact store
 */
public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException(String message) {
        super(message);
    }

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
