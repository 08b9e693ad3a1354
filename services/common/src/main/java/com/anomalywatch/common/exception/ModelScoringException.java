package com.anomalywatch.common.exception;

/**
 * Thrown when a loaded model cannot produce a score for a feature vector.
 */
public class ModelScoringException extends RuntimeException {

    public ModelScoringException(String message) {
        super(message);
    }

    public ModelScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
