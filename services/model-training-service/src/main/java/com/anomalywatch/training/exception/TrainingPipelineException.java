package com.anomalywatch.training.exception;

/**
 * Exception thrown when a training pipeline stage fails
 */
public class TrainingPipelineException extends RuntimeException {

    public TrainingPipelineException(String message) {
        super(message);
    }

    public TrainingPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
