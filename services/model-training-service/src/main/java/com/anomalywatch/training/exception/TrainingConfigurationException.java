package com.anomalywatch.training.exception;

/**
 * Fatal configuration problem detected before the pipeline starts computing,
 * such as a missing source dataset. The message carries remediation steps.
 */
public class TrainingConfigurationException extends RuntimeException {

    public TrainingConfigurationException(String message) {
        super(message);
    }
}
