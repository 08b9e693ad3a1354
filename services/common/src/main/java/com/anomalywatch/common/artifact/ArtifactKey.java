package com.anomalywatch.common.artifact;

import com.anomalywatch.common.feature.CategoryEncoding;
import com.anomalywatch.common.model.FraudModel;
import com.anomalywatch.common.model.IsolationForestDetector;

/**
 * Stable logical names of the artifacts produced by the trainer and
 * consumed by the scoring service.
 */
public enum ArtifactKey {

    CHAMPION("primary", "model_primary.model", FraudModel.class),
    BASELINE("logistic", "model_logistic.model", FraudModel.class),
    ANOMALY_DETECTOR("isolation_forest", "model_isolation_forest.model", IsolationForestDetector.class),
    CATEGORY_ENCODER("encoder", "label_encoder_type.model", CategoryEncoding.class),
    CARD_DOMAIN_MODEL("secondary_rf", "model_secondary_rf.model", FraudModel.class);

    private final String logicalName;
    private final String fileName;
    private final Class<?> artifactType;

    ArtifactKey(String logicalName, String fileName, Class<?> artifactType) {
        this.logicalName = logicalName;
        this.fileName = fileName;
        this.artifactType = artifactType;
    }

    public String logicalName() {
        return logicalName;
    }

    public String fileName() {
        return fileName;
    }

    public Class<?> artifactType() {
        return artifactType;
    }
}
