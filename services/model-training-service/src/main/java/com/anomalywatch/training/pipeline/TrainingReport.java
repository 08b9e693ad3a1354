package com.anomalywatch.training.pipeline;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.training.evaluation.ModelResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one pipeline run.
 */
@Value
@Builder
public class TrainingReport {

    String pipeline;

    int trainingRows;

    int testRows;

    @Singular
    List<ModelResult> results;

    @Singular
    List<ArtifactKey> savedArtifacts;

    Duration elapsed;

    public ModelResult result(String modelName) {
        return results.stream()
                .filter(result -> result.getName().equals(modelName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No result for model " + modelName));
    }
}
