package com.anomalywatch.training.evaluation;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Hold-out evaluation of one trained model.
 */
@Value
@Builder
public class ModelResult {

    String name;

    /**
     * Area under the precision-recall curve; {@code null} for models without probability output.
     */
    Double auprc;

    double f1;

    ConfusionMatrix confusionMatrix;

    @Builder.Default
    Map<String, Object> bestParameters = Map.of();

    public boolean hasAuprc() {
        return auprc != null;
    }
}
