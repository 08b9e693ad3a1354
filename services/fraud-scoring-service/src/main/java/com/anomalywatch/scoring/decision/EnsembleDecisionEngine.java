package com.anomalywatch.scoring.decision;

import com.anomalywatch.scoring.model.PredictionResult;
import com.anomalywatch.scoring.model.RiskFactor;
import com.anomalywatch.scoring.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fuses a model probability with a heuristic floor into a {@link PredictionResult}.
 *
 * <ul>
 *   <li>final probability = max(model, heuristic); neither source can lower the other</li>
 *   <li>fraud when the final probability exceeds 0.5</li>
 *   <li>High above 0.8, Medium above 0.4, otherwise Low</li>
 * </ul>
 *
 * Independent of the feature layout, so both transaction domains share it.
 */
@Component
public class EnsembleDecisionEngine {

    public static final double FRAUD_THRESHOLD = 0.5;
    public static final double HIGH_RISK_THRESHOLD = 0.8;
    public static final double MEDIUM_RISK_THRESHOLD = 0.4;

    static final int EXPLAINED_FACTORS = 3;
    static final String DEFAULT_MODEL_LABEL = "Model";
    public static final String LEGITIMATE_EXPLANATION = "Transaction parameters are consistent with legitimate behavior.";
    public static final String NO_ANOMALIES = "All checks passed: no anomalies detected";

    public PredictionResult decide(double modelProbability, double heuristicProbability, List<RiskFactor> factors) {
        return decide(DEFAULT_MODEL_LABEL, modelProbability, heuristicProbability, factors);
    }

    /**
     * @param modelLabel display name of the model, used in the model's own risk factor
     */
    public PredictionResult decide(String modelLabel, double modelProbability, double heuristicProbability,
                                   List<RiskFactor> factors) {
        requireProbability("modelProbability", modelProbability);
        requireProbability("heuristicProbability", heuristicProbability);

        List<RiskFactor> assembled = new ArrayList<>(factors.size() + 1);
        if (modelProbability > FRAUD_THRESHOLD) {
            String description = String.format(Locale.US,
                    "AI Model: %s detected suspicious pattern (confidence: %.1f%%)",
                    modelLabel, modelProbability * 100);
            assembled.add(modelProbability > HIGH_RISK_THRESHOLD
                    ? RiskFactor.danger(description)
                    : RiskFactor.warning(description));
        }
        assembled.addAll(factors);

        double probability = Math.max(modelProbability, heuristicProbability);
        boolean fraud = probability > FRAUD_THRESHOLD;

        String explanation;
        if (fraud) {
            explanation = "Risk Factors: " + assembled.stream()
                    .limit(EXPLAINED_FACTORS)
                    .map(RiskFactor::getDescription)
                    .collect(Collectors.joining("; ")) + ".";
        } else {
            explanation = LEGITIMATE_EXPLANATION;
            if (assembled.isEmpty()) {
                assembled.add(RiskFactor.info(NO_ANOMALIES));
            }
        }

        return PredictionResult.builder()
                .probability(probability)
                .fraud(fraud)
                .riskLevel(riskLevel(probability))
                .explanation(explanation)
                .factors(List.copyOf(assembled))
                .build();
    }

    public static RiskLevel riskLevel(double probability) {
        if (probability > HIGH_RISK_THRESHOLD) {
            return RiskLevel.HIGH;
        }
        if (probability > MEDIUM_RISK_THRESHOLD) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static void requireProbability(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 1], was " + value);
        }
    }
}
