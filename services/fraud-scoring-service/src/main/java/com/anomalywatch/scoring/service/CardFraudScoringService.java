package com.anomalywatch.scoring.service;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.common.domain.CardTransactionRecord;
import com.anomalywatch.common.feature.CardFeatureEngineer;
import com.anomalywatch.common.feature.CardFeatureVector;
import com.anomalywatch.common.model.FraudModel;
import com.anomalywatch.scoring.config.ScoringProperties;
import com.anomalywatch.scoring.decision.EnsembleDecisionEngine;
import com.anomalywatch.scoring.exception.ArtifactUnavailableException;
import com.anomalywatch.scoring.metrics.ScoringMetrics;
import com.anomalywatch.scoring.model.PredictionResult;
import com.anomalywatch.scoring.registry.ModelRegistry;
import com.anomalywatch.scoring.rules.CardHeuristicRuleEngine;
import com.anomalywatch.scoring.rules.HeuristicAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores card transactions with the card-domain model and the distance rule.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CardFraudScoringService {

    public static final String DOMAIN = "card";

    private final ModelRegistry modelRegistry;
    private final CardHeuristicRuleEngine ruleEngine;
    private final EnsembleDecisionEngine decisionEngine;
    private final ScoringProperties properties;
    private final ScoringMetrics metrics;

    public PredictionResult score(CardTransactionRecord record) {
        long started = System.nanoTime();

        FraudModel model;
        try {
            model = modelRegistry.require(ArtifactKey.CARD_DOMAIN_MODEL, FraudModel.class);
        } catch (ArtifactUnavailableException e) {
            metrics.recordUnavailable(DOMAIN);
            throw e;
        }

        CardFeatureVector features = CardFeatureEngineer.computeFeatures(record);
        double modelProbability = model.fraudProbability(features.toArray());
        HeuristicAssessment assessment = ruleEngine.evaluate(features);

        PredictionResult result = decisionEngine.decide(properties.getCardModelLabel(),
                modelProbability, assessment.getProbabilityFloor(), assessment.getFactors());

        log.info("Card prediction: model={} distance={}km risk={} fraud={}",
                String.format("%.4f", modelProbability), String.format("%.1f", features.distanceKm()),
                result.getRiskLevel().label(), result.isFraud());
        metrics.recordPrediction(DOMAIN, result, System.nanoTime() - started);
        return result;
    }
}
