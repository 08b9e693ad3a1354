package com.anomalywatch.scoring.service;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.common.feature.CategoryEncoding;
import com.anomalywatch.common.feature.FeatureEngineer;
import com.anomalywatch.common.feature.FeatureVector;
import com.anomalywatch.common.model.FraudModel;
import com.anomalywatch.scoring.config.ScoringProperties;
import com.anomalywatch.scoring.decision.EnsembleDecisionEngine;
import com.anomalywatch.scoring.exception.ArtifactUnavailableException;
import com.anomalywatch.scoring.metrics.ScoringMetrics;
import com.anomalywatch.scoring.model.PredictionResult;
import com.anomalywatch.scoring.registry.ModelRegistry;
import com.anomalywatch.scoring.rules.HeuristicAssessment;
import com.anomalywatch.scoring.rules.HeuristicRuleEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores payment transactions with the champion model and the payment rule table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentFraudScoringService {

    public static final String DOMAIN = "payment";

    private final ModelRegistry modelRegistry;
    private final HeuristicRuleEngine ruleEngine;
    private final EnsembleDecisionEngine decisionEngine;
    private final ScoringProperties properties;
    private final ScoringMetrics metrics;

    public PredictionResult score(TransactionRecord record) {
        long started = System.nanoTime();

        FraudModel model;
        CategoryEncoding encoding;
        try {
            model = modelRegistry.require(ArtifactKey.CHAMPION, FraudModel.class);
            encoding = modelRegistry.require(ArtifactKey.CATEGORY_ENCODER, CategoryEncoding.class);
        } catch (ArtifactUnavailableException e) {
            metrics.recordUnavailable(DOMAIN);
            throw e;
        }

        FeatureVector features = FeatureEngineer.computeFeatures(record, encoding);
        double modelProbability = model.fraudProbability(features.toArray());
        HeuristicAssessment assessment = ruleEngine.evaluate(record, features.errorBalanceOrg());

        PredictionResult result = decisionEngine.decide(properties.getPaymentModelLabel(),
                modelProbability, assessment.getProbabilityFloor(), assessment.getFactors());

        log.info("Prediction: model={} heuristic={} risk={} fraud={}",
                String.format("%.4f", modelProbability), String.format("%.2f", assessment.getProbabilityFloor()),
                result.getRiskLevel().label(), result.isFraud());
        metrics.recordPrediction(DOMAIN, result, System.nanoTime() - started);
        return result;
    }
}
