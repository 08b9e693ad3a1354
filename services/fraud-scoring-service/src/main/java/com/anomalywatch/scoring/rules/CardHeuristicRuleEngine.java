package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.feature.CardFeatureVector;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Card-domain rule engine. Its only rule is factor-only, so the floor is always {@code 0}.
 */
@Component
public class CardHeuristicRuleEngine {

    private final DistanceRule distanceRule = new DistanceRule();

    public HeuristicAssessment evaluate(CardFeatureVector features) {
        return distanceRule.evaluate(features)
                .map(factor -> new HeuristicAssessment(0.0, List.of(factor)))
                .orElseGet(HeuristicAssessment::none);
    }
}
