package com.anomalywatch.scoring.rules;

import com.anomalywatch.scoring.model.RiskFactor;
import lombok.Value;

import java.util.List;

/**
 * Combined outcome of a rule table: the highest floor among the rules
 * that fired and their factors in rule order.
 */
@Value
public class HeuristicAssessment {

    double probabilityFloor;

    List<RiskFactor> factors;

    public static HeuristicAssessment none() {
        return new HeuristicAssessment(0.0, List.of());
    }
}
