package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.scoring.model.RiskFactor;

import java.util.Optional;

/**
 * One deterministic payment-domain rule.
 */
public interface HeuristicRule {

    String id();

    /**
     * Minimum fraud probability implied when the rule fires; {@code 0} for
     * rules that only contribute an explanatory factor.
     */
    double probabilityFloor();

    Optional<RiskFactor> evaluate(TransactionRecord record, double errorBalanceOrg);
}
