package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.scoring.model.RiskFactor;

import java.util.Optional;

/**
 * R3: the sender's balances do not reconcile with the amount.
 */
public class BalanceMismatchRule implements HeuristicRule {

    public static final double PROBABILITY_FLOOR = 0.85;

    private final double epsilon;

    public BalanceMismatchRule(double epsilon) {
        this.epsilon = epsilon;
    }

    @Override
    public String id() {
        return "R3";
    }

    @Override
    public double probabilityFloor() {
        return PROBABILITY_FLOOR;
    }

    @Override
    public Optional<RiskFactor> evaluate(TransactionRecord record, double errorBalanceOrg) {
        if (Math.abs(errorBalanceOrg) > epsilon) {
            return Optional.of(RiskFactor.warning(
                    "Balance Discrepancy: Error of " + Amounts.format(errorBalanceOrg) + " detected (expected ≈ 0)"));
        }
        return Optional.empty();
    }
}
