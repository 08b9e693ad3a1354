package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.scoring.model.RiskFactor;

import java.util.Optional;

/**
 * R2: the transaction empties the sender's account.
 */
public class BalanceDrainRule implements HeuristicRule {

    public static final double PROBABILITY_FLOOR = 0.95;

    @Override
    public String id() {
        return "R2";
    }

    @Override
    public double probabilityFloor() {
        return PROBABILITY_FLOOR;
    }

    @Override
    public Optional<RiskFactor> evaluate(TransactionRecord record, double errorBalanceOrg) {
        if (record.getNewBalanceOrig() == 0
                && record.getAmount() > 0
                && record.getAmount() >= record.getOldBalanceOrg()) {
            return Optional.of(RiskFactor.danger(
                    "Balance Drain: Full account emptied (" + Amounts.format(record.getOldBalanceOrg()) + " → 0)"));
        }
        return Optional.empty();
    }
}
