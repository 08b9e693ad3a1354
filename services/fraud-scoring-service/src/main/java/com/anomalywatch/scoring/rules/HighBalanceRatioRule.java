package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.scoring.model.RiskFactor;

import java.util.Optional;

/**
 * R5: the amount is close to or above the available balance.
 * Explanatory only; it never raises the probability floor.
 */
public class HighBalanceRatioRule implements HeuristicRule {

    private final double ratioThreshold;

    public HighBalanceRatioRule(double ratioThreshold) {
        this.ratioThreshold = ratioThreshold;
    }

    @Override
    public String id() {
        return "R5";
    }

    @Override
    public double probabilityFloor() {
        return 0.0;
    }

    @Override
    public Optional<RiskFactor> evaluate(TransactionRecord record, double errorBalanceOrg) {
        if (record.getOldBalanceOrg() <= 0) {
            return Optional.empty();
        }
        double ratio = record.getAmount() / record.getOldBalanceOrg();
        if (ratio > ratioThreshold) {
            return Optional.of(RiskFactor.warning(
                    "High Amount-to-Balance Ratio: " + Amounts.percent(ratio) + " of available balance"));
        }
        return Optional.empty();
    }
}
