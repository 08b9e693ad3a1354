package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.scoring.model.RiskFactor;

import java.util.Locale;
import java.util.Optional;

/**
 * R4: amount above the high-value threshold.
 */
public class HighValueRule implements HeuristicRule {

    public static final double PROBABILITY_FLOOR = 0.70;

    private final double threshold;

    public HighValueRule(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String id() {
        return "R4";
    }

    @Override
    public double probabilityFloor() {
        return PROBABILITY_FLOOR;
    }

    @Override
    public Optional<RiskFactor> evaluate(TransactionRecord record, double errorBalanceOrg) {
        if (record.getAmount() > threshold) {
            return Optional.of(RiskFactor.warning(String.format(Locale.US,
                    "High Amount: %s exceeds %,.0f threshold", Amounts.format(record.getAmount()), threshold)));
        }
        return Optional.empty();
    }
}
