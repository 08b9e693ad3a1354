package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.scoring.model.RiskFactor;

import java.util.Optional;

/**
 * R1: the sender's balance can never legitimately go negative.
 */
public class ForcedOverdraftRule implements HeuristicRule {

    public static final double PROBABILITY_FLOOR = 0.99;

    @Override
    public String id() {
        return "R1";
    }

    @Override
    public double probabilityFloor() {
        return PROBABILITY_FLOOR;
    }

    @Override
    public Optional<RiskFactor> evaluate(TransactionRecord record, double errorBalanceOrg) {
        if (record.getNewBalanceOrig() < 0) {
            return Optional.of(RiskFactor.danger(
                    "Illegal Overdraft: Sender balance went negative, indicating a forced withdrawal"));
        }
        return Optional.empty();
    }
}
