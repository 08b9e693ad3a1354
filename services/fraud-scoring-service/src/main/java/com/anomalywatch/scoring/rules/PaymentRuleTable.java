package com.anomalywatch.scoring.rules;

import java.util.List;

/**
 * Versioned payment-domain rule table. Order determines factor order only.
 */
public final class PaymentRuleTable {

    public static final int VERSION = 2;

    /**
     * Tolerated absolute error in the sender's balance reconciliation.
     */
    public static final double BALANCE_ERROR_EPSILON = 0.01;

    public static final double HIGH_VALUE_AMOUNT = 150_000;

    public static final double HIGH_RATIO_THRESHOLD = 0.9;

    private PaymentRuleTable() {
    }

    public static List<HeuristicRule> rules() {
        return List.of(
                new ForcedOverdraftRule(),
                new BalanceDrainRule(),
                new BalanceMismatchRule(BALANCE_ERROR_EPSILON),
                new HighValueRule(HIGH_VALUE_AMOUNT),
                new HighBalanceRatioRule(HIGH_RATIO_THRESHOLD));
    }
}
