package com.anomalywatch.common.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Raw mobile-money transaction as seen by both the trainer and the scorer.
 *
 * <p>Field names follow the PaySim dataset columns. Balances are the sender
 * ({@code Org}/{@code Orig}) and recipient ({@code Dest}) balances before and
 * after the transfer.
 */
@Value
@Builder(toBuilder = true)
public class TransactionRecord {

    @Builder.Default
    int step = 1;

    String type;

    double amount;

    double oldBalanceOrg;

    double newBalanceOrig;

    double oldBalanceDest;

    double newBalanceDest;
}
