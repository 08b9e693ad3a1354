package com.anomalywatch.training.data;

import com.anomalywatch.common.domain.CardTransactionRecord;
import lombok.Value;

@Value
public class LabeledCardTransaction {

    CardTransactionRecord record;

    boolean fraud;
}
