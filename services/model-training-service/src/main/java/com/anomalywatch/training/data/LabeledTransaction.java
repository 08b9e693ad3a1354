package com.anomalywatch.training.data;

import com.anomalywatch.common.domain.TransactionRecord;
import lombok.Value;

@Value
public class LabeledTransaction {

    TransactionRecord record;

    boolean fraud;
}
