package com.anomalywatch.common.feature;

import com.anomalywatch.common.domain.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

/**
 * Feature Engineer
 *
 * Turns a raw payment transaction into the ordered {@link FeatureVector}
 * consumed by the payment models. The trainer and the scoring service both
 * go through this class, so the training and serving transforms cannot drift.
 */
@Slf4j
public final class FeatureEngineer {

    private FeatureEngineer() {
    }

    public static FeatureVector computeFeatures(TransactionRecord record, CategoryEncoding encoding) {
        int typeCode = encodeType(record.getType(), encoding);

        return new FeatureVector(
                typeCode,
                record.getAmount(),
                record.getOldBalanceOrg(),
                record.getNewBalanceOrig(),
                errorBalanceOrg(record),
                errorBalanceDest(record));
    }

    /**
     * Sender-side balance error; zero for an arithmetically consistent transfer.
     */
    public static double errorBalanceOrg(TransactionRecord record) {
        return record.getNewBalanceOrig() + record.getAmount() - record.getOldBalanceOrg();
    }

    /**
     * Recipient-side balance error; zero for an arithmetically consistent transfer.
     */
    public static double errorBalanceDest(TransactionRecord record) {
        return record.getOldBalanceDest() + record.getAmount() - record.getNewBalanceDest();
    }

    private static int encodeType(String type, CategoryEncoding encoding) {
        var code = encoding.lookup(type);
        if (code.isEmpty()) {
            log.debug("Unseen transaction type '{}', using default code {}", type, CategoryEncoding.DEFAULT_CODE);
            return CategoryEncoding.DEFAULT_CODE;
        }
        return code.getAsInt();
    }
}
