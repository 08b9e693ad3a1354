package com.anomalywatch.common.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Card-present transaction from the alternate (credit card) domain.
 */
@Value
@Builder(toBuilder = true)
public class CardTransactionRecord {

    double amount;

    double latitude;

    double longitude;

    double merchantLatitude;

    double merchantLongitude;

    /**
     * Cardholder date of birth, {@code yyyy-MM-dd}. Kept as text because
     * unparsable values are recovered during feature computation.
     */
    String dateOfBirth;

    long cityPopulation;
}
