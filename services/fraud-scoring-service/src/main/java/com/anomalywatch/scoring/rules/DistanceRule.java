package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.feature.CardFeatureVector;
import com.anomalywatch.scoring.model.RiskFactor;

import java.util.Locale;
import java.util.Optional;

/**
 * Card domain: cardholder unusually far from the merchant. Explanatory only.
 */
public class DistanceRule {

    public static final double DISTANCE_THRESHOLD_KM = 100.0;

    public Optional<RiskFactor> evaluate(CardFeatureVector features) {
        if (features.distanceKm() > DISTANCE_THRESHOLD_KM) {
            return Optional.of(RiskFactor.warning(String.format(Locale.US,
                    "Distance anomaly: %.1f km from merchant", features.distanceKm())));
        }
        return Optional.empty();
    }
}
