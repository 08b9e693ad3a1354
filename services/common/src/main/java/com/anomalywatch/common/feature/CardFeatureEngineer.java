package com.anomalywatch.common.feature;

import com.anomalywatch.common.domain.CardTransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.YearMonth;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Feature computation for the card domain: cardholder-to-merchant distance,
 * cardholder age and city population.
 */
@Slf4j
public final class CardFeatureEngineer {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * Year the card model ages are computed against. Must match training.
     */
    public static final int REFERENCE_YEAR = 2025;

    public static final int DEFAULT_AGE = 30;

    private static final Pattern ISO_DATE = Pattern.compile("^\\s*(\\d{4})-(\\d{1,2})-(\\d{1,2})(?:[ T].*)?\\s*$");

    private CardFeatureEngineer() {
    }

    public static CardFeatureVector computeFeatures(CardTransactionRecord record) {
        double distance = haversineKm(
                record.getLatitude(), record.getLongitude(),
                record.getMerchantLatitude(), record.getMerchantLongitude());

        return new CardFeatureVector(
                record.getAmount(),
                distance,
                ageAt(record.getDateOfBirth(), REFERENCE_YEAR),
                record.getCityPopulation());
    }

    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = phi2 - phi1;
        double dLambda = Math.toRadians(lon2) - Math.toRadians(lon1);

        double a = Math.pow(Math.sin(dPhi / 2), 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.pow(Math.sin(dLambda / 2), 2);
        return EARTH_RADIUS_KM * 2 * Math.asin(Math.sqrt(a));
    }

    public static int ageAt(String dateOfBirth, int referenceYear) {
        OptionalInt birthYear = birthYear(dateOfBirth);
        if (birthYear.isEmpty()) {
            log.debug("Unparsable date of birth '{}', using default age {}", dateOfBirth, DEFAULT_AGE);
            return DEFAULT_AGE;
        }
        return referenceYear - birthYear.getAsInt();
    }

    /**
     * Year component of an ISO {@code yyyy-MM-dd} date (optionally followed by a
     * time part), or empty when the text is not a valid calendar date.
     */
    public static OptionalInt birthYear(String dateOfBirth) {
        if (dateOfBirth == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = ISO_DATE.matcher(dateOfBirth);
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        int year = Integer.parseInt(matcher.group(1));
        int month = Integer.parseInt(matcher.group(2));
        int day = Integer.parseInt(matcher.group(3));
        if (month < 1 || month > 12 || day < 1 || !YearMonth.of(year, month).isValidDay(day)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(year);
    }
}
