package com.anomalywatch.common.feature;

import java.util.Arrays;
import java.util.List;

/**
 * Model input for the card domain, in the fixed order the card model was trained on.
 */
public final class CardFeatureVector {

    public static final List<String> COLUMNS = List.of("amt", "dist_to_merch", "age", "city_pop");

    private final double[] values;

    CardFeatureVector(double amount, double distanceKm, int age, double cityPopulation) {
        this.values = new double[]{amount, distanceKm, age, cityPopulation};
    }

    public double amount() {
        return values[0];
    }

    public double distanceKm() {
        return values[1];
    }

    public int age() {
        return (int) values[2];
    }

    public double cityPopulation() {
        return values[3];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CardFeatureVector)) {
            return false;
        }
        return Arrays.equals(values, ((CardFeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "CardFeatureVector" + Arrays.toString(values);
    }
}
