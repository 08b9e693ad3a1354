package com.anomalywatch.common.feature;

import java.util.Arrays;
import java.util.List;

/**
 * Model input for the payment domain.
 *
 * <p>The column order is the contract with every trained payment model and
 * must never change without retraining.
 */
public final class FeatureVector {

    public static final List<String> COLUMNS = List.of(
            "type",
            "amount",
            "oldbalanceOrg",
            "newbalanceOrig",
            "errorBalanceOrg",
            "errorBalanceDest");

    private final double[] values;

    FeatureVector(int typeCode, double amount, double oldBalanceOrg, double newBalanceOrig,
                  double errorBalanceOrg, double errorBalanceDest) {
        this.values = new double[]{
                typeCode, amount, oldBalanceOrg, newBalanceOrig, errorBalanceOrg, errorBalanceDest
        };
    }

    public int typeCode() {
        return (int) values[0];
    }

    public double amount() {
        return values[1];
    }

    public double oldBalanceOrg() {
        return values[2];
    }

    public double newBalanceOrig() {
        return values[3];
    }

    public double errorBalanceOrg() {
        return values[4];
    }

    public double errorBalanceDest() {
        return values[5];
    }

    /**
     * Values in {@link #COLUMNS} order. Returns a copy.
     */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector)) {
            return false;
        }
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
