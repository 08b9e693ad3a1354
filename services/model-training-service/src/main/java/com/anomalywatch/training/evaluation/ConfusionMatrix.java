package com.anomalywatch.training.evaluation;

import lombok.Value;

/**
 * Binary confusion matrix with fraud as the positive class.
 */
@Value
public class ConfusionMatrix {

    long trueNegatives;
    long falsePositives;
    long falseNegatives;
    long truePositives;

    public static ConfusionMatrix of(int[] actual, int[] predicted) {
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("actual and predicted differ in length");
        }
        long tn = 0;
        long fp = 0;
        long fn = 0;
        long tp = 0;
        for (int i = 0; i < actual.length; i++) {
            boolean positive = actual[i] == 1;
            boolean flagged = predicted[i] == 1;
            if (positive && flagged) {
                tp++;
            } else if (positive) {
                fn++;
            } else if (flagged) {
                fp++;
            } else {
                tn++;
            }
        }
        return new ConfusionMatrix(tn, fp, fn, tp);
    }

    public long total() {
        return trueNegatives + falsePositives + falseNegatives + truePositives;
    }

    public long positiveSupport() {
        return truePositives + falseNegatives;
    }

    public long negativeSupport() {
        return trueNegatives + falsePositives;
    }

    public double precision() {
        return ratio(truePositives, truePositives + falsePositives);
    }

    public double recall() {
        return ratio(truePositives, truePositives + falseNegatives);
    }

    public double f1() {
        return harmonicMean(precision(), recall());
    }

    public double negativePrecision() {
        return ratio(trueNegatives, trueNegatives + falseNegatives);
    }

    public double negativeRecall() {
        return ratio(trueNegatives, trueNegatives + falsePositives);
    }

    public double negativeF1() {
        return harmonicMean(negativePrecision(), negativeRecall());
    }

    public double accuracy() {
        return ratio(trueNegatives + truePositives, total());
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    private static double harmonicMean(double a, double b) {
        return a + b == 0.0 ? 0.0 : 2 * a * b / (a + b);
    }
}
