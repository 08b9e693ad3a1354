package com.anomalywatch.training.evaluation;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Imbalance-aware metrics for binary fraud classification.
 */
public final class ClassificationMetrics {

    private ClassificationMetrics() {
    }

    /**
     * Area under the precision-recall curve as average precision:
     * {@code sum((R_n - R_{n-1}) * P_n)} over the distinct score thresholds,
     * highest first. Returns 0 when there are no positives.
     */
    public static double averagePrecision(int[] actual, double[] scores) {
        if (actual.length != scores.length) {
            throw new IllegalArgumentException("actual and scores differ in length");
        }
        long positives = Arrays.stream(actual).filter(label -> label == 1).count();
        if (positives == 0) {
            return 0.0;
        }

        Integer[] order = IntStream.range(0, scores.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        double averagePrecision = 0.0;
        double previousRecall = 0.0;
        long truePositives = 0;
        long flagged = 0;
        int i = 0;
        while (i < order.length) {
            double threshold = scores[order[i]];
            while (i < order.length && scores[order[i]] == threshold) {
                flagged++;
                if (actual[order[i]] == 1) {
                    truePositives++;
                }
                i++;
            }
            double recall = (double) truePositives / positives;
            double precision = (double) truePositives / flagged;
            averagePrecision += (recall - previousRecall) * precision;
            previousRecall = recall;
        }
        return averagePrecision;
    }

    public static double f1(int[] actual, int[] predicted) {
        return ConfusionMatrix.of(actual, predicted).f1();
    }

    public static int[] threshold(double[] probabilities, double threshold) {
        return Arrays.stream(probabilities).mapToInt(p -> p > threshold ? 1 : 0).toArray();
    }
}
