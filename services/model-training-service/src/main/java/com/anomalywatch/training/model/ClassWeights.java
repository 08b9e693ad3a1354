package com.anomalywatch.training.model;

import com.anomalywatch.training.data.LabeledDataset;

/**
 * Per-row instance weights for imbalanced binary labels.
 */
public final class ClassWeights {

    private ClassWeights() {
    }

    /**
     * Weights each row by {@code n / (2 * n_class)} so both classes carry the same total weight.
     */
    public static double[] balanced(int[] labels) {
        int fraud = 0;
        for (int label : labels) {
            if (label == LabeledDataset.FRAUD) {
                fraud++;
            }
        }
        int legitimate = labels.length - fraud;
        double fraudWeight = fraud == 0 ? 0.0 : labels.length / (2.0 * fraud);
        double legitimateWeight = legitimate == 0 ? 0.0 : labels.length / (2.0 * legitimate);

        double[] weights = new double[labels.length];
        for (int i = 0; i < labels.length; i++) {
            weights[i] = labels[i] == LabeledDataset.FRAUD ? fraudWeight : legitimateWeight;
        }
        return weights;
    }

    /**
     * Unit weight for legitimate rows, {@code positiveWeight} for fraud rows.
     */
    public static double[] positiveWeighted(int[] labels, double positiveWeight) {
        double[] weights = new double[labels.length];
        for (int i = 0; i < labels.length; i++) {
            weights[i] = labels[i] == LabeledDataset.FRAUD ? positiveWeight : 1.0;
        }
        return weights;
    }

    /**
     * Negative to positive row ratio, or 1 when either class is absent.
     */
    public static double negativeToPositiveRatio(LabeledDataset dataset) {
        int fraud = dataset.countOf(LabeledDataset.FRAUD);
        int legitimate = dataset.countOf(LabeledDataset.LEGITIMATE);
        return fraud == 0 || legitimate == 0 ? 1.0 : (double) legitimate / fraud;
    }
}
