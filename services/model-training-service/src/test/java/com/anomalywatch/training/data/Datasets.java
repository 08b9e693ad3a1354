package com.anomalywatch.training.data;

import java.util.List;

/**
 * Small synthetic datasets for tests.
 */
public final class Datasets {

    public static final List<String> COLUMNS = List.of("x", "y");

    private Datasets() {
    }

    /**
     * Legitimate rows clustered near the origin, fraud rows near (10, 10).
     */
    public static LabeledDataset separable(int legitimate, int fraud) {
        double[][] features = new double[legitimate + fraud][];
        int[] labels = new int[legitimate + fraud];
        for (int i = 0; i < legitimate; i++) {
            features[i] = new double[]{(i % 7) * 0.1, (i % 5) * 0.1};
            labels[i] = LabeledDataset.LEGITIMATE;
        }
        for (int i = 0; i < fraud; i++) {
            features[legitimate + i] = new double[]{10 + (i % 3) * 0.2, 10 + (i % 4) * 0.2};
            labels[legitimate + i] = LabeledDataset.FRAUD;
        }
        return new LabeledDataset(COLUMNS, features, labels);
    }
}
