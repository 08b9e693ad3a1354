package com.anomalywatch.training.data;

import com.anomalywatch.common.model.FeatureSchema;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Numeric feature matrix with binary labels ({@code 1} = fraud), in a fixed column layout.
 *
 * <p>Rows are never mutated after construction; every derived dataset is a
 * new instance sharing no arrays with its source.
 */
public final class LabeledDataset {

    public static final int LEGITIMATE = 0;
    public static final int FRAUD = 1;

    private final List<String> columns;
    private final double[][] features;
    private final int[] labels;

    public LabeledDataset(List<String> columns, double[][] features, int[] labels) {
        if (features.length != labels.length) {
            throw new IllegalArgumentException(
                    "Feature rows (" + features.length + ") and labels (" + labels.length + ") differ in size");
        }
        this.columns = List.copyOf(columns);
        this.features = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            if (features[i].length != columns.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + features[i].length
                        + " values, expected " + columns.size());
            }
            this.features[i] = features[i].clone();
        }
        this.labels = labels.clone();
    }

    public List<String> columns() {
        return columns;
    }

    public int size() {
        return labels.length;
    }

    public double[] row(int index) {
        return features[index].clone();
    }

    public int label(int index) {
        return labels[index];
    }

    public int[] labels() {
        return labels.clone();
    }

    public double[][] features() {
        double[][] copy = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            copy[i] = features[i].clone();
        }
        return copy;
    }

    public int countOf(int label) {
        int count = 0;
        for (int value : labels) {
            if (value == label) {
                count++;
            }
        }
        return count;
    }

    public double fraudRate() {
        return size() == 0 ? 0.0 : (double) countOf(FRAUD) / size();
    }

    public int[] indicesOf(int label) {
        return IntStream.range(0, labels.length)
                .filter(i -> labels[i] == label)
                .toArray();
    }

    /**
     * Feature rows carrying the given label.
     */
    public double[][] rowsWithLabel(int label) {
        return Arrays.stream(indicesOf(label))
                .mapToObj(i -> features[i].clone())
                .toArray(double[][]::new);
    }

    public LabeledDataset subset(int[] indices) {
        double[][] rows = new double[indices.length][];
        int[] subsetLabels = new int[indices.length];
        for (int i = 0; i < indices.length; i++) {
            rows[i] = features[indices[i]];
            subsetLabels[i] = labels[indices[i]];
        }
        return new LabeledDataset(columns, rows, subsetLabels);
    }

    public LabeledDataset append(double[][] extraRows, int[] extraLabels) {
        List<double[]> rows = new ArrayList<>(Arrays.asList(features));
        rows.addAll(Arrays.asList(extraRows));
        int[] allLabels = Arrays.copyOf(labels, labels.length + extraLabels.length);
        System.arraycopy(extraLabels, 0, allLabels, labels.length, extraLabels.length);
        return new LabeledDataset(columns, rows.toArray(double[][]::new), allLabels);
    }

    /**
     * Weka view of the dataset with the given per-row instance weights
     * ({@code null} for unit weights).
     */
    public Instances toInstances(String relation, double[] weights) {
        if (weights != null && weights.length != labels.length) {
            throw new IllegalArgumentException("Expected " + labels.length + " weights, got " + weights.length);
        }
        return FeatureSchema.dataset(relation, columns, features, labels, weights);
    }
}
