package com.anomalywatch.common.model;

import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds Weka datasets and instances for a fixed numeric feature layout
 * followed by the binary {@code isFraud} class attribute.
 */
public final class FeatureSchema {

    public static final String CLASS_ATTRIBUTE = "isFraud";
    public static final String LEGITIMATE_LABEL = "0";
    public static final String FRAUD_LABEL = "1";

    private FeatureSchema() {
    }

    public static Instances emptyDataset(String relation, List<String> columns, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>(columns.size() + 1);
        for (String column : columns) {
            attributes.add(new Attribute(column));
        }
        attributes.add(new Attribute(CLASS_ATTRIBUTE, List.of(LEGITIMATE_LABEL, FRAUD_LABEL)));

        Instances dataset = new Instances(relation, attributes, capacity);
        dataset.setClassIndex(attributes.size() - 1);
        return dataset;
    }

    public static Instances dataset(String relation, List<String> columns, double[][] features, int[] labels,
                                    double[] weights) {
        Instances dataset = emptyDataset(relation, columns, features.length);
        for (int i = 0; i < features.length; i++) {
            dataset.add(labeledInstance(features[i], labels[i], weights == null ? 1.0 : weights[i]));
        }
        return dataset;
    }

    public static Instance labeledInstance(double[] features, int label, double weight) {
        double[] values = new double[features.length + 1];
        System.arraycopy(features, 0, values, 0, features.length);
        values[features.length] = label;
        return new DenseInstance(weight, values);
    }

    public static Instance unlabeledInstance(double[] features, Instances header) {
        double[] values = new double[features.length + 1];
        System.arraycopy(features, 0, values, 0, features.length);
        values[features.length] = Utils.missingValue();

        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        return instance;
    }
}
