package com.anomalywatch.common.model;

import com.anomalywatch.common.exception.ModelScoringException;
import weka.classifiers.Classifier;
import weka.core.Instance;
import weka.core.Instances;

import java.io.Serial;
import java.io.Serializable;

/**
 * Supervised fraud model backed by a Weka classifier.
 *
 * <p>Carries a structure-only copy of the training header so that a scoring
 * request can be turned into an {@link Instance} with the same attribute
 * layout the classifier was built on.
 */
public final class WekaFraudModel implements FraudModel, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String name;
    private final Classifier classifier;
    private final Instances header;
    private final int fraudClassIndex;

    public WekaFraudModel(String name, Classifier classifier, Instances trainingData) {
        this.name = name;
        this.classifier = classifier;
        this.header = new Instances(trainingData, 0);
        this.fraudClassIndex = header.classAttribute().indexOfValue(FeatureSchema.FRAUD_LABEL);
        if (fraudClassIndex < 0) {
            throw new IllegalArgumentException("Class attribute has no '" + FeatureSchema.FRAUD_LABEL + "' value");
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double fraudProbability(double[] features) {
        int expected = header.numAttributes() - 1;
        if (features.length != expected) {
            throw new ModelScoringException(String.format(
                    "Model %s expects %d features but received %d", name, expected, features.length));
        }

        Instance instance = FeatureSchema.unlabeledInstance(features, header);
        try {
            return classifier.distributionForInstance(instance)[fraudClassIndex];
        } catch (Exception e) {
            throw new ModelScoringException("Model " + name + " failed to score instance", e);
        }
    }

    public Classifier classifier() {
        return classifier;
    }

    public Instances header() {
        return new Instances(header, 0);
    }
}
