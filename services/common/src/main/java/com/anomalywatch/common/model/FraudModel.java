package com.anomalywatch.common.model;

/**
 * A trained supervised fraud model.
 */
public interface FraudModel {

    /**
     * Logical model name, used in logs and explanations.
     */
    String name();

    /**
     * Probability of the fraud class for one feature vector laid out in the
     * column order the model was trained with.
     *
     * @throws com.anomalywatch.common.exception.ModelScoringException if the model cannot score the input
     */
    double fraudProbability(double[] features);
}
