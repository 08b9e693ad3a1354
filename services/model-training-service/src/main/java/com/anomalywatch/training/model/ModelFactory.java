package com.anomalywatch.training.model;

import com.anomalywatch.common.model.FraudModel;
import com.anomalywatch.training.data.LabeledDataset;

/**
 * Fits a fraud model for one hyperparameter candidate.
 *
 * @param <P> candidate parameter type
 */
@FunctionalInterface
public interface ModelFactory<P> {

    FraudModel fit(P parameters, LabeledDataset train) throws Exception;
}
