package com.anomalywatch.training.model;

import com.anomalywatch.common.model.WekaFraudModel;
import com.anomalywatch.training.config.TrainingProperties;
import com.anomalywatch.training.data.LabeledDataset;
import com.anomalywatch.training.exception.TrainingPipelineException;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.functions.Logistic;
import weka.core.Instances;

/**
 * Interpretable linear baseline: ridge-regularised logistic regression with
 * balanced class weights.
 */
@Slf4j
public class BaselineModelTrainer {

    public static final String MODEL_NAME = "logistic_regression";

    private final TrainingProperties.Baseline settings;

    public BaselineModelTrainer(TrainingProperties.Baseline settings) {
        this.settings = settings;
    }

    public WekaFraudModel train(LabeledDataset train) {
        log.info("[4.1] Model 1: Logistic Regression (baseline)");
        Instances data = train.toInstances(MODEL_NAME, ClassWeights.balanced(train.labels()));

        Logistic logistic = new Logistic();
        logistic.setMaxIts(settings.getMaxIterations());
        logistic.setRidge(settings.getRidge());
        try {
            logistic.buildClassifier(data);
        } catch (Exception e) {
            throw new TrainingPipelineException("Failed to train " + MODEL_NAME, e);
        }
        return new WekaFraudModel(MODEL_NAME, logistic, data);
    }
}
