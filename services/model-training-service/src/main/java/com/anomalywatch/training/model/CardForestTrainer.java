package com.anomalywatch.training.model;

import com.anomalywatch.common.model.WekaFraudModel;
import com.anomalywatch.training.config.TrainingProperties;
import com.anomalywatch.training.data.LabeledDataset;
import com.anomalywatch.training.exception.TrainingPipelineException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.trees.RandomForest;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;

/**
 * Balanced-weight random forest for card transactions, tuned by a seeded
 * randomized search.
 */
@Slf4j
public class CardForestTrainer {

    public static final String MODEL_NAME = "random_forest";

    private final TrainingProperties.CardDomain settings;
    private final HyperparameterSearch search;
    private final long seed;

    public CardForestTrainer(TrainingProperties.CardDomain settings, HyperparameterSearch search, long seed) {
        this.settings = settings;
        this.search = search;
        this.seed = seed;
    }

    public Outcome train(LabeledDataset train) {
        List<CardForestParameters> grid = new ArrayList<>();
        for (Integer trees : settings.getTreeCounts()) {
            for (Integer depth : settings.getMaxDepths()) {
                grid.add(new CardForestParameters(trees, depth));
            }
        }
        List<CardForestParameters> candidates =
                HyperparameterSearch.sampleCandidates(grid, settings.getSearchIterations(), seed);

        SearchResult<CardForestParameters> result = search.search(MODEL_NAME, candidates, train, this::fit);
        return new Outcome(fit(result.getBestParameters(), train), result);
    }

    WekaFraudModel fit(CardForestParameters parameters, LabeledDataset train) {
        Instances data = train.toInstances(MODEL_NAME, ClassWeights.balanced(train.labels()));

        RandomForest forest = new RandomForest();
        forest.setNumIterations(parameters.getTrees());
        forest.setMaxDepth(parameters.getMaxDepth());
        forest.setSeed((int) seed);
        forest.setNumExecutionSlots(1);
        try {
            forest.buildClassifier(data);
        } catch (Exception e) {
            throw new TrainingPipelineException("Failed to train " + MODEL_NAME + " with " + parameters, e);
        }
        return new WekaFraudModel(MODEL_NAME, forest, data);
    }

    @Value
    public static class Outcome {
        WekaFraudModel model;
        SearchResult<CardForestParameters> search;
    }
}
