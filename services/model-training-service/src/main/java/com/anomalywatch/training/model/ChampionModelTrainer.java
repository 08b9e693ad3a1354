package com.anomalywatch.training.model;

import com.anomalywatch.common.model.WekaFraudModel;
import com.anomalywatch.training.config.TrainingProperties;
import com.anomalywatch.training.data.LabeledDataset;
import com.anomalywatch.training.exception.TrainingPipelineException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.meta.LogitBoost;
import weka.classifiers.trees.REPTree;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.List;

/**
 * Gradient-boosted regression trees (Weka {@link LogitBoost} over
 * {@link REPTree}) tuned by a cross-validated AUPRC search.
 */
@Slf4j
public class ChampionModelTrainer {

    public static final String MODEL_NAME = "boosted_trees";

    private final TrainingProperties.Champion settings;
    private final HyperparameterSearch search;
    private final long seed;

    public ChampionModelTrainer(TrainingProperties.Champion settings, HyperparameterSearch search, long seed) {
        this.settings = settings;
        this.search = search;
        this.seed = seed;
    }

    public Outcome train(LabeledDataset train) {
        log.info("[4.2] Model 2: Boosted trees (champion)");
        double positiveWeight = ClassWeights.negativeToPositiveRatio(train);
        log.info("   Positive class weight: {}", String.format("%.2f", positiveWeight));

        List<ChampionParameters> candidates = candidates(positiveWeight);
        log.info("   Running {} search (scoring=average_precision)...", settings.getSearchMode());
        SearchResult<ChampionParameters> result = search.search(MODEL_NAME, candidates, train, this::fit);

        WekaFraudModel model = fit(result.getBestParameters(), train);
        return new Outcome(model, result);
    }

    /**
     * Full grid in declaration order, or a seeded subset in RANDOMIZED mode.
     */
    List<ChampionParameters> candidates(double positiveWeight) {
        List<ChampionParameters> grid = new ArrayList<>();
        for (Integer depth : settings.getMaxDepths()) {
            for (Double rate : settings.getLearningRates()) {
                for (Integer estimators : settings.getEstimatorCounts()) {
                    grid.add(new ChampionParameters(depth, rate, estimators, positiveWeight));
                }
            }
        }
        if (settings.getSearchMode() == TrainingProperties.SearchMode.RANDOMIZED) {
            return HyperparameterSearch.sampleCandidates(grid, settings.getSearchIterations(), seed);
        }
        return grid;
    }

    WekaFraudModel fit(ChampionParameters parameters, LabeledDataset train) {
        Instances data = train.toInstances(MODEL_NAME,
                ClassWeights.positiveWeighted(train.labels(), parameters.getPositiveClassWeight()));

        REPTree tree = new REPTree();
        tree.setMaxDepth(parameters.getMaxDepth());
        tree.setNoPruning(true);

        LogitBoost boost = new LogitBoost();
        boost.setClassifier(tree);
        boost.setNumIterations(parameters.getEstimators());
        boost.setShrinkage(parameters.getLearningRate());
        boost.setSeed((int) seed);
        try {
            boost.buildClassifier(data);
        } catch (Exception e) {
            throw new TrainingPipelineException("Failed to train " + MODEL_NAME + " with " + parameters, e);
        }
        return new WekaFraudModel(MODEL_NAME, boost, data);
    }

    @Value
    public static class Outcome {
        WekaFraudModel model;
        SearchResult<ChampionParameters> search;
    }
}
