package com.anomalywatch.training.model;

import com.anomalywatch.common.model.FraudModel;
import com.anomalywatch.training.data.LabeledDataset;
import com.anomalywatch.training.evaluation.ClassificationMetrics;
import com.anomalywatch.training.exception.TrainingPipelineException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Cross-validated hyperparameter search scored by mean AUPRC.
 *
 * <p>Candidates are fitted concurrently on the supplied executor. Each task
 * builds its own fold datasets, so tasks share nothing mutable. The best
 * candidate is the one with the highest mean score; ties go to the
 * candidate that appears first.
 */
@Slf4j
public class HyperparameterSearch {

    private final ExecutorService executor;
    private final int folds;
    private final long seed;

    public HyperparameterSearch(ExecutorService executor, int folds, long seed) {
        this.executor = executor;
        this.folds = folds;
        this.seed = seed;
    }

    public <P> SearchResult<P> search(String modelName, List<P> candidates, LabeledDataset data,
                                      ModelFactory<P> factory) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No hyperparameter candidates for " + modelName);
        }

        int[][] testFolds = StratifiedKFold.testFolds(data.labels(), folds, seed);
        log.info("   Searching {} candidates for {} ({}-fold, AUPRC)", candidates.size(), modelName, folds);

        List<Future<Double>> futures = new ArrayList<>(candidates.size());
        for (P candidate : candidates) {
            futures.add(executor.submit(() -> crossValidate(candidate, data, testFolds, factory)));
        }

        List<SearchResult.CandidateScore<P>> scores = new ArrayList<>(candidates.size());
        int best = 0;
        for (int i = 0; i < candidates.size(); i++) {
            double score = await(futures, i, modelName);
            scores.add(new SearchResult.CandidateScore<>(candidates.get(i), score));
            log.debug("   {} candidate {} -> mean AUPRC {}", modelName, candidates.get(i), score);
            if (score > scores.get(best).getMeanAuprc()) {
                best = i;
            }
        }

        SearchResult.CandidateScore<P> winner = scores.get(best);
        log.info("   Best {} parameters: {} (CV AUPRC: {})",
                modelName, winner.getParameters(), String.format("%.4f", winner.getMeanAuprc()));
        return new SearchResult<>(winner.getParameters(), winner.getMeanAuprc(), List.copyOf(scores));
    }

    /**
     * Seeded subset of {@code grid} of at most {@code iterations} distinct candidates.
     */
    public static <P> List<P> sampleCandidates(List<P> grid, int iterations, long seed) {
        List<P> shuffled = new ArrayList<>(grid);
        Collections.shuffle(shuffled, new Random(seed));
        return List.copyOf(shuffled.subList(0, Math.min(iterations, shuffled.size())));
    }

    static <P> double crossValidate(P candidate, LabeledDataset data, int[][] testFolds,
                                    ModelFactory<P> factory) throws Exception {
        double total = 0.0;
        for (int[] testIndices : testFolds) {
            LabeledDataset train = data.subset(StratifiedKFold.complement(testIndices, data.size()));
            LabeledDataset test = data.subset(testIndices);

            FraudModel model = factory.fit(candidate, train);
            double[] scores = new double[test.size()];
            for (int i = 0; i < test.size(); i++) {
                scores[i] = model.fraudProbability(test.row(i));
            }
            total += ClassificationMetrics.averagePrecision(test.labels(), scores);
        }
        return total / testFolds.length;
    }

    private static double await(List<Future<Double>> futures, int index, String modelName) {
        try {
            return futures.get(index).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            throw new TrainingPipelineException("Hyperparameter search for " + modelName + " was interrupted", e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            throw new TrainingPipelineException(
                    "Hyperparameter candidate for " + modelName + " failed: " + e.getCause().getMessage(),
                    e.getCause());
        }
    }
}
