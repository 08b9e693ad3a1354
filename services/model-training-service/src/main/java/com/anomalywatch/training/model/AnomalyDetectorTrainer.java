package com.anomalywatch.training.model;

import com.anomalywatch.common.model.IsolationForestDetector;
import com.anomalywatch.training.config.TrainingProperties;
import com.anomalywatch.training.data.LabeledDataset;
import com.anomalywatch.training.exception.TrainingPipelineException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

/**
 * Unsupervised isolation forest fitted on legitimate rows only.
 *
 * <p>The outlier threshold is the {@code (1 - contamination)} quantile of
 * the training scores, so roughly {@code contamination} of legitimate
 * traffic is flagged.
 */
@Slf4j
public class AnomalyDetectorTrainer {

    public static final String MODEL_NAME = "isolation_forest";

    /**
     * Smile requires a sampling rate strictly below 1.
     */
    static final double MAX_SAMPLING_RATE = 0.99;

    private final TrainingProperties.AnomalyDetector settings;
    private final long seed;

    public AnomalyDetectorTrainer(TrainingProperties.AnomalyDetector settings, long seed) {
        this.settings = settings;
        this.seed = seed;
    }

    public IsolationForestDetector train(LabeledDataset train) {
        log.info("[4.3] Model 3: Isolation Forest (anomaly detector)");
        double[][] legitimate = train.rowsWithLabel(LabeledDataset.LEGITIMATE);
        if (legitimate.length < 2) {
            throw new TrainingPipelineException(
                    "Isolation forest needs at least 2 legitimate rows, found " + legitimate.length);
        }
        log.info("   Training on {} legitimate samples", String.format("%,d", legitimate.length));

        int samples = Math.min(settings.getMaxSamples(), legitimate.length);
        double subsample = Math.min(MAX_SAMPLING_RATE, (double) samples / legitimate.length);
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(samples) / Math.log(2)));

        MathEx.setSeed(seed);
        IsolationForest forest = IsolationForest.fit(legitimate, settings.getTrees(), maxDepth, subsample, 0);

        double[] scores = new double[legitimate.length];
        for (int i = 0; i < legitimate.length; i++) {
            scores[i] = forest.score(legitimate[i]);
        }
        double threshold = new Percentile().evaluate(scores, 100.0 * (1.0 - settings.getContamination()));
        log.info("   Outlier threshold: {} (contamination {})",
                String.format("%.4f", threshold), settings.getContamination());

        return new IsolationForestDetector(MODEL_NAME, forest, threshold);
    }
}
