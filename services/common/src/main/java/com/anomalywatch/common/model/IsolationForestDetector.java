package com.anomalywatch.common.model;

import smile.anomaly.IsolationForest;

import java.io.Serial;
import java.io.Serializable;

/**
 * Unsupervised outlier detector: an isolation forest plus the score
 * threshold above which a transaction counts as an outlier.
 */
public final class IsolationForestDetector implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String name;
    private final IsolationForest forest;
    private final double threshold;

    public IsolationForestDetector(String name, IsolationForest forest, double threshold) {
        this.name = name;
        this.forest = forest;
        this.threshold = threshold;
    }

    public String name() {
        return name;
    }

    /**
     * Anomaly score in (0, 1]; higher means easier to isolate.
     */
    public double anomalyScore(double[] features) {
        return forest.score(features);
    }

    public boolean isOutlier(double[] features) {
        return anomalyScore(features) > threshold;
    }

    public double threshold() {
        return threshold;
    }
}
