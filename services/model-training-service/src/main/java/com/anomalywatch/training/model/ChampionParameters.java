package com.anomalywatch.training.model;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One boosted-tree hyperparameter combination.
 */
@Value
public class ChampionParameters {

    int maxDepth;
    double learningRate;
    int estimators;
    double positiveClassWeight;

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("max_depth", maxDepth);
        map.put("learning_rate", learningRate);
        map.put("n_estimators", estimators);
        map.put("scale_pos_weight", positiveClassWeight);
        return map;
    }
}
