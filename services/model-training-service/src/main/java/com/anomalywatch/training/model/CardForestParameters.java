package com.anomalywatch.training.model;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One random-forest hyperparameter combination for the card domain.
 */
@Value
public class CardForestParameters {

    int trees;
    int maxDepth;

    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("n_estimators", trees);
        map.put("max_depth", maxDepth);
        return map;
    }
}
