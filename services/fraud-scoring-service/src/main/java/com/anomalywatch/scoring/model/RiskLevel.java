package com.anomalywatch.scoring.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse risk tier of a final fraud probability.
 */
public enum RiskLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
