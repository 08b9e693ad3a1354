package com.anomalywatch.scoring.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskSeverity {
    INFO("info"),
    WARNING("warning"),
    DANGER("danger");

    private final String value;

    RiskSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
