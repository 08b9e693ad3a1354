package com.anomalywatch.scoring.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Human-readable reason contributing to a risk decision.
 */
@Value
public class RiskFactor {

    @JsonProperty("factor")
    String description;

    RiskSeverity severity;

    public static RiskFactor info(String description) {
        return new RiskFactor(description, RiskSeverity.INFO);
    }

    public static RiskFactor warning(String description) {
        return new RiskFactor(description, RiskSeverity.WARNING);
    }

    public static RiskFactor danger(String description) {
        return new RiskFactor(description, RiskSeverity.DANGER);
    }
}
