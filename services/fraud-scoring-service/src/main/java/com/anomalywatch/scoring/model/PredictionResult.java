package com.anomalywatch.scoring.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Final fraud decision for one transaction, in either domain.
 */
@Value
@Builder
@JsonPropertyOrder({"probability", "is_fraud", "risk_level", "explanation", "risk_factors"})
@Schema(description = "Fraud decision with explanation")
public class PredictionResult {

    @Schema(description = "Fused fraud probability", example = "0.95")
    double probability;

    @JsonProperty("is_fraud")
    @Schema(description = "True when the probability exceeds 0.5")
    boolean fraud;

    @JsonProperty("risk_level")
    @Schema(description = "Low | Medium | High", example = "High")
    RiskLevel riskLevel;

    @Schema(description = "Human-readable summary")
    String explanation;

    @JsonProperty("risk_factors")
    @Schema(description = "Ordered risk factors, never empty")
    List<RiskFactor> factors;
}
