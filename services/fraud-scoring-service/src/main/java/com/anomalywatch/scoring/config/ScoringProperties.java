package com.anomalywatch.scoring.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Scoring service configuration (anomalywatch.scoring.*)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "anomalywatch.scoring")
public class ScoringProperties {

    /**
     * Directory the training service writes artifacts to
     */
    @NotBlank
    private String artifactDirectory = "backend/models";

    /**
     * Display name of the payment champion model in risk factors
     */
    @NotBlank
    private String paymentModelLabel = "Boosted trees";

    /**
     * Display name of the card-domain model in risk factors
     */
    @NotBlank
    private String cardModelLabel = "Random forest";
}
