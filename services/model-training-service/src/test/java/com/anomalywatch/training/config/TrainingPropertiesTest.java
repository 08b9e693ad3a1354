package com.anomalywatch.training.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TrainingProperties Tests")
class TrainingPropertiesTest {

    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    @DisplayName("Should use the sample fraction unless the full dataset is requested")
    void shouldResolveEffectiveSampleFraction() {
        TrainingProperties properties = new TrainingProperties();
        properties.setSampleFraction(0.25);
        assertThat(properties.effectiveSampleFraction()).isEqualTo(0.25);

        properties.setUseFullDataset(true);
        assertThat(properties.effectiveSampleFraction()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should accept the defaults")
    void shouldAcceptDefaults() {
        assertThat(validator.validate(new TrainingProperties())).isEmpty();
    }

    @Test
    @DisplayName("Should reject a zero sample fraction and a single-fold search")
    void shouldRejectInvalidValues() {
        // Given
        TrainingProperties properties = new TrainingProperties();
        properties.setSampleFraction(0.0);
        properties.getChampion().setCrossValidationFolds(1);

        // When
        Set<ConstraintViolation<TrainingProperties>> violations = validator.validate(properties);

        // Then
        assertThat(violations)
                .extracting(violation -> violation.getPropertyPath().toString())
                .containsExactlyInAnyOrder("sampleFraction", "champion.crossValidationFolds");
    }
}
