package com.anomalywatch.scoring.health;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.common.model.FraudModel;
import com.anomalywatch.scoring.registry.ModelRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("ModelRegistryHealthIndicator Tests")
class ModelRegistryHealthIndicatorTest {

    @Test
    @DisplayName("Should be up with partial availability and list what is missing")
    void shouldBeUpWhenPartiallyLoaded() {
        ModelRegistry registry = new ModelRegistry(Map.of(ArtifactKey.CARD_DOMAIN_MODEL, mock(FraudModel.class)));

        Health health = new ModelRegistryHealthIndicator(registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("loaded")).isEqualTo(List.of("secondary_rf"));
        assertThat(health.getDetails().get("missing"))
                .isEqualTo(List.of("primary", "logistic", "isolation_forest", "encoder"));
    }

    @Test
    @DisplayName("Should be down when no artifact is loaded")
    void shouldBeDownWhenEmpty() {
        Health health = new ModelRegistryHealthIndicator(ModelRegistry.empty()).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }
}
