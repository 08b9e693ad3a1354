package com.anomalywatch.scoring.health;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.scoring.registry.ModelRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reports which artifacts are loaded. Up while at least one is available,
 * since each capability fails independently.
 */
@Component("models")
@RequiredArgsConstructor
public class ModelRegistryHealthIndicator implements HealthIndicator {

    private final ModelRegistry modelRegistry;

    @Override
    public Health health() {
        List<String> missing = Arrays.stream(ArtifactKey.values())
                .filter(key -> !modelRegistry.isLoaded(key))
                .map(ArtifactKey::logicalName)
                .collect(Collectors.toList());

        Health.Builder builder = modelRegistry.loadedKeys().isEmpty() ? Health.down() : Health.up();
        return builder
                .withDetail("loaded", modelRegistry.loadedNames())
                .withDetail("missing", missing)
                .build();
    }
}
