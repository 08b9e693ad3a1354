package com.anomalywatch.scoring.config;

import com.anomalywatch.common.artifact.ArtifactStore;
import com.anomalywatch.common.artifact.FileSystemArtifactStore;
import com.anomalywatch.scoring.registry.ModelRegistry;
import com.anomalywatch.scoring.registry.ModelRegistryLoader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(ScoringProperties.class)
public class ScoringConfig {

    @Bean
    public ArtifactStore artifactStore(ScoringProperties properties) {
        return new FileSystemArtifactStore(Path.of(properties.getArtifactDirectory()));
    }

    /**
     * Loaded once while the context starts; request handling only reads it.
     */
    @Bean
    public ModelRegistry modelRegistry(ArtifactStore artifactStore) {
        return ModelRegistryLoader.load(artifactStore);
    }
}
