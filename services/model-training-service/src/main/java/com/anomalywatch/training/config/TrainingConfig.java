package com.anomalywatch.training.config;

import com.anomalywatch.common.artifact.ArtifactStore;
import com.anomalywatch.common.artifact.FileSystemArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@EnableConfigurationProperties(TrainingProperties.class)
public class TrainingConfig {

    @Bean
    public ArtifactStore artifactStore(TrainingProperties properties) {
        log.info("Artifacts will be written to {}", Path.of(properties.getArtifactDirectory()).toAbsolutePath());
        return new FileSystemArtifactStore(Path.of(properties.getArtifactDirectory()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService trainingExecutor(TrainingProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "model-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Hyperparameter search pool size: {}", properties.getWorkerThreads());
        return Executors.newFixedThreadPool(properties.getWorkerThreads(), threadFactory);
    }
}
