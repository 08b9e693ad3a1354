package com.anomalywatch.training.job;

import com.anomalywatch.training.config.TrainingProperties;
import com.anomalywatch.training.evaluation.ModelResult;
import com.anomalywatch.training.pipeline.CardDomainTrainingPipeline;
import com.anomalywatch.training.pipeline.FraudTrainingPipeline;
import com.anomalywatch.training.pipeline.TrainingReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Offline training job.
 *
 * Runs once at startup (unless {@code anomalywatch.training.run-on-startup}
 * is false). Both datasets are checked before any computation starts, so a
 * missing file fails the job immediately with remediation text instead of
 * after the payment models have been trained.
 *
 * Monitoring:
 * - Metrics: job execution time, executions, failures (tagged by pipeline)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrainingJobRunner implements ApplicationRunner {

    private final TrainingProperties properties;
    private final FraudTrainingPipeline paymentPipeline;
    private final CardDomainTrainingPipeline cardPipeline;
    private final MeterRegistry meterRegistry;

    private Counter jobFailureCounter;

    @PostConstruct
    public void initMetrics() {
        jobFailureCounter = Counter.builder("anomalywatch.training.job.failures")
                .description("Training job failures")
                .tag("job", "model_training")
                .register(meterRegistry);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.info("Training on startup disabled (anomalywatch.training.run-on-startup=false)");
            return;
        }
        runAll();
    }

    public List<TrainingReport> runAll() {
        log.info("========== STARTING MODEL TRAINING JOB ==========");
        try {
            paymentPipeline.preflight();
            if (cardPipeline.isEnabled()) {
                cardPipeline.preflight();
            }

            List<TrainingReport> reports = new ArrayList<>();
            reports.add(timed(FraudTrainingPipeline.NAME, paymentPipeline::run));
            if (cardPipeline.isEnabled()) {
                reports.add(timed(CardDomainTrainingPipeline.NAME, cardPipeline::run));
            } else {
                log.info("Card-domain training disabled");
            }

            log.info("========== MODEL TRAINING JOB COMPLETED SUCCESSFULLY ==========");
            reports.forEach(this::logSummary);
            return reports;
        } catch (RuntimeException e) {
            jobFailureCounter.increment();
            log.error("========== MODEL TRAINING JOB FAILED ==========", e);
            throw e;
        }
    }

    private TrainingReport timed(String pipeline, Supplier<TrainingReport> run) {
        Timer timer = Timer.builder("anomalywatch.training.pipeline.execution_time")
                .description("Training pipeline execution time")
                .tag("pipeline", pipeline)
                .register(meterRegistry);
        return timer.record(run);
    }

    private void logSummary(TrainingReport report) {
        log.info("Pipeline '{}': {} training rows, {} test rows, {} s, artifacts {}",
                report.getPipeline(), report.getTrainingRows(), report.getTestRows(),
                report.getElapsed().toSeconds(), report.getSavedArtifacts());
        for (ModelResult result : report.getResults()) {
            log.info("   {} -> AUPRC {}, F1 {}", result.getName(),
                    result.hasAuprc() ? String.format("%.4f", result.getAuprc()) : "N/A",
                    String.format("%.4f", result.getF1()));
        }
    }
}
