package com.anomalywatch.scoring.metrics;

import com.anomalywatch.scoring.model.PredictionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for scoring requests, tagged by transaction domain.
 */
@Component
@RequiredArgsConstructor
public class ScoringMetrics {

    private final MeterRegistry meterRegistry;

    public void recordPrediction(String domain, PredictionResult result, long durationNanos) {
        Counter.builder("anomalywatch.scoring.predictions")
            .description("Fraud predictions served")
            .tag("domain", domain)
            .tag("outcome", result.isFraud() ? "fraud" : "legitimate")
            .tag("risk_level", result.getRiskLevel().label())
            .register(meterRegistry)
            .increment();

        Timer.builder("anomalywatch.scoring.latency")
            .description("Time to score one transaction")
            .tag("domain", domain)
            .register(meterRegistry)
            .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordUnavailable(String domain) {
        Counter.builder("anomalywatch.scoring.unavailable")
            .description("Predictions rejected because a required model was not loaded")
            .tag("domain", domain)
            .register(meterRegistry)
            .increment();
    }
}
