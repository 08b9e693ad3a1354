package com.anomalywatch.training.job;

import com.anomalywatch.training.config.TrainingProperties;
import com.anomalywatch.training.exception.TrainingConfigurationException;
import com.anomalywatch.training.pipeline.CardDomainTrainingPipeline;
import com.anomalywatch.training.pipeline.FraudTrainingPipeline;
import com.anomalywatch.training.pipeline.TrainingReport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TrainingJobRunner Unit Tests")
class TrainingJobRunnerTest {

    @Mock
    private FraudTrainingPipeline paymentPipeline;

    @Mock
    private CardDomainTrainingPipeline cardPipeline;

    private TrainingProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private TrainingJobRunner runner;

    @BeforeEach
    void setUp() {
        properties = new TrainingProperties();
        meterRegistry = new SimpleMeterRegistry();
        runner = new TrainingJobRunner(properties, paymentPipeline, cardPipeline, meterRegistry);
        runner.initMetrics();
    }

    @Test
    @DisplayName("Should check both datasets before running either pipeline")
    void shouldPreflightBothDatasetsFirst() {
        // Given
        when(cardPipeline.isEnabled()).thenReturn(true);
        doThrow(new TrainingConfigurationException("Card-domain dataset not found"))
                .when(cardPipeline).preflight();

        // When / Then
        assertThatThrownBy(() -> runner.runAll()).isInstanceOf(TrainingConfigurationException.class);
        verify(paymentPipeline).preflight();
        verify(paymentPipeline, never()).run();
        verify(cardPipeline, never()).run();
        assertThat(meterRegistry.counter("anomalywatch.training.job.failures", "job", "model_training").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should run the payment pipeline only when the card domain is disabled")
    void shouldSkipDisabledCardDomain() {
        // Given
        when(cardPipeline.isEnabled()).thenReturn(false);
        when(paymentPipeline.run()).thenReturn(report(FraudTrainingPipeline.NAME));

        // When
        List<TrainingReport> reports = runner.runAll();

        // Then
        assertThat(reports).extracting(TrainingReport::getPipeline).containsExactly(FraudTrainingPipeline.NAME);
        verify(cardPipeline, never()).run();
        assertThat(meterRegistry.find("anomalywatch.training.pipeline.execution_time").timer()).isNotNull();
    }

    @Test
    @DisplayName("Should do nothing at startup when disabled")
    void shouldHonourRunOnStartup() {
        properties.setRunOnStartup(false);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(paymentPipeline, cardPipeline);
    }

    private static TrainingReport report(String pipeline) {
        return TrainingReport.builder()
                .pipeline(pipeline)
                .elapsed(Duration.ofSeconds(1))
                .build();
    }
}
