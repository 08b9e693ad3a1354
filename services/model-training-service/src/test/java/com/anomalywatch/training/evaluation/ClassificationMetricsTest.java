package com.anomalywatch.training.evaluation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Classification metrics Tests")
class ClassificationMetricsTest {

    @Nested
    @DisplayName("Average precision")
    class AveragePrecisionTests {

        @Test
        @DisplayName("Should sum precision over each recall step")
        void shouldSumPrecisionOverRecallSteps() {
            int[] actual = {0, 0, 1, 1};
            double[] scores = {0.1, 0.4, 0.35, 0.8};

            // ranking: 0.8(1) 0.4(0) 0.35(1) 0.1(0)
            assertThat(ClassificationMetrics.averagePrecision(actual, scores)).isCloseTo(0.8333, within(1e-4));
            assertThat(ClassificationMetrics.averagePrecision(new int[]{0, 1}, new double[]{0.2, 0.9})).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should treat tied scores as a single threshold")
        void shouldGroupTies() {
            int[] actual = {1, 0, 1, 0};
            double[] scores = {0.5, 0.5, 0.5, 0.5};

            assertThat(ClassificationMetrics.averagePrecision(actual, scores)).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Should be 0 without positives")
        void shouldBeZeroWithoutPositives() {
            assertThat(ClassificationMetrics.averagePrecision(new int[]{0, 0}, new double[]{0.3, 0.7})).isZero();
        }
    }

    @Nested
    @DisplayName("Confusion matrix")
    class ConfusionMatrixTests {

        @Test
        @DisplayName("Should count outcomes with fraud as the positive class")
        void shouldCountOutcomes() {
            // Given
            int[] actual = {1, 1, 1, 0, 0, 0, 0};
            int[] predicted = {1, 1, 0, 1, 0, 0, 0};

            // When
            ConfusionMatrix matrix = ConfusionMatrix.of(actual, predicted);

            // Then
            assertThat(matrix.getTruePositives()).isEqualTo(2);
            assertThat(matrix.getFalseNegatives()).isEqualTo(1);
            assertThat(matrix.getFalsePositives()).isEqualTo(1);
            assertThat(matrix.getTrueNegatives()).isEqualTo(3);
            assertThat(matrix.precision()).isCloseTo(2.0 / 3, within(1e-9));
            assertThat(matrix.recall()).isCloseTo(2.0 / 3, within(1e-9));
            assertThat(matrix.f1()).isCloseTo(2.0 / 3, within(1e-9));
            assertThat(matrix.negativeRecall()).isCloseTo(0.75, within(1e-9));
            assertThat(matrix.accuracy()).isCloseTo(5.0 / 7, within(1e-9));
        }

        @Test
        @DisplayName("Should report zero F1 when nothing is flagged")
        void shouldHandleNoFlags() {
            ConfusionMatrix matrix = ConfusionMatrix.of(new int[]{1, 0}, new int[]{0, 0});

            assertThat(matrix.precision()).isZero();
            assertThat(matrix.f1()).isZero();
        }

        @Test
        @DisplayName("Should render a report row per class plus averages")
        void shouldRenderReport() {
            ConfusionMatrix matrix = ConfusionMatrix.of(new int[]{1, 0, 0, 1}, new int[]{1, 0, 1, 1});

            assertThat(ClassificationReport.lines(matrix, "Legitimate", "Fraud"))
                    .hasSize(6)
                    .anySatisfy(line -> assertThat(line).contains("Fraud").contains("0.67").contains("1.00"))
                    .anySatisfy(line -> assertThat(line).contains("accuracy").contains("0.75"));
        }
    }

    @Test
    @DisplayName("Should threshold probabilities strictly above the cut-off")
    void shouldThreshold() {
        assertThat(ClassificationMetrics.threshold(new double[]{0.2, 0.5, 0.51}, 0.5)).containsExactly(0, 0, 1);
    }
}
