package com.anomalywatch.training.model;

import com.anomalywatch.common.model.FraudModel;
import com.anomalywatch.training.data.Datasets;
import com.anomalywatch.training.data.LabeledDataset;
import com.anomalywatch.training.exception.TrainingPipelineException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.ToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HyperparameterSearch Tests")
class HyperparameterSearchTest {

    private ExecutorService executor;
    private HyperparameterSearch search;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        search = new HyperparameterSearch(executor, 3, 42L);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should pick the candidate with the best mean AUPRC")
    void shouldPickBestCandidate() {
        // Given: "ranking" scores by the x feature, "random" gives every row the same score
        LabeledDataset data = Datasets.separable(60, 30);
        ModelFactory<String> factory = (candidate, train) -> model(candidate,
                "ranking".equals(candidate) ? features -> features[0] / 20 : features -> 0.5);

        // When
        SearchResult<String> result = search.search("toy", List.of("random", "ranking"), data, factory);

        // Then
        assertThat(result.getBestParameters()).isEqualTo("ranking");
        assertThat(result.getBestScore()).isEqualTo(1.0);
        assertThat(result.getCandidates()).extracting(SearchResult.CandidateScore::getParameters)
                .containsExactly("random", "ranking");
    }

    @Test
    @DisplayName("Should break ties in favour of the earliest candidate")
    void shouldPreferEarliestOnTie() {
        LabeledDataset data = Datasets.separable(60, 30);
        ModelFactory<String> factory = (candidate, train) -> model(candidate, features -> features[0] / 20);

        SearchResult<String> result = search.search("toy", List.of("first", "second"), data, factory);

        assertThat(result.getBestParameters()).isEqualTo("first");
    }

    @Test
    @DisplayName("Should surface a failing candidate as a pipeline error")
    void shouldPropagateFailures() {
        LabeledDataset data = Datasets.separable(60, 30);
        ModelFactory<String> factory = (candidate, train) -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() -> search.search("toy", List.of("broken"), data, factory))
                .isInstanceOf(TrainingPipelineException.class)
                .hasMessageContaining("boom");
    }

    @Test
    @DisplayName("Should sample a seeded subset of distinct candidates")
    void shouldSampleCandidates() {
        List<Integer> grid = List.of(1, 2, 3, 4, 5, 6, 7, 8);

        List<Integer> first = HyperparameterSearch.sampleCandidates(grid, 3, 42L);
        List<Integer> second = HyperparameterSearch.sampleCandidates(grid, 3, 42L);

        assertThat(first).hasSize(3).doesNotHaveDuplicates().isEqualTo(second);
        assertThat(HyperparameterSearch.sampleCandidates(grid, 20, 42L)).hasSize(8);
    }

    private static FraudModel model(String name, ToDoubleFunction<double[]> scorer) {
        return new FraudModel() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public double fraudProbability(double[] features) {
                return scorer.applyAsDouble(features);
            }
        };
    }
}
