package com.anomalywatch.training.data;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StratifiedSampler Tests")
class StratifiedSamplerTest {

    private final List<Integer> rows = IntStream.range(0, 1_000).boxed().collect(Collectors.toList());

    @Test
    @DisplayName("Should keep every positive row and the requested share of negatives")
    void shouldKeepAllPositives() {
        // Given: multiples of 50 are positive
        List<Integer> sampled = StratifiedSampler.sample(rows, i -> i % 50 == 0, 0.1, 42L);

        // Then
        assertThat(sampled.stream().filter(i -> i % 50 == 0)).hasSize(20);
        assertThat(sampled.stream().filter(i -> i % 50 != 0)).hasSize(98);
    }

    @Test
    @DisplayName("Should produce the same sample for the same seed")
    void shouldBeReproducible() {
        List<Integer> first = StratifiedSampler.sample(rows, i -> i % 50 == 0, 0.2, 7L);
        List<Integer> second = StratifiedSampler.sample(rows, i -> i % 50 == 0, 0.2, 7L);

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should reject fractions outside (0, 1]")
    void shouldRejectInvalidFraction() {
        assertThatThrownBy(() -> StratifiedSampler.sample(rows, i -> true, 0.0, 42L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StratifiedSampler.sample(rows, i -> true, 1.5, 42L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should cap a row sample at the requested size")
    void shouldCapRowSample() {
        assertThat(StratifiedSampler.sampleRows(rows, 100, 42L)).hasSize(100).doesNotHaveDuplicates();
        assertThat(StratifiedSampler.sampleRows(rows, 5_000, 42L)).hasSize(1_000);
    }
}
