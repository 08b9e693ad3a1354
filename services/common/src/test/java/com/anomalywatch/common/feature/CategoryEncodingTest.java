package com.anomalywatch.common.feature;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CategoryEncoding Tests")
class CategoryEncodingTest {

    @Test
    @DisplayName("Should assign codes to distinct labels in sorted order")
    void shouldAssignSortedCodes() {
        CategoryEncoding encoding = CategoryEncoding.fit(List.of("TRANSFER", "CASH_OUT", "TRANSFER"));

        assertThat(encoding.labels()).containsExactly("CASH_OUT", "TRANSFER");
        assertThat(encoding.lookup("CASH_OUT")).hasValue(0);
        assertThat(encoding.lookup("TRANSFER")).hasValue(1);
        assertThat(encoding.decode(1)).contains("TRANSFER");
    }

    @Test
    @DisplayName("Should report unseen labels as not found")
    void shouldReportUnseenLabels() {
        CategoryEncoding encoding = CategoryEncoding.fit(List.of("TRANSFER"));

        assertThat(encoding.lookup("DEBIT")).isEmpty();
        assertThat(encoding.lookup(null)).isEmpty();
        assertThat(encoding.encodeOrDefault("DEBIT")).isEqualTo(CategoryEncoding.DEFAULT_CODE);
        assertThat(encoding.decode(5)).isEmpty();
    }

    @Test
    @DisplayName("Should refuse to fit without labels")
    void shouldRefuseEmptyFit() {
        assertThatThrownBy(() -> CategoryEncoding.fit(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
