package com.anomalywatch.scoring.rules;

import com.anomalywatch.common.domain.TransactionRecord;
import com.anomalywatch.common.feature.FeatureEngineer;
import com.anomalywatch.scoring.model.RiskFactor;
import com.anomalywatch.scoring.model.RiskSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HeuristicRuleEngine Tests")
class HeuristicRuleEngineTest {

    private final HeuristicRuleEngine engine = new HeuristicRuleEngine();

    @Test
    @DisplayName("Should evaluate the versioned payment table in rule order")
    void shouldUseVersionedRuleTable() {
        assertThat(PaymentRuleTable.VERSION).isEqualTo(2);
        assertThat(engine.rules()).extracting(HeuristicRule::id).containsExactly("R1", "R2", "R3", "R4", "R5");
    }

    @Nested
    @DisplayName("Individual rules")
    class IndividualRuleTests {

        @Test
        @DisplayName("R1: negative post-balance yields 0.99 and a danger factor")
        void shouldFlagForcedOverdraft() {
            HeuristicAssessment assessment = evaluate(record(500, 1_000, -100));

            assertThat(assessment.getProbabilityFloor()).isGreaterThanOrEqualTo(0.99);
            assertThat(assessment.getFactors().get(0).getSeverity()).isEqualTo(RiskSeverity.DANGER);
            assertThat(assessment.getFactors().get(0).getDescription()).startsWith("Illegal Overdraft");
        }

        @Test
        @DisplayName("R2: emptying the account yields 0.95")
        void shouldFlagBalanceDrain() {
            HeuristicAssessment assessment = evaluate(record(50_000, 50_000, 0));

            assertThat(assessment.getProbabilityFloor()).isEqualTo(0.95);
            assertThat(assessment.getFactors()).extracting(RiskFactor::getDescription)
                    .contains("Balance Drain: Full account emptied (50,000.00 → 0)");
        }

        @Test
        @DisplayName("R3: balance discrepancy above 0.01 yields 0.85")
        void shouldFlagBalanceDiscrepancy() {
            HeuristicAssessment assessment = evaluate(record(100, 1_000, 1_000));

            assertThat(assessment.getProbabilityFloor()).isEqualTo(0.85);
            assertThat(assessment.getFactors()).singleElement()
                    .isEqualTo(RiskFactor.warning("Balance Discrepancy: Error of 100.00 detected (expected ≈ 0)"));
        }

        @Test
        @DisplayName("R3: discrepancy within 0.01 is tolerated")
        void shouldTolerateRoundingError() {
            HeuristicAssessment assessment = evaluate(record(100, 1_000, 900.005));

            assertThat(assessment.getFactors()).isEmpty();
            assertThat(assessment.getProbabilityFloor()).isZero();
        }

        @Test
        @DisplayName("R4: amount above 150,000 yields 0.70")
        void shouldFlagHighValue() {
            HeuristicAssessment assessment = evaluate(record(200_000, 1_000_000, 800_000));

            assertThat(assessment.getProbabilityFloor()).isEqualTo(0.70);
            assertThat(assessment.getFactors()).singleElement()
                    .isEqualTo(RiskFactor.warning("High Amount: 200,000.00 exceeds 150,000 threshold"));
        }

        @Test
        @DisplayName("R5: high amount-to-balance ratio adds a factor without raising the floor")
        void shouldAddRatioFactorOnly() {
            HeuristicAssessment assessment = evaluate(record(950, 1_000, 50));

            assertThat(assessment.getProbabilityFloor()).isZero();
            assertThat(assessment.getFactors()).singleElement()
                    .isEqualTo(RiskFactor.warning("High Amount-to-Balance Ratio: 95.0% of available balance"));
        }
    }

    @Test
    @DisplayName("Should report every triggered rule and keep the highest floor")
    void shouldCombineTriggeredRules() {
        // Given: overdraft, discrepancy, high value and high ratio all at once
        TransactionRecord record = record(200_000, 100_000, -5_000);

        // When
        HeuristicAssessment assessment = evaluate(record);

        // Then
        assertThat(assessment.getProbabilityFloor()).isEqualTo(0.99);
        assertThat(assessment.getFactors()).extracting(RiskFactor::getDescription)
                .satisfiesExactly(
                        d -> assertThat(d).startsWith("Illegal Overdraft"),
                        d -> assertThat(d).startsWith("Balance Discrepancy"),
                        d -> assertThat(d).startsWith("High Amount:"),
                        d -> assertThat(d).startsWith("High Amount-to-Balance Ratio"));
    }

    @Test
    @DisplayName("Should fire nothing for an ordinary payment")
    void shouldFireNothingForOrdinaryPayment() {
        TransactionRecord record = TransactionRecord.builder()
                .type("PAYMENT")
                .amount(5_000)
                .oldBalanceOrg(150_000)
                .newBalanceOrig(145_000)
                .newBalanceDest(5_000)
                .build();

        assertThat(evaluate(record)).isEqualTo(HeuristicAssessment.none());
    }

    private HeuristicAssessment evaluate(TransactionRecord record) {
        return engine.evaluate(record, FeatureEngineer.errorBalanceOrg(record));
    }

    private static TransactionRecord record(double amount, double oldBalanceOrg, double newBalanceOrig) {
        return TransactionRecord.builder()
                .type("TRANSFER")
                .amount(amount)
                .oldBalanceOrg(oldBalanceOrg)
                .newBalanceOrig(newBalanceOrig)
                .build();
    }
}
