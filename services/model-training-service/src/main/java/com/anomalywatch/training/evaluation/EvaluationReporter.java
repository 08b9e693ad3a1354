package com.anomalywatch.training.evaluation;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Logs the model comparison table and the champion's error breakdown.
 */
@Slf4j
public final class EvaluationReporter {

    private EvaluationReporter() {
    }

    public static void logComparison(List<ModelResult> results) {
        log.info("");
        log.info(String.format("%-25s %-10s %-10s", "Model", "AUPRC", "F1-Score"));
        log.info("-".repeat(50));
        for (ModelResult result : results) {
            String auprc = result.hasAuprc() ? String.format("%.4f", result.getAuprc()) : "N/A";
            log.info(String.format("%-25s %-10s %-10.4f", result.getName(), auprc, result.getF1()));
        }
    }

    public static void logDiagnostics(ModelResult result) {
        ConfusionMatrix matrix = result.getConfusionMatrix();
        log.info("");
        log.info("{} confusion matrix:", result.getName());
        log.info("   True Negatives:  {}", String.format("%,d", matrix.getTrueNegatives()));
        log.info("   False Positives: {}  (unnecessary blocks)", String.format("%,d", matrix.getFalsePositives()));
        log.info("   False Negatives: {}  (missed fraud, CRITICAL)", String.format("%,d", matrix.getFalseNegatives()));
        log.info("   True Positives:  {}", String.format("%,d", matrix.getTruePositives()));
        if (matrix.getFalseNegatives() > 0) {
            log.warn("{} missed {} fraudulent transactions in the hold-out split",
                    result.getName(), matrix.getFalseNegatives());
        }

        log.info("");
        log.info("Classification report ({}):", result.getName());
        for (String line : ClassificationReport.lines(matrix, "Legitimate", "Fraud")) {
            log.info("   {}", line);
        }
    }
}
