package com.anomalywatch.training.evaluation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per-class precision / recall / F1 / support table.
 */
public final class ClassificationReport {

    private static final String ROW = "%12s %9.2f %9.2f %9.2f %9d";

    private ClassificationReport() {
    }

    public static List<String> lines(ConfusionMatrix matrix, String negativeName, String positiveName) {
        long total = matrix.total();
        double negativeShare = total == 0 ? 0.0 : (double) matrix.negativeSupport() / total;
        double positiveShare = total == 0 ? 0.0 : (double) matrix.positiveSupport() / total;

        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.US, "%12s %9s %9s %9s %9s", "", "precision", "recall", "f1-score", "support"));
        lines.add(String.format(Locale.US, ROW, negativeName,
                matrix.negativePrecision(), matrix.negativeRecall(), matrix.negativeF1(), matrix.negativeSupport()));
        lines.add(String.format(Locale.US, ROW, positiveName,
                matrix.precision(), matrix.recall(), matrix.f1(), matrix.positiveSupport()));
        lines.add(String.format(Locale.US, "%12s %9s %9s %9.2f %9d", "accuracy", "", "", matrix.accuracy(), total));
        lines.add(String.format(Locale.US, ROW, "macro avg",
                (matrix.negativePrecision() + matrix.precision()) / 2,
                (matrix.negativeRecall() + matrix.recall()) / 2,
                (matrix.negativeF1() + matrix.f1()) / 2,
                total));
        lines.add(String.format(Locale.US, ROW, "weighted avg",
                matrix.negativePrecision() * negativeShare + matrix.precision() * positiveShare,
                matrix.negativeRecall() * negativeShare + matrix.recall() * positiveShare,
                matrix.negativeF1() * negativeShare + matrix.f1() * positiveShare,
                total));
        return lines;
    }
}
