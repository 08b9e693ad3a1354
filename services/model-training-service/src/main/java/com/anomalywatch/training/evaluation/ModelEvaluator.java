package com.anomalywatch.training.evaluation;

import com.anomalywatch.common.model.FraudModel;
import com.anomalywatch.common.model.IsolationForestDetector;
import com.anomalywatch.training.data.LabeledDataset;

import java.util.Map;

/**
 * Scores trained models on the held-out split.
 */
public final class ModelEvaluator {

    /**
     * Probability above which a supervised model's output counts as a fraud prediction.
     */
    public static final double DECISION_THRESHOLD = 0.5;

    private ModelEvaluator() {
    }

    public static ModelResult evaluate(FraudModel model, LabeledDataset test, Map<String, Object> bestParameters) {
        double[] probabilities = new double[test.size()];
        for (int i = 0; i < test.size(); i++) {
            probabilities[i] = model.fraudProbability(test.row(i));
        }
        int[] actual = test.labels();
        int[] predicted = ClassificationMetrics.threshold(probabilities, DECISION_THRESHOLD);
        ConfusionMatrix matrix = ConfusionMatrix.of(actual, predicted);

        return ModelResult.builder()
                .name(model.name())
                .auprc(ClassificationMetrics.averagePrecision(actual, probabilities))
                .f1(matrix.f1())
                .confusionMatrix(matrix)
                .bestParameters(bestParameters)
                .build();
    }

    /**
     * Outliers are mapped onto the fraud label and inliers onto the legitimate label.
     * The detector has no probability output, so only F1 is reported.
     */
    public static ModelResult evaluate(IsolationForestDetector detector, LabeledDataset test) {
        int[] predicted = new int[test.size()];
        for (int i = 0; i < test.size(); i++) {
            predicted[i] = detector.isOutlier(test.row(i)) ? LabeledDataset.FRAUD : LabeledDataset.LEGITIMATE;
        }
        ConfusionMatrix matrix = ConfusionMatrix.of(test.labels(), predicted);

        return ModelResult.builder()
                .name(detector.name())
                .f1(matrix.f1())
                .confusionMatrix(matrix)
                .build();
    }
}
