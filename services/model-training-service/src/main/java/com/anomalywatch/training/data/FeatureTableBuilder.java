package com.anomalywatch.training.data;

import com.anomalywatch.common.feature.CategoryEncoding;
import com.anomalywatch.common.feature.FeatureEngineer;
import com.anomalywatch.common.feature.FeatureVector;
import com.anomalywatch.training.exception.TrainingPipelineException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Restricts the sample to fraud-capable transaction types, fits the
 * {@link CategoryEncoding} on them and computes the feature matrix through
 * the same {@link FeatureEngineer} the scoring service uses.
 */
@Slf4j
public final class FeatureTableBuilder {

    private FeatureTableBuilder() {
    }

    public static FeatureTable build(List<LabeledTransaction> rows, Collection<String> fraudCapableTypes) {
        Set<String> allowed = Set.copyOf(fraudCapableTypes);

        log.info("[2.1] Filtering to {}...", allowed);
        List<LabeledTransaction> filtered = rows.stream()
                .filter(row -> allowed.contains(row.getRecord().getType()))
                .collect(Collectors.toList());
        log.info("   Records after filter: {}", String.format("%,d", filtered.size()));
        if (filtered.isEmpty()) {
            throw new TrainingPipelineException("No transactions of types " + allowed + " in the sample");
        }

        log.info("[2.2] Fitting category encoding...");
        CategoryEncoding encoding = CategoryEncoding.fit(
                filtered.stream().map(row -> row.getRecord().getType()).collect(Collectors.toSet()));
        log.info("   Classes: {}", encoding.labels());

        log.info("[2.3] Creating error-balance features...");
        double[][] features = new double[filtered.size()][];
        int[] labels = new int[filtered.size()];
        for (int i = 0; i < filtered.size(); i++) {
            LabeledTransaction row = filtered.get(i);
            FeatureVector vector = FeatureEngineer.computeFeatures(row.getRecord(), encoding);
            features[i] = vector.toArray();
            labels[i] = row.isFraud() ? LabeledDataset.FRAUD : LabeledDataset.LEGITIMATE;
        }

        LabeledDataset dataset = new LabeledDataset(FeatureVector.COLUMNS, features, labels);
        log.info("[2.4] Final feature set: {} columns, {} rows, fraud rate {}%",
                FeatureVector.COLUMNS.size(), dataset.size(), String.format("%.4f", dataset.fraudRate() * 100));
        return new FeatureTable(dataset, encoding);
    }
}
