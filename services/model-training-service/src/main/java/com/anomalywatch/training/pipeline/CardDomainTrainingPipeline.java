package com.anomalywatch.training.pipeline;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.common.artifact.ArtifactStore;
import com.anomalywatch.common.feature.CardFeatureEngineer;
import com.anomalywatch.common.feature.CardFeatureVector;
import com.anomalywatch.training.config.TrainingProperties;
import com.anomalywatch.training.data.LabeledCardTransaction;
import com.anomalywatch.training.data.LabeledDataset;
import com.anomalywatch.training.data.StratifiedSampler;
import com.anomalywatch.training.data.StratifiedSplitter;
import com.anomalywatch.training.data.TrainTestSplit;
import com.anomalywatch.training.data.TrainingDatasetLoader;
import com.anomalywatch.training.evaluation.EvaluationReporter;
import com.anomalywatch.training.evaluation.ModelEvaluator;
import com.anomalywatch.training.evaluation.ModelResult;
import com.anomalywatch.training.model.CardForestTrainer;
import com.anomalywatch.training.model.HyperparameterSearch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Card-transaction training pipeline: geo-distance and age features,
 * balanced random forest, saved as {@link ArtifactKey#CARD_DOMAIN_MODEL}.
 */
@Slf4j
@Component
public class CardDomainTrainingPipeline {

    public static final String NAME = "card";

    private final TrainingProperties properties;
    private final TrainingDatasetLoader loader;
    private final ArtifactStore artifactStore;
    private final ExecutorService trainingExecutor;

    public CardDomainTrainingPipeline(TrainingProperties properties,
                                      TrainingDatasetLoader loader,
                                      ArtifactStore artifactStore,
                                      @Qualifier("trainingExecutor") ExecutorService trainingExecutor) {
        this.properties = properties;
        this.loader = loader;
        this.artifactStore = artifactStore;
        this.trainingExecutor = trainingExecutor;
    }

    public boolean isEnabled() {
        return properties.getCardDomain().isEnabled();
    }

    public void preflight() {
        TrainingDatasetLoader.requireDataset(Path.of(properties.getCardDomain().getDatasetPath()),
                "Card-domain dataset", "anomalywatch.training.card-domain.dataset-path");
    }

    public TrainingReport run() {
        long started = System.nanoTime();
        preflight();
        TrainingProperties.CardDomain settings = properties.getCardDomain();
        long seed = properties.getRandomSeed();

        StageBanner.log(log, "CARD DOMAIN: DATA INGESTION");
        List<LabeledCardTransaction> rows = StratifiedSampler.sampleRows(
                loader.loadCardTransactions(Path.of(settings.getDatasetPath())), settings.getSampleSize(), seed);
        log.info("   Using {} rows", String.format("%,d", rows.size()));

        StageBanner.log(log, "CARD DOMAIN: FEATURE ENGINEERING");
        LabeledDataset dataset = toDataset(rows);
        log.info("   Features: {}, fraud rate {}%",
                CardFeatureVector.COLUMNS, String.format("%.4f", dataset.fraudRate() * 100));
        TrainTestSplit split = StratifiedSplitter.split(dataset, properties.getTestFraction(), seed);
        log.info("   Train: {}  |  Test: {}",
                String.format("%,d", split.getTrain().size()), String.format("%,d", split.getTest().size()));

        StageBanner.log(log, "CARD DOMAIN: RANDOM FOREST");
        HyperparameterSearch search = new HyperparameterSearch(
                trainingExecutor, settings.getCrossValidationFolds(), seed);
        CardForestTrainer.Outcome outcome = new CardForestTrainer(settings, search, seed).train(split.getTrain());

        StageBanner.log(log, "CARD DOMAIN: EVALUATION");
        ModelResult result = ModelEvaluator.evaluate(
                outcome.getModel(), split.getTest(), outcome.getSearch().getBestParameters().asMap());
        EvaluationReporter.logComparison(List.of(result));
        log.info("Best parameters: {}", result.getBestParameters());
        EvaluationReporter.logDiagnostics(result);

        artifactStore.save(ArtifactKey.CARD_DOMAIN_MODEL, outcome.getModel());
        log.info("   Saved {} ({}) to {}", ArtifactKey.CARD_DOMAIN_MODEL.logicalName(),
                ArtifactKey.CARD_DOMAIN_MODEL.fileName(), artifactStore.location());

        return TrainingReport.builder()
                .pipeline(NAME)
                .trainingRows(split.getTrain().size())
                .testRows(split.getTest().size())
                .result(result)
                .savedArtifact(ArtifactKey.CARD_DOMAIN_MODEL)
                .elapsed(Duration.ofNanos(System.nanoTime() - started))
                .build();
    }

    static LabeledDataset toDataset(List<LabeledCardTransaction> rows) {
        double[][] features = new double[rows.size()][];
        int[] labels = new int[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            LabeledCardTransaction row = rows.get(i);
            features[i] = CardFeatureEngineer.computeFeatures(row.getRecord()).toArray();
            labels[i] = row.isFraud() ? LabeledDataset.FRAUD : LabeledDataset.LEGITIMATE;
        }
        return new LabeledDataset(CardFeatureVector.COLUMNS, features, labels);
    }
}
