package com.anomalywatch.training.pipeline;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.common.artifact.ArtifactStore;
import com.anomalywatch.common.model.IsolationForestDetector;
import com.anomalywatch.common.model.WekaFraudModel;
import com.anomalywatch.training.config.TrainingProperties;
import com.anomalywatch.training.data.FeatureTable;
import com.anomalywatch.training.data.FeatureTableBuilder;
import com.anomalywatch.training.data.LabeledDataset;
import com.anomalywatch.training.data.LabeledTransaction;
import com.anomalywatch.training.data.StratifiedSampler;
import com.anomalywatch.training.data.StratifiedSplitter;
import com.anomalywatch.training.data.TrainTestSplit;
import com.anomalywatch.training.data.TrainingDatasetLoader;
import com.anomalywatch.training.evaluation.EvaluationReporter;
import com.anomalywatch.training.evaluation.ModelEvaluator;
import com.anomalywatch.training.evaluation.ModelResult;
import com.anomalywatch.training.model.AnomalyDetectorTrainer;
import com.anomalywatch.training.model.BaselineModelTrainer;
import com.anomalywatch.training.model.ChampionModelTrainer;
import com.anomalywatch.training.model.HyperparameterSearch;
import com.anomalywatch.training.sampling.SmoteOversampler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Payment-domain training pipeline.
 *
 * <ol>
 *   <li>Ingestion and stratified down-sampling</li>
 *   <li>Fraud-capable filter, category encoding and error-balance features</li>
 *   <li>Stratified train/test split, then SMOTE on the training split</li>
 *   <li>Baseline, champion and anomaly detector training</li>
 *   <li>Hold-out evaluation</li>
 *   <li>Artifact serialization</li>
 * </ol>
 */
@Slf4j
@Component
public class FraudTrainingPipeline {

    public static final String NAME = "payment";

    private final TrainingProperties properties;
    private final TrainingDatasetLoader loader;
    private final ArtifactStore artifactStore;
    private final ExecutorService trainingExecutor;

    public FraudTrainingPipeline(TrainingProperties properties,
                                 TrainingDatasetLoader loader,
                                 ArtifactStore artifactStore,
                                 @Qualifier("trainingExecutor") ExecutorService trainingExecutor) {
        this.properties = properties;
        this.loader = loader;
        this.artifactStore = artifactStore;
        this.trainingExecutor = trainingExecutor;
    }

    /**
     * Verifies the dataset is present before any computation starts.
     */
    public void preflight() {
        TrainingDatasetLoader.requireDataset(
                Path.of(properties.getDatasetPath()), "PaySim dataset", "anomalywatch.training.dataset-path");
    }

    public TrainingReport run() {
        long started = System.nanoTime();
        preflight();
        long seed = properties.getRandomSeed();

        StageBanner.log(log, "PHASE 1: DATA INGESTION");
        List<LabeledTransaction> rows = loader.loadPaySim(Path.of(properties.getDatasetPath()));
        double fraction = properties.effectiveSampleFraction();
        if (fraction < 1.0) {
            log.info("[1.1] Development mode: keeping all fraud and {}% of legitimate rows",
                    String.format("%.0f", fraction * 100));
            rows = StratifiedSampler.sample(rows, LabeledTransaction::isFraud, fraction, seed);
        } else {
            log.info("[1.1] Using the full dataset");
        }

        StageBanner.log(log, "PHASE 2: FEATURE ENGINEERING");
        FeatureTable table = FeatureTableBuilder.build(rows, properties.getFraudCapableTypes());

        log.info("[2.5] Train/test split ({}/{})...",
                String.format("%.0f", (1 - properties.getTestFraction()) * 100),
                String.format("%.0f", properties.getTestFraction() * 100));
        TrainTestSplit split = StratifiedSplitter.split(table.getDataset(), properties.getTestFraction(), seed);
        log.info("   Train: {}  |  Test: {}",
                String.format("%,d", split.getTrain().size()), String.format("%,d", split.getTest().size()));

        StageBanner.log(log, "PHASE 3: IMBALANCE HANDLING (SMOTE)");
        LabeledDataset balanced = new SmoteOversampler(properties.getOversampling().getNeighbors(), seed)
                .resample(split.getTrain());

        StageBanner.log(log, "PHASE 4: TRI-MODEL ARCHITECTURE");
        HyperparameterSearch search = new HyperparameterSearch(
                trainingExecutor, properties.getChampion().getCrossValidationFolds(), seed);

        WekaFraudModel baseline = new BaselineModelTrainer(properties.getBaseline()).train(balanced);
        ChampionModelTrainer.Outcome champion =
                new ChampionModelTrainer(properties.getChampion(), search, seed).train(balanced);
        IsolationForestDetector detector =
                new AnomalyDetectorTrainer(properties.getAnomalyDetector(), seed).train(balanced);

        StageBanner.log(log, "PHASE 5: EVALUATION");
        LabeledDataset test = split.getTest();
        ModelResult baselineResult = ModelEvaluator.evaluate(baseline, test, Map.of());
        ModelResult championResult = ModelEvaluator.evaluate(
                champion.getModel(), test, champion.getSearch().getBestParameters().asMap());
        ModelResult detectorResult = ModelEvaluator.evaluate(detector, test);
        List<ModelResult> results = List.of(baselineResult, championResult, detectorResult);
        EvaluationReporter.logComparison(results);
        log.info("Champion parameters: {}", championResult.getBestParameters());
        EvaluationReporter.logDiagnostics(championResult);

        StageBanner.log(log, "PHASE 6: MODEL SERIALIZATION");
        save(ArtifactKey.CHAMPION, champion.getModel());
        save(ArtifactKey.BASELINE, baseline);
        save(ArtifactKey.ANOMALY_DETECTOR, detector);
        save(ArtifactKey.CATEGORY_ENCODER, table.getEncoding());

        return TrainingReport.builder()
                .pipeline(NAME)
                .trainingRows(balanced.size())
                .testRows(test.size())
                .results(results)
                .savedArtifact(ArtifactKey.CHAMPION)
                .savedArtifact(ArtifactKey.BASELINE)
                .savedArtifact(ArtifactKey.ANOMALY_DETECTOR)
                .savedArtifact(ArtifactKey.CATEGORY_ENCODER)
                .elapsed(Duration.ofNanos(System.nanoTime() - started))
                .build();
    }

    private void save(ArtifactKey key, Serializable artifact) {
        artifactStore.save(key, artifact);
        log.info("   Saved {} ({}) to {}", key.logicalName(), key.fileName(), artifactStore.location());
    }
}
