package com.anomalywatch.training.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Training pipeline configuration (anomalywatch.training.*)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "anomalywatch.training")
public class TrainingProperties {

    /**
     * Run the pipeline when the application starts
     */
    private boolean runOnStartup = true;

    /**
     * PaySim transactions CSV
     */
    @NotBlank
    private String datasetPath = "data/onlinefraud.csv";

    /**
     * Directory the artifacts are written to
     */
    @NotBlank
    private String artifactDirectory = "backend/models";

    /**
     * Fraction of legitimate rows kept; fraud rows are always kept
     */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double sampleFraction = 0.1;

    /**
     * Train on every row; overrides sampleFraction
     */
    private boolean useFullDataset = false;

    private long randomSeed = 42L;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double testFraction = 0.2;

    /**
     * Size of the pool hyperparameter candidates are fitted on
     */
    @Min(1)
    private int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    /**
     * Transaction types that exhibit fraud in the dataset
     */
    @NotEmpty
    private List<String> fraudCapableTypes = new ArrayList<>(List.of("CASH_OUT", "TRANSFER"));

    @Valid
    private Oversampling oversampling = new Oversampling();

    @Valid
    private Baseline baseline = new Baseline();

    @Valid
    private Champion champion = new Champion();

    @Valid
    private AnomalyDetector anomalyDetector = new AnomalyDetector();

    @Valid
    private CardDomain cardDomain = new CardDomain();

    public double effectiveSampleFraction() {
        return useFullDataset ? 1.0 : sampleFraction;
    }

    public enum SearchMode {
        GRID,
        RANDOMIZED
    }

    @Data
    public static class Oversampling {
        /**
         * Nearest same-class neighbours interpolated towards
         */
        @Min(1)
        private int neighbors = 5;
    }

    @Data
    public static class Baseline {
        @Min(1)
        private int maxIterations = 1000;

        @DecimalMin("0.0")
        private double ridge = 1.0E-8;
    }

    @Data
    public static class Champion {
        private SearchMode searchMode = SearchMode.GRID;

        /**
         * Candidates evaluated in RANDOMIZED mode
         */
        @Min(1)
        private int searchIterations = 5;

        @Min(2)
        private int crossValidationFolds = 3;

        @NotEmpty
        private List<Integer> maxDepths = new ArrayList<>(List.of(4, 6));

        @NotEmpty
        private List<Double> learningRates = new ArrayList<>(List.of(0.1, 0.3));

        @NotEmpty
        private List<Integer> estimatorCounts = new ArrayList<>(List.of(100, 200));
    }

    @Data
    public static class AnomalyDetector {
        @Min(1)
        private int trees = 100;

        @Min(2)
        private int maxSamples = 256;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "0.5")
        private double contamination = 0.01;
    }

    @Data
    public static class CardDomain {
        private boolean enabled = true;

        @NotBlank
        private String datasetPath = "data/fraudTrain.csv";

        /**
         * Rows drawn from the card dataset
         */
        @Min(10)
        private int sampleSize = 100_000;

        @Min(1)
        private int searchIterations = 3;

        @Min(2)
        private int crossValidationFolds = 3;

        @NotEmpty
        private List<Integer> treeCounts = new ArrayList<>(List.of(50, 100));

        @NotEmpty
        private List<Integer> maxDepths = new ArrayList<>(List.of(5, 10));
    }
}
