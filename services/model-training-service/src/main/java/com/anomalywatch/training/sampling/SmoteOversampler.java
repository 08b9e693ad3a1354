package com.anomalywatch.training.sampling;

import com.anomalywatch.training.data.LabeledDataset;
import com.anomalywatch.training.exception.TrainingPipelineException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.ml.distance.DistanceMeasure;
import org.apache.commons.math3.ml.distance.EuclideanDistance;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Synthetic minority oversampling (SMOTE).
 *
 * <p>Each synthetic row lies on the segment between a minority row and one of
 * its {@code k} nearest minority neighbours. Rows are generated until both
 * classes have the same count. Only ever applied to a training split.
 */
@Slf4j
public class SmoteOversampler {

    private final int neighbors;
    private final long seed;
    private final DistanceMeasure distance = new EuclideanDistance();

    public SmoteOversampler(int neighbors, long seed) {
        if (neighbors < 1) {
            throw new IllegalArgumentException("neighbors must be positive, was " + neighbors);
        }
        this.neighbors = neighbors;
        this.seed = seed;
    }

    public LabeledDataset resample(LabeledDataset train) {
        int fraud = train.countOf(LabeledDataset.FRAUD);
        int legitimate = train.countOf(LabeledDataset.LEGITIMATE);
        int minorityLabel = fraud <= legitimate ? LabeledDataset.FRAUD : LabeledDataset.LEGITIMATE;
        int missing = Math.abs(legitimate - fraud);

        log.info("   Pre-oversampling fraud ratio: {}%", String.format("%.4f", train.fraudRate() * 100));
        if (missing == 0) {
            return train;
        }

        double[][] minority = train.rowsWithLabel(minorityLabel);
        if (minority.length < 2) {
            throw new TrainingPipelineException(
                    "Oversampling needs at least 2 minority rows, found " + minority.length);
        }

        int k = Math.min(neighbors, minority.length - 1);
        int[][] nearest = nearestNeighbours(minority, k);

        Random random = new Random(seed);
        double[][] synthetic = new double[missing][];
        for (int i = 0; i < missing; i++) {
            int base = random.nextInt(minority.length);
            int neighbour = nearest[base][random.nextInt(k)];
            double gap = random.nextDouble();
            synthetic[i] = interpolate(minority[base], minority[neighbour], gap);
        }

        int[] syntheticLabels = new int[missing];
        Arrays.fill(syntheticLabels, minorityLabel);
        LabeledDataset balanced = train.append(synthetic, syntheticLabels);

        log.info("   Post-oversampling train size: {}", String.format("%,d", balanced.size()));
        log.info("   Post-oversampling fraud ratio: {}%", String.format("%.2f", balanced.fraudRate() * 100));
        return balanced;
    }

    static double[] interpolate(double[] from, double[] to, double gap) {
        double[] row = new double[from.length];
        for (int j = 0; j < from.length; j++) {
            row[j] = from[j] + gap * (to[j] - from[j]);
        }
        return row;
    }

    /**
     * Indices of the {@code k} nearest other rows for every row, closest first.
     * Brute force; the minority class is small by definition.
     */
    int[][] nearestNeighbours(double[][] rows, int k) {
        return IntStream.range(0, rows.length)
                .parallel()
                .mapToObj(i -> IntStream.range(0, rows.length)
                        .filter(j -> j != i)
                        .boxed()
                        .sorted(Comparator.<Integer>comparingDouble(j -> distance.compute(rows[i], rows[j]))
                                .thenComparingInt(j -> j))
                        .limit(k)
                        .mapToInt(Integer::intValue)
                        .toArray())
                .toArray(int[][]::new);
    }
}
