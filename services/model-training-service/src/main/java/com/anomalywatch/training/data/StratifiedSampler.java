package com.anomalywatch.training.data;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Development-mode down-sampling that keeps every positive row and a seeded
 * fraction of the negative rows, then shuffles the result.
 */
@Slf4j
public final class StratifiedSampler {

    private StratifiedSampler() {
    }

    public static <T> List<T> sample(List<T> rows, Predicate<T> isPositive, double negativeFraction, long seed) {
        if (negativeFraction <= 0.0 || negativeFraction > 1.0) {
            throw new IllegalArgumentException("negativeFraction must be in (0, 1], was " + negativeFraction);
        }

        List<T> positives = new ArrayList<>();
        List<T> negatives = new ArrayList<>();
        for (T row : rows) {
            (isPositive.test(row) ? positives : negatives).add(row);
        }

        Random random = new Random(seed);
        int keep = (int) Math.round(negatives.size() * negativeFraction);
        if (keep < negatives.size()) {
            Collections.shuffle(negatives, random);
        }

        List<T> sampled = new ArrayList<>(positives.size() + keep);
        sampled.addAll(positives);
        sampled.addAll(negatives.subList(0, keep));
        Collections.shuffle(sampled, random);

        log.info("   Sampled records: {} ({} positive, {} of {} negative)",
                String.format("%,d", sampled.size()), positives.size(), keep, negatives.size());
        return sampled;
    }

    /**
     * Seeded sample of at most {@code maxRows} rows without replacement, regardless of label.
     */
    public static <T> List<T> sampleRows(List<T> rows, int maxRows, long seed) {
        if (rows.size() <= maxRows) {
            return new ArrayList<>(rows);
        }
        List<T> shuffled = new ArrayList<>(rows);
        Collections.shuffle(shuffled, new Random(seed));
        return new ArrayList<>(shuffled.subList(0, maxRows));
    }
}
