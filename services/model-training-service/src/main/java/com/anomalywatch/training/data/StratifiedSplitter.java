package com.anomalywatch.training.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded train/test split that holds out the same fraction of each class,
 * so both splits keep the original fraud rate.
 */
public final class StratifiedSplitter {

    private StratifiedSplitter() {
    }

    public static TrainTestSplit split(LabeledDataset dataset, double testFraction, long seed) {
        if (testFraction <= 0.0 || testFraction >= 1.0) {
            throw new IllegalArgumentException("testFraction must be in (0, 1), was " + testFraction);
        }

        Random random = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();

        for (int label : new int[]{LabeledDataset.LEGITIMATE, LabeledDataset.FRAUD}) {
            List<Integer> indices = new ArrayList<>();
            for (int index : dataset.indicesOf(label)) {
                indices.add(index);
            }
            Collections.shuffle(indices, random);

            int testCount = (int) Math.round(indices.size() * testFraction);
            if (indices.size() > 1) {
                testCount = Math.max(1, Math.min(testCount, indices.size() - 1));
            }
            test.addAll(indices.subList(0, testCount));
            train.addAll(indices.subList(testCount, indices.size()));
        }

        Collections.shuffle(train, random);
        Collections.shuffle(test, random);

        return new TrainTestSplit(
                dataset.subset(train.stream().mapToInt(Integer::intValue).toArray()),
                dataset.subset(test.stream().mapToInt(Integer::intValue).toArray()));
    }
}
