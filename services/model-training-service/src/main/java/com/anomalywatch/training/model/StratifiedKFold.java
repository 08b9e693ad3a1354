package com.anomalywatch.training.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded stratified k-fold partitioning: each class is shuffled and dealt
 * round robin across the folds, so every fold keeps the class ratio.
 */
public final class StratifiedKFold {

    private StratifiedKFold() {
    }

    /**
     * Row indices of each test fold. Every row appears in exactly one fold.
     */
    public static int[][] testFolds(int[] labels, int folds, long seed) {
        if (folds < 2) {
            throw new IllegalArgumentException("At least 2 folds are required, got " + folds);
        }
        if (labels.length < folds) {
            throw new IllegalArgumentException(
                    "Cannot split " + labels.length + " rows into " + folds + " folds");
        }

        List<List<Integer>> assigned = new ArrayList<>(folds);
        for (int f = 0; f < folds; f++) {
            assigned.add(new ArrayList<>());
        }

        Random random = new Random(seed);
        int next = 0;
        for (int label : new int[]{0, 1}) {
            List<Integer> rows = new ArrayList<>();
            for (int i = 0; i < labels.length; i++) {
                if (labels[i] == label) {
                    rows.add(i);
                }
            }
            Collections.shuffle(rows, random);
            for (Integer row : rows) {
                assigned.get(next).add(row);
                next = (next + 1) % folds;
            }
        }

        int[][] result = new int[folds][];
        for (int f = 0; f < folds; f++) {
            List<Integer> fold = assigned.get(f);
            Collections.sort(fold);
            result[f] = fold.stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    /**
     * Row indices not in {@code testFold}, ascending.
     */
    public static int[] complement(int[] testFold, int size) {
        boolean[] excluded = new boolean[size];
        for (int index : testFold) {
            excluded[index] = true;
        }
        int[] train = new int[size - testFold.length];
        int cursor = 0;
        for (int i = 0; i < size; i++) {
            if (!excluded[i]) {
                train[cursor++] = i;
            }
        }
        return train;
    }
}
