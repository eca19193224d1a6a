package com.energy.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of randomized partitioning trees, fitted once per run and discarded afterwards.
 */
public class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * Fit the forest.
     *
     * @param data       samples, each row is a feature vector
     * @param numTrees   number of trees in the forest
     * @param maxSamples sub-sampling size per tree, capped at the row count
     * @param seed       random seed; same seed and data give the same forest
     */
    public static IsolationForest fit(double[][] data, int numTrees, int maxSamples, long seed) {
        int sampleSize = Math.min(maxSamples, data.length);
        int maxDepth = maxDepth(sampleSize);
        List<IsolationTree> trees = new ArrayList<>(numTrees);

        Random random = new Random(seed);

        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, sampleSize, random);
            trees.add(IsolationTree.build(sample, maxDepth, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), sampleSize);
    }

    public static int maxDepth(int sampleSize) {
        return (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
    }

    /**
     * Anomaly score s(x, n) = 2^(-E(h(x)) / c(n)), between 0 (normal) and 1 (anomalous).
     */
    public double anomalyScore(double[] point) {
        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.5;

        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] anomalyScores(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        return scores;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
}
