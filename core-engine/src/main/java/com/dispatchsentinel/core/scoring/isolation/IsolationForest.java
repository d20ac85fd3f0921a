package com.dispatchsentinel.core.scoring.isolation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest (Liu, Ting and Zhou, 2008).
 *
 * <p>
 * Anomalies are few and different, so random axis-aligned splits isolate them
 * in fewer steps than normal points. The anomaly score of a point is
 * {@code s(x) = 2^(-E[h(x)] / c(psi))}, where {@code E[h(x)]} is its mean path
 * length over all trees and {@code c(psi)} the expected path length for the
 * sub-sample size {@code psi}. Scores near 1 are anomalous, scores well below
 * 0.5 are normal.
 * </p>
 *
 * <p>
 * Training is deterministic for a given seed and input order.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = Collections.unmodifiableList(trees);
        this.sampleSize = sampleSize;
    }

    /**
     * Train a forest.
     *
     * @param data       training rows, all of equal width; must not be empty
     * @param numTrees   number of trees
     * @param maxSamples sub-sample size per tree, capped at {@code data.length}
     * @param seed       random seed
     * @return the trained forest
     * @throws IllegalArgumentException if {@code data} is empty or
     *                                  {@code numTrees < 1}
     */
    public static IsolationForest train(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on an empty matrix");
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got: " + numTrees);
        }
        int sampleSize = Math.max(1, Math.min(maxSamples, data.length));
        int maxDepth = (int) Math.ceil(Math.log(Math.max(2, sampleSize)) / Math.log(2));

        Random random = new Random(seed);
        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            trees.add(IsolationTree.build(subsample(data, sampleSize, random), maxDepth, random));
        }
        return new IsolationForest(trees, sampleSize);
    }

    /**
     * @param point a row of the same width as the training data
     * @return the anomaly score in (0, 1]
     */
    public double anomalyScore(double[] point) {
        double meanPath = 0.0;
        for (IsolationTree tree : trees) {
            meanPath += tree.pathLength(point);
        }
        meanPath /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) {
            return 0.5;
        }
        return Math.pow(2.0, -meanPath / c);
    }

    /**
     * @param points rows to score
     * @return one anomaly score per row
     */
    public double[] anomalyScores(double[][] points) {
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = anomalyScore(points[i]);
        }
        return scores;
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // partial Fisher-Yates over row indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
