package com.dispatchsentinel.core.scoring.isolation;

import java.util.Random;

/**
 * A single random isolation tree.
 *
 * <p>
 * Each internal node splits on a feature chosen uniformly among those that
 * still vary within the node, at a value drawn uniformly between that
 * feature's minimum and maximum. A node becomes a leaf when it holds at most
 * one sample, reaches the depth limit or no feature varies.
 * </p>
 */
final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree build(double[][] data, int maxDepth, Random random) {
        return new IsolationTree(buildNode(data, 0, maxDepth, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.external(n);
        }

        int numFeatures = data[0].length;
        double[] min = new double[numFeatures];
        double[] max = new double[numFeatures];
        for (int f = 0; f < numFeatures; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
        }
        for (double[] row : data) {
            for (int f = 0; f < numFeatures; f++) {
                if (row[f] < min[f]) min[f] = row[f];
                if (row[f] > max[f]) max[f] = row[f];
            }
        }

        int[] candidates = new int[numFeatures];
        int candidateCount = 0;
        for (int f = 0; f < numFeatures; f++) {
            if (min[f] < max[f]) {
                candidates[candidateCount++] = f;
            }
        }
        if (candidateCount == 0) {
            return IsolationNode.external(n);
        }

        int feature = candidates[random.nextInt(candidateCount)];
        double splitValue = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int leftCount = 0;
        for (double[] row : data) {
            if (row[feature] < splitValue) leftCount++;
        }
        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0;
        int ri = 0;
        for (double[] row : data) {
            if (row[feature] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        return IsolationNode.internal(feature, splitValue,
                buildNode(leftData, depth + 1, maxDepth, random),
                buildNode(rightData, depth + 1, maxDepth, random));
    }
}
