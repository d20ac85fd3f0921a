package com.dispatchsentinel.core.scoring.isolation;

/**
 * Node of an {@link IsolationTree}: either an internal split on one feature
 * or an external (leaf) node remembering how many samples reached it.
 */
final class IsolationNode {

    /** Euler–Mascheroni constant. */
    private static final double EULER_GAMMA = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    static IsolationNode internal(int splitFeature, double splitValue, IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitFeature, splitValue, left, right, 0);
    }

    static IsolationNode external(int size) {
        return new IsolationNode(-1, 0.0, null, null, size);
    }

    boolean isExternal() {
        return left == null;
    }

    double pathLength(double[] point, int depth) {
        if (isExternal()) {
            return depth + averagePathLength(size);
        }
        return point[splitFeature] < splitValue
                ? left.pathLength(point, depth + 1)
                : right.pathLength(point, depth + 1);
    }

    /**
     * Average path length of an unsuccessful binary-search-tree lookup among
     * {@code n} items: {@code c(n) = 2H(n-1) - 2(n-1)/n}, with the harmonic
     * number approximated as {@code ln(i) + γ}.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }
}
