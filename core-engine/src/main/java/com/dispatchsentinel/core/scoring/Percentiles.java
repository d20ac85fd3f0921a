package com.dispatchsentinel.core.scoring;

import java.util.Arrays;

/**
 * Percentiles with linear interpolation between closest ranks.
 */
final class Percentiles {

    private Percentiles() {
        // utility class
    }

    /**
     * @param values   sample; must not be empty
     * @param fraction quantile in [0, 1]
     * @return the interpolated quantile
     */
    static double linear(double[] values, double fraction) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot take a percentile of an empty sample");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
