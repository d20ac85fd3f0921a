package com.dispatchsentinel.core.features;

/**
 * Add-only accumulator for count, mean and population standard deviation.
 *
 * <p>
 * Values are accumulated relative to the first value seen (shifted data), so a
 * constant series yields a standard deviation of exactly {@code 0} and a
 * single value yields {@code 0} rather than {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RunningMoments {

    private long count;
    private double shift;
    private double sum;
    private double sumSquares;

    /**
     * @param value a finite value
     */
    public void add(double value) {
        if (count == 0) {
            shift = value;
        }
        double d = value - shift;
        sum += d;
        sumSquares += d * d;
        count++;
    }

    public long count() {
        return count;
    }

    /**
     * @return the mean, or {@code NaN} when empty
     */
    public double mean() {
        return count == 0 ? Double.NaN : shift + sum / count;
    }

    /**
     * @return the population standard deviation, {@code 0} for a single value,
     *         {@code NaN} when empty
     */
    public double populationStd() {
        if (count == 0) {
            return Double.NaN;
        }
        if (count == 1) {
            return 0.0;
        }
        double variance = (sumSquares - sum * sum / count) / count;
        return variance > 0 ? Math.sqrt(variance) : 0.0;
    }

    /**
     * Standardize a value against the accumulated moments.
     *
     * @param value the value
     * @return {@code (value - mean) / std}, or {@code NaN} when empty or the
     *         standard deviation is zero
     */
    public double zScore(double value) {
        double std = populationStd();
        if (count == 0 || std == 0.0) {
            return Double.NaN;
        }
        return (value - mean()) / std;
    }
}
