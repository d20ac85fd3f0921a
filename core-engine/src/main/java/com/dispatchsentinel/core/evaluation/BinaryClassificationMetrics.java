package com.dispatchsentinel.core.evaluation;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Precision, recall, F1 and ROC-AUC for binary decisions against binary
 * labels. Undefined ratios (zero denominators) are reported as {@code 0}.
 *
 * @since 1.0.0
 */
public final class BinaryClassificationMetrics {

    private final double precision;
    private final double recall;
    private final double f1;

    private BinaryClassificationMetrics(double precision, double recall, double f1) {
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
    }

    /**
     * @param predicted decisions, positive = anomaly
     * @param actual    labels, same length
     * @return the metrics
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static BinaryClassificationMetrics of(boolean[] predicted, boolean[] actual) {
        if (predicted.length != actual.length) {
            throw new IllegalArgumentException("Length mismatch: " + predicted.length + " vs " + actual.length);
        }
        int tp = 0;
        int fp = 0;
        int fn = 0;
        for (int i = 0; i < predicted.length; i++) {
            if (predicted[i] && actual[i]) tp++;
            else if (predicted[i]) fp++;
            else if (actual[i]) fn++;
        }
        double precision = tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
        double recall = tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
        double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
        return new BinaryClassificationMetrics(precision, recall, f1);
    }

    /**
     * Area under the ROC curve, computed from the Mann–Whitney rank statistic
     * with tied scores sharing their average rank. {@code NaN} scores rank
     * below every other score.
     *
     * @param scores continuous scores, higher = more likely positive
     * @param actual labels, same length
     * @return the AUC, or {@code null} when only one class is present
     */
    public static Double rocAuc(double[] scores, boolean[] actual) {
        if (scores.length != actual.length) {
            throw new IllegalArgumentException("Length mismatch: " + scores.length + " vs " + actual.length);
        }
        int n = scores.length;
        long positives = 0;
        for (boolean label : actual) {
            if (label) positives++;
        }
        long negatives = n - positives;
        if (positives == 0 || negatives == 0) {
            return null;
        }

        double[] ranked = new double[n];
        for (int i = 0; i < n; i++) {
            ranked[i] = Double.isNaN(scores[i]) ? Double.NEGATIVE_INFINITY : scores[i];
        }
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble(i -> ranked[i]));

        double positiveRankSum = 0.0;
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && ranked[order[j + 1]] == ranked[order[i]]) {
                j++;
            }
            double averageRank = (i + j) / 2.0 + 1.0;
            for (int k = i; k <= j; k++) {
                if (actual[order[k]]) {
                    positiveRankSum += averageRank;
                }
            }
            i = j + 1;
        }
        double u = positiveRankSum - positives * (positives + 1) / 2.0;
        return u / ((double) positives * negatives);
    }

    public double getPrecision() {
        return precision;
    }

    public double getRecall() {
        return recall;
    }

    public double getF1() {
        return f1;
    }

    @Override
    public String toString() {
        return String.format("precision=%.3f recall=%.3f f1=%.3f", precision, recall, f1);
    }
}
