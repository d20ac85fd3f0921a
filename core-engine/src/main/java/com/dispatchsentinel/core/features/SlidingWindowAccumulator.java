package com.dispatchsentinel.core.features;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * FIFO window of delay values supporting O(1) mean and standard deviation and
 * an O(log n) lookup median.
 *
 * <p>
 * Values leave in the order they entered. Sums are kept relative to the first
 * value added since the window was last empty.
 * </p>
 */
final class SlidingWindowAccumulator {

    private final Deque<Double> window = new ArrayDeque<>();

    /** Same values as {@link #window}, ascending. */
    private final List<Double> sorted = new ArrayList<>();

    private double shift;
    private double sum;
    private double sumSquares;

    void add(double value) {
        if (window.isEmpty()) {
            shift = value;
            sum = 0.0;
            sumSquares = 0.0;
        }
        window.addLast(value);
        double d = value - shift;
        sum += d;
        sumSquares += d * d;

        int pos = Collections.binarySearch(sorted, value);
        sorted.add(pos < 0 ? -pos - 1 : pos, value);
    }

    void removeOldest() {
        Double value = window.pollFirst();
        if (value == null) {
            throw new IllegalStateException("Cannot evict from an empty window");
        }
        double d = value - shift;
        sum -= d;
        sumSquares -= d * d;

        int pos = Collections.binarySearch(sorted, value);
        sorted.remove(pos);
    }

    int count() {
        return window.size();
    }

    Double mean() {
        int n = window.size();
        return n == 0 ? null : shift + sum / n;
    }

    Double median() {
        int n = sorted.size();
        if (n == 0) {
            return null;
        }
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    /**
     * Population standard deviation; a window holding a single value or equal
     * values yields exactly 0.
     */
    Double std() {
        int n = window.size();
        if (n == 0) {
            return null;
        }
        if (n == 1 || sorted.get(0).equals(sorted.get(n - 1))) {
            return 0.0;
        }
        double variance = (sumSquares - sum * sum / n) / n;
        return variance > 0 ? Math.sqrt(variance) : 0.0;
    }
}
