package com.dispatchsentinel.core.split;

import com.dispatchsentinel.core.model.DelayEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One walk-forward train/test partition.
 *
 * <p>
 * For a {@linkplain #isTemporal() temporal} fold every training timestamp is
 * strictly before every test timestamp. Folds produced by the row-index
 * fallback carry no such guarantee.
 * </p>
 *
 * @since 1.0.0
 */
public final class Fold {

    private final int index;
    private final List<DelayEvent> train;
    private final List<DelayEvent> test;
    private final boolean temporal;

    /**
     * @param index    1-based index among emitted folds
     * @param train    training events, in order
     * @param test     test events, in order
     * @param temporal whether the fold was cut on calendar dates
     */
    public Fold(int index, List<DelayEvent> train, List<DelayEvent> test, boolean temporal) {
        this.index = index;
        this.train = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(train, "train must not be null")));
        this.test = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(test, "test must not be null")));
        this.temporal = temporal;
    }

    public int getIndex() {
        return index;
    }

    public List<DelayEvent> getTrain() {
        return train;
    }

    public List<DelayEvent> getTest() {
        return test;
    }

    public List<String> getTrainEventIds() {
        return train.stream().map(DelayEvent::getEventId).toList();
    }

    public List<String> getTestEventIds() {
        return test.stream().map(DelayEvent::getEventId).toList();
    }

    public boolean isTemporal() {
        return temporal;
    }

    /**
     * @return the latest training timestamp, or {@code null} for a
     *         non-temporal fold
     */
    public Instant getTrainEnd() {
        return temporal ? train.stream().map(DelayEvent::getTimestamp).max(Instant::compareTo).orElse(null) : null;
    }

    /**
     * @return the earliest test timestamp, or {@code null} for a non-temporal
     *         fold
     */
    public Instant getTestStart() {
        return temporal ? test.stream().map(DelayEvent::getTimestamp).min(Instant::compareTo).orElse(null) : null;
    }

    @Override
    public String toString() {
        return "Fold{" +
                "index=" + index +
                ", train=" + train.size() +
                ", test=" + test.size() +
                ", temporal=" + temporal +
                '}';
    }
}
