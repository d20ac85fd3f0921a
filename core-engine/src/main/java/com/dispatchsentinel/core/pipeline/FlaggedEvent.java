package com.dispatchsentinel.core.pipeline;

import com.dispatchsentinel.core.model.DelayEvent;

import java.util.Objects;

/**
 * One row of the production anomaly table: the event with both strategies'
 * outputs on the full dataset.
 *
 * <p>
 * {@code isolationScore} and {@code isolationAnomaly} are {@code null} when the
 * isolation scorer had no usable feature. {@code combinedAnomaly} is
 * {@code null} when no combination policy is configured.
 * </p>
 *
 * @since 1.0.0
 */
public final class FlaggedEvent {

    private final DelayEvent event;
    private final Double isolationScore;
    private final Boolean isolationAnomaly;
    private final double delayZscore;
    private final boolean zscoreAnomaly;
    private final Boolean combinedAnomaly;

    FlaggedEvent(DelayEvent event, Double isolationScore, Boolean isolationAnomaly,
            double delayZscore, boolean zscoreAnomaly, Boolean combinedAnomaly) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.isolationScore = isolationScore;
        this.isolationAnomaly = isolationAnomaly;
        this.delayZscore = delayZscore;
        this.zscoreAnomaly = zscoreAnomaly;
        this.combinedAnomaly = combinedAnomaly;
    }

    public DelayEvent getEvent() {
        return event;
    }

    public Double getIsolationScore() {
        return isolationScore;
    }

    public Boolean getIsolationAnomaly() {
        return isolationAnomaly;
    }

    /**
     * @return full-dataset z-score of the delay, {@code NaN} when undefined
     */
    public double getDelayZscore() {
        return delayZscore;
    }

    public boolean isZscoreAnomaly() {
        return zscoreAnomaly;
    }

    public Boolean getCombinedAnomaly() {
        return combinedAnomaly;
    }

    @Override
    public String toString() {
        return "FlaggedEvent{" +
                "eventId=" + event.getEventId() +
                ", isolationScore=" + isolationScore +
                ", isolationAnomaly=" + isolationAnomaly +
                ", delayZscore=" + delayZscore +
                ", zscoreAnomaly=" + zscoreAnomaly +
                ", combinedAnomaly=" + combinedAnomaly +
                '}';
    }
}
