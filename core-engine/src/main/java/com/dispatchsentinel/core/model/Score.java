package com.dispatchsentinel.core.model;

import java.util.Objects;

/**
 * Output of one scoring strategy for one event.
 *
 * <p>
 * Higher {@link #getScore() score} means more anomalous. The score is
 * {@link Double#NaN} when the strategy cannot score the event (e.g. a z-score
 * against a zero standard deviation); such events are never flagged.
 * </p>
 *
 * @since 1.0.0
 */
public final class Score {

    private final String eventId;
    private final ScoringMethod method;
    private final double score;
    private final boolean decision;

    public Score(String eventId, ScoringMethod method, double score, boolean decision) {
        this.eventId = Objects.requireNonNull(eventId, "eventId must not be null");
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.score = score;
        this.decision = decision;
    }

    public String getEventId() {
        return eventId;
    }

    public ScoringMethod getMethod() {
        return method;
    }

    public double getScore() {
        return score;
    }

    /**
     * @return {@code true} when the strategy flags the event as anomalous
     */
    public boolean isAnomaly() {
        return decision;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Score that))
            return false;
        return Double.compare(score, that.score) == 0
                && decision == that.decision
                && eventId.equals(that.eventId)
                && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, method, score, decision);
    }

    @Override
    public String toString() {
        return "Score{" + method + " " + eventId + " score=" + score + " anomaly=" + decision + '}';
    }
}
