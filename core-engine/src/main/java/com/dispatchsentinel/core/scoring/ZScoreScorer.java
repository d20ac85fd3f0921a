package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.features.RunningMoments;
import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.Score;
import com.dispatchsentinel.core.model.ScoringMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Univariate scorer on the delay metric.
 *
 * <p>
 * Mean and population standard deviation are taken from the training events
 * only and applied to the scored events. The score is {@code |z|}; the
 * decision is {@code |z| > threshold}. When the training delays have zero
 * variance, or a scored event has no delay, the score is {@code NaN} and the
 * event is not flagged.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreScorer implements AnomalyScorer {

    public static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    /**
     * @param threshold absolute z above which an event is flagged; must be
     *                  positive
     * @throws IllegalArgumentException if {@code threshold <= 0}
     */
    public ZScoreScorer(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public ZScoreScorer() {
        this(DEFAULT_THRESHOLD);
    }

    @Override
    public ScoringMethod getMethod() {
        return ScoringMethod.ZSCORE;
    }

    @Override
    public List<Score> fitAndScore(List<DelayEvent> train, List<DelayEvent> scoreSet) {
        Objects.requireNonNull(train, "train must not be null");
        Objects.requireNonNull(scoreSet, "scoreSet must not be null");

        RunningMoments moments = new RunningMoments();
        for (DelayEvent event : train) {
            if (event.hasDelay()) {
                moments.add(event.getDelay());
            }
        }
        if (moments.count() == 0) {
            throw new EmptyFeatureSetException(ScoringMethod.ZSCORE,
                    "No delay value among " + train.size() + " training event(s)");
        }

        List<Score> scores = new ArrayList<>(scoreSet.size());
        for (DelayEvent event : scoreSet) {
            double z = event.hasDelay() ? moments.zScore(event.getDelay()) : Double.NaN;
            double magnitude = Math.abs(z);
            scores.add(new Score(event.getEventId(), ScoringMethod.ZSCORE, magnitude, magnitude > threshold));
        }
        return scores;
    }

    public double getThreshold() {
        return threshold;
    }
}
