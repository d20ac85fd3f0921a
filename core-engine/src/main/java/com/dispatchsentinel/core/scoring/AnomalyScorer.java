package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.Score;
import com.dispatchsentinel.core.model.ScoringMethod;

import java.util.List;

/**
 * Contract for the anomaly scoring strategies.
 *
 * <p>
 * A scorer is fitted on one set of events and scores another; it keeps no
 * state between calls, so one instance can serve every fold. Strategies are
 * reported side by side and never merged here: combining decisions is the
 * job of a {@link CombinationPolicy}.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyScorer {

    /**
     * @return the strategy this scorer implements
     */
    ScoringMethod getMethod();

    /**
     * Fit on {@code train} and score every event of {@code scoreSet}.
     *
     * @param train    events the model may learn from; must not be empty
     * @param scoreSet events to score
     * @return one {@link Score} per event of {@code scoreSet}, in order
     * @throws EmptyFeatureSetException if {@code train} offers no usable
     *                                  input for this strategy
     */
    List<Score> fitAndScore(List<DelayEvent> train, List<DelayEvent> scoreSet);
}
