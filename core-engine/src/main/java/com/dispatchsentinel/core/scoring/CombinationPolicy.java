package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.model.Score;
import com.dispatchsentinel.core.model.ScoringMethod;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optional layer that merges the per-strategy decisions for one event into a
 * single decision. The scorers themselves never combine.
 *
 * @see CombinationPolicies
 * @since 1.0.0
 */
@FunctionalInterface
public interface CombinationPolicy {

    /**
     * @param decisions decision of every strategy that scored the event
     * @return the combined decision
     */
    boolean combine(Map<ScoringMethod, Boolean> decisions);

    /**
     * Combine aligned score lists event by event.
     *
     * @param scores per-strategy scores
     * @return combined decision per event id, in first-seen order
     */
    default Map<String, Boolean> apply(Map<ScoringMethod, List<Score>> scores) {
        Map<String, Map<ScoringMethod, Boolean>> byEvent = new LinkedHashMap<>();
        scores.forEach((method, list) -> {
            for (Score score : list) {
                byEvent.computeIfAbsent(score.getEventId(), id -> new EnumMap<>(ScoringMethod.class))
                        .put(method, score.isAnomaly());
            }
        });
        Map<String, Boolean> combined = new LinkedHashMap<>();
        byEvent.forEach((id, decisions) -> combined.put(id, combine(decisions)));
        return combined;
    }
}
