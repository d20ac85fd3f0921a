package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.config.IsolationSettings;
import com.dispatchsentinel.core.features.FeatureRegistry;
import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.Score;
import com.dispatchsentinel.core.model.ScoringMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IsolationForestScorer}.
 */
class IsolationForestScorerTest {

    private static final FeatureRegistry REGISTRY = FeatureRegistry.of(List.of(
            FeatureRegistry.delay("delay"),
            FeatureRegistry.attribute("distance_km")));

    private static List<DelayEvent> gaussianEvents(int n, long seed) {
        Random random = new Random(seed);
        List<DelayEvent> events = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            events.add(DelayEvent.builder()
                    .eventId("e" + i)
                    .delay(5.0 + 2.0 * random.nextGaussian())
                    .attribute("distance_km", 40.0 + 10.0 * random.nextGaussian())
                    .build());
        }
        return events;
    }

    @Test
    @DisplayName("Should flag about a contamination share of the training data")
    void shouldCalibrateToContamination() {
        List<DelayEvent> events = gaussianEvents(1000, 11);
        IsolationForestScorer scorer = new IsolationForestScorer(REGISTRY, 0.05, 100, 256, 42L);

        List<Score> scores = scorer.fitAndScore(events, events);

        long flagged = scores.stream().filter(Score::isAnomaly).count();
        assertThat(flagged).isBetween(40L, 60L);
    }

    @Test
    @DisplayName("Should flag exactly when the score is positive")
    void shouldAlignDecisionWithScoreSign() {
        List<DelayEvent> events = gaussianEvents(200, 12);

        List<Score> scores = new IsolationForestScorer(REGISTRY, 0.1, 50, 256, 42L).fitAndScore(events, events);

        assertThat(scores).hasSize(200).allSatisfy(s -> {
            assertThat(s.getMethod()).isEqualTo(ScoringMethod.ISOLATION);
            assertThat(s.isAnomaly()).isEqualTo(s.getScore() > 0);
        });
    }

    @Test
    @DisplayName("Should rank an injected outlier above the training data")
    void shouldRankOutlierFirst() {
        List<DelayEvent> train = gaussianEvents(300, 13);
        DelayEvent outlier = DelayEvent.builder().eventId("x").delay(500.0).attribute("distance_km", 400.0).build();
        DelayEvent typical = DelayEvent.builder().eventId("t").delay(5.0).attribute("distance_km", 40.0).build();

        List<Score> scores = IsolationForestScorer.forFolds(REGISTRY, 0.02, new IsolationSettings())
                .fitAndScore(train, List.of(outlier, typical));

        assertThat(scores.get(0).isAnomaly()).isTrue();
        assertThat(scores.get(1).isAnomaly()).isFalse();
        assertThat(scores.get(0).getScore()).isGreaterThan(scores.get(1).getScore());
    }

    @Test
    @DisplayName("Should use the production tree count for the production scorer")
    void shouldUseProductionEstimators() {
        IsolationSettings settings = new IsolationSettings();

        assertThat(IsolationForestScorer.forFolds(REGISTRY, 0.02, settings).getEstimators()).isEqualTo(100);
        assertThat(IsolationForestScorer.forProduction(REGISTRY, 0.02, settings).getEstimators()).isEqualTo(200);
    }

    @Test
    @DisplayName("Should throw EmptyFeatureSetException when no column has a value")
    void shouldThrowOnEmptyFeatureSet() {
        List<DelayEvent> blank = List.of(
                DelayEvent.builder().eventId("a").build(),
                DelayEvent.builder().eventId("b").build());

        IsolationForestScorer scorer = new IsolationForestScorer(REGISTRY, 0.05, 10, 256, 42L);

        assertThatThrownBy(() -> scorer.fitAndScore(blank, blank))
                .isInstanceOf(EmptyFeatureSetException.class)
                .satisfies(e -> assertThat(((EmptyFeatureSetException) e).getMethod())
                        .isEqualTo(ScoringMethod.ISOLATION));
    }

    @Test
    @DisplayName("Should reject contamination outside (0, 0.5)")
    void shouldRejectInvalidContamination() {
        assertThatThrownBy(() -> new IsolationForestScorer(REGISTRY, 0.5, 10, 256, 42L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("contamination");
    }
}
