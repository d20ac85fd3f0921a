package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.Score;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dispatchsentinel.core.testutil.TestEvents.day;
import static com.dispatchsentinel.core.testutil.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreScorer}.
 */
class ZScoreScorerTest {

    private final ZScoreScorer scorer = new ZScoreScorer();

    @Test
    @DisplayName("Should standardize test delays with training moments only")
    void shouldUseTrainingMoments() {
        List<DelayEvent> train = List.of(
                event("a", "R1", day(0), 4.0),
                event("b", "R1", day(1), 6.0));
        List<DelayEvent> test = List.of(
                event("c", "R1", day(2), 9.0),
                event("d", "R1", day(3), 2.5));

        List<Score> scores = scorer.fitAndScore(train, test);

        assertThat(scores.get(0).getScore()).isCloseTo(4.0, within(1e-12));
        assertThat(scores.get(0).isAnomaly()).isTrue();
        assertThat(scores.get(1).getScore()).isCloseTo(2.5, within(1e-12));
        assertThat(scores.get(1).isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should not flag anything when training delays have zero variance")
    void shouldNotFlagOnZeroVariance() {
        List<DelayEvent> train = List.of(
                event("a", "R1", day(0), 5.0),
                event("b", "R1", day(1), 5.0));
        List<DelayEvent> test = List.of(event("c", "R1", day(2), 5_000.0));

        Score score = scorer.fitAndScore(train, test).get(0);

        assertThat(score.getScore()).isNaN();
        assertThat(score.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should give events without a delay a NaN score")
    void shouldScoreMissingDelayAsNaN() {
        List<DelayEvent> train = List.of(
                event("a", "R1", day(0), 1.0),
                event("b", "R1", day(1), 3.0));

        Score score = scorer.fitAndScore(train, List.of(event("c", "R1", day(2), null))).get(0);

        assertThat(score.getScore()).isNaN();
        assertThat(score.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should treat the threshold as exclusive")
    void shouldUseExclusiveThreshold() {
        List<DelayEvent> train = List.of(
                event("a", "R1", day(0), -1.0),
                event("b", "R1", day(1), 1.0));

        Score score = new ZScoreScorer(3.0).fitAndScore(train, List.of(event("c", "R1", day(2), 3.0))).get(0);

        assertThat(score.getScore()).isEqualTo(3.0);
        assertThat(score.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should throw EmptyFeatureSetException when no training delay exists")
    void shouldThrowWithoutTrainingDelays() {
        List<DelayEvent> train = List.of(event("a", "R1", day(0), null));

        assertThatThrownBy(() -> scorer.fitAndScore(train, train))
                .isInstanceOf(EmptyFeatureSetException.class);
    }
}
