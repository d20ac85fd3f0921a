package com.dispatchsentinel.core.evaluation;

import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.Score;
import com.dispatchsentinel.core.model.ScoringMethod;
import com.dispatchsentinel.core.split.Fold;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.dispatchsentinel.core.testutil.TestEvents.day;
import static com.dispatchsentinel.core.testutil.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Evaluator}.
 */
class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator(0.05);

    private static Fold fold() {
        List<DelayEvent> train = List.of(
                event("t1", "R1", "P1", day(0), 1.0, false),
                event("t2", "R1", "P1", day(1), 2.0, false));
        List<DelayEvent> test = List.of(
                event("a", "R1", "P1", day(2), 50.0, true),
                event("b", "R1", "P1", day(2), 3.0, null),
                event("c", "R1", "P1", day(3), 4.0, false));
        return new Fold(1, train, test, true);
    }

    private static Map<ScoringMethod, List<Score>> scores() {
        Map<ScoringMethod, List<Score>> scores = new EnumMap<>(ScoringMethod.class);
        scores.put(ScoringMethod.ISOLATION, List.of(
                new Score("a", ScoringMethod.ISOLATION, 0.3, true),
                new Score("b", ScoringMethod.ISOLATION, 0.1, true),
                new Score("c", ScoringMethod.ISOLATION, -0.2, false)));
        scores.put(ScoringMethod.ZSCORE, List.of(
                new Score("a", ScoringMethod.ZSCORE, 97.0, true),
                new Score("b", ScoringMethod.ZSCORE, Double.NaN, false),
                new Score("c", ScoringMethod.ZSCORE, 5.0, true)));
        return scores;
    }

    @Test
    @DisplayName("Should report label-based metrics when labels exist, missing labels negative")
    void shouldReportLabelledMetrics() {
        FoldReport report = evaluator.evaluate(fold(), scores(), true, List.of());

        ScorerMetrics isolation = report.getMetrics(ScoringMethod.ISOLATION).orElseThrow();
        assertThat(isolation.getPrecision()).isCloseTo(0.5, within(1e-12));
        assertThat(isolation.getRecall()).isEqualTo(1.0);
        assertThat(isolation.getAuc()).isEqualTo(1.0);
        assertThat(isolation.getAnomalyCount()).isNull();

        ScorerMetrics zscore = report.getMetrics(ScoringMethod.ZSCORE).orElseThrow();
        assertThat(zscore.getPrecision()).isCloseTo(0.5, within(1e-12));
        assertThat(zscore.getAuc()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should report descriptive statistics without labels, ignoring NaN")
    void shouldReportDescriptiveMetrics() {
        FoldReport report = evaluator.evaluate(fold(), scores(), false, List.of());

        ScorerMetrics zscore = report.getMetrics(ScoringMethod.ZSCORE).orElseThrow();
        assertThat(zscore.getPrecision()).isNull();
        assertThat(zscore.getAnomalyCount()).isEqualTo(2);
        assertThat(zscore.getScoreMean()).isCloseTo(51.0, within(1e-12));
        assertThat(zscore.getScoreStd()).isCloseTo(46.0, within(1e-12));
    }

    @Test
    @DisplayName("Should carry fold bookkeeping and warnings into the report")
    void shouldCarryFoldDetails() {
        Map<ScoringMethod, List<Score>> onlyZscore = new EnumMap<>(ScoringMethod.class);
        onlyZscore.put(ScoringMethod.ZSCORE, scores().get(ScoringMethod.ZSCORE));

        FoldReport report = evaluator.evaluate(fold(), onlyZscore, true, List.of("isolation skipped"));

        assertThat(report.getFoldIndex()).isEqualTo(1);
        assertThat(report.getNTrain()).isEqualTo(2);
        assertThat(report.getNTest()).isEqualTo(3);
        assertThat(report.getContamination()).isEqualTo(0.05);
        assertThat(report.isTemporal()).isTrue();
        assertThat(report.getTrainEnd()).isEqualTo(day(1));
        assertThat(report.getTestStart()).isEqualTo(day(2));
        assertThat(report.getScorers()).containsOnlyKeys("zscore");
        assertThat(report.getWarnings()).containsExactly("isolation skipped");
    }

    @Test
    @DisplayName("Should reject scores not aligned with the test events")
    void shouldRejectMisalignedScores() {
        Map<ScoringMethod, List<Score>> misaligned = new EnumMap<>(ScoringMethod.class);
        misaligned.put(ScoringMethod.ZSCORE, List.of(new Score("a", ScoringMethod.ZSCORE, 1.0, false)));

        assertThatThrownBy(() -> evaluator.evaluate(fold(), misaligned, true, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
