package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.config.PipelineConfig;
import com.dispatchsentinel.core.features.FeatureRegistry;
import com.dispatchsentinel.core.model.ScoringMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ScorerFactory}.
 */
class ScorerFactoryTest {

    private final PipelineConfig config = new PipelineConfig();
    private final FeatureRegistry registry = FeatureRegistry.forConfig(config);

    @Test
    @DisplayName("Should create IsolationForestScorer for ISOLATION")
    void shouldCreateIsolationScorer() {
        AnomalyScorer scorer = ScorerFactory.create(ScoringMethod.ISOLATION, config, registry);

        assertThat(scorer).isInstanceOf(IsolationForestScorer.class);
        assertThat(((IsolationForestScorer) scorer).getContamination()).isEqualTo(0.02);
        assertThat(((IsolationForestScorer) scorer).getEstimators()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should create ZScoreScorer with the configured threshold")
    void shouldCreateZScoreScorer() {
        config.setZscoreThreshold(2.0);

        AnomalyScorer scorer = ScorerFactory.create(ScoringMethod.ZSCORE, config, registry);

        assertThat(scorer).isInstanceOf(ZScoreScorer.class);
        assertThat(((ZScoreScorer) scorer).getThreshold()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should create one scorer per method in declaration order")
    void shouldCreateAll() {
        List<AnomalyScorer> scorers = ScorerFactory.createAll(config, registry);

        assertThat(scorers).extracting(AnomalyScorer::getMethod)
                .containsExactly(ScoringMethod.ISOLATION, ScoringMethod.ZSCORE);
    }

    @Test
    @DisplayName("Should throw for a null method")
    void shouldThrowForNullMethod() {
        assertThatThrownBy(() -> ScorerFactory.create(null, config, registry))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should resolve method keys and reject unknown ones")
    void shouldResolveMethodKeys() {
        assertThat(ScoringMethod.fromKey("isolation")).isEqualTo(ScoringMethod.ISOLATION);
        assertThat(ScoringMethod.fromKey("zscore")).isEqualTo(ScoringMethod.ZSCORE);
        assertThatThrownBy(() -> ScoringMethod.fromKey("lof"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
