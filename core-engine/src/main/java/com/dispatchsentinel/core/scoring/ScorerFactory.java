package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.config.PipelineConfig;
import com.dispatchsentinel.core.features.FeatureRegistry;
import com.dispatchsentinel.core.model.ScoringMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Creates the walk-forward {@link AnomalyScorer}s from configuration.
 *
 * <p>
 * This is the single point of extension when adding a scoring strategy: add
 * the {@link ScoringMethod} constant and its case here.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScorerFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ScorerFactory.class);

    private ScorerFactory() {
        // utility class
    }

    /**
     * @param method   the strategy; must not be {@code null}
     * @param config   the pipeline configuration; must not be {@code null}
     * @param registry the feature columns; must not be {@code null}
     * @return a scorer for walk-forward folds
     */
    public static AnomalyScorer create(ScoringMethod method, PipelineConfig config, FeatureRegistry registry) {
        Objects.requireNonNull(method, "ScoringMethod must not be null");
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        Objects.requireNonNull(registry, "FeatureRegistry must not be null");

        return switch (method) {
            case ISOLATION -> IsolationForestScorer.forFolds(registry, config.getContamination(), config.getIsolation());
            case ZSCORE -> new ZScoreScorer(config.getZscoreThreshold());
        };
    }

    /**
     * Create one scorer per {@link ScoringMethod}, in declaration order.
     *
     * @return unmodifiable list of scorers
     */
    public static List<AnomalyScorer> createAll(PipelineConfig config, FeatureRegistry registry) {
        List<AnomalyScorer> scorers = new ArrayList<>();
        for (ScoringMethod method : ScoringMethod.values()) {
            scorers.add(create(method, config, registry));
        }
        LOG.info("Created {} scorer(s): {}", scorers.size(), List.of(ScoringMethod.values()));
        return Collections.unmodifiableList(scorers);
    }
}
