package com.dispatchsentinel.core.pipeline;

import com.dispatchsentinel.core.config.PipelineConfig;
import com.dispatchsentinel.core.features.FeatureRegistry;
import com.dispatchsentinel.core.features.RunningMoments;
import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.Score;
import com.dispatchsentinel.core.model.ScoringMethod;
import com.dispatchsentinel.core.scoring.CombinationPolicies;
import com.dispatchsentinel.core.scoring.CombinationPolicy;
import com.dispatchsentinel.core.scoring.EmptyFeatureSetException;
import com.dispatchsentinel.core.scoring.IsolationForestScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores the whole dataset with production settings and ranks the result.
 *
 * <p>
 * The isolation forest is trained and applied on all events with
 * {@code production_estimators} trees. The delay z-score uses the population
 * mean and standard deviation of the full dataset. Rows are ordered by
 * descending isolation score (ties keep dataset order) and truncated to
 * {@code topN}. This is separate from walk-forward evaluation and is not
 * leakage-free by construction.
 * </p>
 *
 * @since 1.0.0
 */
public class ProductionFlagger {

    private static final Logger LOG = LoggerFactory.getLogger(ProductionFlagger.class);

    private static final Comparator<FlaggedEvent> BY_ISOLATION_SCORE_DESC =
            Comparator.comparingDouble((FlaggedEvent f) -> f.getIsolationScore()).reversed();

    private final PipelineConfig config;
    private final FeatureRegistry registry;
    private final Optional<CombinationPolicy> combinationPolicy;

    public ProductionFlagger(PipelineConfig config, FeatureRegistry registry) {
        this.config = Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.registry = Objects.requireNonNull(registry, "FeatureRegistry must not be null");
        this.combinationPolicy = CombinationPolicies.fromConfig(config);
    }

    /**
     * @param events the enriched dataset; must not be {@code null}
     * @return the ranked, truncated table
     */
    public List<FlaggedEvent> flag(List<DelayEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        List<Score> isolationScores = null;
        try {
            isolationScores = IsolationForestScorer
                    .forProduction(registry, config.getContamination(), config.getIsolation())
                    .fitAndScore(events, events);
        } catch (EmptyFeatureSetException e) {
            LOG.warn("Production isolation scoring skipped: {}", e.getMessage());
        }

        RunningMoments moments = new RunningMoments();
        for (DelayEvent event : events) {
            if (event.hasDelay()) {
                moments.add(event.getDelay());
            }
        }
        double threshold = config.getZscoreThreshold();

        List<FlaggedEvent> rows = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            DelayEvent event = events.get(i);
            double z = event.hasDelay() ? moments.zScore(event.getDelay()) : Double.NaN;
            boolean zscoreAnomaly = Math.abs(z) > threshold;

            Double isolationScore = null;
            Boolean isolationAnomaly = null;
            Map<ScoringMethod, Boolean> decisions = new EnumMap<>(ScoringMethod.class);
            if (isolationScores != null) {
                Score score = isolationScores.get(i);
                isolationScore = score.getScore();
                isolationAnomaly = score.isAnomaly();
                decisions.put(ScoringMethod.ISOLATION, isolationAnomaly);
            }
            decisions.put(ScoringMethod.ZSCORE, zscoreAnomaly);

            Boolean combined = combinationPolicy.map(policy -> policy.combine(decisions)).orElse(null);
            rows.add(new FlaggedEvent(event, isolationScore, isolationAnomaly, z, zscoreAnomaly, combined));
        }

        if (isolationScores == null) {
            return rows;
        }

        rows.sort(BY_ISOLATION_SCORE_DESC);
        List<FlaggedEvent> top = rows.size() > config.getTopN()
                ? new ArrayList<>(rows.subList(0, config.getTopN()))
                : rows;
        long flagged = top.stream().filter(f -> Boolean.TRUE.equals(f.getIsolationAnomaly())).count();
        LOG.info("Production flagging: {} of {} events kept, {} flagged by isolation", top.size(), events.size(), flagged);
        return top;
    }
}
