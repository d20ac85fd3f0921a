package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.config.IsolationSettings;
import com.dispatchsentinel.core.features.FeatureExtractor;
import com.dispatchsentinel.core.features.FeatureRegistry;
import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.Score;
import com.dispatchsentinel.core.model.ScoringMethod;
import com.dispatchsentinel.core.scoring.isolation.IsolationForest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Multivariate scorer backed by an {@link IsolationForest}.
 *
 * <h3>Scoring</h3>
 * <p>
 * The forest is trained on the registry's usable columns of the training
 * events. The decision threshold {@code t} is the
 * {@code (1 - contamination)} percentile of the training anomaly scores, so
 * roughly a {@code contamination} share of the training data lies above it.
 * Each scored event gets {@code s(x) - t}: positive means anomalous, and the
 * decision is exactly {@code s(x) - t > 0}.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestScorer implements AnomalyScorer {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestScorer.class);

    private final FeatureRegistry registry;
    private final double contamination;
    private final int estimators;
    private final int maxSamples;
    private final long seed;

    /**
     * @param registry      declared feature columns; must not be {@code null}
     * @param contamination expected anomaly fraction in (0, 0.5)
     * @param estimators    number of trees
     * @param maxSamples    sub-sample size per tree
     * @param seed          random seed
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public IsolationForestScorer(FeatureRegistry registry, double contamination,
            int estimators, int maxSamples, long seed) {
        this.registry = Objects.requireNonNull(registry, "FeatureRegistry must not be null");
        if (!(contamination > 0 && contamination < 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5), got: " + contamination);
        }
        if (estimators < 1) {
            throw new IllegalArgumentException("estimators must be >= 1, got: " + estimators);
        }
        this.contamination = contamination;
        this.estimators = estimators;
        this.maxSamples = maxSamples;
        this.seed = seed;
    }

    /**
     * Scorer for walk-forward folds.
     */
    public static IsolationForestScorer forFolds(FeatureRegistry registry, double contamination,
            IsolationSettings settings) {
        return new IsolationForestScorer(registry, contamination,
                settings.getEstimators(), settings.getMaxSamples(), settings.getSeed());
    }

    /**
     * Scorer for the full-dataset production model.
     */
    public static IsolationForestScorer forProduction(FeatureRegistry registry, double contamination,
            IsolationSettings settings) {
        return new IsolationForestScorer(registry, contamination,
                settings.getProductionEstimators(), settings.getMaxSamples(), settings.getSeed());
    }

    @Override
    public ScoringMethod getMethod() {
        return ScoringMethod.ISOLATION;
    }

    @Override
    public List<Score> fitAndScore(List<DelayEvent> train, List<DelayEvent> scoreSet) {
        Objects.requireNonNull(train, "train must not be null");
        Objects.requireNonNull(scoreSet, "scoreSet must not be null");

        List<FeatureExtractor> columns = registry.usableColumns(train);
        if (train.isEmpty() || columns.isEmpty()) {
            throw new EmptyFeatureSetException(ScoringMethod.ISOLATION,
                    "No usable numeric feature among " + train.size() + " training event(s)");
        }

        double[][] trainMatrix = FeatureRegistry.toMatrix(train, columns);
        IsolationForest forest = IsolationForest.train(trainMatrix, estimators, maxSamples, seed);
        double threshold = Percentiles.linear(forest.anomalyScores(trainMatrix), 1.0 - contamination);

        LOG.debug("Isolation forest: {} trees, {} columns, {} training rows, threshold={}",
                estimators, columns.size(), train.size(), threshold);

        double[][] scoreMatrix = FeatureRegistry.toMatrix(scoreSet, columns);
        List<Score> scores = new ArrayList<>(scoreSet.size());
        for (int i = 0; i < scoreSet.size(); i++) {
            double score = forest.anomalyScore(scoreMatrix[i]) - threshold;
            scores.add(new Score(scoreSet.get(i).getEventId(), ScoringMethod.ISOLATION, score, score > 0));
        }
        return scores;
    }

    public double getContamination() {
        return contamination;
    }

    public int getEstimators() {
        return estimators;
    }
}
