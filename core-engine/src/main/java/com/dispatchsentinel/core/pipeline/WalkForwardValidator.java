package com.dispatchsentinel.core.pipeline;

import com.dispatchsentinel.core.evaluation.Evaluator;
import com.dispatchsentinel.core.evaluation.FoldReport;
import com.dispatchsentinel.core.evaluation.RunReport;
import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.Score;
import com.dispatchsentinel.core.model.ScoringMethod;
import com.dispatchsentinel.core.scoring.AnomalyScorer;
import com.dispatchsentinel.core.scoring.EmptyFeatureSetException;
import com.dispatchsentinel.core.split.Fold;
import com.dispatchsentinel.core.split.TimeSegmentedSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs every scorer on every walk-forward fold and evaluates the results.
 *
 * <h3>Failure handling</h3>
 * <ul>
 * <li>A scorer throwing {@link EmptyFeatureSetException} is skipped for that
 * fold; the fold report records a warning.</li>
 * <li>Any other exception while processing a fold is logged at error level
 * and the fold is left out of the report. Remaining folds still run.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class WalkForwardValidator {

    private static final Logger LOG = LoggerFactory.getLogger(WalkForwardValidator.class);

    private final List<AnomalyScorer> scorers;
    private final Evaluator evaluator;
    private final TimeSegmentedSplitter splitter;

    public WalkForwardValidator(List<AnomalyScorer> scorers, Evaluator evaluator, TimeSegmentedSplitter splitter) {
        this.scorers = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(scorers, "scorers must not be null")));
        this.evaluator = Objects.requireNonNull(evaluator, "Evaluator must not be null");
        this.splitter = Objects.requireNonNull(splitter, "TimeSegmentedSplitter must not be null");
    }

    /**
     * @param events the enriched dataset; must not be {@code null}
     * @return one report per successfully processed fold, in fold order
     */
    public RunReport run(List<DelayEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        boolean labelsAvailable = false;
        for (DelayEvent event : events) {
            if (event.getLabel() != null) {
                labelsAvailable = true;
                break;
            }
        }
        if (!labelsAvailable) {
            LOG.info("Dataset carries no labels; reporting descriptive statistics only");
        }

        List<Fold> folds = splitter.split(events);
        LOG.info("Walk-forward validation over {} fold(s) with {} scorer(s)", folds.size(), scorers.size());

        List<FoldReport> reports = new ArrayList<>(folds.size());
        for (Fold fold : folds) {
            try {
                reports.add(runFold(fold, labelsAvailable));
            } catch (RuntimeException e) {
                LOG.error("Fold {} excluded from the report: {}", fold.getIndex(), e.getMessage(), e);
            }
        }
        return new RunReport(reports);
    }

    // -------------------------------------------------------------------------

    private FoldReport runFold(Fold fold, boolean labelsAvailable) {
        Map<ScoringMethod, List<Score>> scores = new EnumMap<>(ScoringMethod.class);
        List<String> warnings = new ArrayList<>();

        for (AnomalyScorer scorer : scorers) {
            try {
                scores.put(scorer.getMethod(), scorer.fitAndScore(fold.getTrain(), fold.getTest()));
            } catch (EmptyFeatureSetException e) {
                String warning = scorer.getMethod() + " skipped: " + e.getMessage();
                LOG.warn("Fold {}: {}", fold.getIndex(), warning);
                warnings.add(warning);
            }
        }

        FoldReport report = evaluator.evaluate(fold, scores, labelsAvailable, warnings);
        LOG.info("Fold {}: train={} test={} scorers={}",
                fold.getIndex(), report.getNTrain(), report.getNTest(), report.getScorers().keySet());
        return report;
    }
}
