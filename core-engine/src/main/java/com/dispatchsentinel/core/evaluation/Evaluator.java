package com.dispatchsentinel.core.evaluation;

import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.Score;
import com.dispatchsentinel.core.model.ScoringMethod;
import com.dispatchsentinel.core.split.Fold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the per-strategy scores of one fold into a {@link FoldReport}.
 *
 * <h3>Metrics</h3>
 * <ul>
 * <li><b>Labelled data</b>: precision, recall and F1 of the decisions, plus
 * ROC-AUC of the continuous scores. An event without a label counts as
 * negative.</li>
 * <li><b>Unlabelled data</b>: number of flagged events, mean and population
 * standard deviation of the finite scores.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final double contamination;

    public Evaluator(double contamination) {
        this.contamination = contamination;
    }

    /**
     * @param fold             the fold the scores were produced on
     * @param scoresByMethod   test-set scores per strategy, aligned with
     *                         {@link Fold#getTest()}
     * @param labelsAvailable  whether the dataset carries labels
     * @param warnings         messages to record on the fold
     * @return the fold report
     * @throws IllegalArgumentException if a score list is not aligned with
     *                                  the test events
     */
    public FoldReport evaluate(Fold fold, Map<ScoringMethod, List<Score>> scoresByMethod,
            boolean labelsAvailable, List<String> warnings) {
        Objects.requireNonNull(fold, "fold must not be null");
        Objects.requireNonNull(scoresByMethod, "scoresByMethod must not be null");

        List<DelayEvent> test = fold.getTest();
        boolean[] actual = new boolean[test.size()];
        for (int i = 0; i < test.size(); i++) {
            actual[i] = Boolean.TRUE.equals(test.get(i).getLabel());
        }

        Map<ScoringMethod, ScorerMetrics> metrics = new EnumMap<>(ScoringMethod.class);
        for (Map.Entry<ScoringMethod, List<Score>> entry : scoresByMethod.entrySet()) {
            List<Score> scores = entry.getValue();
            if (scores.size() != test.size()) {
                throw new IllegalArgumentException(entry.getKey() + " produced " + scores.size()
                        + " score(s) for " + test.size() + " test event(s)");
            }
            double[] values = new double[scores.size()];
            boolean[] predicted = new boolean[scores.size()];
            for (int i = 0; i < scores.size(); i++) {
                values[i] = scores.get(i).getScore();
                predicted[i] = scores.get(i).isAnomaly();
            }

            ScorerMetrics result = labelsAvailable
                    ? ScorerMetrics.labelled(BinaryClassificationMetrics.of(predicted, actual),
                            BinaryClassificationMetrics.rocAuc(values, actual))
                    : describe(predicted, values);
            metrics.put(entry.getKey(), result);
            LOG.debug("Fold {} {}: {}", fold.getIndex(), entry.getKey(), result);
        }

        return new FoldReport(fold.getIndex(), fold.getTrain().size(), test.size(), contamination,
                fold.isTemporal(), fold.getTrainEnd(), fold.getTestStart(), metrics, warnings);
    }

    // -------------------------------------------------------------------------

    private static ScorerMetrics describe(boolean[] predicted, double[] values) {
        int flagged = 0;
        for (boolean p : predicted) {
            if (p) flagged++;
        }
        int n = 0;
        double sum = 0.0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                n++;
                sum += v;
            }
        }
        if (n == 0) {
            return ScorerMetrics.descriptive(flagged, null, null);
        }
        double mean = sum / n;
        double squares = 0.0;
        for (double v : values) {
            if (Double.isFinite(v)) {
                squares += (v - mean) * (v - mean);
            }
        }
        return ScorerMetrics.descriptive(flagged, mean, Math.sqrt(squares / n));
    }

    public double getContamination() {
        return contamination;
    }
}
