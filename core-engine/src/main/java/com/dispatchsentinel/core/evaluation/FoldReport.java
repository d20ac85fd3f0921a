package com.dispatchsentinel.core.evaluation;

import com.dispatchsentinel.core.model.ScoringMethod;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluation of one walk-forward fold.
 *
 * <p>
 * Only strategies that ran on the fold appear under {@code scorers}; a
 * skipped strategy leaves a message in {@code warnings}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "fold_index", "n_train", "n_test", "contamination", "temporal",
        "train_end", "test_start", "scorers", "warnings" })
public final class FoldReport {

    private final int foldIndex;
    private final int nTrain;
    private final int nTest;
    private final double contamination;
    private final boolean temporal;
    private final Instant trainEnd;
    private final Instant testStart;
    private final Map<String, ScorerMetrics> scorers;
    private final List<String> warnings;

    FoldReport(int foldIndex, int nTrain, int nTest, double contamination, boolean temporal,
            Instant trainEnd, Instant testStart, Map<ScoringMethod, ScorerMetrics> scorers, List<String> warnings) {
        this.foldIndex = foldIndex;
        this.nTrain = nTrain;
        this.nTest = nTest;
        this.contamination = contamination;
        this.temporal = temporal;
        this.trainEnd = trainEnd;
        this.testStart = testStart;
        Map<String, ScorerMetrics> byKey = new LinkedHashMap<>();
        scorers.forEach((method, metrics) -> byKey.put(method.getKey(), metrics));
        this.scorers = Collections.unmodifiableMap(byKey);
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    @JsonProperty("fold_index")
    public int getFoldIndex() {
        return foldIndex;
    }

    @JsonProperty("n_train")
    public int getNTrain() {
        return nTrain;
    }

    @JsonProperty("n_test")
    public int getNTest() {
        return nTest;
    }

    @JsonProperty("contamination")
    public double getContamination() {
        return contamination;
    }

    @JsonProperty("temporal")
    public boolean isTemporal() {
        return temporal;
    }

    @JsonProperty("train_end")
    public Instant getTrainEnd() {
        return trainEnd;
    }

    @JsonProperty("test_start")
    public Instant getTestStart() {
        return testStart;
    }

    @JsonProperty("scorers")
    public Map<String, ScorerMetrics> getScorers() {
        return scorers;
    }

    @JsonIgnore
    public Optional<ScorerMetrics> getMetrics(ScoringMethod method) {
        return Optional.ofNullable(scorers.get(method.getKey()));
    }

    @JsonProperty("warnings")
    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "FoldReport{" +
                "foldIndex=" + foldIndex +
                ", nTrain=" + nTrain +
                ", nTest=" + nTest +
                ", scorers=" + scorers +
                ", warnings=" + warnings +
                '}';
    }
}
