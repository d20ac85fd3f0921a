package com.dispatchsentinel.core.evaluation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Metrics of one scoring strategy on one fold.
 *
 * <p>
 * Label-based fields ({@code precision}, {@code recall}, {@code f1},
 * {@code auc}) are set when the dataset carries labels; descriptive fields
 * ({@code anomaly_count}, {@code score_mean}, {@code score_std}) otherwise.
 * Unset fields are omitted from JSON.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "precision", "recall", "f1", "auc", "anomaly_count", "score_mean", "score_std" })
public final class ScorerMetrics {

    private final Double precision;
    private final Double recall;
    private final Double f1;
    private final Double auc;
    private final Integer anomalyCount;
    private final Double scoreMean;
    private final Double scoreStd;

    private ScorerMetrics(Double precision, Double recall, Double f1, Double auc,
            Integer anomalyCount, Double scoreMean, Double scoreStd) {
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
        this.auc = auc;
        this.anomalyCount = anomalyCount;
        this.scoreMean = scoreMean;
        this.scoreStd = scoreStd;
    }

    static ScorerMetrics labelled(BinaryClassificationMetrics metrics, Double auc) {
        return new ScorerMetrics(metrics.getPrecision(), metrics.getRecall(), metrics.getF1(), auc,
                null, null, null);
    }

    static ScorerMetrics descriptive(int anomalyCount, Double scoreMean, Double scoreStd) {
        return new ScorerMetrics(null, null, null, null, anomalyCount, scoreMean, scoreStd);
    }

    @JsonProperty("precision")
    public Double getPrecision() {
        return precision;
    }

    @JsonProperty("recall")
    public Double getRecall() {
        return recall;
    }

    @JsonProperty("f1")
    public Double getF1() {
        return f1;
    }

    @JsonProperty("auc")
    public Double getAuc() {
        return auc;
    }

    @JsonProperty("anomaly_count")
    public Integer getAnomalyCount() {
        return anomalyCount;
    }

    @JsonProperty("score_mean")
    public Double getScoreMean() {
        return scoreMean;
    }

    @JsonProperty("score_std")
    public Double getScoreStd() {
        return scoreStd;
    }

    @Override
    public String toString() {
        return "ScorerMetrics{" +
                "precision=" + precision +
                ", recall=" + recall +
                ", f1=" + f1 +
                ", auc=" + auc +
                ", anomalyCount=" + anomalyCount +
                ", scoreMean=" + scoreMean +
                ", scoreStd=" + scoreStd +
                '}';
    }
}
