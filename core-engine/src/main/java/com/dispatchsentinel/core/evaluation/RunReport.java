package com.dispatchsentinel.core.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Walk-forward evaluation result: the per-fold reports in fold order.
 * No cross-fold aggregate is computed.
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "n_folds", "folds" })
public final class RunReport {

    private final List<FoldReport> folds;

    public RunReport(List<FoldReport> folds) {
        this.folds = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(folds, "folds must not be null")));
    }

    @JsonProperty("n_folds")
    public int getNFolds() {
        return folds.size();
    }

    @JsonProperty("folds")
    public List<FoldReport> getFolds() {
        return folds;
    }

    @Override
    public String toString() {
        return "RunReport{nFolds=" + folds.size() + ", folds=" + folds + '}';
    }
}
