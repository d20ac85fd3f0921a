package com.dispatchsentinel.core.pipeline;

import com.dispatchsentinel.core.evaluation.RunReport;
import com.dispatchsentinel.core.model.DelayEvent;

import java.util.Collections;
import java.util.List;

/**
 * Outputs of one {@link AnomalyPipeline} run.
 *
 * @since 1.0.0
 */
public final class PipelineResult {

    private final List<DelayEvent> events;
    private final List<String> featureColumns;
    private final RunReport report;
    private final List<FlaggedEvent> flagged;

    PipelineResult(List<DelayEvent> events, List<String> featureColumns, RunReport report, List<FlaggedEvent> flagged) {
        this.events = Collections.unmodifiableList(events);
        this.featureColumns = Collections.unmodifiableList(featureColumns);
        this.report = report;
        this.flagged = Collections.unmodifiableList(flagged);
    }

    /**
     * @return the enriched dataset in input order
     */
    public List<DelayEvent> getEvents() {
        return events;
    }

    /**
     * @return names of the derived columns attached to every event, in order
     */
    public List<String> getFeatureColumns() {
        return featureColumns;
    }

    public RunReport getReport() {
        return report;
    }

    public List<FlaggedEvent> getFlagged() {
        return flagged;
    }
}
