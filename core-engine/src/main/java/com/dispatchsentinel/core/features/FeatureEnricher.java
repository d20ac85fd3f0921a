package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.config.PipelineConfig;
import com.dispatchsentinel.core.model.DelayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the feature builders in dependency order: dispatch columns, windowed
 * aggregates, global z-scores and, when enabled, trailing z-scores.
 *
 * @since 1.0.0
 */
public class FeatureEnricher {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureEnricher.class);

    private final DispatchFeatureBuilder dispatchFeatures;
    private final WindowedFeatureBuilder windowedFeatures;
    private final GroupNormalizer groupNormalizer;
    private final TrailingGroupNormalizer trailingNormalizer;

    public FeatureEnricher(PipelineConfig config) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.dispatchFeatures = new DispatchFeatureBuilder();
        this.windowedFeatures = new WindowedFeatureBuilder(config.getEntityKeys(), config.windowSpecs());
        this.groupNormalizer = new GroupNormalizer(config.getZscoreKeys());
        this.trailingNormalizer = config.isTrailingZScore()
                ? new TrailingGroupNormalizer(config.getZscoreKeys())
                : null;
    }

    /**
     * @return every column {@link #enrich(List)} attaches, in order
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(dispatchFeatures.columnNames());
        names.addAll(windowedFeatures.columnNames());
        names.addAll(groupNormalizer.columnNames());
        if (trailingNormalizer != null) {
            names.addAll(trailingNormalizer.columnNames());
        }
        return names;
    }

    /**
     * Attach all derived columns in place.
     *
     * @param events the dataset; must not be {@code null}
     * @return the same list, for chaining
     */
    public List<DelayEvent> enrich(List<DelayEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        dispatchFeatures.apply(events);
        windowedFeatures.apply(events);
        groupNormalizer.apply(events);
        if (trailingNormalizer != null) {
            trailingNormalizer.apply(events);
        }

        LOG.info("Enriched {} events with {} derived column(s)", events.size(), columnNames().size());
        return events;
    }
}
