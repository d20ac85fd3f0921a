package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.model.DelayEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Causal per-group z-score of the delay metric.
 *
 * <p>
 * Attaches {@code <key>_trailing_zscore}, standardizing each delay against the
 * mean and population standard deviation of the group's events with a
 * <strong>strictly earlier</strong> timestamp. Undefined ({@code NaN}) when no
 * earlier delay exists or the earlier delays have zero variance; {@code null}
 * for events without timestamp, delay or key value.
 * </p>
 *
 * @since 1.0.0
 */
public class TrailingGroupNormalizer {

    static final String SUFFIX = "_trailing_zscore";

    private final List<String> entityKeys;

    public TrailingGroupNormalizer(List<String> entityKeys) {
        this.entityKeys = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(entityKeys, "entityKeys must not be null")));
    }

    public static String columnName(String entityKey) {
        return entityKey + SUFFIX;
    }

    public List<String> columnNames() {
        return entityKeys.stream().map(TrailingGroupNormalizer::columnName).toList();
    }

    public void apply(List<DelayEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        for (String key : entityKeys) {
            String column = columnName(key);
            Map<String, List<DelayEvent>> partitions = EventPartitions.timestampedByKey(events, key);

            for (List<DelayEvent> sorted : partitions.values()) {
                RunningMoments history = new RunningMoments();
                int start = 0;
                while (start < sorted.size()) {
                    // events sharing a timestamp are scored against the same history
                    int end = start;
                    while (end < sorted.size()
                            && sorted.get(end).getTimestamp().equals(sorted.get(start).getTimestamp())) {
                        end++;
                    }
                    for (int i = start; i < end; i++) {
                        DelayEvent event = sorted.get(i);
                        event.putFeature(column, event.hasDelay() ? history.zScore(event.getDelay()) : null);
                    }
                    for (int i = start; i < end; i++) {
                        if (sorted.get(i).hasDelay()) {
                            history.add(sorted.get(i).getDelay());
                        }
                    }
                    start = end;
                }
            }

            for (DelayEvent event : events) {
                if (!event.hasFeature(column)) {
                    event.putFeature(column, null);
                }
            }
        }
    }
}
