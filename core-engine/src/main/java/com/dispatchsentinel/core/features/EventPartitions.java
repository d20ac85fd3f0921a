package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.model.DelayEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Groups events by the value of one entity-key dimension.
 */
final class EventPartitions {

    static final Comparator<DelayEvent> BY_TIMESTAMP = Comparator.comparing(DelayEvent::getTimestamp);

    private EventPartitions() {
        // utility class
    }

    /**
     * Partition events by key value, preserving encounter order. Events
     * without a value for the key are left out.
     */
    static Map<String, List<DelayEvent>> byKey(List<DelayEvent> events, String entityKey) {
        Map<String, List<DelayEvent>> partitions = new LinkedHashMap<>();
        for (DelayEvent event : events) {
            Optional<String> value = event.getEntityKey(entityKey);
            value.ifPresent(v -> partitions.computeIfAbsent(v, k -> new ArrayList<>()).add(event));
        }
        return partitions;
    }

    /**
     * Partition timestamped events by key value, each partition stably sorted
     * by timestamp.
     */
    static Map<String, List<DelayEvent>> timestampedByKey(List<DelayEvent> events, String entityKey) {
        List<DelayEvent> timestamped = new ArrayList<>(events.size());
        for (DelayEvent event : events) {
            if (event.hasTimestamp()) {
                timestamped.add(event);
            }
        }
        Map<String, List<DelayEvent>> partitions = byKey(timestamped, entityKey);
        for (List<DelayEvent> partition : partitions.values()) {
            partition.sort(BY_TIMESTAMP);
        }
        return partitions;
    }
}
