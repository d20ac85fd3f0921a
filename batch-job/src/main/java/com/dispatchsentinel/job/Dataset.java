package com.dispatchsentinel.job;

import com.dispatchsentinel.core.model.DelayEvent;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * A loaded input file: the header, the raw rows and the events parsed from
 * them, row for row.
 *
 * @since 1.0.0
 */
public final class Dataset {

    private final List<String> columns;
    private final List<Map<String, String>> rows;
    private final List<DelayEvent> events;
    private final Map<DelayEvent, Map<String, String>> rowByEvent = new IdentityHashMap<>();

    Dataset(List<String> columns, List<Map<String, String>> rows, List<DelayEvent> events) {
        if (rows.size() != events.size()) {
            throw new IllegalArgumentException(rows.size() + " row(s) but " + events.size() + " event(s)");
        }
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
        this.events = events;
        for (int i = 0; i < events.size(); i++) {
            rowByEvent.put(events.get(i), rows.get(i));
        }
    }

    /**
     * @return input column names in file order
     */
    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, String>> getRows() {
        return rows;
    }

    /**
     * @return the parsed events; mutable so the pipeline can enrich them
     */
    public List<DelayEvent> getEvents() {
        return events;
    }

    /**
     * @return the raw input row an event was parsed from, empty when unknown
     */
    public Map<String, String> rowOf(DelayEvent event) {
        return rowByEvent.getOrDefault(event, Collections.emptyMap());
    }

    public int size() {
        return events.size();
    }
}
