package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.model.WindowSpec;
import com.dispatchsentinel.core.model.WindowStatistic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attaches causal trailing-window aggregates of the delay metric per entity
 * group.
 *
 * <p>
 * For every event {@code e} and every configured {@code (entity key, window)}
 * pair, the statistics cover the delays of all events sharing {@code e}'s key
 * value whose timestamp lies in {@code [e.ts - duration, e.ts]}, bounds
 * inclusive. Events with the same timestamp see each other; events with a
 * later timestamp are never visible.
 * </p>
 *
 * <h3>Algorithm</h3>
 * <p>
 * Each partition is sorted by timestamp once and walked with two pointers:
 * the upper pointer admits every event at or before the cursor's timestamp,
 * the lower pointer evicts events older than the window's lower bound. Each
 * event enters and leaves the {@link SlidingWindowAccumulator} at most once.
 * </p>
 *
 * <h3>Missing data</h3>
 * <ul>
 * <li>Events without a timestamp or without a value for the key get
 * {@code null} columns and contribute to no window.</li>
 * <li>Events without a delay are windowed but add no value; a window with no
 * values has a count of 0 and {@code null} mean, median and std.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class WindowedFeatureBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(WindowedFeatureBuilder.class);

    private final List<String> entityKeys;
    private final List<WindowSpec> windows;

    /**
     * @param entityKeys grouping dimensions; must not be {@code null}
     * @param windows    trailing windows; must not be {@code null}
     */
    public WindowedFeatureBuilder(List<String> entityKeys, List<WindowSpec> windows) {
        this.entityKeys = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(entityKeys, "entityKeys must not be null")));
        this.windows = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(windows, "windows must not be null")));
    }

    /**
     * Column names this builder attaches, in attachment order.
     *
     * @return unmodifiable list of column names
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>();
        for (String key : entityKeys) {
            for (WindowSpec window : windows) {
                for (WindowStatistic stat : WindowStatistic.values()) {
                    names.add(stat.columnName(key, window));
                }
            }
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * Attach the windowed columns to every event. The list order is left
     * untouched.
     *
     * @param events the dataset; must not be {@code null}
     */
    public void apply(List<DelayEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        long untimed = events.stream().filter(e -> !e.hasTimestamp()).count();
        if (untimed > 0) {
            LOG.warn("{} of {} events have no timestamp and are excluded from windowed features",
                    untimed, events.size());
        }

        for (String key : entityKeys) {
            Map<String, List<DelayEvent>> partitions = EventPartitions.timestampedByKey(events, key);
            LOG.debug("Windowing '{}' over {} partition(s)", key, partitions.size());

            for (WindowSpec window : windows) {
                for (List<DelayEvent> partition : partitions.values()) {
                    applyTrailing(partition, key, window);
                }
                String probe = WindowStatistic.MEAN.columnName(key, window);
                for (DelayEvent event : events) {
                    if (!event.hasFeature(probe)) {
                        attach(event, key, window, null, null, null, null);
                    }
                }
            }
        }
    }

    /**
     * Slide one window over a partition sorted by timestamp.
     */
    private void applyTrailing(List<DelayEvent> sorted, String key, WindowSpec window) {
        SlidingWindowAccumulator acc = new SlidingWindowAccumulator();
        int n = sorted.size();
        int lo = 0;
        int hi = 0;

        for (int i = 0; i < n; i++) {
            DelayEvent current = sorted.get(i);
            Instant upper = current.getTimestamp();
            Instant lower = upper.minus(window.getDuration());

            while (hi < n && !sorted.get(hi).getTimestamp().isAfter(upper)) {
                DelayEvent entering = sorted.get(hi);
                if (entering.hasDelay()) {
                    acc.add(entering.getDelay());
                }
                hi++;
            }
            while (lo < hi && sorted.get(lo).getTimestamp().isBefore(lower)) {
                if (sorted.get(lo).hasDelay()) {
                    acc.removeOldest();
                }
                lo++;
            }

            attach(current, key, window, acc.mean(), acc.median(), acc.std(), (double) acc.count());
        }
    }

    private static void attach(DelayEvent event, String key, WindowSpec window,
            Double mean, Double median, Double std, Double count) {
        event.putFeature(WindowStatistic.MEAN.columnName(key, window), mean);
        event.putFeature(WindowStatistic.MEDIAN.columnName(key, window), median);
        event.putFeature(WindowStatistic.STD.columnName(key, window), std);
        event.putFeature(WindowStatistic.COUNT.columnName(key, window), count);
    }
}
