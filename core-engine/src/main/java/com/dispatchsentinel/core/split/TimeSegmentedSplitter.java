package com.dispatchsentinel.core.split;

import com.dispatchsentinel.core.model.DelayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Expanding-window walk-forward splitter over calendar dates.
 *
 * <p>
 * The distinct UTC dates of the timestamped events are cut into {@code k}
 * contiguous, near-equal segments; fold {@code i} trains on segments
 * {@code 0..i} and tests on segment {@code i + 1}. When the data spans fewer
 * dates than requested, {@code k} drops to {@code max(2, dates)}. Folds with
 * an empty side are skipped.
 * </p>
 *
 * <h3>Fallback</h3>
 * <p>
 * When no event carries a timestamp the splitter cuts the event list into
 * contiguous row chunks instead. Those folds are marked non-temporal: they
 * give no protection against look-ahead leakage.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSegmentedSplitter {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSegmentedSplitter.class);

    private static final Comparator<DelayEvent> BY_TIMESTAMP = Comparator.comparing(DelayEvent::getTimestamp);

    private final int splitCount;

    /**
     * @param splitCount requested number of segments, at least 2
     * @throws IllegalArgumentException if {@code splitCount < 2}
     */
    public TimeSegmentedSplitter(int splitCount) {
        if (splitCount < 2) {
            throw new IllegalArgumentException("splitCount must be >= 2, got: " + splitCount);
        }
        this.splitCount = splitCount;
    }

    /**
     * Split the dataset into walk-forward folds.
     *
     * @param events the enriched dataset; must not be {@code null}
     * @return the emitted folds, at most {@code splitCount - 1}
     */
    public List<Fold> split(List<DelayEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        Map<LocalDate, List<DelayEvent>> byDate = new TreeMap<>();
        for (DelayEvent event : events) {
            if (event.hasTimestamp()) {
                LocalDate date = event.getTimestamp().atZone(ZoneOffset.UTC).toLocalDate();
                byDate.computeIfAbsent(date, d -> new ArrayList<>()).add(event);
            }
        }

        if (byDate.isEmpty()) {
            LOG.warn("No event carries a timestamp; falling back to row-index folds "
                    + "(no temporal leakage protection)");
            return splitByRows(events);
        }

        int timestamped = byDate.values().stream().mapToInt(List::size).sum();
        if (timestamped < events.size()) {
            LOG.warn("{} event(s) without timestamp excluded from temporal folds", events.size() - timestamped);
        }

        List<List<DelayEvent>> days = new ArrayList<>(byDate.values());
        int k = splitCount;
        if (days.size() < k) {
            k = Math.max(2, days.size());
            LOG.info("Only {} distinct date(s) for {} requested splits; using {}", days.size(), splitCount, k);
        }

        List<List<DelayEvent>> segments = new ArrayList<>(k);
        for (int[] bounds : segmentBounds(days.size(), k)) {
            List<DelayEvent> segment = new ArrayList<>();
            for (int d = bounds[0]; d < bounds[1]; d++) {
                segment.addAll(days.get(d));
            }
            segment.sort(BY_TIMESTAMP);
            segments.add(segment);
        }

        return expandingFolds(segments, true);
    }

    private List<Fold> splitByRows(List<DelayEvent> events) {
        List<List<DelayEvent>> segments = new ArrayList<>(splitCount);
        for (int[] bounds : segmentBounds(events.size(), splitCount)) {
            segments.add(new ArrayList<>(events.subList(bounds[0], bounds[1])));
        }
        return expandingFolds(segments, false);
    }

    private static List<Fold> expandingFolds(List<List<DelayEvent>> segments, boolean temporal) {
        List<Fold> folds = new ArrayList<>();
        List<DelayEvent> train = new ArrayList<>();
        for (int i = 0; i < segments.size() - 1; i++) {
            train.addAll(segments.get(i));
            List<DelayEvent> test = segments.get(i + 1);
            if (train.isEmpty() || test.isEmpty()) {
                LOG.debug("Skipping degenerate fold after segment {}: train={} test={}",
                        i, train.size(), test.size());
                continue;
            }
            folds.add(new Fold(folds.size() + 1, train, test, temporal));
        }
        LOG.info("Built {} {} fold(s)", folds.size(), temporal ? "date-segmented" : "row-index");
        return folds;
    }

    /**
     * Cut {@code n} items into {@code k} contiguous ranges whose sizes differ
     * by at most one, larger ranges first.
     *
     * @return {@code k} half-open {@code [from, to)} ranges
     */
    static List<int[]> segmentBounds(int n, int k) {
        List<int[]> bounds = new ArrayList<>(k);
        int base = n / k;
        int extra = n % k;
        int from = 0;
        for (int i = 0; i < k; i++) {
            int size = base + (i < extra ? 1 : 0);
            bounds.add(new int[] { from, from + size });
            from += size;
        }
        return bounds;
    }

    public int getSplitCount() {
        return splitCount;
    }
}
