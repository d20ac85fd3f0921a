package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.model.DelayEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dispatchsentinel.core.testutil.TestEvents.day;
import static com.dispatchsentinel.core.testutil.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link GroupNormalizer} and {@link TrailingGroupNormalizer}.
 */
class GroupNormalizerTest {

    @Test
    @DisplayName("Should standardize the delay within each group over the whole dataset")
    void shouldStandardizePerGroup() {
        List<DelayEvent> events = List.of(
                event("a", "R1", day(0), 2.0),
                event("b", "R1", day(1), 4.0),
                event("c", "R2", day(0), 100.0),
                event("d", "R2", day(1), 300.0));

        new GroupNormalizer(List.of("route_id")).apply(events);

        assertThat(events.get(0).getFeature("route_id_zscore").orElseThrow()).isCloseTo(-1.0, within(1e-12));
        assertThat(events.get(1).getFeature("route_id_zscore").orElseThrow()).isCloseTo(1.0, within(1e-12));
        assertThat(events.get(3).getFeature("route_id_zscore").orElseThrow()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should yield NaN for a group with zero delay variance")
    void shouldYieldNaNForZeroVariance() {
        List<DelayEvent> events = List.of(
                event("a", "R1", day(0), 7.0),
                event("b", "R1", day(1), 7.0),
                event("c", "R1", day(2), 7.0));

        new GroupNormalizer(List.of("route_id")).apply(events);

        assertThat(events).allSatisfy(e -> assertThat(e.getFeature("route_id_zscore").orElseThrow()).isNaN());
    }

    @Test
    @DisplayName("Should leave the z-score missing when key or delay is missing")
    void shouldSkipMissingKeyOrDelay() {
        DelayEvent noDelay = event("a", "R1", day(0), null);
        DelayEvent noKey = DelayEvent.builder().eventId("b").timestamp(day(0)).delay(3.0).build();

        new GroupNormalizer(List.of("route_id")).apply(List.of(noDelay, noKey));

        assertThat(noDelay.hasFeature("route_id_zscore")).isTrue();
        assertThat(noDelay.getFeature("route_id_zscore")).isEmpty();
        assertThat(noKey.getFeature("route_id_zscore")).isEmpty();
    }

    @Test
    @DisplayName("Trailing variant should use strictly earlier events only")
    void trailingShouldUseEarlierEventsOnly() {
        List<DelayEvent> events = List.of(
                event("a", "R1", day(0), 2.0),
                event("b", "R1", day(1), 4.0),
                event("c", "R1", day(2), 6.0),
                event("d", "R1", day(3), 1_000.0));

        new TrailingGroupNormalizer(List.of("route_id")).apply(events);

        String column = TrailingGroupNormalizer.columnName("route_id");
        assertThat(column).isEqualTo("route_id_trailing_zscore");
        assertThat(events.get(0).getFeature(column).orElseThrow()).isNaN();
        assertThat(events.get(1).getFeature(column).orElseThrow()).isNaN();
        // history {2, 4}: mean 3, std 1
        assertThat(events.get(2).getFeature(column).orElseThrow()).isCloseTo(3.0, within(1e-12));
        assertThat(events.get(3).getFeature(column).orElseThrow()).isGreaterThan(100.0);
    }

    @Test
    @DisplayName("Trailing variant should score simultaneous events against the same history")
    void trailingShouldShareHistoryForEqualTimestamps() {
        List<DelayEvent> events = List.of(
                event("a", "R1", day(0), 2.0),
                event("b", "R1", day(0), 4.0),
                event("c", "R1", day(1), 5.0),
                event("d", "R1", day(1), 1.0));

        new TrailingGroupNormalizer(List.of("route_id")).apply(events);

        String column = TrailingGroupNormalizer.columnName("route_id");
        assertThat(events.get(0).getFeature(column).orElseThrow()).isNaN();
        assertThat(events.get(1).getFeature(column).orElseThrow()).isNaN();
        assertThat(events.get(2).getFeature(column).orElseThrow()).isCloseTo(2.0, within(1e-12));
        assertThat(events.get(3).getFeature(column).orElseThrow()).isCloseTo(-2.0, within(1e-12));
    }

    @Test
    @DisplayName("Should leave an infinite delay out of the group moments")
    void shouldIgnoreInfiniteDelay() {
        List<DelayEvent> events = List.of(
                event("a", "R1", day(0), Double.POSITIVE_INFINITY),
                event("b", "R1", day(1), 1.0),
                event("c", "R1", day(2), 3.0));

        new GroupNormalizer(List.of("route_id")).apply(events);

        assertThat(events.get(0).getFeature("route_id_zscore")).isEmpty();
        assertThat(events.get(1).getFeature("route_id_zscore").orElseThrow()).isCloseTo(-1.0, within(1e-12));
        assertThat(events.get(2).getFeature("route_id_zscore").orElseThrow()).isCloseTo(1.0, within(1e-12));
    }
}
