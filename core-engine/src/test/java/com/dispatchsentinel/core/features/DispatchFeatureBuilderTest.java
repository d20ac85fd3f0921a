package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.model.DelayEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.dispatchsentinel.core.testutil.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DispatchFeatureBuilder}.
 */
class DispatchFeatureBuilderTest {

    private final DispatchFeatureBuilder builder = new DispatchFeatureBuilder();

    @Test
    @DisplayName("Should derive magnitude, lateness, hour and weekend flags in UTC")
    void shouldDeriveDispatchColumns() {
        // Saturday 2024-01-06, 23:30 UTC
        DelayEvent early = event("a", "R1", Instant.parse("2024-01-06T23:30:00Z"), -20.0);
        // Monday 2024-01-08, 08:15 UTC
        DelayEvent late = event("b", "R1", Instant.parse("2024-01-08T08:15:00Z"), 16.0);

        builder.apply(List.of(early, late));

        assertThat(early.getFeature(DispatchFeatureBuilder.ABS_DELAY)).contains(20.0);
        assertThat(early.getFeature(DispatchFeatureBuilder.IS_DELAYED)).contains(0.0);
        assertThat(early.getFeature(DispatchFeatureBuilder.HOUR)).contains(23.0);
        assertThat(early.getFeature(DispatchFeatureBuilder.IS_WEEKEND)).contains(1.0);

        assertThat(late.getFeature(DispatchFeatureBuilder.IS_DELAYED)).contains(1.0);
        assertThat(late.getFeature(DispatchFeatureBuilder.HOUR)).contains(8.0);
        assertThat(late.getFeature(DispatchFeatureBuilder.IS_WEEKEND)).contains(0.0);
    }

    @Test
    @DisplayName("Should treat exactly 15 minutes as not delayed")
    void shouldUseStrictLatenessThreshold() {
        DelayEvent boundary = event("a", "R1", Instant.parse("2024-01-08T00:00:00Z"), 15.0);

        builder.apply(List.of(boundary));

        assertThat(boundary.getFeature(DispatchFeatureBuilder.IS_DELAYED)).contains(0.0);
    }

    @Test
    @DisplayName("Should leave columns missing when their inputs are missing")
    void shouldLeaveMissingInputsEmpty() {
        DelayEvent bare = event("a", "R1", null, null);

        builder.apply(List.of(bare));

        assertThat(bare.getFeatures()).containsOnlyKeys(builder.columnNames());
        assertThat(bare.getFeatures().values()).containsOnlyNulls();
    }
}
