package com.dispatchsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WindowSpec} and {@link WindowStatistic}.
 */
class WindowSpecTest {

    @Test
    @DisplayName("Should parse day, hour and minute labels case-insensitively")
    void shouldParseLabels() {
        assertThat(WindowSpec.parse("7D").getDuration()).isEqualTo(Duration.ofDays(7));
        assertThat(WindowSpec.parse("12h").getDuration()).isEqualTo(Duration.ofHours(12));
        assertThat(WindowSpec.parse(" 30M ").getDuration()).isEqualTo(Duration.ofMinutes(30));
        assertThat(WindowSpec.parse("30d").getLabel()).isEqualTo("30D");
    }

    @Test
    @DisplayName("Should reject malformed and non-positive labels")
    void shouldRejectInvalidLabels() {
        assertThatThrownBy(() -> WindowSpec.parse("7X"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid window label");
        assertThatThrownBy(() -> WindowSpec.parse("0D"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }

    @Test
    @DisplayName("Should name columns as <key>_<stat>_<window>")
    void shouldBuildColumnNames() {
        WindowSpec week = WindowSpec.ofDays(7);

        assertThat(WindowStatistic.MEAN.columnName("route_id", week)).isEqualTo("route_id_mean_7D");
        assertThat(WindowStatistic.COUNT.columnName("plant_id", week)).isEqualTo("plant_id_count_7D");
        assertThat(week).isEqualTo(WindowSpec.parse("7d"));
    }
}
