package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.config.PipelineConfig;
import com.dispatchsentinel.core.model.DelayEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dispatchsentinel.core.testutil.TestEvents.day;
import static com.dispatchsentinel.core.testutil.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FeatureRegistry} and {@link FeatureEnricher}.
 */
class FeatureRegistryTest {

    @Test
    @DisplayName("Should declare delay, attributes, dispatch, windowed and z-score columns in order")
    void shouldDeclareColumnsFromConfig() {
        PipelineConfig config = new PipelineConfig();
        config.setEntityKeys(List.of("route_id"));
        config.setWindows(List.of("7D"));
        config.getSchema().setNumericColumns(List.of("distance_km"));
        config.setTrailingZScore(true);

        List<String> names = FeatureRegistry.forConfig(config).getExtractors().stream()
                .map(FeatureExtractor::getName)
                .toList();

        assertThat(names).containsExactly(
                "dispatch_delay_minutes", "distance_km", "abs_delay", "hour",
                "route_id_mean_7D", "route_id_median_7D", "route_id_std_7D", "route_id_count_7D",
                "route_id_zscore", "route_id_trailing_zscore");
    }

    @Test
    @DisplayName("Should never expose the label or boolean indicators as features")
    void shouldExcludeLabelAndIndicators() {
        List<String> names = FeatureRegistry.forConfig(new PipelineConfig()).getExtractors().stream()
                .map(FeatureExtractor::getName)
                .toList();

        assertThat(names).doesNotContain("anomaly", "label", "is_anomaly",
                DispatchFeatureBuilder.IS_WEEKEND, DispatchFeatureBuilder.IS_DELAYED);
    }

    @Test
    @DisplayName("Should keep only columns with at least one finite value")
    void shouldSelectUsableColumns() {
        FeatureRegistry registry = FeatureRegistry.of(List.of(
                FeatureRegistry.delay("delay"),
                FeatureRegistry.attribute("distance_km"),
                FeatureRegistry.derived("route_id_zscore")));
        DelayEvent a = DelayEvent.builder().eventId("a").delay(1.0).attribute("distance_km", null).build();
        a.putFeature("route_id_zscore", Double.NaN);
        DelayEvent b = DelayEvent.builder().eventId("b").delay(null).attribute("distance_km", 12.5).build();
        b.putFeature("route_id_zscore", null);

        List<FeatureExtractor> usable = registry.usableColumns(List.of(a, b));

        assertThat(usable).extracting(FeatureExtractor::getName).containsExactly("delay", "distance_km");
    }

    @Test
    @DisplayName("Should fill missing and NaN matrix cells with 0")
    void shouldFillMatrixGaps() {
        List<FeatureExtractor> columns = List.of(
                FeatureRegistry.delay("delay"),
                FeatureRegistry.derived("route_id_zscore"));
        DelayEvent a = event("a", "R1", day(0), 4.0);
        a.putFeature("route_id_zscore", Double.NaN);
        DelayEvent b = event("b", "R1", day(0), null);
        b.putFeature("route_id_zscore", -1.5);

        double[][] matrix = FeatureRegistry.toMatrix(List.of(a, b), columns);

        assertThat(matrix[0]).containsExactly(4.0, 0.0);
        assertThat(matrix[1]).containsExactly(0.0, -1.5);
    }

    @Test
    @DisplayName("Enricher should attach exactly the columns it declares")
    void enricherShouldAttachDeclaredColumns() {
        PipelineConfig config = new PipelineConfig();
        config.setTrailingZScore(true);
        FeatureEnricher enricher = new FeatureEnricher(config);
        List<DelayEvent> events = List.of(
                event("a", "R1", "P1", day(0), 3.0, null),
                event("b", "R1", "P2", day(1), 5.0, null));

        enricher.enrich(events);

        assertThat(events.get(1).getFeatures().keySet()).containsExactlyElementsOf(enricher.columnNames());
        List<String> registryColumns = FeatureRegistry.forConfig(config).getExtractors().stream()
                .map(FeatureExtractor::getName)
                .filter(name -> !name.equals(config.getSchema().getDelayColumn()))
                .toList();
        assertThat(enricher.columnNames()).containsAll(registryColumns);
    }
}
