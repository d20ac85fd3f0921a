package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.config.PipelineConfig;
import com.dispatchsentinel.core.model.DelayEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * The declared list of numeric columns fed to multivariate scorers.
 *
 * <p>
 * Columns are fixed by configuration rather than discovered from the data:
 * the delay, the declared numeric input attributes, {@code abs_delay} and
 * {@code hour}, every windowed column and every z-score column. The boolean
 * indicator columns and the ground-truth label are never part of the matrix.
 * </p>
 *
 * <p>
 * Missing, {@code NaN} and infinite values become {@code 0} in the matrix.
 * {@link #usableColumns(List)} narrows the registry to the columns with at
 * least one finite value in a given set of events.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureRegistry {

    private final List<FeatureExtractor> extractors;

    private FeatureRegistry(List<FeatureExtractor> extractors) {
        this.extractors = Collections.unmodifiableList(new ArrayList<>(extractors));
    }

    /**
     * @param extractors columns in matrix order; must not be {@code null}
     * @return a registry over exactly these columns
     */
    public static FeatureRegistry of(List<FeatureExtractor> extractors) {
        return new FeatureRegistry(Objects.requireNonNull(extractors, "extractors must not be null"));
    }

    /**
     * Build the registry matching what {@link FeatureEnricher} attaches under
     * the given configuration.
     *
     * @param config the pipeline configuration; must not be {@code null}
     * @return the registry
     */
    public static FeatureRegistry forConfig(PipelineConfig config) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");

        List<FeatureExtractor> columns = new ArrayList<>();
        columns.add(delay(config.getSchema().getDelayColumn()));
        for (String attribute : config.getSchema().getNumericColumns()) {
            columns.add(attribute(attribute));
        }
        columns.add(derived(DispatchFeatureBuilder.ABS_DELAY));
        columns.add(derived(DispatchFeatureBuilder.HOUR));

        WindowedFeatureBuilder windowed = new WindowedFeatureBuilder(config.getEntityKeys(), config.windowSpecs());
        for (String name : windowed.columnNames()) {
            columns.add(derived(name));
        }
        for (String name : new GroupNormalizer(config.getZscoreKeys()).columnNames()) {
            columns.add(derived(name));
        }
        if (config.isTrailingZScore()) {
            for (String name : new TrailingGroupNormalizer(config.getZscoreKeys()).columnNames()) {
                columns.add(derived(name));
            }
        }
        return new FeatureRegistry(columns);
    }

    // ---------------------------------------------------------------
    // Extractors
    // ---------------------------------------------------------------

    /**
     * @param name column name to report, e.g. {@code dispatch_delay_minutes}
     * @return extractor for the delay metric
     */
    public static FeatureExtractor delay(String name) {
        return column(name == null || name.isBlank() ? "delay" : name, DelayEvent::getDelay);
    }

    public static FeatureExtractor attribute(String name) {
        return column(name, event -> event.getAttributes().get(name));
    }

    public static FeatureExtractor derived(String name) {
        return column(name, event -> event.getFeature(name).orElse(null));
    }

    private static FeatureExtractor column(String name, Function<DelayEvent, Double> reader) {
        Objects.requireNonNull(name, "Column name must not be null");
        return new FeatureExtractor() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Double extract(DelayEvent event) {
                return reader.apply(event);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    // ---------------------------------------------------------------
    // Matrix
    // ---------------------------------------------------------------

    public List<FeatureExtractor> getExtractors() {
        return extractors;
    }

    /**
     * @param events the events a model would be fitted on
     * @return the columns having at least one finite value among {@code events}
     */
    public List<FeatureExtractor> usableColumns(List<DelayEvent> events) {
        List<FeatureExtractor> usable = new ArrayList<>();
        for (FeatureExtractor extractor : extractors) {
            for (DelayEvent event : events) {
                if (isFinite(extractor.extract(event))) {
                    usable.add(extractor);
                    break;
                }
            }
        }
        return usable;
    }

    /**
     * Build a dense matrix, one row per event, one column per extractor.
     *
     * @param events  rows
     * @param columns columns
     * @return the matrix with missing values replaced by {@code 0}
     */
    public static double[][] toMatrix(List<DelayEvent> events, List<FeatureExtractor> columns) {
        double[][] matrix = new double[events.size()][columns.size()];
        for (int i = 0; i < events.size(); i++) {
            DelayEvent event = events.get(i);
            for (int j = 0; j < columns.size(); j++) {
                Double value = columns.get(j).extract(event);
                matrix[i][j] = isFinite(value) ? value : 0.0;
            }
        }
        return matrix;
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }

    @Override
    public String toString() {
        return "FeatureRegistry" + extractors;
    }
}
