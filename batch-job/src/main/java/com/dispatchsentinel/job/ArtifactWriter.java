package com.dispatchsentinel.job;

import com.dispatchsentinel.core.evaluation.RunReport;
import com.dispatchsentinel.core.model.DelayEvent;
import com.dispatchsentinel.core.pipeline.FlaggedEvent;
import com.dispatchsentinel.core.pipeline.PipelineResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Writes the three run artifacts into the output directory.
 *
 * <ul>
 * <li>{@value #FEATURES_FILE}: input columns plus every derived column</li>
 * <li>{@value #REPORT_FILE}: the walk-forward {@link RunReport}</li>
 * <li>{@value #FLAGGED_FILE}: the ranked production table</li>
 * </ul>
 *
 * <p>
 * Each file is written next to its target under a temporary name and then
 * moved into place, so readers never observe a partial artifact. Missing and
 * {@code NaN} values are written as empty cells.
 * </p>
 *
 * @since 1.0.0
 */
public class ArtifactWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactWriter.class);

    public static final String FEATURES_FILE = "dispatch_features.csv";
    public static final String REPORT_FILE = "baseline_report.json";
    public static final String FLAGGED_FILE = "flagged_anomalies.csv";

    public static final String ISOLATION_SCORE = "isolation_score";
    public static final String ISOLATION_ANOMALY = "isolation_anomaly";
    public static final String DELAY_ZSCORE = "delay_zscore";
    public static final String ZSCORE_ANOMALY = "zscore_anomaly";
    public static final String COMBINED_ANOMALY = "combined_anomaly";

    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper jsonMapper;
    private final Path outputDir;
    private final String delayColumn;

    /**
     * @param outputDir   directory to write into; created when missing
     * @param delayColumn name under which the delay is written when the input
     *                    file did not carry it
     */
    public ArtifactWriter(Path outputDir, String delayColumn) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir must not be null");
        this.delayColumn = Objects.requireNonNull(delayColumn, "delayColumn must not be null");
        this.jsonMapper = new ObjectMapper();
        jsonMapper.registerModule(new JavaTimeModule());
        jsonMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Write all artifacts of a run.
     *
     * @throws UncheckedIOException if a file cannot be written
     */
    public void writeAll(Dataset dataset, PipelineResult result) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + outputDir, e);
        }
        writeFeatures(dataset, result.getFeatureColumns());
        writeReport(result.getReport());
        writeFlagged(dataset, result.getFeatureColumns(), result.getFlagged());
    }

    public Path writeFeatures(Dataset dataset, List<String> featureColumns) {
        List<String> columns = featureTableColumns(dataset, featureColumns);
        List<Map<String, String>> rows = new ArrayList<>(dataset.size());
        for (DelayEvent event : dataset.getEvents()) {
            rows.add(featureRow(dataset, event, featureColumns));
        }
        return writeCsv(FEATURES_FILE, columns, rows);
    }

    public Path writeReport(RunReport report) {
        Path target = outputDir.resolve(REPORT_FILE);
        writeAtomically(target, out -> jsonMapper.writeValue(out, report));
        LOG.info("Wrote evaluation report with {} fold(s) to {}", report.getNFolds(), target);
        return target;
    }

    public Path writeFlagged(Dataset dataset, List<String> featureColumns, List<FlaggedEvent> flagged) {
        boolean combined = flagged.stream().anyMatch(f -> f.getCombinedAnomaly() != null);

        List<String> columns = featureTableColumns(dataset, featureColumns);
        columns.add(ISOLATION_SCORE);
        columns.add(ISOLATION_ANOMALY);
        columns.add(DELAY_ZSCORE);
        columns.add(ZSCORE_ANOMALY);
        if (combined) {
            columns.add(COMBINED_ANOMALY);
        }

        List<Map<String, String>> rows = new ArrayList<>(flagged.size());
        for (FlaggedEvent f : flagged) {
            Map<String, String> row = featureRow(dataset, f.getEvent(), featureColumns);
            row.put(ISOLATION_SCORE, format(f.getIsolationScore()));
            row.put(ISOLATION_ANOMALY, format(f.getIsolationAnomaly()));
            row.put(DELAY_ZSCORE, format(f.getDelayZscore()));
            row.put(ZSCORE_ANOMALY, format(f.isZscoreAnomaly()));
            if (combined) {
                row.put(COMBINED_ANOMALY, format(f.getCombinedAnomaly()));
            }
            rows.add(row);
        }
        return writeCsv(FLAGGED_FILE, columns, rows);
    }

    // ---------------------------------------------------------------
    // Table helpers
    // ---------------------------------------------------------------

    private List<String> featureTableColumns(Dataset dataset, List<String> featureColumns) {
        Set<String> columns = new LinkedHashSet<>(dataset.getColumns());
        columns.add(delayColumn);
        columns.addAll(featureColumns);
        return new ArrayList<>(columns);
    }

    private Map<String, String> featureRow(Dataset dataset, DelayEvent event, List<String> featureColumns) {
        Map<String, String> row = new LinkedHashMap<>(dataset.rowOf(event));
        if (!dataset.getColumns().contains(delayColumn)) {
            row.put(delayColumn, format(event.getDelay()));
        }
        for (String column : featureColumns) {
            row.put(column, format(event.getFeature(column).orElse(null)));
        }
        return row;
    }

    private Path writeCsv(String fileName, List<String> columns, List<Map<String, String>> rows) {
        CsvSchema schema = CsvSchema.builder()
                .addColumns(columns, CsvSchema.ColumnType.STRING)
                .build()
                .withHeader();
        Path target = outputDir.resolve(fileName);
        writeAtomically(target, out -> {
            try (SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
                writer.writeAll(rows);
            }
        });
        LOG.info("Wrote {} row(s) x {} column(s) to {}", rows.size(), columns.size(), target);
        return target;
    }

    static String format(Double value) {
        return value == null || value.isNaN() || value.isInfinite() ? "" : String.valueOf(value);
    }

    static String format(Boolean value) {
        return value == null ? "" : String.valueOf(value);
    }

    // ---------------------------------------------------------------
    // Atomic file replacement
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface StreamWriter {
        void write(OutputStream out) throws IOException;
    }

    private void writeAtomically(Path target, StreamWriter content) {
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                content.write(out);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported for {}; replacing non-atomically", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
