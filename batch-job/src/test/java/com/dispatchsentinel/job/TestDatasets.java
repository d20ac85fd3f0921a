package com.dispatchsentinel.job;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Writes synthetic dispatch CSV files for the job tests.
 */
final class TestDatasets {

    static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    private TestDatasets() {
    }

    /**
     * Two dispatches per day (routes {@code R1} and {@code R2}), delays around
     * 5 minutes and a 500-minute outlier on every 20th row.
     *
     * @param rows     number of data rows
     * @param labelled whether to add an {@code anomaly} column
     */
    static Path writeSynthetic(Path file, int rows, boolean labelled) throws IOException {
        Random random = new Random(11);
        List<String> lines = new ArrayList<>();
        lines.add("dispatch_id,timestamp,route_id,plant_id,dispatch_delay_minutes" + (labelled ? ",anomaly" : ""));
        for (int i = 0; i < rows; i++) {
            boolean outlier = i % 20 == 7;
            double delay = outlier ? 500.0 : 5.0 + 2.0 * random.nextGaussian();
            Instant ts = BASE.plus(Duration.ofDays(i / 2)).plus(Duration.ofHours(i % 2));
            String line = String.format(Locale.ROOT, "D%03d,%s,R%d,P%d,%.3f",
                    i, ts, (i % 2) + 1, (i / 2) % 2 + 1, delay);
            lines.add(labelled ? line + "," + (outlier ? 1 : 0) : line);
        }
        Files.write(file, lines, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Rows that carry neither a parseable timestamp nor a delay.
     */
    static Path writeUnusable(Path file, int rows) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("dispatch_id,timestamp,route_id,dispatch_delay_minutes");
        for (int i = 0; i < rows; i++) {
            lines.add("D" + i + ",,R1,");
        }
        Files.write(file, lines, StandardCharsets.UTF_8);
        return file;
    }
}
