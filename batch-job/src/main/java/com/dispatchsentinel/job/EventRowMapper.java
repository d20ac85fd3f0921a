package com.dispatchsentinel.job;

import com.dispatchsentinel.core.config.DatasetSchema;
import com.dispatchsentinel.core.model.DelayEvent;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts one raw CSV row into a {@link DelayEvent}.
 *
 * <h3>Column resolution</h3>
 * <ul>
 * <li><b>Timestamp</b>: ISO-8601 instant, offset date-time, local date-time
 * ({@code T} or space separator, read as UTC) or plain date. Anything else
 * becomes {@code null}.</li>
 * <li><b>Delay</b>: the delay column when it holds a finite number, otherwise
 * {@code actual - expected} arrival in minutes.</li>
 * <li><b>Label</b>: the first configured label column present in the file;
 * {@code 1}/{@code true} is positive, {@code 0}/{@code false} negative and
 * anything else unknown.</li>
 * </ul>
 *
 * <p>
 * Parse failures are counted rather than thrown; the reader reports them
 * once per file.
 * </p>
 *
 * @since 1.0.0
 */
class EventRowMapper {

    private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private final DatasetSchema schema;
    private final Set<String> entityKeys;
    private final String labelColumn;

    private int timestampFailures;
    private int delayFailures;

    /**
     * @param schema     input column names
     * @param entityKeys entity-key dimensions to carry on each event
     * @param header     columns present in the file
     */
    EventRowMapper(DatasetSchema schema, List<String> entityKeys, List<String> header) {
        this.schema = Objects.requireNonNull(schema, "DatasetSchema must not be null");
        this.entityKeys = new LinkedHashSet<>(entityKeys);
        this.labelColumn = schema.getLabelColumns().stream()
                .filter(header::contains)
                .findFirst()
                .orElse(null);
    }

    DelayEvent map(Map<String, String> row, int rowIndex) {
        String id = value(row, schema.getIdColumn());
        DelayEvent.Builder builder = DelayEvent.builder()
                .eventId(id != null ? id : String.valueOf(rowIndex))
                .timestamp(timestamp(row))
                .delay(delay(row))
                .label(label(row));

        for (String key : entityKeys) {
            builder.entityKey(key, value(row, key));
        }
        for (String column : schema.getNumericColumns()) {
            builder.attribute(column, number(value(row, column)));
        }
        return builder.build();
    }

    String getLabelColumn() {
        return labelColumn;
    }

    int getTimestampFailures() {
        return timestampFailures;
    }

    int getDelayFailures() {
        return delayFailures;
    }

    // ---------------------------------------------------------------
    // Column parsers
    // ---------------------------------------------------------------

    private Instant timestamp(Map<String, String> row) {
        String raw = value(row, schema.getTimestampColumn());
        if (raw == null) {
            return null;
        }
        Instant parsed = parseInstant(raw);
        if (parsed == null) {
            timestampFailures++;
        }
        return parsed;
    }

    private Double delay(Map<String, String> row) {
        String raw = value(row, schema.getDelayColumn());
        if (raw != null) {
            Double parsed = number(raw);
            if (parsed != null) {
                return parsed;
            }
            delayFailures++;
        }

        String expected = value(row, schema.getExpectedArrivalColumn());
        String actual = value(row, schema.getActualArrivalColumn());
        if (expected == null || actual == null) {
            return null;
        }
        Instant expectedAt = parseInstant(expected);
        Instant actualAt = parseInstant(actual);
        if (expectedAt == null || actualAt == null) {
            delayFailures++;
            return null;
        }
        return Duration.between(expectedAt, actualAt).getSeconds() / 60.0;
    }

    private Boolean label(Map<String, String> row) {
        if (labelColumn == null) {
            return null;
        }
        String raw = value(row, labelColumn);
        if (raw == null) {
            return null;
        }
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "1":
            case "1.0":
            case "true":
                return Boolean.TRUE;
            case "0":
            case "0.0":
            case "false":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Parse the supported ISO-8601 variants; {@code null} when none match.
     */
    static Instant parseInstant(String raw) {
        try {
            TemporalAccessor parsed = TIMESTAMP.parseBest(raw.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            if (parsed instanceof LocalDateTime) {
                return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Double number(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            Double parsed = Double.valueOf(raw);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String value(Map<String, String> row, String column) {
        if (column == null) {
            return null;
        }
        String value = row.get(column);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
