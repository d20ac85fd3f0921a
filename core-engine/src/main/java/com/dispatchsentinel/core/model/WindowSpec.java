package com.dispatchsentinel.core.model;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A trailing look-back window, e.g. {@code 7D} or {@code 12H}.
 *
 * <p>
 * The label is used verbatim as the suffix of windowed feature columns
 * ({@code route_id_mean_7D}). Supported units: {@code D} (days), {@code H}
 * (hours) and {@code M} (minutes).
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowSpec {

    private static final Pattern LABEL = Pattern.compile("(\\d+)([DHM])");

    private final String label;
    private final Duration duration;

    private WindowSpec(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    /**
     * Parse a window label.
     *
     * @param label e.g. {@code "7D"}, {@code "30d"}, {@code "12H"}
     * @return the window
     * @throws NullPointerException     if {@code label} is {@code null}
     * @throws IllegalArgumentException if the label is malformed or not positive
     */
    public static WindowSpec parse(String label) {
        Objects.requireNonNull(label, "Window label must not be null");
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        Matcher m = LABEL.matcher(normalized);
        if (!m.matches()) {
            throw new IllegalArgumentException(
                    "Invalid window label: '" + label + "'. Expected <n>D, <n>H or <n>M");
        }
        long amount = Long.parseLong(m.group(1));
        if (amount <= 0) {
            throw new IllegalArgumentException("Window label must be positive, got: '" + label + "'");
        }
        Duration duration = switch (m.group(2)) {
            case "D" -> Duration.ofDays(amount);
            case "H" -> Duration.ofHours(amount);
            default -> Duration.ofMinutes(amount);
        };
        return new WindowSpec(normalized, duration);
    }

    public static WindowSpec ofDays(int days) {
        return parse(days + "D");
    }

    public String getLabel() {
        return label;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowSpec that))
            return false;
        return label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return label.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
