package com.dispatchsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single timestamped dispatch record carrying a delay metric.
 *
 * <p>
 * The schema is fixed and resolved once at ingestion: an identifier, one value
 * per configured entity-key dimension (e.g. {@code route_id}, {@code plant_id}),
 * an optional timestamp, the delay in minutes, an optional ground-truth label
 * and any declared extra numeric attributes.
 * </p>
 *
 * <h3>Derived features</h3>
 * <p>
 * Feature builders attach derived columns through
 * {@link #putFeature(String, Double)}. Features are append-only: a column can
 * be attached once, and the insertion order is preserved so that artifact
 * columns come out in a stable order.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. The pipeline is a
 * single-threaded batch job.
 * </p>
 *
 * @since 1.0.0
 */
public class DelayEvent {

    private final String eventId;
    private final Map<String, String> entityKeys;
    private final Instant timestamp;
    private final Double delay;
    private final Boolean label;
    private final Map<String, Double> attributes;

    /** Derived columns, in attachment order. Values may be null or NaN. */
    private final Map<String, Double> features = new LinkedHashMap<>();

    private DelayEvent(Builder builder) {
        this.eventId = Objects.requireNonNull(builder.eventId, "eventId must not be null");
        this.entityKeys = Collections.unmodifiableMap(new LinkedHashMap<>(builder.entityKeys));
        this.timestamp = builder.timestamp;
        this.delay = builder.delay;
        this.label = builder.label;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getEventId() {
        return eventId;
    }

    /**
     * @return unmodifiable map of entity-key dimension to value
     */
    public Map<String, String> getEntityKeys() {
        return entityKeys;
    }

    /**
     * Value of one entity-key dimension.
     *
     * @param dimension the key column, e.g. {@code route_id}
     * @return optional value, empty when absent or blank
     */
    public Optional<String> getEntityKey(String dimension) {
        String value = entityKeys.get(dimension);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    /**
     * @return the event timestamp, or {@code null} when unknown
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    /**
     * @return the delay metric in minutes, or {@code null} when unknown
     */
    public Double getDelay() {
        return delay;
    }

    /**
     * @return whether the delay is known and finite; non-finite delays take
     *         no part in any aggregate
     */
    public boolean hasDelay() {
        return delay != null && Double.isFinite(delay);
    }

    /**
     * @return the ground-truth label, or {@code null} when not supplied
     */
    public Boolean getLabel() {
        return label;
    }

    /**
     * @return unmodifiable map of declared extra numeric input columns
     */
    public Map<String, Double> getAttributes() {
        return attributes;
    }

    // ---------------------------------------------------------------
    // Derived features
    // ---------------------------------------------------------------

    /**
     * Attach a derived column.
     *
     * @param name  column name; must not be {@code null}
     * @param value the value; {@code null} marks "not computable"
     * @throws IllegalStateException if a column of that name is already attached
     */
    public void putFeature(String name, Double value) {
        Objects.requireNonNull(name, "Feature name must not be null");
        if (features.containsKey(name)) {
            throw new IllegalStateException(
                    "Feature '" + name + "' already attached to event " + eventId);
        }
        features.put(name, value);
    }

    /**
     * @param name column name
     * @return optional value, empty when not attached or attached as null
     */
    public Optional<Double> getFeature(String name) {
        return Optional.ofNullable(features.get(name));
    }

    public boolean hasFeature(String name) {
        return features.containsKey(name);
    }

    /**
     * @return unmodifiable view of the derived columns in attachment order
     */
    public Map<String, Double> getFeatures() {
        return Collections.unmodifiableMap(features);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DelayEvent} instances.
     *
     * <p>
     * {@code eventId} is <strong>required</strong>.
     * </p>
     */
    public static class Builder {
        private String eventId;
        private final Map<String, String> entityKeys = new LinkedHashMap<>();
        private Instant timestamp;
        private Double delay;
        private Boolean label;
        private final Map<String, Double> attributes = new LinkedHashMap<>();

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder entityKey(String dimension, String value) {
            this.entityKeys.put(Objects.requireNonNull(dimension, "dimension must not be null"), value);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder delay(Double delay) {
            this.delay = delay;
            return this;
        }

        public Builder label(Boolean label) {
            this.label = label;
            return this;
        }

        public Builder attribute(String name, Double value) {
            this.attributes.put(Objects.requireNonNull(name, "attribute name must not be null"), value);
            return this;
        }

        /**
         * @return a new {@link DelayEvent}
         * @throws NullPointerException if {@code eventId} is {@code null}
         */
        public DelayEvent build() {
            return new DelayEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DelayEvent that))
            return false;
        return Objects.equals(eventId, that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "DelayEvent{" +
                "eventId='" + eventId + '\'' +
                ", entityKeys=" + entityKeys +
                ", timestamp=" + timestamp +
                ", delay=" + delay +
                ", label=" + label +
                '}';
    }
}
