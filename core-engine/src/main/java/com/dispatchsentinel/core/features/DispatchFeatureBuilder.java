package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.model.DelayEvent;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Per-event columns derived from the delay and the dispatch time.
 *
 * <ul>
 * <li>{@value #ABS_DELAY} — absolute delay in minutes</li>
 * <li>{@value #IS_DELAYED} — 1 when the delay exceeds
 * {@value #DELAYED_THRESHOLD_MINUTES} minutes, else 0</li>
 * <li>{@value #HOUR} — hour of day (UTC)</li>
 * <li>{@value #IS_WEEKEND} — 1 on Saturday or Sunday (UTC), else 0</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class DispatchFeatureBuilder {

    public static final String ABS_DELAY = "abs_delay";
    public static final String IS_DELAYED = "is_delayed_15";
    public static final String HOUR = "hour";
    public static final String IS_WEEKEND = "is_weekend";

    static final double DELAYED_THRESHOLD_MINUTES = 15.0;

    public List<String> columnNames() {
        return List.of(ABS_DELAY, IS_DELAYED, HOUR, IS_WEEKEND);
    }

    public void apply(List<DelayEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        for (DelayEvent event : events) {
            if (event.hasDelay()) {
                double delay = event.getDelay();
                event.putFeature(ABS_DELAY, Math.abs(delay));
                event.putFeature(IS_DELAYED, delay > DELAYED_THRESHOLD_MINUTES ? 1.0 : 0.0);
            } else {
                event.putFeature(ABS_DELAY, null);
                event.putFeature(IS_DELAYED, null);
            }

            if (event.hasTimestamp()) {
                ZonedDateTime utc = event.getTimestamp().atZone(ZoneOffset.UTC);
                DayOfWeek day = utc.getDayOfWeek();
                event.putFeature(HOUR, (double) utc.getHour());
                event.putFeature(IS_WEEKEND,
                        day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? 1.0 : 0.0);
            } else {
                event.putFeature(HOUR, null);
                event.putFeature(IS_WEEKEND, null);
            }
        }
    }
}
