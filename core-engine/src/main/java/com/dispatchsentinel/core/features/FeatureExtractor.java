package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.model.DelayEvent;

/**
 * Reads one numeric column of the feature matrix from an event.
 *
 * @since 1.0.0
 */
public interface FeatureExtractor {

    /**
     * @return the column name
     */
    String getName();

    /**
     * @param event the event
     * @return the value, or {@code null} when the event has none
     */
    Double extract(DelayEvent event);
}
