package com.dispatchsentinel.core.features;

import com.dispatchsentinel.core.model.DelayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Global per-group z-score of the delay metric.
 *
 * <p>
 * For each key value the mean and population standard deviation are computed
 * once over <strong>every</strong> event carrying that value, regardless of
 * time, and {@code <key>_zscore = (delay - mean) / std} is attached. This is a
 * descriptive baseline and is not causal; see
 * {@link TrailingGroupNormalizer} for the variant that only looks back.
 * </p>
 *
 * <p>
 * A group whose delays are all equal has {@code std == 0}; every member then
 * gets {@code NaN}. Events with no delay or no key value get {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public class GroupNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(GroupNormalizer.class);

    static final String SUFFIX = "_zscore";

    private final List<String> entityKeys;

    public GroupNormalizer(List<String> entityKeys) {
        this.entityKeys = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(entityKeys, "entityKeys must not be null")));
    }

    public static String columnName(String entityKey) {
        return entityKey + SUFFIX;
    }

    public List<String> columnNames() {
        return entityKeys.stream().map(GroupNormalizer::columnName).toList();
    }

    /**
     * Attach the z-score column for every configured key.
     *
     * @param events the dataset; must not be {@code null}
     */
    public void apply(List<DelayEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        for (String key : entityKeys) {
            Map<String, RunningMoments> groups = new HashMap<>();
            for (DelayEvent event : events) {
                Optional<String> value = event.getEntityKey(key);
                if (value.isPresent() && event.hasDelay()) {
                    groups.computeIfAbsent(value.get(), k -> new RunningMoments()).add(event.getDelay());
                }
            }

            long degenerate = groups.values().stream().filter(m -> m.populationStd() == 0.0).count();
            if (degenerate > 0) {
                LOG.debug("{} of {} '{}' group(s) have zero delay variance; their z-scores are undefined",
                        degenerate, groups.size(), key);
            }

            String column = columnName(key);
            for (DelayEvent event : events) {
                Optional<String> value = event.getEntityKey(key);
                Double z = null;
                if (value.isPresent() && event.hasDelay()) {
                    z = groups.get(value.get()).zScore(event.getDelay());
                }
                event.putFeature(column, z);
            }
        }
    }
}
