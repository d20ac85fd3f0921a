package com.dispatchsentinel.core.model;

import java.util.Locale;

/**
 * The two independent scoring strategies reported side by side.
 *
 * @since 1.0.0
 */
public enum ScoringMethod {

    /** Multivariate isolation forest over the numeric feature matrix. */
    ISOLATION("isolation"),

    /** Univariate z-score of the delay metric. */
    ZSCORE("zscore");

    private final String key;

    ScoringMethod(String key) {
        this.key = key;
    }

    /**
     * @return lowercase key used in reports and configuration
     */
    public String getKey() {
        return key;
    }

    /**
     * Resolve a method from its key, case-insensitively.
     *
     * @param key e.g. {@code "isolation"}
     * @return the method
     * @throws IllegalArgumentException if the key is unknown
     */
    public static ScoringMethod fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (ScoringMethod method : values()) {
                if (method.key.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown scoring method: '" + key + "'. Supported: isolation, zscore");
    }

    @Override
    public String toString() {
        return key;
    }
}
