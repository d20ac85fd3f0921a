package com.dispatchsentinel.core.model;

/**
 * Statistics computed for every {@code (entity key, window)} pair.
 *
 * @since 1.0.0
 */
public enum WindowStatistic {

    MEAN("mean"),
    MEDIAN("median"),
    /** Population standard deviation; a single value yields 0. */
    STD("std"),
    COUNT("count");

    private final String token;

    WindowStatistic(String token) {
        this.token = token;
    }

    /**
     * @return the token used in column names
     */
    public String getToken() {
        return token;
    }

    /**
     * Column name for this statistic: {@code <entityKey>_<stat>_<window>}.
     *
     * @param entityKey the grouping dimension
     * @param window    the trailing window
     * @return the column name
     */
    public String columnName(String entityKey, WindowSpec window) {
        return entityKey + "_" + token + "_" + window.getLabel();
    }
}
