/**
 * Domain model classes for Dispatch Sentinel.
 *
 * <ul>
 * <li>{@link com.dispatchsentinel.core.model.DelayEvent} — typed dispatch
 * record with append-only derived features</li>
 * <li>{@link com.dispatchsentinel.core.model.WindowSpec} and
 * {@link com.dispatchsentinel.core.model.WindowStatistic} — trailing window
 * definitions</li>
 * <li>{@link com.dispatchsentinel.core.model.Score} — per-event output of a
 * {@link com.dispatchsentinel.core.model.ScoringMethod}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.dispatchsentinel.core.model;
