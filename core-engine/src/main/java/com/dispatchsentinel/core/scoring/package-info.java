/**
 * Anomaly scoring strategies.
 *
 * <p>
 * Both strategies implement
 * {@link com.dispatchsentinel.core.scoring.AnomalyScorer} and are created by
 * {@link com.dispatchsentinel.core.scoring.ScorerFactory}:
 * </p>
 * <ul>
 * <li>{@link com.dispatchsentinel.core.scoring.IsolationForestScorer} —
 * multivariate isolation forest with a contamination-derived threshold</li>
 * <li>{@link com.dispatchsentinel.core.scoring.ZScoreScorer} — train-only
 * z-score of the delay, flagged above a fixed threshold</li>
 * </ul>
 * <p>
 * Their decisions stay separate. A
 * {@link com.dispatchsentinel.core.scoring.CombinationPolicy} may merge them
 * downstream.
 * </p>
 *
 * @since 1.0.0
 */
package com.dispatchsentinel.core.scoring;
