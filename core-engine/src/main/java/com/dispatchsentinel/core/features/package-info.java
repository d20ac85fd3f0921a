/**
 * Feature derivation for the detection pipeline.
 *
 * <p>
 * {@link com.dispatchsentinel.core.features.FeatureEnricher} attaches, in
 * order, the dispatch columns, the causal trailing-window aggregates of
 * {@link com.dispatchsentinel.core.features.WindowedFeatureBuilder}, the
 * global group z-score of
 * {@link com.dispatchsentinel.core.features.GroupNormalizer} and optionally
 * the trailing z-score of
 * {@link com.dispatchsentinel.core.features.TrailingGroupNormalizer}.
 * {@link com.dispatchsentinel.core.features.FeatureRegistry} declares which
 * of those columns form the scorer input.
 * </p>
 *
 * @since 1.0.0
 */
package com.dispatchsentinel.core.features;
