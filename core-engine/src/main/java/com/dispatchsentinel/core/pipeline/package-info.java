/**
 * Orchestration of a batch run.
 *
 * <p>
 * {@link com.dispatchsentinel.core.pipeline.AnomalyPipeline} enriches the
 * dataset, hands it to
 * {@link com.dispatchsentinel.core.pipeline.WalkForwardValidator} for the
 * leakage-free evaluation report and to
 * {@link com.dispatchsentinel.core.pipeline.ProductionFlagger} for the ranked
 * anomaly table.
 * </p>
 *
 * @since 1.0.0
 */
package com.dispatchsentinel.core.pipeline;
