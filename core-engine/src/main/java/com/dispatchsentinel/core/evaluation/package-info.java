/**
 * Per-fold evaluation of the scoring strategies and the JSON-ready report
 * types ({@link com.dispatchsentinel.core.evaluation.RunReport},
 * {@link com.dispatchsentinel.core.evaluation.FoldReport}).
 *
 * @since 1.0.0
 */
package com.dispatchsentinel.core.evaluation;
