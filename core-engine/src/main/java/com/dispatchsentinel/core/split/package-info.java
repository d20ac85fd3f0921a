/**
 * Time-respecting cross-validation.
 *
 * <p>
 * {@link com.dispatchsentinel.core.split.TimeSegmentedSplitter} emits
 * expanding-window {@link com.dispatchsentinel.core.split.Fold}s cut on
 * calendar dates.
 * </p>
 *
 * @since 1.0.0
 */
package com.dispatchsentinel.core.split;
