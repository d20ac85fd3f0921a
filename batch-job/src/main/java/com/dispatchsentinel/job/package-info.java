/**
 * Batch entry point: environment configuration, CSV ingestion and artifact
 * output around the core pipeline.
 *
 * @since 1.0.0
 */
package com.dispatchsentinel.job;
