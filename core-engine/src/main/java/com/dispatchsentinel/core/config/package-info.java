/**
 * Configuration loading and validation for the detection pipeline.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.dispatchsentinel.core.config.PipelineConfigLoader} into a
 * {@link com.dispatchsentinel.core.config.PipelineConfig} instance, which is
 * passed explicitly to every component. Validation runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.dispatchsentinel.core.config;
