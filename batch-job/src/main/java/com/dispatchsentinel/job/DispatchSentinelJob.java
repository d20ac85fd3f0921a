package com.dispatchsentinel.job;

import com.dispatchsentinel.core.config.PipelineConfig;
import com.dispatchsentinel.core.config.PipelineConfigLoader;
import com.dispatchsentinel.core.pipeline.AnomalyPipeline;
import com.dispatchsentinel.core.pipeline.PipelineException;
import com.dispatchsentinel.core.pipeline.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Main entry point for the Dispatch Sentinel batch job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   CSV dataset
 *     → DispatchCsvReader → DelayEvent
 *     → AnomalyPipeline (features, walk-forward evaluation, production flagging)
 *     → ArtifactWriter → dispatch_features.csv, baseline_report.json, flagged_anomalies.csv
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Paths and overrides are resolved from environment variables via
 * {@link JobConfig}; tuning comes from the YAML pipeline configuration.
 * </p>
 *
 * <h3>Exit status</h3>
 * <p>
 * {@code 0} on success. {@code 1} on a pipeline failure, in which case no
 * artifact is written. {@code 2} on invalid configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class DispatchSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(DispatchSentinelJob.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PIPELINE_FAILURE = 1;
    static final int EXIT_CONFIG_FAILURE = 2;

    private DispatchSentinelJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        int status = launch(JobConfig::fromEnvironment);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Resolve the configuration, then run the job once. Only failures while
     * resolving and validating the configuration map to
     * {@link #EXIT_CONFIG_FAILURE}; anything thrown later propagates.
     *
     * @param configSource supplies the job configuration
     * @return the process exit status
     */
    static int launch(Supplier<JobConfig> configSource) {
        JobConfig config;
        PipelineConfig pipelineConfig;
        try {
            config = configSource.get();
            pipelineConfig = loadPipelineConfig(config);
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG_FAILURE;
        }
        return run(config, pipelineConfig);
    }

    /**
     * Run the job once with a validated pipeline configuration.
     *
     * @return {@link #EXIT_OK}, or {@link #EXIT_PIPELINE_FAILURE} when the
     *         pipeline cannot score the dataset
     */
    static int run(JobConfig config, PipelineConfig pipelineConfig) {
        LOG.info("Starting Dispatch Sentinel with config: {}", config);
        LOG.info("Pipeline configuration: {}", pipelineConfig);

        // 1. Load dataset
        Dataset dataset = new DispatchCsvReader(pipelineConfig).read(config.getInputPath());

        // 2. Run
        PipelineResult result;
        try {
            result = new AnomalyPipeline(pipelineConfig).run(dataset.getEvents());
        } catch (PipelineException e) {
            LOG.error("Pipeline failed, no artifacts written: {}", e.getMessage(), e);
            return EXIT_PIPELINE_FAILURE;
        }

        // 3. Write artifacts
        new ArtifactWriter(config.getOutputDir(), pipelineConfig.getSchema().getDelayColumn())
                .writeAll(dataset, result);
        LOG.info("Dispatch Sentinel finished: artifacts in {}", config.getOutputDir());
        return EXIT_OK;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Load the YAML configuration, apply the environment overrides and
     * validate the result.
     *
     * @throws IllegalArgumentException if the configuration file is missing
     * @throws IllegalStateException    if the configuration is invalid
     */
    static PipelineConfig loadPipelineConfig(JobConfig config) {
        String path = config.getPipelineConfigPath();
        PipelineConfig pipelineConfig = path != null && !path.isBlank()
                ? PipelineConfigLoader.fromFile(path)
                : PipelineConfigLoader.load();
        config.applyTo(pipelineConfig).validate();
        return pipelineConfig;
    }
}
