package com.dispatchsentinel.job;

import com.dispatchsentinel.core.config.PipelineConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Dispatch Sentinel batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job runs unchanged from a shell, a cron entry or a container.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * <h3>Overrides</h3>
 * <p>
 * {@code contamination} and {@code splitCount} are optional. When set they
 * take precedence over the values of the YAML pipeline configuration
 * (see {@link #applyTo(PipelineConfig)}).
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String ENV_INPUT_PATH = "INPUT_PATH";
    public static final String ENV_OUTPUT_DIR = "OUTPUT_DIR";
    public static final String ENV_CONTAMINATION = "CONTAMINATION";
    public static final String ENV_SPLITS = "N_SPLITS";
    public static final String ENV_PIPELINE_CONFIG_PATH = "PIPELINE_CONFIG_PATH";

    public static final String DEFAULT_INPUT_PATH = "data/features/dispatch_dataset.csv";
    public static final String DEFAULT_OUTPUT_DIR = "reports/models";

    // ---------------------------------------------------------------
    // I/O
    // ---------------------------------------------------------------
    private final Path inputPath;
    private final Path outputDir;

    // ---------------------------------------------------------------
    // Pipeline overrides
    // ---------------------------------------------------------------
    private final Double contamination;
    private final Integer splitCount;
    private final String pipelineConfigPath;

    private JobConfig(Builder b) {
        this.inputPath = Paths.get(b.inputPath);
        this.outputDir = Paths.get(b.outputDir);
        this.contamination = b.contamination;
        this.splitCount = b.splitCount;
        this.pipelineConfigPath = b.pipelineConfigPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            String contamination = env(ENV_CONTAMINATION, null);
            String splits = env(ENV_SPLITS, null);
            return new Builder()
                    .inputPath(env(ENV_INPUT_PATH, DEFAULT_INPUT_PATH))
                    .outputDir(env(ENV_OUTPUT_DIR, DEFAULT_OUTPUT_DIR))
                    .contamination(contamination == null ? null : Double.valueOf(contamination))
                    .splitCount(splits == null ? null : Integer.valueOf(splits))
                    .pipelineConfigPath(env(ENV_PIPELINE_CONFIG_PATH, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Copy the overrides that are set onto the pipeline configuration.
     *
     * @param config the loaded pipeline configuration; modified in place
     * @return the same configuration, for chaining
     */
    public PipelineConfig applyTo(PipelineConfig config) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        if (contamination != null) {
            config.setContamination(contamination);
        }
        if (splitCount != null) {
            config.setSplitCount(splitCount);
        }
        return config;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getInputPath() {
        return inputPath;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Double getContamination() {
        return contamination;
    }

    public Integer getSplitCount() {
        return splitCount;
    }

    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (non-blank paths, contamination in (0, 0.5), at least 2 splits).
     * </p>
     */
    public static class Builder {
        private String inputPath = DEFAULT_INPUT_PATH;
        private String outputDir = DEFAULT_OUTPUT_DIR;
        private Double contamination;
        private Integer splitCount;
        private String pipelineConfigPath = "";

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputDir(String v) {
            this.outputDir = v;
            return this;
        }

        public Builder contamination(Double v) {
            this.contamination = v;
            return this;
        }

        public Builder splitCount(Integer v) {
            this.splitCount = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(inputPath, "inputPath");
            requireNonBlank(outputDir, "outputDir");

            if (contamination != null && !(contamination > 0 && contamination < 0.5)) {
                throw new IllegalArgumentException(
                        "contamination must be in (0, 0.5), got: " + contamination);
            }
            if (splitCount != null && splitCount < 2) {
                throw new IllegalArgumentException("splitCount must be >= 2, got: " + splitCount);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath=" + inputPath +
                ", outputDir=" + outputDir +
                ", contamination=" + contamination +
                ", splitCount=" + splitCount +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                '}';
    }
}
