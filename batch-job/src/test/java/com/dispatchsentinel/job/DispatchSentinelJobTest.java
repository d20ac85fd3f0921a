package com.dispatchsentinel.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link DispatchSentinelJob#launch(java.util.function.Supplier)}.
 */
class DispatchSentinelJobTest {

    @TempDir
    Path dir;

    private JobConfig config(Path input, Path output) {
        return new JobConfig.Builder()
                .inputPath(input.toString())
                .outputDir(output.toString())
                .build();
    }

    @Test
    @DisplayName("Should write all three artifacts for a labelled dataset")
    void shouldWriteArtifacts() throws IOException {
        Path input = TestDatasets.writeSynthetic(dir.resolve("dispatch.csv"), 100, true);
        Path output = dir.resolve("reports");

        int status = DispatchSentinelJob.launch(() -> config(input, output));

        assertThat(status).isEqualTo(DispatchSentinelJob.EXIT_OK);
        assertThat(output.resolve(ArtifactWriter.FEATURES_FILE)).exists();
        assertThat(output.resolve(ArtifactWriter.FLAGGED_FILE)).exists();
        JsonNode report = new ObjectMapper().readTree(output.resolve(ArtifactWriter.REPORT_FILE).toFile());
        assertThat(report.get("n_folds").asInt()).isPositive();
        assertThat(report.get("folds").get(0).get("scorers").get("zscore").has("recall")).isTrue();
    }

    @Test
    @DisplayName("Should apply the split override from the job configuration")
    void shouldApplySplitOverride() throws IOException {
        Path input = TestDatasets.writeSynthetic(dir.resolve("dispatch.csv"), 100, false);
        Path output = dir.resolve("reports");
        JobConfig config = new JobConfig.Builder()
                .inputPath(input.toString())
                .outputDir(output.toString())
                .splitCount(3)
                .build();

        assertThat(DispatchSentinelJob.launch(() -> config)).isEqualTo(DispatchSentinelJob.EXIT_OK);

        JsonNode report = new ObjectMapper().readTree(output.resolve(ArtifactWriter.REPORT_FILE).toFile());
        assertThat(report.get("n_folds").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail without writing artifacts when no feature is usable")
    void shouldFailWithoutArtifacts() throws IOException {
        Path input = TestDatasets.writeUnusable(dir.resolve("empty.csv"), 10);
        Path output = dir.resolve("reports");

        int status = DispatchSentinelJob.launch(() -> config(input, output));

        assertThat(status).isEqualTo(DispatchSentinelJob.EXIT_PIPELINE_FAILURE);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("Should exit with the configuration status for a missing pipeline configuration file")
    void shouldRejectMissingPipelineConfig() {
        JobConfig config = new JobConfig.Builder()
                .inputPath(dir.resolve("dispatch.csv").toString())
                .outputDir(dir.resolve("reports").toString())
                .pipelineConfigPath(dir.resolve("missing.yml").toString())
                .build();

        assertThat(DispatchSentinelJob.launch(() -> config)).isEqualTo(DispatchSentinelJob.EXIT_CONFIG_FAILURE);
    }

    @Test
    @DisplayName("Should reject repeated windows before reading the dataset")
    void shouldRejectDuplicateWindowsBeforeReading() throws IOException {
        Path yaml = Files.writeString(dir.resolve("pipeline.yml"), "windows: [7D, 7d]\n", StandardCharsets.UTF_8);
        Path output = dir.resolve("reports");
        JobConfig config = new JobConfig.Builder()
                .inputPath(dir.resolve("never-read.csv").toString())
                .outputDir(output.toString())
                .pipelineConfigPath(yaml.toString())
                .build();

        assertThat(DispatchSentinelJob.launch(() -> config)).isEqualTo(DispatchSentinelJob.EXIT_CONFIG_FAILURE);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("Should exit with the configuration status when the job settings are invalid")
    void shouldRejectInvalidJobSettings() {
        int status = DispatchSentinelJob.launch(() -> new JobConfig.Builder().splitCount(1).build());

        assertThat(status).isEqualTo(DispatchSentinelJob.EXIT_CONFIG_FAILURE);
    }

    @Test
    @DisplayName("Should propagate failures raised after the configuration is loaded")
    void shouldPropagateRunFailures() {
        Path output = dir.resolve("reports");

        assertThatThrownBy(() -> DispatchSentinelJob.launch(() -> config(dir.resolve("missing.csv"), output)))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should write byte-identical artifacts for identical input")
    void shouldWriteIdenticalArtifacts() throws IOException {
        Path input = TestDatasets.writeSynthetic(dir.resolve("dispatch.csv"), 100, true);
        Path first = dir.resolve("first");
        Path second = dir.resolve("second");

        assertThat(DispatchSentinelJob.launch(() -> config(input, first))).isEqualTo(DispatchSentinelJob.EXIT_OK);
        assertThat(DispatchSentinelJob.launch(() -> config(input, second))).isEqualTo(DispatchSentinelJob.EXIT_OK);

        assertThat(Files.readAllBytes(second.resolve(ArtifactWriter.FLAGGED_FILE)))
                .isEqualTo(Files.readAllBytes(first.resolve(ArtifactWriter.FLAGGED_FILE)));
        assertThat(Files.readAllBytes(second.resolve(ArtifactWriter.FEATURES_FILE)))
                .isEqualTo(Files.readAllBytes(first.resolve(ArtifactWriter.FEATURES_FILE)));
        assertThat(Files.readAllBytes(second.resolve(ArtifactWriter.REPORT_FILE)))
                .isEqualTo(Files.readAllBytes(first.resolve(ArtifactWriter.REPORT_FILE)));
    }
}
