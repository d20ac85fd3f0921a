package com.dispatchsentinel.core.config;

import com.dispatchsentinel.core.model.WindowSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional and falls back to the
 * default shown):
 * </p>
 *
 * <pre>
 * contamination: 0.02
 * splitCount: 5
 * entityKeys: [route_id, plant_id]
 * windows: [7D, 30D]
 * zscoreKeys: [route_id]
 * trailingZScore: false
 * zscoreThreshold: 3.0
 * topN: 1000
 * combinationPolicy: none      # none | union | intersection | weighted_vote
 * isolation:
 *   estimators: 100
 *   productionEstimators: 200
 *   maxSamples: 256
 *   seed: 42
 * schema:
 *   idColumn: dispatch_id
 *   timestampColumn: timestamp
 *   delayColumn: dispatch_delay_minutes
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every value is legal.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineConfig {

    static final Set<String> COMBINATION_POLICIES = Set.of("none", "union", "intersection", "weighted_vote");

    /** Expected anomaly fraction, 0 &lt; c &lt; 0.5. */
    private double contamination = 0.02;

    /** Requested number of date segments for walk-forward validation. */
    private int splitCount = 5;

    private List<String> entityKeys = new ArrayList<>(List.of("route_id", "plant_id"));
    private List<String> windows = new ArrayList<>(List.of("7D", "30D"));
    private List<String> zscoreKeys = new ArrayList<>(List.of("route_id"));
    private boolean trailingZScore;
    private double zscoreThreshold = 3.0;
    private int topN = 1000;

    private String combinationPolicy = "none";
    private double isolationVoteWeight = 1.0;
    private double zscoreVoteWeight = 1.0;
    private double voteQuorum = 1.0;

    private IsolationSettings isolation = new IsolationSettings();
    private DatasetSchema schema = new DatasetSchema();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting, collecting all errors before failing.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(contamination > 0 && contamination < 0.5)) {
            errors.add("contamination must be in (0, 0.5), got: " + contamination);
        }
        if (splitCount < 2) {
            errors.add("splitCount must be >= 2, got: " + splitCount);
        }
        if (entityKeys.isEmpty()) {
            errors.add("entityKeys must not be empty");
        }
        collectKeyErrors("entityKeys", entityKeys, errors);
        collectKeyErrors("zscoreKeys", zscoreKeys, errors);
        Set<String> labels = new HashSet<>();
        for (String window : windows) {
            try {
                String label = WindowSpec.parse(window).getLabel();
                if (!labels.add(label)) {
                    errors.add("windows must not repeat '" + label + "' (from '" + window + "')");
                }
            } catch (RuntimeException e) {
                errors.add(e.getMessage());
            }
        }
        if (!(zscoreThreshold > 0)) {
            errors.add("zscoreThreshold must be > 0, got: " + zscoreThreshold);
        }
        if (topN < 1) {
            errors.add("topN must be >= 1, got: " + topN);
        }
        if (combinationPolicy == null
                || !COMBINATION_POLICIES.contains(combinationPolicy.toLowerCase(Locale.ROOT))) {
            errors.add("Unknown combinationPolicy: '" + combinationPolicy
                    + "'. Supported: " + String.join(", ", COMBINATION_POLICIES));
        }
        if (isolationVoteWeight < 0 || zscoreVoteWeight < 0 || !(voteQuorum > 0)) {
            errors.add("vote weights must be >= 0 and voteQuorum > 0");
        }
        if (isolation == null) {
            errors.add("isolation settings must not be null");
        } else {
            isolation.collectErrors(errors);
        }
        if (schema == null) {
            errors.add("schema must not be null");
        } else {
            schema.collectErrors(errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void collectKeyErrors(String name, List<String> keys, List<String> errors) {
        Set<String> seen = new HashSet<>();
        for (String key : keys) {
            if (key == null || key.isBlank()) {
                errors.add(name + " must not contain blank names");
            } else if (!seen.add(key)) {
                errors.add(name + " must not repeat '" + key + "'");
            }
        }
    }

    /**
     * @return the parsed {@link #getWindows() windows}
     * @throws IllegalArgumentException if a label is malformed
     */
    public List<WindowSpec> windowSpecs() {
        List<WindowSpec> specs = new ArrayList<>(windows.size());
        for (String window : windows) {
            specs.add(WindowSpec.parse(window));
        }
        return Collections.unmodifiableList(specs);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getSplitCount() {
        return splitCount;
    }

    public void setSplitCount(int splitCount) {
        this.splitCount = splitCount;
    }

    public List<String> getEntityKeys() {
        return Collections.unmodifiableList(entityKeys);
    }

    public void setEntityKeys(List<String> entityKeys) {
        this.entityKeys = entityKeys != null ? new ArrayList<>(entityKeys) : new ArrayList<>();
    }

    public List<String> getWindows() {
        return Collections.unmodifiableList(windows);
    }

    public void setWindows(List<String> windows) {
        this.windows = windows != null ? new ArrayList<>(windows) : new ArrayList<>();
    }

    public List<String> getZscoreKeys() {
        return Collections.unmodifiableList(zscoreKeys);
    }

    public void setZscoreKeys(List<String> zscoreKeys) {
        this.zscoreKeys = zscoreKeys != null ? new ArrayList<>(zscoreKeys) : new ArrayList<>();
    }

    /**
     * @return whether the causal {@code <key>_trailing_zscore} columns are added
     */
    public boolean isTrailingZScore() {
        return trailingZScore;
    }

    public void setTrailingZScore(boolean trailingZScore) {
        this.trailingZScore = trailingZScore;
    }

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public int getTopN() {
        return topN;
    }

    public void setTopN(int topN) {
        this.topN = topN;
    }

    public String getCombinationPolicy() {
        return combinationPolicy;
    }

    public void setCombinationPolicy(String combinationPolicy) {
        this.combinationPolicy = combinationPolicy;
    }

    public double getIsolationVoteWeight() {
        return isolationVoteWeight;
    }

    public void setIsolationVoteWeight(double isolationVoteWeight) {
        this.isolationVoteWeight = isolationVoteWeight;
    }

    public double getZscoreVoteWeight() {
        return zscoreVoteWeight;
    }

    public void setZscoreVoteWeight(double zscoreVoteWeight) {
        this.zscoreVoteWeight = zscoreVoteWeight;
    }

    public double getVoteQuorum() {
        return voteQuorum;
    }

    public void setVoteQuorum(double voteQuorum) {
        this.voteQuorum = voteQuorum;
    }

    public IsolationSettings getIsolation() {
        return isolation;
    }

    public void setIsolation(IsolationSettings isolation) {
        this.isolation = isolation;
    }

    public DatasetSchema getSchema() {
        return schema;
    }

    public void setSchema(DatasetSchema schema) {
        this.schema = schema;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "contamination=" + contamination +
                ", splitCount=" + splitCount +
                ", entityKeys=" + entityKeys +
                ", windows=" + windows +
                ", zscoreKeys=" + zscoreKeys +
                ", trailingZScore=" + trailingZScore +
                ", zscoreThreshold=" + zscoreThreshold +
                ", topN=" + topN +
                ", combinationPolicy='" + combinationPolicy + '\'' +
                ", isolation=" + isolation +
                ", schema=" + schema +
                '}';
    }
}
