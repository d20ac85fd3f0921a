package com.dispatchsentinel.core.config;

import java.util.List;

/**
 * Isolation-forest tuning, nested under {@code isolation:} in the pipeline
 * YAML.
 *
 * @since 1.0.0
 */
public class IsolationSettings {

    /** Trees per fold model. */
    private int estimators = 100;

    /** Trees for the full-dataset production model. */
    private int productionEstimators = 200;

    /** Sub-sample size per tree, capped by the training set size. */
    private int maxSamples = 256;

    /** Seed for tree construction; fixed so runs are reproducible. */
    private long seed = 42L;

    void collectErrors(List<String> errors) {
        if (estimators < 1) {
            errors.add("isolation.estimators must be >= 1, got: " + estimators);
        }
        if (productionEstimators < 1) {
            errors.add("isolation.productionEstimators must be >= 1, got: " + productionEstimators);
        }
        if (maxSamples < 2) {
            errors.add("isolation.maxSamples must be >= 2, got: " + maxSamples);
        }
    }

    public int getEstimators() {
        return estimators;
    }

    public void setEstimators(int estimators) {
        this.estimators = estimators;
    }

    public int getProductionEstimators() {
        return productionEstimators;
    }

    public void setProductionEstimators(int productionEstimators) {
        this.productionEstimators = productionEstimators;
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    public void setMaxSamples(int maxSamples) {
        this.maxSamples = maxSamples;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    @Override
    public String toString() {
        return "IsolationSettings{" +
                "estimators=" + estimators +
                ", productionEstimators=" + productionEstimators +
                ", maxSamples=" + maxSamples +
                ", seed=" + seed +
                '}';
    }
}
