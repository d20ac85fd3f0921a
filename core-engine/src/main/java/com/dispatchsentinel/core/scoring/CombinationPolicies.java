package com.dispatchsentinel.core.scoring;

import com.dispatchsentinel.core.config.PipelineConfig;
import com.dispatchsentinel.core.model.ScoringMethod;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Built-in {@link CombinationPolicy} implementations.
 *
 * @since 1.0.0
 */
public final class CombinationPolicies {

    private CombinationPolicies() {
        // utility class
    }

    /**
     * @return flags an event when any strategy flags it
     */
    public static CombinationPolicy union() {
        return decisions -> decisions.containsValue(Boolean.TRUE);
    }

    /**
     * @return flags an event when every strategy that scored it flags it
     */
    public static CombinationPolicy intersection() {
        return decisions -> !decisions.isEmpty() && !decisions.containsValue(Boolean.FALSE);
    }

    /**
     * Flags an event when the summed weight of the strategies flagging it
     * reaches {@code quorum}. Strategies without a weight count as 0.
     *
     * @param weights per-strategy weights; must not be {@code null}
     * @param quorum  minimum summed weight, positive
     * @return the policy
     */
    public static CombinationPolicy weightedVote(Map<ScoringMethod, Double> weights, double quorum) {
        Objects.requireNonNull(weights, "weights must not be null");
        if (!(quorum > 0)) {
            throw new IllegalArgumentException("quorum must be > 0, got: " + quorum);
        }
        Map<ScoringMethod, Double> copy = new EnumMap<>(ScoringMethod.class);
        copy.putAll(weights);
        return decisions -> {
            double total = 0.0;
            for (Map.Entry<ScoringMethod, Boolean> entry : decisions.entrySet()) {
                if (entry.getValue()) {
                    total += copy.getOrDefault(entry.getKey(), 0.0);
                }
            }
            return total >= quorum;
        };
    }

    /**
     * Resolve the policy named by {@link PipelineConfig#getCombinationPolicy()}.
     *
     * @return the policy, or empty for {@code none}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Optional<CombinationPolicy> fromConfig(PipelineConfig config) {
        Objects.requireNonNull(config, "PipelineConfig must not be null");
        String name = config.getCombinationPolicy() == null
                ? "none"
                : config.getCombinationPolicy().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "none" -> Optional.empty();
            case "union" -> Optional.of(union());
            case "intersection" -> Optional.of(intersection());
            case "weighted_vote" -> {
                Map<ScoringMethod, Double> weights = new EnumMap<>(ScoringMethod.class);
                weights.put(ScoringMethod.ISOLATION, config.getIsolationVoteWeight());
                weights.put(ScoringMethod.ZSCORE, config.getZscoreVoteWeight());
                yield Optional.of(weightedVote(weights, config.getVoteQuorum()));
            }
            default -> throw new IllegalArgumentException(
                    "Unknown combination policy: '" + config.getCombinationPolicy()
                            + "'. Supported: none, union, intersection, weighted_vote");
        };
    }
}
