package com.sentinel.api.classifier;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-category weights used to fold six scores into one overall score.
 * The overall score is the weighted mean, so it stays in [0,1] for any
 * non-negative weights.
 */
public final class CategoryWeights {

    private static final CategoryWeights DEFAULTS = new CategoryWeights(defaultMap());

    private final EnumMap<RiskCategory, Double> weights;
    private final double total;

    private CategoryWeights(EnumMap<RiskCategory, Double> weights) {
        this.weights = weights;
        this.total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public static CategoryWeights defaults() {
        return DEFAULTS;
    }

    /**
     * Builds weights from overrides; categories left out keep their default weight.
     */
    public static CategoryWeights of(Map<RiskCategory, Double> overrides) {
        EnumMap<RiskCategory, Double> map = defaultMap();
        if (overrides != null) {
            overrides.forEach((category, weight) -> {
                if (weight == null || weight.isNaN() || weight < 0) {
                    throw new IllegalArgumentException("Weight for " + category + " must be a non-negative number");
                }
                map.put(category, weight);
            });
        }
        var result = new CategoryWeights(map);
        if (result.total <= 0) {
            throw new IllegalArgumentException("At least one category weight must be positive");
        }
        return result;
    }

    public double weightOf(RiskCategory category) {
        return weights.get(category);
    }

    public double weightedMean(Map<RiskCategory, Double> scores) {
        double sum = 0.0;
        for (RiskCategory category : RiskCategory.values()) {
            sum += weights.get(category) * scores.getOrDefault(category, 0.0);
        }
        return sum / total;
    }

    private static EnumMap<RiskCategory, Double> defaultMap() {
        EnumMap<RiskCategory, Double> map = new EnumMap<>(RiskCategory.class);
        for (RiskCategory category : RiskCategory.values()) {
            map.put(category, category.defaultWeight());
        }
        return map;
    }
}
