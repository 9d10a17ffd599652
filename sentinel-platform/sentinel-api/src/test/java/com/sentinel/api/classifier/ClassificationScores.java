package com.sentinel.api.classifier;

import java.util.EnumMap;
import java.util.Map;

/**
 * Test scores with a chosen overall value. The score is built through
 * {@link ClassificationScore#of} with all weight on the dominant category, so the
 * overall value is still the weighted mean of the category scores.
 */
public final class ClassificationScores {

    private ClassificationScores() {}

    public static ClassificationScore dominatedBy(RiskCategory dominant, double overall) {
        return ClassificationScore.of(Map.of(dominant, overall), weightsFocusedOn(dominant));
    }

    static CategoryWeights weightsFocusedOn(RiskCategory dominant) {
        Map<RiskCategory, Double> weights = new EnumMap<>(RiskCategory.class);
        for (RiskCategory category : RiskCategory.values()) {
            weights.put(category, category == dominant ? 1.0 : 0.0);
        }
        return CategoryWeights.of(weights);
    }
}
