package com.sentinel.api.classifier;

import com.sentinel.core.domain.PolicyCategory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable result of classifying one piece of content.
 * Every score, including {@code overall}, is in [0,1]; {@code overall} is the
 * weighted mean of the six category scores.
 */
public record ClassificationScore(
        double toxicity,
        double harassment,
        double hateSpeech,
        double sexualContent,
        double threat,
        double spam,
        double overall
) {
    private static final ClassificationScore ZERO = new ClassificationScore(0, 0, 0, 0, 0, 0, 0);

    public ClassificationScore {
        toxicity = clamp(toxicity);
        harassment = clamp(harassment);
        hateSpeech = clamp(hateSpeech);
        sexualContent = clamp(sexualContent);
        threat = clamp(threat);
        spam = clamp(spam);
        overall = clamp(overall);
    }

    public static ClassificationScore zero() {
        return ZERO;
    }

    /**
     * Builds a score from raw category scores; missing categories count as zero.
     */
    public static ClassificationScore of(Map<RiskCategory, Double> raw, CategoryWeights weights) {
        EnumMap<RiskCategory, Double> clamped = new EnumMap<>(RiskCategory.class);
        for (RiskCategory category : RiskCategory.values()) {
            Double value = raw == null ? null : raw.get(category);
            clamped.put(category, clamp(value == null ? 0.0 : value));
        }
        return new ClassificationScore(
                clamped.get(RiskCategory.TOXICITY),
                clamped.get(RiskCategory.HARASSMENT),
                clamped.get(RiskCategory.HATE_SPEECH),
                clamped.get(RiskCategory.SEXUAL_CONTENT),
                clamped.get(RiskCategory.THREAT),
                clamped.get(RiskCategory.SPAM),
                weights.weightedMean(clamped));
    }

    public double scoreOf(RiskCategory category) {
        return switch (category) {
            case TOXICITY -> toxicity;
            case HARASSMENT -> harassment;
            case HATE_SPEECH -> hateSpeech;
            case SEXUAL_CONTENT -> sexualContent;
            case THREAT -> threat;
            case SPAM -> spam;
        };
    }

    /**
     * Highest-scoring category. Ties go to the category with the larger default weight.
     */
    public RiskCategory dominantCategory() {
        Comparator<RiskCategory> byScore = Comparator.comparingDouble(this::scoreOf);
        return Arrays.stream(RiskCategory.values())
                .max(byScore.thenComparingDouble(RiskCategory::defaultWeight))
                .orElse(RiskCategory.TOXICITY);
    }

    public PolicyCategory dominantPolicyCategory() {
        return dominantCategory().policyCategory();
    }

    /**
     * Scores in toxicity, harassment, hate speech, sexual content, threat, spam order.
     */
    public double[] categoryScores() {
        return new double[] {toxicity, harassment, hateSpeech, sexualContent, threat, spam};
    }

    static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
