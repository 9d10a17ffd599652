package com.sentinel.api.classifier;

import com.sentinel.core.domain.PolicyCategory;

/**
 * The six scored risk categories and their default weight in the overall score.
 */
public enum RiskCategory {
    TOXICITY(0.20, PolicyCategory.TOXICITY),
    HARASSMENT(0.20, PolicyCategory.HARASSMENT),
    HATE_SPEECH(0.25, PolicyCategory.HATE_SPEECH),
    SEXUAL_CONTENT(0.15, PolicyCategory.SEXUAL_CONTENT),
    THREAT(0.15, PolicyCategory.THREAT),
    SPAM(0.05, PolicyCategory.SPAM);

    private final double defaultWeight;
    private final PolicyCategory policyCategory;

    RiskCategory(double defaultWeight, PolicyCategory policyCategory) {
        this.defaultWeight = defaultWeight;
        this.policyCategory = policyCategory;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    public PolicyCategory policyCategory() {
        return policyCategory;
    }
}
