package com.sentinel.api.classifier;

import java.util.Map;

/**
 * Pluggable scoring backend. Implementations may be remote or non-deterministic;
 * {@link ClassificationService} wraps them with timeouts, retries and fail-open.
 */
public interface ContentClassifier {

    /**
     * Raw per-category scores for the text. Values outside [0,1] are clamped by the caller.
     */
    Map<RiskCategory, Double> score(String text);
}
