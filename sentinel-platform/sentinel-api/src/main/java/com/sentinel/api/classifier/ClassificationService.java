package com.sentinel.api.classifier;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Scores content through the pluggable backend.
 * The backend call is bounded by a time limit and a few retries; when those are
 * exhausted the content is scored zero and marked degraded (fail-open), so a
 * scoring outage never blocks legitimate traffic.
 */
@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    private final ContentClassifier classifier;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final Executor executor;

    public ClassificationService(
            ContentClassifier classifier,
            @Qualifier("classifierRetry") Retry retry,
            @Qualifier("classifierTimeLimiter") TimeLimiter timeLimiter,
            @Qualifier("classifierExecutor") Executor executor) {
        this.classifier = classifier;
        this.retry = retry;
        this.timeLimiter = timeLimiter;
        this.executor = executor;
    }

    public ClassificationOutcome classify(String text) {
        return classify(text, CategoryWeights.defaults());
    }

    /**
     * Classifies text with the given category weights. Never throws.
     */
    public ClassificationOutcome classify(String text, CategoryWeights weights) {
        Callable<Map<RiskCategory, Double>> guarded = Retry.decorateCallable(retry,
                () -> timeLimiter.executeFutureSupplier(
                        () -> CompletableFuture.supplyAsync(() -> classifier.score(text), executor)));
        try {
            Map<RiskCategory, Double> raw = guarded.call();
            return ClassificationOutcome.scored(ClassificationScore.of(raw, weights));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Classification interrupted, failing open");
            return ClassificationOutcome.failedOpen("interrupted");
        } catch (Exception e) {
            log.warn("Classifier unavailable after {} attempts, failing open: {}",
                    retry.getRetryConfig().getMaxAttempts(), e.toString());
            return ClassificationOutcome.failedOpen(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * @param degraded true when the backend failed and zero scores were substituted
     * @param failure  description of the backend failure, null when scored normally
     */
    public record ClassificationOutcome(ClassificationScore score, boolean degraded, String failure) {

        static ClassificationOutcome scored(ClassificationScore score) {
            return new ClassificationOutcome(score, false, null);
        }

        static ClassificationOutcome failedOpen(String failure) {
            return new ClassificationOutcome(ClassificationScore.zero(), true, failure);
        }
    }
}
