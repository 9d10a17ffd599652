package com.sentinel.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP rate limiting for the moderation API, using Bucket4j.
 * Separate buckets for ingest traffic, moderator/admin decisions and reads.
 */
@Configuration
public class RateLimitConfig {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    @Value("${sentinel.rate-limit.ingest-per-minute:600}")
    private long ingestPerMinute;

    @Value("${sentinel.rate-limit.decision-per-minute:60}")
    private long decisionPerMinute;

    @Value("${sentinel.rate-limit.read-per-minute:300}")
    private long readPerMinute;

    /**
     * Content events and reports: high volume, one bucket per client.
     */
    public Bucket resolveIngestBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":ingest", key -> bucketOf(ingestPerMinute));
    }

    /**
     * Moderator decisions, admin penalties, appeal submissions and resolutions.
     */
    public Bucket resolveDecisionBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":decision", key -> bucketOf(decisionPerMinute));
    }

    public Bucket resolveReadBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":read", key -> bucketOf(readPerMinute));
    }

    private static Bucket bucketOf(long perMinute) {
        Bandwidth limit = Bandwidth.builder()
                .capacity(perMinute)
                .refillGreedy(perMinute, Duration.ofMinutes(1))
                .build();
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * Clear rate limit buckets for a client (for testing).
     */
    public void clearBuckets(String clientId) {
        buckets.remove(clientId + ":ingest");
        buckets.remove(clientId + ":decision");
        buckets.remove(clientId + ":read");
    }
}
