package com.sentinel.api.config;

import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces per-client HTTP rate limits and answers 429 once a bucket is empty.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimitConfig rateLimitConfig;

    public RateLimitInterceptor(RateLimitConfig rateLimitConfig) {
        this.rateLimitConfig = rateLimitConfig;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {

        String clientId = resolveClientId(request);
        Bucket bucket = selectBucket(request, clientId);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (probe.isConsumed()) {
            response.addHeader("X-Rate-Limit-Remaining", String.valueOf(probe.getRemainingTokens()));
            return true;
        }

        long waitForRefill = probe.getNanosToWaitForRefill() / 1_000_000_000;
        log.debug("Rate limit exceeded for client {} on {}", clientId, request.getRequestURI());
        response.addHeader("X-Rate-Limit-Retry-After-Seconds", String.valueOf(waitForRefill));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"RATE_001\",\"message\":\"Rate limit exceeded. Retry after "
                + waitForRefill + " seconds.\"}");
        return false;
    }

    private String resolveClientId(HttpServletRequest request) {
        String actorId = request.getHeader("X-Actor-ID");
        if (actorId != null && !actorId.isBlank()) {
            return actorId;
        }

        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null) {
            return forwarded.split(",")[0].trim();
        }

        return request.getRemoteAddr();
    }

    private Bucket selectBucket(HttpServletRequest request, String clientId) {
        String path = request.getRequestURI();
        String method = request.getMethod();

        if ("GET".equals(method)) {
            return rateLimitConfig.resolveReadBucket(clientId);
        }

        if (path.contains("/decisions") ||
            path.contains("/penalties") ||
            path.contains("/appeals") ||
            "DELETE".equals(method)) {
            return rateLimitConfig.resolveDecisionBucket(clientId);
        }

        return rateLimitConfig.resolveIngestBucket(clientId);
    }
}
