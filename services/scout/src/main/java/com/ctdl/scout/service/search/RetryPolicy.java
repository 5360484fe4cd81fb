package com.ctdl.scout.service.search;

import java.time.Duration;
import java.util.Set;

/**
 * Bounded retry with exponential backoff for plain {@code http://} endpoints.
 * <p>
 * The policy is deliberately not applied to {@code https://} endpoints: those fail on the first error.
 * Sleep before attempt {@code n + 1} is {@code backoffFactor * 2^(n - 1)} seconds, capped at {@code backoffMax}.
 */
public final class RetryPolicy {

    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(500, 502, 503, 504);

    private final int maxAttempts;
    private final double backoffFactor;
    private final Duration backoffMax;

    public RetryPolicy(int maxAttempts, double backoffFactor, Duration backoffMax) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
        }
        if (backoffFactor < 0) {
            throw new IllegalArgumentException("backoffFactor must not be negative but was " + backoffFactor);
        }
        this.maxAttempts = maxAttempts;
        this.backoffFactor = backoffFactor;
        this.backoffMax = backoffMax;
    }

    public boolean appliesTo(String url) {
        return url != null && url.regionMatches(true, 0, "http://", 0, 7);
    }

    public boolean isRetryableStatus(int statusCode) {
        return RETRYABLE_STATUSES.contains(statusCode);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * @param attempt the 1-based attempt that just failed
     */
    public Duration backoffAfter(int attempt) {
        double seconds = backoffFactor * Math.pow(2, attempt - 1);
        long millis = Math.round(seconds * 1000);
        Duration backoff = Duration.ofMillis(millis);
        return backoff.compareTo(backoffMax) > 0 ? backoffMax : backoff;
    }
}
