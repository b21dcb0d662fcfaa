package com.medclinic.backend.global.ratelimit;

/**
 * Outcome of counting one request against a fixed window.
 *
 * @param retryAfterSeconds seconds until the current window ends, at least one
 * @param resetEpochSecond  epoch second at which the current window ends
 */
public record RateLimitDecision(
        boolean allowed,
        long limit,
        long remaining,
        long retryAfterSeconds,
        long resetEpochSecond
) {
}
