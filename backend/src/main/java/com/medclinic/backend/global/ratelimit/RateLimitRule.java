package com.medclinic.backend.global.ratelimit;

import java.time.Duration;

public record RateLimitRule(RateLimitScope scope, long maxRequests, Duration window) {

    public RateLimitRule {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1 for " + scope);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive for " + scope);
        }
    }

    public long windowMillis() {
        return window.toMillis();
    }
}
