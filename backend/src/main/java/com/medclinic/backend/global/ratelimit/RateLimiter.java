package com.medclinic.backend.global.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-window limiter. Windows are aligned to {@code floor(epochMillis / windowMillis)}, so a
 * request at the exact boundary counts toward the new window only.
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitStore store;
    private final Clock clock;
    private final Map<RateLimitScope, RateLimitRule> rules = new EnumMap<>(RateLimitScope.class);

    public RateLimiter(
            RateLimitStore store,
            Clock clock,
            @Value("${clinic.rate-limit.global.max-requests:50}") long globalMax,
            @Value("${clinic.rate-limit.global.window:15m}") Duration globalWindow,
            @Value("${clinic.rate-limit.auth.max-requests:5}") long authMax,
            @Value("${clinic.rate-limit.auth.window:15m}") Duration authWindow,
            @Value("${clinic.rate-limit.admin.max-requests:10}") long adminMax,
            @Value("${clinic.rate-limit.admin.window:15m}") Duration adminWindow
    ) {
        this.store = store;
        this.clock = clock;
        rules.put(RateLimitScope.GLOBAL, new RateLimitRule(RateLimitScope.GLOBAL, globalMax, globalWindow));
        rules.put(RateLimitScope.AUTH, new RateLimitRule(RateLimitScope.AUTH, authMax, authWindow));
        rules.put(RateLimitScope.ADMIN, new RateLimitRule(RateLimitScope.ADMIN, adminMax, adminWindow));
    }

    public RateLimitDecision check(RateLimitScope scope, String identity) {
        RateLimitRule rule = rules.get(scope);
        long nowMillis = clock.millis();
        long windowMillis = rule.windowMillis();
        long windowIndex = Math.floorDiv(nowMillis, windowMillis);
        long windowEndMillis = (windowIndex + 1) * windowMillis;

        long count = store.incrementAndGet(scope.keyPrefix() + ":" + identity, windowIndex, windowEndMillis);
        boolean allowed = count <= rule.maxRequests();
        long remaining = Math.max(0L, rule.maxRequests() - count);
        long retryAfterSeconds = Math.max(1L, (windowEndMillis - nowMillis + 999L) / 1000L);
        long resetEpochSecond = (windowEndMillis + 999L) / 1000L;
        return new RateLimitDecision(allowed, rule.maxRequests(), remaining, retryAfterSeconds, resetEpochSecond);
    }

    @Scheduled(fixedDelayString = "${clinic.rate-limit.sweep-interval:PT1M}")
    public void evictExpiredWindows() {
        int evicted = store.evictExpired(clock.millis());
        if (evicted > 0) {
            log.debug("Evicted {} expired rate-limit windows", evicted);
        }
    }
}
