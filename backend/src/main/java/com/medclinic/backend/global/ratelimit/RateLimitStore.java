package com.medclinic.backend.global.ratelimit;

/**
 * Counter storage for fixed rate-limit windows. Implementations count atomically per key.
 */
public interface RateLimitStore {

    /**
     * Increments the counter of {@code key} in the window identified by {@code windowIndex}
     * and returns the count including this request. A different window index starts from zero.
     *
     * @param windowEndMillis epoch millis at which the window closes, used for expiry
     */
    long incrementAndGet(String key, long windowIndex, long windowEndMillis);

    /**
     * Drops windows that closed before {@code nowMillis}.
     */
    default int evictExpired(long nowMillis) {
        return 0;
    }
}
