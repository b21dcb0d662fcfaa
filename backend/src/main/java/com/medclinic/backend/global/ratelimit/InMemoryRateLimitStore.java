package com.medclinic.backend.global.ratelimit;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local counters. Quotas are per instance when the API runs on several nodes.
 */
@Component
@ConditionalOnProperty(value = "clinic.rate-limit.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimitStore implements RateLimitStore {

    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    @Override
    public long incrementAndGet(String key, long windowIndex, long windowEndMillis) {
        Window updated = windows.compute(key, (ignored, current) -> {
            if (current == null || current.index() != windowIndex) {
                return new Window(windowIndex, windowEndMillis, 1L);
            }
            return new Window(windowIndex, windowEndMillis, current.count() + 1);
        });
        return updated.count();
    }

    @Override
    public int evictExpired(long nowMillis) {
        int before = windows.size();
        windows.entrySet().removeIf(entry -> entry.getValue().endMillis() <= nowMillis);
        return Math.max(0, before - windows.size());
    }

    int size() {
        return windows.size();
    }

    private record Window(long index, long endMillis, long count) {
    }
}
