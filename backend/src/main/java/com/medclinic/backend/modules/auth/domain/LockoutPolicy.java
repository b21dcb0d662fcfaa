package com.medclinic.backend.modules.auth.domain;

import java.time.Duration;
import java.time.OffsetDateTime;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Decides the failed-attempt counter and lock of an account for a single login attempt.
 * Deterministic: no I/O, the caller supplies {@code now}.
 *
 * <ul>
 *     <li>an active lock wins and is never extended by further attempts;</li>
 *     <li>a valid password resets the counter and clears the lock;</li>
 *     <li>an invalid password increments the counter and locks once it reaches
 *     {@code maxAttempts}.</li>
 * </ul>
 */
@Component
public class LockoutPolicy {

    private final int maxAttempts;
    private final Duration lockoutDuration;

    public LockoutPolicy(
            @Value("${clinic.auth.lockout.max-attempts:5}") int maxAttempts,
            @Value("${clinic.auth.lockout.duration:15m}") Duration lockoutDuration
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (lockoutDuration == null || lockoutDuration.isNegative() || lockoutDuration.isZero()) {
            throw new IllegalArgumentException("lockoutDuration must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.lockoutDuration = lockoutDuration;
    }

    public LockoutDecision evaluate(int failedAttempts, OffsetDateTime lockedUntil, OffsetDateTime now, boolean valid) {
        if (isLocked(lockedUntil, now)) {
            return new LockoutDecision(AuthOutcome.LOCKED, failedAttempts, lockedUntil);
        }
        if (valid) {
            return new LockoutDecision(AuthOutcome.SUCCESS, 0, null);
        }
        int next = Math.max(failedAttempts, 0) + 1;
        if (next >= maxAttempts) {
            return new LockoutDecision(AuthOutcome.LOCKED_JUST_NOW, next, now.plus(lockoutDuration));
        }
        return new LockoutDecision(AuthOutcome.INVALID_CREDENTIALS, next, null);
    }

    public boolean isLocked(OffsetDateTime lockedUntil, OffsetDateTime now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    public Duration remainingLock(OffsetDateTime lockedUntil, OffsetDateTime now) {
        if (!isLocked(lockedUntil, now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, lockedUntil);
    }

    public Duration getLockoutDuration() {
        return lockoutDuration;
    }
}
