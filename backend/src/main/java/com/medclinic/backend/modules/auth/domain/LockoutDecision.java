package com.medclinic.backend.modules.auth.domain;

import java.time.OffsetDateTime;

/**
 * Next lockout state of an account after one login attempt.
 */
public record LockoutDecision(AuthOutcome outcome, int failedAttempts, OffsetDateTime lockedUntil) {

    public boolean granted() {
        return outcome == AuthOutcome.SUCCESS;
    }
}
