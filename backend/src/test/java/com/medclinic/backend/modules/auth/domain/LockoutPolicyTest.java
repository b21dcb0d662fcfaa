package com.medclinic.backend.modules.auth.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.OffsetDateTime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LockoutPolicyTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T10:00:00Z");

    private final LockoutPolicy policy = new LockoutPolicy(5, Duration.ofMinutes(15));

    @Test
    @DisplayName("five consecutive failures lock the account for fifteen minutes")
    void lockAfterMaxAttempts() {
        int failed = 0;
        OffsetDateTime lockedUntil = null;
        for (int attempt = 1; attempt <= 4; attempt++) {
            LockoutDecision decision = policy.evaluate(failed, lockedUntil, NOW, false);
            assertThat(decision.outcome()).isEqualTo(AuthOutcome.INVALID_CREDENTIALS);
            assertThat(decision.failedAttempts()).isEqualTo(attempt);
            assertThat(decision.lockedUntil()).isNull();
            failed = decision.failedAttempts();
            lockedUntil = decision.lockedUntil();
        }

        LockoutDecision fifth = policy.evaluate(failed, lockedUntil, NOW, false);

        assertThat(fifth.outcome()).isEqualTo(AuthOutcome.LOCKED_JUST_NOW);
        assertThat(fifth.failedAttempts()).isEqualTo(5);
        assertThat(fifth.lockedUntil()).isEqualTo(NOW.plusMinutes(15));
        assertThat(fifth.granted()).isFalse();
    }

    @Test
    void correctPasswordIsRejectedWhileLocked() {
        OffsetDateTime lockedUntil = NOW.plusMinutes(10);

        LockoutDecision decision = policy.evaluate(5, lockedUntil, NOW, true);

        assertThat(decision.outcome()).isEqualTo(AuthOutcome.LOCKED);
        assertThat(decision.granted()).isFalse();
        assertThat(decision.failedAttempts()).isEqualTo(5);
        assertThat(decision.lockedUntil()).isEqualTo(lockedUntil);
    }

    @Test
    void failuresWhileLockedDoNotExtendTheLock() {
        OffsetDateTime lockedUntil = NOW.plusMinutes(1);

        LockoutDecision decision = policy.evaluate(5, lockedUntil, NOW, false);

        assertThat(decision.outcome()).isEqualTo(AuthOutcome.LOCKED);
        assertThat(decision.lockedUntil()).isEqualTo(lockedUntil);
        assertThat(decision.failedAttempts()).isEqualTo(5);
    }

    @Test
    void successResetsCounterAndClearsExpiredLock() {
        LockoutDecision decision = policy.evaluate(5, NOW.minusSeconds(1), NOW, true);

        assertThat(decision.outcome()).isEqualTo(AuthOutcome.SUCCESS);
        assertThat(decision.failedAttempts()).isZero();
        assertThat(decision.lockedUntil()).isNull();
    }

    @Test
    void lockEndingExactlyNowNoLongerBlocks() {
        assertThat(policy.isLocked(NOW, NOW)).isFalse();
        assertThat(policy.isLocked(NOW.plusNanos(1), NOW)).isTrue();
    }

    @Test
    @DisplayName("a failure after an expired lock locks again right away")
    void failureAfterExpiredLockRelocks() {
        LockoutDecision decision = policy.evaluate(5, NOW.minusMinutes(1), NOW, false);

        assertThat(decision.outcome()).isEqualTo(AuthOutcome.LOCKED_JUST_NOW);
        assertThat(decision.failedAttempts()).isEqualTo(6);
        assertThat(decision.lockedUntil()).isEqualTo(NOW.plusMinutes(15));
    }

    @Test
    void counterNeverDecreasesOnFailure() {
        int failed = 0;
        OffsetDateTime lockedUntil = null;
        OffsetDateTime now = NOW;
        for (int i = 0; i < 20; i++) {
            LockoutDecision decision = policy.evaluate(failed, lockedUntil, now, false);
            assertThat(decision.failedAttempts()).isGreaterThanOrEqualTo(failed);
            failed = decision.failedAttempts();
            lockedUntil = decision.lockedUntil();
            now = now.plusMinutes(4);
        }
    }

    @Test
    void remainingLockIsZeroWhenUnlocked() {
        assertThat(policy.remainingLock(null, NOW)).isEqualTo(Duration.ZERO);
        assertThat(policy.remainingLock(NOW.minusSeconds(5), NOW)).isEqualTo(Duration.ZERO);
        assertThat(policy.remainingLock(NOW.plusSeconds(90), NOW)).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new LockoutPolicy(0, Duration.ofMinutes(15)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LockoutPolicy(5, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
