package com.medclinic.backend.modules.auth.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import com.medclinic.backend.modules.auth.application.CredentialStore;
import com.medclinic.backend.modules.auth.domain.Account;
import com.medclinic.backend.modules.auth.domain.AccountRole;
import com.medclinic.backend.support.AbstractPostgresIntegrationTest;
import com.medclinic.backend.support.TestAccountFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Page;

@SpringBootTest
class JpaCredentialStoreIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private TestAccountFactory testAccountFactory;

    private Account nurse;
    private OffsetDateTime now;

    @BeforeEach
    void setUp() {
        nurse = testAccountFactory.createStaff("nurse@clinic.com", "Nurse123!", AccountRole.NURSE);
        now = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    }

    @Test
    void lookupIgnoresEmailCase() {
        assertThat(credentialStore.findByEmail("NURSE@Clinic.COM"))
                .map(Account::getId)
                .contains(nurse.getId());
    }

    @Test
    void conditionalUpdateAppliesOnceAndBumpsVersion() {
        long version = credentialStore.findById(nurse.getId()).orElseThrow().getVersion();

        assertThat(credentialStore.compareAndSetLockout(nurse.getId(), version, 1, null, now)).isTrue();
        assertThat(credentialStore.compareAndSetLockout(nurse.getId(), version, 1, null, now))
                .as("stale version must not overwrite")
                .isFalse();

        Account stored = credentialStore.findById(nurse.getId()).orElseThrow();
        assertThat(stored.getVersion()).isEqualTo(version + 1);
        assertThat(stored.getFailedAttempts()).isEqualTo(1);
    }

    @Test
    void lockIsPersistedAndClearedBySuccessfulLogin() {
        long version = credentialStore.findById(nurse.getId()).orElseThrow().getVersion();
        OffsetDateTime lockedUntil = now.plusMinutes(15);

        credentialStore.compareAndSetLockout(nurse.getId(), version, 5, lockedUntil, now);
        Account locked = credentialStore.findById(nurse.getId()).orElseThrow();
        assertThat(locked.getLockedUntil()).isAtSameInstantAs(lockedUntil);
        assertThat(locked.isLockedAt(now)).isTrue();

        assertThat(credentialStore.compareAndSetLoginSuccess(nurse.getId(), locked.getVersion(), now)).isTrue();
        Account cleared = credentialStore.findById(nurse.getId()).orElseThrow();
        assertThat(cleared.getFailedAttempts()).isZero();
        assertThat(cleared.getLockedUntil()).isNull();
        assertThat(cleared.getLastLogin()).isAtSameInstantAs(now);
    }

    @Test
    void unconditionalUpdatesReportMissingAccounts() {
        assertThat(credentialStore.resetLockout(UUID.randomUUID(), now)).isFalse();
        assertThat(credentialStore.updateActive(nurse.getId(), false, now)).isTrue();
        assertThat(credentialStore.findById(nurse.getId()).orElseThrow().isActive()).isFalse();
    }

    @Test
    void lockedAccountsAreListedSoonestExpiryFirst() {
        Account doctor = testAccountFactory.createStaff("doctor@clinic.com", "Doctor123!", AccountRole.DOCTOR);
        Account secretary = testAccountFactory.createStaff("secretary@clinic.com", "Secret123!", AccountRole.SECRETARY);
        credentialStore.compareAndSetLockout(doctor.getId(),
                credentialStore.findById(doctor.getId()).orElseThrow().getVersion(), 5, now.plusMinutes(12), now);
        credentialStore.compareAndSetLockout(secretary.getId(),
                credentialStore.findById(secretary.getId()).orElseThrow().getVersion(), 5, now.plusMinutes(3), now);
        credentialStore.compareAndSetLockout(nurse.getId(),
                credentialStore.findById(nurse.getId()).orElseThrow().getVersion(), 5, now.minusMinutes(1), now);

        Page<Account> locked = credentialStore.findLocked(now, 0, 10);

        assertThat(locked.getTotalElements()).isEqualTo(2);
        assertThat(locked.getContent()).extracting(Account::getEmail)
                .containsExactly("secretary@clinic.com", "doctor@clinic.com");
    }
}
