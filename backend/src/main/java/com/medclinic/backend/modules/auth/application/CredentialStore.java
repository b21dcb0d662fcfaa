package com.medclinic.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.medclinic.backend.modules.auth.domain.Account;

import org.springframework.data.domain.Page;

/**
 * Account storage used by the authentication flows.
 *
 * <p>Lockout state is written with compare-and-set semantics: the write only applies when the
 * stored version still equals {@code expectedVersion}, and {@code false} is returned otherwise.
 * Storage failures surface as {@link org.springframework.dao.DataAccessException}.</p>
 */
public interface CredentialStore {

    Optional<Account> findByEmail(String email);

    Optional<Account> findById(UUID accountId);

    /**
     * Accounts whose lock is still running at {@code now}, soonest expiry first.
     */
    Page<Account> findLocked(OffsetDateTime now, int page, int size);

    boolean compareAndSetLockout(UUID accountId, long expectedVersion, int failedAttempts,
                                 OffsetDateTime lockedUntil, OffsetDateTime now);

    boolean compareAndSetLoginSuccess(UUID accountId, long expectedVersion, OffsetDateTime now);

    boolean updatePasswordHash(UUID accountId, String passwordHash, OffsetDateTime now);

    boolean resetLockout(UUID accountId, OffsetDateTime now);

    boolean updateActive(UUID accountId, boolean active, OffsetDateTime now);

    boolean existsByEmail(String email);

    Account create(Account account);
}
