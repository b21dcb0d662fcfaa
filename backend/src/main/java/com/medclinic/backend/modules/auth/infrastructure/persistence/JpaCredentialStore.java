package com.medclinic.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.medclinic.backend.modules.auth.application.CredentialStore;
import com.medclinic.backend.modules.auth.domain.Account;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JpaCredentialStore implements CredentialStore {

    private final AccountRepository accountRepository;

    public JpaCredentialStore(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return accountRepository.findByEmailIgnoreCase(email.trim());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findById(UUID accountId) {
        return accountRepository.findById(accountId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<Account> findLocked(OffsetDateTime now, int page, int size) {
        PageRequest pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.ASC, "lockedUntil"));
        return accountRepository.findByLockedUntilAfter(now, pageable);
    }

    @Override
    @Transactional
    public boolean compareAndSetLockout(UUID accountId, long expectedVersion, int failedAttempts,
                                        OffsetDateTime lockedUntil, OffsetDateTime now) {
        return accountRepository.updateLockoutState(accountId, expectedVersion, failedAttempts, lockedUntil, now) == 1;
    }

    @Override
    @Transactional
    public boolean compareAndSetLoginSuccess(UUID accountId, long expectedVersion, OffsetDateTime now) {
        return accountRepository.recordSuccessfulLogin(accountId, expectedVersion, now) == 1;
    }

    @Override
    @Transactional
    public boolean updatePasswordHash(UUID accountId, String passwordHash, OffsetDateTime now) {
        return accountRepository.updatePasswordHash(accountId, passwordHash, now) == 1;
    }

    @Override
    @Transactional
    public boolean resetLockout(UUID accountId, OffsetDateTime now) {
        return accountRepository.resetLockout(accountId, now) == 1;
    }

    @Override
    @Transactional
    public boolean updateActive(UUID accountId, boolean active, OffsetDateTime now) {
        return accountRepository.updateActive(accountId, active, now) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return accountRepository.existsByEmail(email);
    }

    @Override
    @Transactional
    public Account create(Account account) {
        return accountRepository.saveAndFlush(account);
    }
}
