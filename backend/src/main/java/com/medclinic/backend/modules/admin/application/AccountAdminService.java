package com.medclinic.backend.modules.admin.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.medclinic.backend.modules.admin.presentation.dto.AccountSecurityResponse;
import com.medclinic.backend.modules.admin.presentation.dto.LockedAccountsResponse;
import com.medclinic.backend.modules.auth.application.AuthProblems;
import com.medclinic.backend.modules.auth.application.CredentialStore;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditAction;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditOutcome;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.SecurityAuditEvent;
import com.medclinic.backend.modules.auth.domain.Account;
import com.medclinic.backend.modules.auth.domain.AccountRole;

import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

/**
 * Account-security maintenance for managers. Callers must hold an active, verified MANAGER
 * account at the time of the call; the role claim in the token alone is not enough.
 */
@Service
public class AccountAdminService {

    static final int MAX_PAGE_SIZE = 100;

    private final CredentialStore credentialStore;
    private final SecurityAuditLogger auditLogger;
    private final Clock clock;

    public AccountAdminService(CredentialStore credentialStore, SecurityAuditLogger auditLogger, Clock clock) {
        this.credentialStore = credentialStore;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public AccountSecurityResponse unlock(UUID actorId, UUID targetId, String sourceIp) {
        Account actor = requireAdministrator(actorId, AuditAction.ADMIN_UNLOCK, sourceIp);
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!credentialStore.resetLockout(targetId, now)) {
            record(AuditAction.ADMIN_UNLOCK, actor, AuditOutcome.NOT_FOUND, sourceIp, targetId);
            throw AuthProblems.accountNotFound();
        }
        record(AuditAction.ADMIN_UNLOCK, actor, AuditOutcome.SUCCESS, sourceIp, targetId);
        return snapshot(targetId, now);
    }

    public AccountSecurityResponse updateStatus(UUID actorId, UUID targetId, boolean active, String sourceIp) {
        Account actor = requireAdministrator(actorId, AuditAction.ADMIN_STATUS_CHANGE, sourceIp);
        if (!active && actor.getId().equals(targetId)) {
            record(AuditAction.ADMIN_STATUS_CHANGE, actor, AuditOutcome.VALIDATION_ERROR, sourceIp, targetId);
            throw AuthProblems.validation("Managers cannot deactivate their own account");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!credentialStore.updateActive(targetId, active, now)) {
            record(AuditAction.ADMIN_STATUS_CHANGE, actor, AuditOutcome.NOT_FOUND, sourceIp, targetId);
            throw AuthProblems.accountNotFound();
        }
        auditLogger.record(new SecurityAuditEvent(
                AuditAction.ADMIN_STATUS_CHANGE,
                actor.getEmail(),
                AuditOutcome.SUCCESS,
                sourceIp,
                Map.of("target", targetId.toString(), "active", active)
        ));
        return snapshot(targetId, now);
    }

    public AccountSecurityResponse securitySnapshot(UUID actorId, UUID targetId, String sourceIp) {
        requireAdministrator(actorId, null, sourceIp);
        return snapshot(targetId, OffsetDateTime.now(clock));
    }

    public LockedAccountsResponse lockedAccounts(UUID actorId, int page, int size, String sourceIp) {
        requireAdministrator(actorId, null, sourceIp);
        int normalizedPage = Math.max(page, 0);
        int normalizedSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        OffsetDateTime now = OffsetDateTime.now(clock);

        Page<Account> result = credentialStore.findLocked(now, normalizedPage, normalizedSize);
        List<LockedAccountsResponse.LockedAccount> items = result.getContent().stream()
                .filter(account -> account.isLockedAt(now))
                .map(account -> toLockedAccount(account, now))
                .toList();

        return new LockedAccountsResponse(
                items,
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                result.getTotalPages()
        );
    }

    private LockedAccountsResponse.LockedAccount toLockedAccount(Account account, OffsetDateTime now) {
        Duration remaining = Duration.between(now, account.getLockedUntil());
        return new LockedAccountsResponse.LockedAccount(
                account.getId(),
                account.getEmail(),
                account.getRole().name(),
                account.getFailedAttempts(),
                account.getLockedUntil(),
                AuthProblems.ceilSeconds(remaining),
                (AuthProblems.ceilSeconds(remaining) + 59) / 60
        );
    }

    private AccountSecurityResponse snapshot(UUID targetId, OffsetDateTime now) {
        Account target = credentialStore.findById(targetId)
                .orElseThrow(AuthProblems::accountNotFound);
        return AccountSecurityResponse.from(target, now);
    }

    private Account requireAdministrator(UUID actorId, AuditAction action, String sourceIp) {
        Account actor = credentialStore.findById(actorId)
                .filter(Account::isActive)
                .orElse(null);
        if (actor == null) {
            audit(action, actorId.toString(), AuditOutcome.AUTHENTICATION_ERROR, sourceIp);
            throw AuthProblems.authenticationError("Account not available");
        }
        if (actor.getRole() != AccountRole.MANAGER) {
            audit(action, actor.getEmail(), AuditOutcome.FORBIDDEN, sourceIp);
            throw AuthProblems.forbidden("Manager role required");
        }
        if (!actor.isVerified()) {
            audit(action, actor.getEmail(), AuditOutcome.FORBIDDEN, sourceIp);
            throw AuthProblems.accountNotVerified();
        }
        return actor;
    }

    private void audit(AuditAction action, String principal, AuditOutcome outcome, String sourceIp) {
        if (action != null) {
            auditLogger.record(action, principal, outcome, sourceIp);
        }
    }

    private void record(AuditAction action, Account actor, AuditOutcome outcome, String sourceIp, UUID targetId) {
        auditLogger.record(new SecurityAuditEvent(action, actor.getEmail(), outcome, sourceIp,
                Map.of("target", targetId.toString())));
    }
}
