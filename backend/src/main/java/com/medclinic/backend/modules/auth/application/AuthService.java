package com.medclinic.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import com.medclinic.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.medclinic.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.medclinic.backend.modules.auth.application.JwtTokenService.TokenExpiredException;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditAction;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditOutcome;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.SecurityAuditEvent;
import com.medclinic.backend.modules.auth.domain.Account;
import com.medclinic.backend.modules.auth.domain.AuthOutcome;
import com.medclinic.backend.modules.auth.domain.LockoutDecision;
import com.medclinic.backend.modules.auth.domain.LockoutPolicy;
import com.medclinic.backend.modules.auth.presentation.dto.AccountResponse;
import com.medclinic.backend.modules.auth.presentation.dto.AccountSummaryResponse;
import com.medclinic.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.medclinic.backend.modules.auth.presentation.dto.LoginRequest;
import com.medclinic.backend.modules.auth.presentation.dto.LoginResponse;
import com.medclinic.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Login, token rotation and credential maintenance for staff accounts.
 *
 * <p>Not transactional as a whole: password hashing runs outside any transaction and each
 * write goes through a short conditional update of the {@link CredentialStore}.</p>
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final int MAX_CONDITIONAL_UPDATE_ATTEMPTS = 3;

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;
    private final LockoutPolicy lockoutPolicy;
    private final JwtTokenService jwtTokenService;
    private final SecurityAuditLogger auditLogger;
    private final Clock clock;

    public AuthService(
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            PasswordPolicy passwordPolicy,
            LockoutPolicy lockoutPolicy,
            JwtTokenService jwtTokenService,
            SecurityAuditLogger auditLogger,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.passwordPolicy = passwordPolicy;
        this.lockoutPolicy = lockoutPolicy;
        this.jwtTokenService = jwtTokenService;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public LoginResponse login(LoginRequest request, String sourceIp) {
        String email = normalizeEmail(request.email());
        String password = request.password();
        if (email.isEmpty() || password == null || password.isEmpty()) {
            audit(AuditAction.LOGIN, email, AuditOutcome.VALIDATION_ERROR, sourceIp);
            throw AuthProblems.validation("Email and password are required");
        }

        Optional<Account> found = storeCall(AuditAction.LOGIN, email, sourceIp,
                () -> credentialStore.findByEmail(email));
        if (found.isEmpty()) {
            passwordHasher.verifyDummy(password);
            audit(AuditAction.LOGIN, email, AuditOutcome.INVALID_CREDENTIALS, sourceIp, Map.of("reason", "unknown_account"));
            throw AuthProblems.invalidCredentials();
        }

        Account account = found.get();
        if (!account.isActive()) {
            audit(AuditAction.LOGIN, email, AuditOutcome.ACCOUNT_DEACTIVATED, sourceIp);
            throw AuthProblems.accountDeactivated();
        }

        OffsetDateTime checkedAt = now();
        if (lockoutPolicy.isLocked(account.getLockedUntil(), checkedAt)) {
            audit(AuditAction.LOGIN, email, AuditOutcome.ACCOUNT_LOCKED, sourceIp);
            throw AuthProblems.accountLocked(lockoutPolicy.remainingLock(account.getLockedUntil(), checkedAt));
        }

        boolean valid = passwordHasher.verify(password, account.getPasswordHash());
        PersistedAttempt attempt = persistAttempt(account, valid, email, sourceIp);
        LockoutDecision decision = attempt.decision();

        switch (decision.outcome()) {
            case SUCCESS -> {
                Account current = attempt.account();
                TokenPair pair = jwtTokenService.issueTokenPair(current);
                audit(AuditAction.LOGIN, email, AuditOutcome.SUCCESS, sourceIp);
                return LoginResponse.of(AccountSummaryResponse.from(current), pair);
            }
            case INVALID_CREDENTIALS -> {
                audit(AuditAction.LOGIN, email, AuditOutcome.INVALID_CREDENTIALS, sourceIp,
                        Map.of("failedAttempts", decision.failedAttempts()));
                throw AuthProblems.invalidCredentials();
            }
            case LOCKED_JUST_NOW -> {
                audit(AuditAction.LOGIN, email, AuditOutcome.ACCOUNT_LOCKED, sourceIp,
                        Map.of("failedAttempts", decision.failedAttempts(), "lockedUntil", decision.lockedUntil()));
                throw AuthProblems.accountLocked(lockoutPolicy.getLockoutDuration());
            }
            default -> {
                audit(AuditAction.LOGIN, email, AuditOutcome.ACCOUNT_LOCKED, sourceIp);
                throw AuthProblems.accountLocked(lockoutPolicy.remainingLock(decision.lockedUntil(), now()));
            }
        }
    }

    public TokenPairResponse refresh(String refreshToken, String sourceIp) {
        if (refreshToken == null || refreshToken.isBlank()) {
            audit(AuditAction.REFRESH, null, AuditOutcome.AUTHENTICATION_ERROR, sourceIp, Map.of("reason", "missing_token"));
            throw AuthProblems.authenticationError("Refresh token required");
        }

        ParsedToken parsed = parseToken(AuditAction.REFRESH, sourceIp, () -> jwtTokenService.parseRefreshToken(refreshToken));
        String principal = parsed.accountId().toString();

        Optional<Account> found = storeCall(AuditAction.REFRESH, principal, sourceIp,
                () -> credentialStore.findById(parsed.accountId()));
        if (found.isEmpty() || !found.get().isActive() || found.get().isLockedAt(now())) {
            audit(AuditAction.REFRESH, principal, AuditOutcome.AUTHENTICATION_ERROR, sourceIp,
                    Map.of("reason", found.isEmpty() ? "unknown_account" : "account_unavailable"));
            throw AuthProblems.authenticationError("Invalid refresh token");
        }

        TokenPair pair = jwtTokenService.issueTokenPair(found.get());
        audit(AuditAction.REFRESH, found.get().getEmail(), AuditOutcome.SUCCESS, sourceIp);
        return TokenPairResponse.from(pair);
    }

    /**
     * Records the logout. Tokens are stateless so there is nothing to revoke server side; the
     * caller clears the cookies.
     */
    public void logout(UUID accountId, String email, String sourceIp) {
        String principal = email != null ? email : accountId != null ? accountId.toString() : null;
        audit(AuditAction.LOGOUT, principal, AuditOutcome.SUCCESS, sourceIp,
                Map.of("authenticated", accountId != null));
    }

    public AccountResponse verify(String token, String sourceIp) {
        if (token == null || token.isBlank()) {
            audit(AuditAction.VERIFY, null, AuditOutcome.VALIDATION_ERROR, sourceIp);
            throw AuthProblems.validation("Token is required");
        }

        ParsedToken parsed = parseToken(AuditAction.VERIFY, sourceIp, () -> jwtTokenService.parseAccessToken(token));
        String principal = parsed.accountId().toString();

        Optional<Account> found = storeCall(AuditAction.VERIFY, principal, sourceIp,
                () -> credentialStore.findById(parsed.accountId()));
        if (found.isEmpty() || !found.get().isActive() || found.get().isLockedAt(now())) {
            audit(AuditAction.VERIFY, principal, AuditOutcome.AUTHENTICATION_ERROR, sourceIp);
            throw AuthProblems.authenticationError("Invalid token");
        }
        return new AccountResponse(AccountSummaryResponse.from(found.get()));
    }

    public void changePassword(UUID accountId, ChangePasswordRequest request, String sourceIp) {
        String accountKey = accountId.toString();
        if (request.currentPassword() == null || request.currentPassword().isEmpty()
                || request.newPassword() == null || request.newPassword().isEmpty()) {
            audit(AuditAction.CHANGE_PASSWORD, accountKey, AuditOutcome.VALIDATION_ERROR, sourceIp);
            throw AuthProblems.validation("Current and new password are required");
        }

        Optional<Account> found = storeCall(AuditAction.CHANGE_PASSWORD, accountKey, sourceIp,
                () -> credentialStore.findById(accountId));
        if (found.isEmpty() || !found.get().isActive()) {
            audit(AuditAction.CHANGE_PASSWORD, accountKey, AuditOutcome.AUTHENTICATION_ERROR, sourceIp);
            throw AuthProblems.authenticationError("Account not available");
        }
        Account account = found.get();
        String email = account.getEmail();
        OffsetDateTime checkedAt = now();
        if (account.isLockedAt(checkedAt)) {
            audit(AuditAction.CHANGE_PASSWORD, email, AuditOutcome.ACCOUNT_LOCKED, sourceIp);
            throw AuthProblems.accountLocked(lockoutPolicy.remainingLock(account.getLockedUntil(), checkedAt));
        }

        if (!passwordHasher.verify(request.currentPassword(), account.getPasswordHash())) {
            audit(AuditAction.CHANGE_PASSWORD, email, AuditOutcome.VALIDATION_ERROR, sourceIp,
                    Map.of("reason", "current_password_mismatch"));
            throw AuthProblems.validation("Current password is incorrect");
        }

        List<String> violations = passwordPolicy.violations(request.newPassword());
        if (!violations.isEmpty()) {
            audit(AuditAction.CHANGE_PASSWORD, email, AuditOutcome.VALIDATION_ERROR, sourceIp,
                    Map.of("reason", "weak_password"));
            throw AuthProblems.validation("New password " + String.join(", ", violations));
        }
        if (request.newPassword().equals(request.currentPassword())) {
            audit(AuditAction.CHANGE_PASSWORD, email, AuditOutcome.VALIDATION_ERROR, sourceIp,
                    Map.of("reason", "password_reused"));
            throw AuthProblems.validation("New password must be different from current password");
        }

        String newHash = passwordHasher.hash(request.newPassword());
        boolean updated = storeCall(AuditAction.CHANGE_PASSWORD, email, sourceIp,
                () -> credentialStore.updatePasswordHash(account.getId(), newHash, now()));
        if (!updated) {
            audit(AuditAction.CHANGE_PASSWORD, email, AuditOutcome.AUTHENTICATION_ERROR, sourceIp);
            throw AuthProblems.authenticationError("Account not available");
        }
        audit(AuditAction.CHANGE_PASSWORD, email, AuditOutcome.SUCCESS, sourceIp);
    }

    public AccountResponse currentAccount(UUID accountId) {
        Account account;
        try {
            account = credentialStore.findById(accountId)
                    .orElseThrow(() -> AuthProblems.authenticationError("Account not available"));
        } catch (DataAccessException ex) {
            log.error("Failed to load account {}", accountId, ex);
            throw AuthProblems.serverError("Account lookup failed", ex);
        }
        if (!account.isActive()) {
            throw AuthProblems.authenticationError("Account not available");
        }
        OffsetDateTime checkedAt = now();
        if (account.isLockedAt(checkedAt)) {
            throw AuthProblems.accountLocked(lockoutPolicy.remainingLock(account.getLockedUntil(), checkedAt));
        }
        return new AccountResponse(AccountSummaryResponse.from(account));
    }

    /**
     * Applies the lockout decision with a conditional update on the account version. When a
     * concurrent attempt wins, the account is re-read and the decision recomputed from the
     * same hash result.
     */
    private PersistedAttempt persistAttempt(Account account, boolean valid, String email, String sourceIp) {
        Account current = account;
        for (int attempt = 1; attempt <= MAX_CONDITIONAL_UPDATE_ATTEMPTS; attempt++) {
            OffsetDateTime now = now();
            LockoutDecision decision = lockoutPolicy.evaluate(
                    current.getFailedAttempts(), current.getLockedUntil(), now, valid);
            if (decision.outcome() == AuthOutcome.LOCKED) {
                return new PersistedAttempt(current, decision);
            }

            Account snapshot = current;
            boolean written = storeCall(AuditAction.LOGIN, email, sourceIp, () -> decision.granted()
                    ? credentialStore.compareAndSetLoginSuccess(snapshot.getId(), snapshot.getVersion(), now)
                    : credentialStore.compareAndSetLockout(snapshot.getId(), snapshot.getVersion(),
                            decision.failedAttempts(), decision.lockedUntil(), now));
            if (written) {
                current.setFailedAttempts(decision.failedAttempts());
                current.setLockedUntil(decision.lockedUntil());
                if (decision.granted()) {
                    current.setLastLogin(now);
                }
                return new PersistedAttempt(current, decision);
            }

            log.debug("Concurrent lockout update for account {} (attempt {})", current.getId(), attempt);
            Optional<Account> reloaded = storeCall(AuditAction.LOGIN, email, sourceIp,
                    () -> credentialStore.findById(snapshot.getId()));
            if (reloaded.isEmpty()) {
                audit(AuditAction.LOGIN, email, AuditOutcome.INVALID_CREDENTIALS, sourceIp, Map.of("reason", "account_removed"));
                throw AuthProblems.invalidCredentials();
            }
            current = reloaded.get();
            if (!current.isActive()) {
                audit(AuditAction.LOGIN, email, AuditOutcome.ACCOUNT_DEACTIVATED, sourceIp);
                throw AuthProblems.accountDeactivated();
            }
        }

        log.error("Gave up persisting login attempt for account {} after {} conflicting updates",
                account.getId(), MAX_CONDITIONAL_UPDATE_ATTEMPTS);
        audit(AuditAction.LOGIN, email, AuditOutcome.SERVER_ERROR, sourceIp, Map.of("reason", "update_contention"));
        throw AuthProblems.serverError("Could not record login attempt", null);
    }

    private ParsedToken parseToken(AuditAction action, String sourceIp, Supplier<ParsedToken> parser) {
        try {
            return parser.get();
        } catch (TokenExpiredException ex) {
            audit(action, null, AuditOutcome.TOKEN_EXPIRED, sourceIp);
            throw AuthProblems.tokenExpired();
        } catch (InvalidTokenException ex) {
            audit(action, null, AuditOutcome.INVALID_TOKEN, sourceIp);
            throw AuthProblems.invalidToken();
        }
    }

    private <T> T storeCall(AuditAction action, String principal, String sourceIp, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException ex) {
            log.error("Credential store failure during {} for {}", action, principal, ex);
            audit(action, principal, AuditOutcome.SERVER_ERROR, sourceIp);
            throw AuthProblems.serverError("Credential store unavailable", ex);
        }
    }

    private void audit(AuditAction action, String principal, AuditOutcome outcome, String sourceIp) {
        auditLogger.record(action, principal, outcome, sourceIp);
    }

    private void audit(AuditAction action, String principal, AuditOutcome outcome, String sourceIp,
                       Map<String, Object> detail) {
        auditLogger.record(new SecurityAuditEvent(action, principal, outcome, sourceIp, detail));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private record PersistedAttempt(Account account, LockoutDecision decision) {
    }
}
