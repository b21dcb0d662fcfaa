package com.medclinic.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medclinic.backend.modules.auth.domain.Account;

public record AccountSecurityResponse(
        UUID id,
        String email,
        String role,
        boolean active,
        boolean verified,
        int failedAttempts,
        boolean locked,
        OffsetDateTime lockedUntil,
        OffsetDateTime lastLogin
) {

    public static AccountSecurityResponse from(Account account, OffsetDateTime now) {
        return new AccountSecurityResponse(
                account.getId(),
                account.getEmail(),
                account.getRole().name(),
                account.isActive(),
                account.isVerified(),
                account.getFailedAttempts(),
                account.isLockedAt(now),
                account.getLockedUntil(),
                account.getLastLogin()
        );
    }
}
