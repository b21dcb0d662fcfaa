package com.medclinic.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record LockedAccountsResponse(
        List<LockedAccount> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {

    public record LockedAccount(
            UUID id,
            String email,
            String role,
            int failedAttempts,
            OffsetDateTime lockedUntil,
            long remainingLockSeconds,
            long remainingLockMinutes
    ) {
    }
}
