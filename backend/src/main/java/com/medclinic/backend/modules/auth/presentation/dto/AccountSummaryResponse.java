package com.medclinic.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medclinic.backend.modules.auth.domain.Account;

public record AccountSummaryResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        String role,
        boolean active,
        boolean verified,
        OffsetDateTime lastLogin
) {

    public static AccountSummaryResponse from(Account account) {
        return new AccountSummaryResponse(
                account.getId(),
                account.getEmail(),
                account.getFirstName(),
                account.getLastName(),
                account.getRole().name(),
                account.isActive(),
                account.isVerified(),
                account.getLastLogin()
        );
    }
}
