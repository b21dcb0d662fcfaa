package com.medclinic.backend.global.security;

import java.util.UUID;

import com.medclinic.backend.modules.auth.domain.AccountRole;

public record JwtAuthenticationPrincipal(UUID accountId, String email, AccountRole role) {
}
