package com.medclinic.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Presence of both fields is checked by the login flow itself so that the rejection is audited.
 */
public record LoginRequest(
        @Size(max = 320) String email,
        @Size(max = 256) String password
) {
}
