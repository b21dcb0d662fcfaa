package com.medclinic.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

public record VerifyTokenRequest(
        @Size(max = 4096) String token
) {
}
