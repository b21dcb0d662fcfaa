package com.medclinic.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @Size(max = 256) String currentPassword,
        @Size(max = 256) String newPassword
) {
}
