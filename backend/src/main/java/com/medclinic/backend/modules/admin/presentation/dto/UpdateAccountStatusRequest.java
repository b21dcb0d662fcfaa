package com.medclinic.backend.modules.admin.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateAccountStatusRequest(
        @NotNull(message = "active is required") Boolean active
) {
}
