package com.medclinic.backend.modules.auth.presentation.dto;

public record AccountResponse(AccountSummaryResponse account) {
}
