package com.medclinic.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
