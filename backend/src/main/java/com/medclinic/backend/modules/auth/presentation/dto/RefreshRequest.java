package com.medclinic.backend.modules.auth.presentation.dto;

/**
 * Optional body of a refresh call. The refresh cookie takes precedence when both are sent.
 */
public record RefreshRequest(String refreshToken) {
}
