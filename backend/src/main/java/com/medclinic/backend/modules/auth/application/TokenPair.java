package com.medclinic.backend.modules.auth.application;

import java.time.OffsetDateTime;

public record TokenPair(
        String accessToken,
        String refreshToken,
        long accessExpiresIn,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {
    public static final String TOKEN_TYPE = "Bearer";
}
