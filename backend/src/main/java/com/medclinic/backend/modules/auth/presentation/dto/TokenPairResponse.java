package com.medclinic.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.medclinic.backend.modules.auth.application.TokenPair;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {

    public static TokenPairResponse from(TokenPair pair) {
        return new TokenPairResponse(
                pair.accessToken(),
                TokenPair.TOKEN_TYPE,
                pair.accessExpiresIn(),
                pair.refreshToken(),
                pair.refreshExpiresIn(),
                pair.issuedAt()
        );
    }
}
