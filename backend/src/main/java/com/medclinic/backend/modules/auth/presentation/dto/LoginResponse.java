package com.medclinic.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.medclinic.backend.modules.auth.application.TokenPair;

public record LoginResponse(
        AccountSummaryResponse account,
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {

    public static LoginResponse of(AccountSummaryResponse account, TokenPair pair) {
        return new LoginResponse(
                account,
                pair.accessToken(),
                pair.refreshToken(),
                TokenPair.TOKEN_TYPE,
                pair.accessExpiresIn(),
                pair.refreshExpiresIn(),
                pair.issuedAt()
        );
    }
}
