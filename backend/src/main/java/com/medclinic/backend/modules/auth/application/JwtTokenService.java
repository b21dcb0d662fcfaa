package com.medclinic.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.medclinic.backend.modules.auth.domain.Account;
import com.medclinic.backend.modules.auth.domain.AccountRole;
import com.medclinic.backend.modules.auth.domain.TokenType;
import com.medclinic.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Mints and verifies the stateless access/refresh token pair. Validity is decided by
 * signature, type, issuer, audience and expiry only; nothing is persisted.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_TYPE = "type";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_EMAIL = "email";

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final String issuer;
    private final String audience;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${clinic.auth.jwt.access-ttl:15m}") Duration accessTokenTtl,
            @Value("${clinic.auth.jwt.refresh-ttl:7d}") Duration refreshTokenTtl,
            @Value("${clinic.auth.jwt.issuer:medical-clinic-api}") String issuer,
            @Value("${clinic.auth.jwt.audience:medical-clinic-client}") String audience,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
        this.issuer = issuer;
        this.audience = audience;
        this.clock = clock;
    }

    public TokenPair issueTokenPair(Account account) {
        Instant now = clock.instant();
        String accessToken = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(account.getId().toString())
                .issuer(issuer)
                .audience().add(audience).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(accessTokenTtl)))
                .claim(CLAIM_TYPE, TokenType.ACCESS.claimValue())
                .claim(CLAIM_ROLE, account.getRole().name())
                .claim(CLAIM_EMAIL, account.getEmail())
                .signWith(tokenProvider.getSecretKey(TokenType.ACCESS), SIG.HS256)
                .compact();

        String refreshToken = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(account.getId().toString())
                .issuer(issuer)
                .audience().add(audience).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(refreshTokenTtl)))
                .claim(CLAIM_TYPE, TokenType.REFRESH.claimValue())
                .signWith(tokenProvider.getSecretKey(TokenType.REFRESH), SIG.HS256)
                .compact();

        return new TokenPair(
                accessToken,
                refreshToken,
                accessTokenTtl.toSeconds(),
                refreshTokenTtl.toSeconds(),
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        return parse(token, TokenType.ACCESS);
    }

    public ParsedToken parseRefreshToken(String token) {
        return parse(token, TokenType.REFRESH);
    }

    public ParsedToken parse(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty", null);
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey(expectedType))
                    .requireIssuer(issuer)
                    .requireAudience(audience)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid " + expectedType.claimValue() + " token", e);
        }

        TokenType actualType = TokenType.fromClaim(claims.get(CLAIM_TYPE, String.class));
        if (actualType != expectedType) {
            throw new InvalidTokenException("Unexpected token type", null);
        }

        try {
            UUID accountId = UUID.fromString(claims.getSubject());
            String roleClaim = claims.get(CLAIM_ROLE, String.class);
            AccountRole role = roleClaim == null ? null : AccountRole.from(roleClaim);
            if (actualType == TokenType.ACCESS && role == null) {
                throw new InvalidTokenException("Access token without role", null);
            }
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration().toInstant();
            return new ParsedToken(
                    accountId,
                    actualType,
                    role,
                    claims.get(CLAIM_EMAIL, String.class),
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (RuntimeException e) {
            throw new InvalidTokenException("Malformed token claims", e);
        }
    }

    public record ParsedToken(
            UUID accountId,
            TokenType type,
            AccountRole role,
            String email,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class TokenExpiredException extends InvalidTokenException {
        public TokenExpiredException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
