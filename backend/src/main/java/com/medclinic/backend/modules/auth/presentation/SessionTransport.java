package com.medclinic.backend.modules.auth.presentation;

import java.time.Duration;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Moves tokens between HTTP and the auth flows: HttpOnly cookies out, bearer header, cookie or
 * body in.
 */
@Component
public class SessionTransport {

    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";
    public static final String LEGACY_SESSION_COOKIE = "session_id";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String SAME_SITE = "Strict";

    private final boolean secure;
    private final String refreshPath;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;

    public SessionTransport(
            @Value("${clinic.auth.cookie.secure:true}") boolean secure,
            @Value("${clinic.auth.cookie.refresh-path:/api/v1/auth/refresh}") String refreshPath,
            @Value("${clinic.auth.jwt.access-ttl:15m}") Duration accessTokenTtl,
            @Value("${clinic.auth.jwt.refresh-ttl:7d}") Duration refreshTokenTtl
    ) {
        this.secure = secure;
        this.refreshPath = refreshPath;
        this.accessTokenTtl = accessTokenTtl;
        this.refreshTokenTtl = refreshTokenTtl;
    }

    public void writeTokens(HttpServletResponse response, String accessToken, String refreshToken) {
        response.addHeader(HttpHeaders.SET_COOKIE,
                cookie(ACCESS_TOKEN_COOKIE, accessToken, "/", accessTokenTtl).toString());
        response.addHeader(HttpHeaders.SET_COOKIE,
                cookie(REFRESH_TOKEN_COOKIE, refreshToken, refreshPath, refreshTokenTtl).toString());
    }

    public void clear(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(ACCESS_TOKEN_COOKIE, "", "/", Duration.ZERO).toString());
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(REFRESH_TOKEN_COOKIE, "", refreshPath, Duration.ZERO).toString());
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(LEGACY_SESSION_COOKIE, "", "/", Duration.ZERO).toString());
    }

    /**
     * Access token from the {@code Authorization} header, falling back to the access cookie.
     */
    public String resolveAccessToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        return readCookie(request, ACCESS_TOKEN_COOKIE);
    }

    /**
     * Refresh token from the refresh cookie, falling back to the request body.
     */
    public String resolveRefreshToken(HttpServletRequest request, String bodyToken) {
        String fromCookie = readCookie(request, REFRESH_TOKEN_COOKIE);
        if (fromCookie != null) {
            return fromCookie;
        }
        return bodyToken == null || bodyToken.isBlank() ? null : bodyToken.trim();
    }

    private ResponseCookie cookie(String name, String value, String path, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite(SAME_SITE)
                .path(path)
                .maxAge(maxAge)
                .build();
    }

    private static String readCookie(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                return cookie.getValue();
            }
        }
        return null;
    }
}
