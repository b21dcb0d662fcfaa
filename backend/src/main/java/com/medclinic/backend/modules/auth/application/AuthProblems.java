package com.medclinic.backend.modules.auth.application;

import java.time.Duration;

import com.medclinic.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Factories for the problem codes raised by the authentication flows.
 */
public final class AuthProblems {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String ACCOUNT_DEACTIVATED = "ACCOUNT_DEACTIVATED";
    public static final String ACCOUNT_LOCKED = "ACCOUNT_LOCKED";
    public static final String INVALID_TOKEN = "INVALID_TOKEN";
    public static final String TOKEN_EXPIRED = "TOKEN_EXPIRED";
    public static final String AUTHENTICATION_ERROR = "AUTHENTICATION_ERROR";
    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String ACCOUNT_NOT_VERIFIED = "ACCOUNT_NOT_VERIFIED";
    public static final String ACCOUNT_NOT_FOUND = "ACCOUNT_NOT_FOUND";
    public static final String SERVER_ERROR = "SERVER_ERROR";

    private AuthProblems() {
    }

    public static ProblemException validation(String detail) {
        return new ProblemException(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, detail);
    }

    public static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, "Invalid email or password");
    }

    public static ProblemException accountDeactivated() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, ACCOUNT_DEACTIVATED, "Account is deactivated");
    }

    public static ProblemException accountLocked(Duration remaining) {
        return ProblemException.retryable(
                HttpStatus.UNAUTHORIZED,
                ACCOUNT_LOCKED,
                "Account is temporarily locked due to too many failed login attempts",
                ceilSeconds(remaining)
        );
    }

    public static ProblemException invalidToken() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_TOKEN, "Invalid token");
    }

    public static ProblemException tokenExpired() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, TOKEN_EXPIRED, "Token expired");
    }

    public static ProblemException authenticationError(String detail) {
        return new ProblemException(HttpStatus.UNAUTHORIZED, AUTHENTICATION_ERROR, detail);
    }

    public static ProblemException forbidden(String detail) {
        return new ProblemException(HttpStatus.FORBIDDEN, FORBIDDEN, detail);
    }

    public static ProblemException accountNotVerified() {
        return new ProblemException(HttpStatus.FORBIDDEN, ACCOUNT_NOT_VERIFIED, "Account must be verified");
    }

    public static ProblemException accountNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, ACCOUNT_NOT_FOUND, "Account not found");
    }

    public static ProblemException serverError(String detail, Throwable cause) {
        return new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, SERVER_ERROR, detail, cause);
    }

    /**
     * Whole seconds, rounded up, never below one.
     */
    public static long ceilSeconds(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return 1L;
        }
        long seconds = duration.getSeconds();
        if (duration.getNano() > 0) {
            seconds++;
        }
        return Math.max(1L, seconds);
    }
}
