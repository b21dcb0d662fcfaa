package com.medclinic.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Domain failure rendered as a {@link ProblemResponse}. A problem may carry a retry hint, which
 * becomes the {@code Retry-After} header and the {@code retryAfterSeconds} body field.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detailMessage;
    private final Long retryAfterSeconds;

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        this(status, code, detail, null, cause);
    }

    private ProblemException(HttpStatus status, String code, String detail, Long retryAfterSeconds, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("problem code must not be blank");
        }
        if (retryAfterSeconds != null && retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.code = code;
        this.detailMessage = detail == null || detail.isBlank() ? code : detail;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static ProblemException retryable(HttpStatus status, String code, String detail, long retryAfterSeconds) {
        return new ProblemException(status, code, detail, retryAfterSeconds, null);
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detailMessage;
    }

    /**
     * @return seconds until a retry may succeed, or {@code null} when the problem is not retryable
     */
    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
