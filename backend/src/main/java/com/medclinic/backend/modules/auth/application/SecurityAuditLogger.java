package com.medclinic.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes authentication events to the {@code SECURITY_AUDIT} logger. Passwords and tokens are
 * never part of an event.
 */
@Component
public class SecurityAuditLogger {

    public static final String LOGGER_NAME = "SECURITY_AUDIT";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);
    private static final int MAX_VALUE_LENGTH = 320;

    private final Clock clock;

    public SecurityAuditLogger(Clock clock) {
        this.clock = clock;
    }

    public void record(SecurityAuditEvent event) {
        OffsetDateTime timestamp = OffsetDateTime.now(clock);
        String detail = event.detail() == null || event.detail().isEmpty() ? "{}" : event.detail().toString();
        if (event.outcome() == AuditOutcome.SUCCESS) {
            audit.info("action={} outcome={} principal={} sourceIp={} timestamp={} detail={}",
                    event.action(), event.outcome(), sanitize(event.principal()),
                    sanitize(event.sourceIp()), timestamp, sanitize(detail));
        } else {
            audit.warn("action={} outcome={} principal={} sourceIp={} timestamp={} detail={}",
                    event.action(), event.outcome(), sanitize(event.principal()),
                    sanitize(event.sourceIp()), timestamp, sanitize(detail));
        }
    }

    public void record(AuditAction action, String principal, AuditOutcome outcome, String sourceIp) {
        record(new SecurityAuditEvent(action, principal, outcome, sourceIp, Map.of()));
    }

    private static String sanitize(String value) {
        if (value == null || value.isEmpty()) {
            return "-";
        }
        String cleaned = value.replaceAll("[\\r\\n\\t]", "_");
        return cleaned.length() > MAX_VALUE_LENGTH ? cleaned.substring(0, MAX_VALUE_LENGTH) : cleaned;
    }

    public enum AuditAction {
        AUTHENTICATE,
        LOGIN,
        REFRESH,
        LOGOUT,
        VERIFY,
        CHANGE_PASSWORD,
        RATE_LIMIT,
        API_KEY,
        ADMIN_UNLOCK,
        ADMIN_STATUS_CHANGE
    }

    public enum AuditOutcome {
        SUCCESS,
        VALIDATION_ERROR,
        INVALID_CREDENTIALS,
        ACCOUNT_DEACTIVATED,
        ACCOUNT_LOCKED,
        INVALID_TOKEN,
        TOKEN_EXPIRED,
        AUTHENTICATION_ERROR,
        RATE_LIMITED,
        FORBIDDEN,
        NOT_FOUND,
        SERVER_ERROR
    }

    public record SecurityAuditEvent(
            AuditAction action,
            String principal,
            AuditOutcome outcome,
            String sourceIp,
            Map<String, Object> detail
    ) {
    }
}
