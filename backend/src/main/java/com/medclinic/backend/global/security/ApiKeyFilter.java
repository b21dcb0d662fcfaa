package com.medclinic.backend.global.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

import com.medclinic.backend.global.error.ProblemResponseWriter;
import com.medclinic.backend.global.web.ClientIpResolver;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditAction;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditOutcome;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.SecurityAuditEvent;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Optional shared-key gate in front of every {@code /api/} route. Off unless
 * {@code clinic.api-key.enabled} is set, in which case {@code clinic.api-key.value} is required.
 */
@Component
public class ApiKeyFilter extends OncePerRequestFilter {

    static final String API_KEY_REQUIRED = "API_KEY_REQUIRED";
    static final String INVALID_API_KEY = "INVALID_API_KEY";

    private static final String API_PREFIX = "/api/";

    private final boolean enabled;
    private final String headerName;
    private final byte[] expectedKey;
    private final ClientIpResolver clientIpResolver;
    private final ProblemResponseWriter problemResponseWriter;
    private final SecurityAuditLogger auditLogger;

    public ApiKeyFilter(
            @Value("${clinic.api-key.enabled:false}") boolean enabled,
            @Value("${clinic.api-key.header:X-API-Key}") String headerName,
            @Value("${clinic.api-key.value:}") String expectedKey,
            ClientIpResolver clientIpResolver,
            ProblemResponseWriter problemResponseWriter,
            SecurityAuditLogger auditLogger
    ) {
        if (enabled && !StringUtils.hasText(expectedKey)) {
            throw new IllegalStateException("clinic.api-key.value must be set when clinic.api-key.enabled is true");
        }
        this.enabled = enabled;
        this.headerName = headerName;
        this.expectedKey = expectedKey == null ? new byte[0] : expectedKey.getBytes(StandardCharsets.UTF_8);
        this.clientIpResolver = clientIpResolver;
        this.problemResponseWriter = problemResponseWriter;
        this.auditLogger = auditLogger;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String presented = request.getHeader(headerName);
        if (!StringUtils.hasText(presented)) {
            reject(request, response, API_KEY_REQUIRED, "API key required");
            return;
        }
        if (!MessageDigest.isEqual(expectedKey, presented.trim().getBytes(StandardCharsets.UTF_8))) {
            reject(request, response, INVALID_API_KEY, "Invalid API key");
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled
                || "OPTIONS".equalsIgnoreCase(request.getMethod())
                || !request.getRequestURI().startsWith(request.getContextPath() + API_PREFIX);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String code, String detail)
            throws IOException {
        auditLogger.record(new SecurityAuditEvent(
                AuditAction.API_KEY,
                null,
                AuditOutcome.AUTHENTICATION_ERROR,
                clientIpResolver.resolve(request),
                Map.of("reason", code, "method", request.getMethod(), "path", request.getRequestURI())
        ));
        problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED, code, detail);
    }
}
