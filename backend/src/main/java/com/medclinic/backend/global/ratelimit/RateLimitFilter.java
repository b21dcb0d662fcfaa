package com.medclinic.backend.global.ratelimit;

import java.io.IOException;
import java.util.Map;

import com.medclinic.backend.global.error.ProblemResponseWriter;
import com.medclinic.backend.global.security.JwtAuthenticationPrincipal;
import com.medclinic.backend.global.security.SecurityUtils;
import com.medclinic.backend.global.web.ClientIpResolver;
import com.medclinic.backend.modules.auth.application.AuthProblems;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditAction;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditOutcome;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.SecurityAuditEvent;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the GLOBAL, AUTH and ADMIN quotas before a request reaches any controller. Runs
 * after JWT authentication so admin quotas can be keyed by account.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String API_PREFIX = "/api/";
    static final String LOGIN_PATH = "/api/v1/auth/login";
    static final String REFRESH_PATH = "/api/v1/auth/refresh";
    static final String ADMIN_PREFIX = "/api/v1/admin/";

    static final String HEADER_LIMIT = "RateLimit-Limit";
    static final String HEADER_REMAINING = "RateLimit-Remaining";
    static final String HEADER_RESET = "RateLimit-Reset";

    private final RateLimiter rateLimiter;
    private final ClientIpResolver clientIpResolver;
    private final ProblemResponseWriter problemResponseWriter;
    private final SecurityAuditLogger auditLogger;
    private final boolean enabled;

    public RateLimitFilter(
            RateLimiter rateLimiter,
            ClientIpResolver clientIpResolver,
            ProblemResponseWriter problemResponseWriter,
            SecurityAuditLogger auditLogger,
            @Value("${clinic.rate-limit.enabled:true}") boolean enabled
    ) {
        this.rateLimiter = rateLimiter;
        this.clientIpResolver = clientIpResolver;
        this.problemResponseWriter = problemResponseWriter;
        this.auditLogger = auditLogger;
        this.enabled = enabled;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String path = pathWithinApplication(request);
        String clientIp = clientIpResolver.resolve(request);

        RateLimitDecision global = check(RateLimitScope.GLOBAL, clientIp);
        if (global != null) {
            writeHeaders(response, global);
            if (!global.allowed()) {
                reject(request, response, RateLimitScope.GLOBAL, clientIp, global);
                return;
            }
        }

        if ("POST".equalsIgnoreCase(request.getMethod()) && (LOGIN_PATH.equals(path) || REFRESH_PATH.equals(path))) {
            RateLimitDecision auth = check(RateLimitScope.AUTH, clientIp);
            if (auth != null && !auth.allowed()) {
                reject(request, response, RateLimitScope.AUTH, clientIp, auth);
                return;
            }
        }

        if (path.startsWith(ADMIN_PREFIX)) {
            String identity = SecurityUtils.findCurrentPrincipal()
                    .map(JwtAuthenticationPrincipal::accountId)
                    .map(accountId -> clientIp + "-" + accountId)
                    .orElse(clientIp);
            RateLimitDecision admin = check(RateLimitScope.ADMIN, identity);
            if (admin != null && !admin.allowed()) {
                reject(request, response, RateLimitScope.ADMIN, identity, admin);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled
                || "OPTIONS".equalsIgnoreCase(request.getMethod())
                || !pathWithinApplication(request).startsWith(API_PREFIX);
    }

    /**
     * Counts the request; a failing counter store lets the request through.
     */
    private RateLimitDecision check(RateLimitScope scope, String identity) {
        try {
            return rateLimiter.check(scope, identity);
        } catch (DataAccessException ex) {
            log.error("Rate-limit store unavailable, admitting {} request from {}", scope, identity, ex);
            return null;
        }
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, RateLimitScope scope,
                        String identity, RateLimitDecision decision) throws IOException {
        auditLogger.record(new SecurityAuditEvent(
                AuditAction.RATE_LIMIT,
                identity,
                AuditOutcome.RATE_LIMITED,
                clientIpResolver.resolve(request),
                Map.of("scope", scope.name(), "path", pathWithinApplication(request))
        ));
        writeHeaders(response, decision);
        problemResponseWriter.writeRetryable(request, response, HttpStatus.TOO_MANY_REQUESTS,
                AuthProblems.RATE_LIMITED, "Too many requests, please try again later",
                decision.retryAfterSeconds());
    }

    private static void writeHeaders(HttpServletResponse response, RateLimitDecision decision) {
        response.setHeader(HEADER_LIMIT, String.valueOf(decision.limit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(decision.remaining()));
        response.setHeader(HEADER_RESET, String.valueOf(decision.retryAfterSeconds()));
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
