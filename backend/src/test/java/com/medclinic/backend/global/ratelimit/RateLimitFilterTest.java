package com.medclinic.backend.global.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medclinic.backend.global.error.ProblemResponseWriter;
import com.medclinic.backend.global.security.JwtAuthenticationPrincipal;
import com.medclinic.backend.global.web.ClientIpResolver;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditOutcome;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.SecurityAuditEvent;
import com.medclinic.backend.modules.auth.domain.AccountRole;
import com.medclinic.backend.support.MutableClock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

class RateLimitFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SecurityAuditLogger auditLogger;
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        auditLogger = mock(SecurityAuditLogger.class);
        RateLimiter limiter = new RateLimiter(new InMemoryRateLimitStore(), MutableClock.at("2025-03-01T10:00:00Z"),
                3, Duration.ofMinutes(15),
                1, Duration.ofMinutes(15),
                1, Duration.ofMinutes(15));
        filter = filterWith(limiter);
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private RateLimitFilter filterWith(RateLimiter limiter) {
        return new RateLimitFilter(limiter, new ClientIpResolver(false),
                new ProblemResponseWriter(objectMapper), auditLogger, true);
    }

    private MockHttpServletResponse dispatch(String method, String uri, MockFilterChain chain) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        request.setRemoteAddr("192.168.1.20");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, chain);
        return response;
    }

    @Test
    void admittedRequestCarriesQuotaHeaders() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse response = dispatch("GET", "/api/v1/auth/me", chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getHeader("RateLimit-Limit")).isEqualTo("3");
        assertThat(response.getHeader("RateLimit-Remaining")).isEqualTo("2");
        assertThat(response.getHeader("RateLimit-Reset")).isEqualTo("900");
    }

    @Test
    void globalQuotaExhaustedReturnsProblemWithRetryAfter() throws Exception {
        for (int i = 0; i < 3; i++) {
            dispatch("GET", "/api/v1/auth/me", new MockFilterChain());
        }
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse response = dispatch("GET", "/api/v1/auth/me", chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("900");
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.path("code").asText()).isEqualTo("RATE_LIMITED");
        assertThat(body.path("retryAfterSeconds").asLong()).isEqualTo(900L);

        ArgumentCaptor<SecurityAuditEvent> event = ArgumentCaptor.forClass(SecurityAuditEvent.class);
        verify(auditLogger).record(event.capture());
        assertThat(event.getValue().outcome()).isEqualTo(AuditOutcome.RATE_LIMITED);
        assertThat(event.getValue().detail()).containsEntry("scope", "GLOBAL");
    }

    @Test
    void loginHasItsOwnStricterQuota() throws Exception {
        assertThat(dispatch("POST", "/api/v1/auth/login", new MockFilterChain()).getStatus()).isEqualTo(200);

        MockHttpServletResponse second = dispatch("POST", "/api/v1/auth/login", new MockFilterChain());

        assertThat(second.getStatus()).isEqualTo(429);
        assertThat(dispatch("GET", "/api/v1/auth/me", new MockFilterChain()).getStatus()).isEqualTo(200);
    }

    @Test
    void adminQuotaIsKeyedByAccount() throws Exception {
        authenticate(UUID.randomUUID());
        assertThat(dispatch("GET", "/api/v1/admin/accounts/x/security", new MockFilterChain()).getStatus()).isEqualTo(200);
        assertThat(dispatch("GET", "/api/v1/admin/accounts/x/security", new MockFilterChain()).getStatus()).isEqualTo(429);

        authenticate(UUID.randomUUID());
        assertThat(dispatch("GET", "/api/v1/admin/accounts/x/security", new MockFilterChain()).getStatus()).isEqualTo(200);
    }

    @Test
    void pathsOutsideApiAreNotCounted() throws Exception {
        for (int i = 0; i < 5; i++) {
            MockHttpServletResponse response = dispatch("GET", "/healthz", new MockFilterChain());
            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(response.getHeader("RateLimit-Limit")).isNull();
        }
    }

    @Test
    void failingStoreLetsRequestsThrough() throws Exception {
        RateLimitStore brokenStore = mock(RateLimitStore.class);
        when(brokenStore.incrementAndGet(anyString(), anyLong(), anyLong()))
                .thenThrow(new DataAccessResourceFailureException("redis down"));
        filter = filterWith(new RateLimiter(brokenStore, MutableClock.at("2025-03-01T10:00:00Z"),
                1, Duration.ofMinutes(15), 1, Duration.ofMinutes(15), 1, Duration.ofMinutes(15)));
        MockFilterChain chain = new MockFilterChain();

        MockHttpServletResponse response = dispatch("POST", "/api/v1/auth/login", chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    void disabledFilterPassesEverything() throws Exception {
        RateLimiter limiter = mock(RateLimiter.class);
        filter = new RateLimitFilter(limiter, new ClientIpResolver(false),
                new ProblemResponseWriter(objectMapper), auditLogger, false);

        dispatch("POST", "/api/v1/auth/login", new MockFilterChain());

        verify(limiter, never()).check(any(), any());
    }

    private static void authenticate(UUID accountId) {
        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(accountId, "manager@clinic.com", AccountRole.MANAGER);
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority(AccountRole.MANAGER.authority()))));
    }
}
