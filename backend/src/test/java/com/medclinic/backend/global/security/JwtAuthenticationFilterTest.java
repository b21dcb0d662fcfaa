package com.medclinic.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medclinic.backend.global.error.ProblemResponseWriter;
import com.medclinic.backend.global.web.ClientIpResolver;
import com.medclinic.backend.modules.auth.application.CredentialStore;
import com.medclinic.backend.modules.auth.application.JwtTokenService;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditAction;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditOutcome;
import com.medclinic.backend.modules.auth.domain.Account;
import com.medclinic.backend.modules.auth.domain.AccountRole;
import com.medclinic.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.medclinic.backend.modules.auth.presentation.SessionTransport;
import com.medclinic.backend.support.TestAccounts;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T10:00:00Z");
    private static final UUID ACCOUNT_ID = UUID.fromString("00000000-0000-0000-0000-000000000301");
    private static final String EMAIL = "manager@clinic.com";

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private SecurityAuditLogger auditLogger;

    private JwtTokenService jwtTokenService;
    private JwtAuthenticationFilter filter;
    private RestAuthenticationEntryPoint entryPoint;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        jwtTokenService = new JwtTokenService(
                new JwtTokenProvider(
                        "filter-access-secret-0123456789-abcdefghijklmn",
                        "filter-refresh-secret-0123456789-abcdefghijklmn"),
                Duration.ofMinutes(15),
                Duration.ofDays(7),
                "medical-clinic-api",
                "medical-clinic-client",
                clock
        );
        SessionTransport transport = new SessionTransport(true, "/api/v1/auth/refresh", Duration.ofMinutes(15), Duration.ofDays(7));
        filter = new JwtAuthenticationFilter(jwtTokenService, credentialStore, transport, auditLogger,
                new ClientIpResolver(false), clock);
        entryPoint = new RestAuthenticationEntryPoint(new ProblemResponseWriter(new ObjectMapper()));
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private Account account(AccountRole role) {
        return TestAccounts.account(ACCOUNT_ID, EMAIL, "hash", role);
    }

    private MockHttpServletRequest requestWithTokenFor(Account account) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auth/me");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + jwtTokenService.issueTokenPair(account).accessToken());
        return request;
    }

    /**
     * Runs the filter, then renders what the entry point would answer for a protected endpoint.
     */
    private MockHttpServletResponse rejectAfterFilter(MockHttpServletRequest request) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        entryPoint.commence(request, response, new InsufficientAuthenticationException("anonymous"));
        return response;
    }

    @Test
    void authoritiesComeFromStoredRoleNotFromTokenClaim() throws Exception {
        MockHttpServletRequest request = requestWithTokenFor(account(AccountRole.MANAGER));
        when(credentialStore.findById(ACCOUNT_ID)).thenReturn(Optional.of(account(AccountRole.NURSE)));

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority).containsExactly("ROLE_NURSE");
        assertThat(((JwtAuthenticationPrincipal) authentication.getPrincipal()).role()).isEqualTo(AccountRole.NURSE);
    }

    @Test
    void deactivatedAccountIsRejectedDespiteValidToken() throws Exception {
        Account manager = account(AccountRole.MANAGER);
        MockHttpServletRequest request = requestWithTokenFor(manager);
        manager.setActive(false);
        when(credentialStore.findById(ACCOUNT_ID)).thenReturn(Optional.of(manager));

        MockHttpServletResponse response = rejectAfterFilter(request);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("\"code\":\"ACCOUNT_DEACTIVATED\"");
        verify(auditLogger).record(eq(AuditAction.AUTHENTICATE), eq(EMAIL), eq(AuditOutcome.ACCOUNT_DEACTIVATED), any());
    }

    @Test
    void lockedAccountIsRejectedWithRetryHint() throws Exception {
        Account doctor = account(AccountRole.DOCTOR);
        MockHttpServletRequest request = requestWithTokenFor(doctor);
        doctor.setFailedAttempts(5);
        doctor.setLockedUntil(NOW.plusMinutes(10));
        when(credentialStore.findById(ACCOUNT_ID)).thenReturn(Optional.of(doctor));

        MockHttpServletResponse response = rejectAfterFilter(request);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getHeader(HttpHeaders.RETRY_AFTER)).isEqualTo("600");
        assertThat(response.getContentAsString()).contains("\"code\":\"ACCOUNT_LOCKED\"");
    }

    @Test
    void expiredLockNoLongerBlocks() throws Exception {
        Account doctor = account(AccountRole.DOCTOR);
        doctor.setLockedUntil(NOW.minusSeconds(1));
        MockHttpServletRequest request = requestWithTokenFor(doctor);
        when(credentialStore.findById(ACCOUNT_ID)).thenReturn(Optional.of(doctor));

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNotNull();
    }

    @Test
    void removedAccountIsAuthenticationError() throws Exception {
        MockHttpServletRequest request = requestWithTokenFor(account(AccountRole.SECRETARY));
        when(credentialStore.findById(ACCOUNT_ID)).thenReturn(Optional.empty());

        MockHttpServletResponse response = rejectAfterFilter(request);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("\"code\":\"AUTHENTICATION_ERROR\"");
    }

    @Test
    void storeFailureIsServerErrorNotUnauthorized() throws Exception {
        MockHttpServletRequest request = requestWithTokenFor(account(AccountRole.DOCTOR));
        when(credentialStore.findById(ACCOUNT_ID)).thenThrow(new DataAccessResourceFailureException("down"));

        MockHttpServletResponse response = rejectAfterFilter(request);

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.getContentAsString()).contains("\"code\":\"SERVER_ERROR\"");
    }

    @Test
    void malformedTokenIsInvalidTokenWithoutStoreLookup() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auth/me");
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt");

        MockHttpServletResponse response = rejectAfterFilter(request);

        assertThat(response.getContentAsString()).contains("\"code\":\"INVALID_TOKEN\"");
        verify(credentialStore, never()).findById(any());
    }
}
