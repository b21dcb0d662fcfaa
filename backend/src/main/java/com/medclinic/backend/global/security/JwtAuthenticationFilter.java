package com.medclinic.backend.global.security;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.medclinic.backend.global.error.ProblemException;
import com.medclinic.backend.global.web.ClientIpResolver;
import com.medclinic.backend.modules.auth.application.AuthProblems;
import com.medclinic.backend.modules.auth.application.CredentialStore;
import com.medclinic.backend.modules.auth.application.JwtTokenService;
import com.medclinic.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.medclinic.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.medclinic.backend.modules.auth.application.JwtTokenService.TokenExpiredException;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditAction;
import com.medclinic.backend.modules.auth.application.SecurityAuditLogger.AuditOutcome;
import com.medclinic.backend.modules.auth.domain.Account;
import com.medclinic.backend.modules.auth.presentation.SessionTransport;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying an access token. The token only names the account: whether it
 * may act, and with which role, is read from the stored account on every request, so a
 * deactivation or lock takes effect immediately.
 *
 * <p>A rejected token leaves the request anonymous and stores the problem for
 * {@link RestAuthenticationEntryPoint}, so public endpoints such as logout never fail because of
 * a stale cookie.</p>
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    static final String TOKEN_FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".failure";

    private final JwtTokenService jwtTokenService;
    private final CredentialStore credentialStore;
    private final SessionTransport sessionTransport;
    private final SecurityAuditLogger auditLogger;
    private final ClientIpResolver clientIpResolver;
    private final Clock clock;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            CredentialStore credentialStore,
            SessionTransport sessionTransport,
            SecurityAuditLogger auditLogger,
            ClientIpResolver clientIpResolver,
            Clock clock
    ) {
        this.jwtTokenService = jwtTokenService;
        this.credentialStore = credentialStore;
        this.sessionTransport = sessionTransport;
        this.auditLogger = auditLogger;
        this.clientIpResolver = clientIpResolver;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = sessionTransport.resolveAccessToken(request);
        if (token != null) {
            try {
                Account account = loadActiveAccount(jwtTokenService.parseAccessToken(token), request);
                JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                        account.getId(),
                        account.getEmail(),
                        account.getRole()
                );
                List<SimpleGrantedAuthority> authorities =
                        List.of(new SimpleGrantedAuthority(account.getRole().authority()));

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (TokenExpiredException ex) {
                reject(request, AuthProblems.tokenExpired());
            } catch (InvalidTokenException ex) {
                reject(request, AuthProblems.invalidToken());
            } catch (ProblemException ex) {
                reject(request, ex);
            }
        }

        filterChain.doFilter(request, response);
    }

    private Account loadActiveAccount(ParsedToken parsed, HttpServletRequest request) {
        String principal = parsed.accountId().toString();
        Optional<Account> found;
        try {
            found = credentialStore.findById(parsed.accountId());
        } catch (DataAccessException ex) {
            log.error("Failed to load account {} for access token", principal, ex);
            throw AuthProblems.serverError("Credential store unavailable", ex);
        }

        if (found.isEmpty()) {
            audit(principal, AuditOutcome.AUTHENTICATION_ERROR, request);
            throw AuthProblems.authenticationError("Account not found");
        }
        Account account = found.get();
        if (!account.isActive()) {
            audit(account.getEmail(), AuditOutcome.ACCOUNT_DEACTIVATED, request);
            throw AuthProblems.accountDeactivated();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (account.isLockedAt(now)) {
            audit(account.getEmail(), AuditOutcome.ACCOUNT_LOCKED, request);
            throw AuthProblems.accountLocked(Duration.between(now, account.getLockedUntil()));
        }
        return account;
    }

    private void reject(HttpServletRequest request, ProblemException problem) {
        SecurityContextHolder.clearContext();
        request.setAttribute(TOKEN_FAILURE_ATTRIBUTE, problem);
    }

    private void audit(String principal, AuditOutcome outcome, HttpServletRequest request) {
        auditLogger.record(AuditAction.AUTHENTICATE, principal, outcome, clientIpResolver.resolve(request));
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }
}
