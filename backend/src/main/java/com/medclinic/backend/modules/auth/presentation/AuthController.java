package com.medclinic.backend.modules.auth.presentation;

import java.util.Optional;

import com.medclinic.backend.global.security.JwtAuthenticationPrincipal;
import com.medclinic.backend.global.security.SecurityUtils;
import com.medclinic.backend.global.web.ClientIpResolver;
import com.medclinic.backend.modules.auth.application.AuthService;
import com.medclinic.backend.modules.auth.presentation.dto.AccountResponse;
import com.medclinic.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.medclinic.backend.modules.auth.presentation.dto.LoginRequest;
import com.medclinic.backend.modules.auth.presentation.dto.LoginResponse;
import com.medclinic.backend.modules.auth.presentation.dto.MessageResponse;
import com.medclinic.backend.modules.auth.presentation.dto.RefreshRequest;
import com.medclinic.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.medclinic.backend.modules.auth.presentation.dto.VerifyTokenRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Authentication", description = "Staff login, token rotation and credential maintenance")
public class AuthController {

    private final AuthService authService;
    private final SessionTransport sessionTransport;
    private final ClientIpResolver clientIpResolver;

    public AuthController(AuthService authService, SessionTransport sessionTransport, ClientIpResolver clientIpResolver) {
        this.authService = authService;
        this.sessionTransport = sessionTransport;
        this.clientIpResolver = clientIpResolver;
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Verifies credentials, applies the lockout policy and issues a token pair.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged in, token cookies set"),
            @ApiResponse(responseCode = "401", description = "INVALID_CREDENTIALS, ACCOUNT_LOCKED or ACCOUNT_DEACTIVATED"),
            @ApiResponse(responseCode = "429", description = "RATE_LIMITED")
    })
    public ResponseEntity<LoginResponse> login(
            @Valid @RequestBody LoginRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        LoginResponse response = authService.login(request, clientIpResolver.resolve(httpRequest));
        sessionTransport.writeTokens(httpResponse, response.accessToken(), response.refreshToken());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/refresh")
    @Operation(summary = "Rotate tokens", description = "Accepts the refresh cookie or a refreshToken body field.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New token pair issued"),
            @ApiResponse(responseCode = "401", description = "AUTHENTICATION_ERROR, INVALID_TOKEN or TOKEN_EXPIRED")
    })
    public ResponseEntity<TokenPairResponse> refresh(
            @RequestBody(required = false) RefreshRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse
    ) {
        String bodyToken = request == null ? null : request.refreshToken();
        String refreshToken = sessionTransport.resolveRefreshToken(httpRequest, bodyToken);
        TokenPairResponse tokens = authService.refresh(refreshToken, clientIpResolver.resolve(httpRequest));
        sessionTransport.writeTokens(httpResponse, tokens.accessToken(), tokens.refreshToken());
        return ResponseEntity.ok(tokens);
    }

    @PostMapping("/logout")
    @Operation(summary = "Log out", description = "Clears the token cookies. Never fails on authentication.")
    public ResponseEntity<MessageResponse> logout(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        Optional<JwtAuthenticationPrincipal> principal = SecurityUtils.findCurrentPrincipal();
        authService.logout(
                principal.map(JwtAuthenticationPrincipal::accountId).orElse(null),
                principal.map(JwtAuthenticationPrincipal::email).orElse(null),
                clientIpResolver.resolve(httpRequest)
        );
        sessionTransport.clear(httpResponse);
        return ResponseEntity.ok(new MessageResponse("Logout successful"));
    }

    @PostMapping("/verify")
    @Operation(summary = "Verify an access token")
    public ResponseEntity<AccountResponse> verify(@Valid @RequestBody VerifyTokenRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.verify(request.token(), clientIpResolver.resolve(httpRequest)));
    }

    @PutMapping("/change-password")
    @Operation(summary = "Change own password")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "VALIDATION_ERROR, including a wrong current password")
    })
    public ResponseEntity<MessageResponse> changePassword(
            @Valid @RequestBody ChangePasswordRequest request,
            HttpServletRequest httpRequest
    ) {
        authService.changePassword(SecurityUtils.getCurrentAccountId(), request, clientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(new MessageResponse("Password changed successfully"));
    }

    @GetMapping("/me")
    @Operation(summary = "Current account")
    public ResponseEntity<AccountResponse> me() {
        return ResponseEntity.ok(authService.currentAccount(SecurityUtils.getCurrentAccountId()));
    }
}
