package com.medclinic.backend.modules.admin.presentation;

import java.util.UUID;

import com.medclinic.backend.global.security.SecurityUtils;
import com.medclinic.backend.global.web.ClientIpResolver;
import com.medclinic.backend.modules.admin.application.AccountAdminService;
import com.medclinic.backend.modules.admin.presentation.dto.AccountSecurityResponse;
import com.medclinic.backend.modules.admin.presentation.dto.LockedAccountsResponse;
import com.medclinic.backend.modules.admin.presentation.dto.UpdateAccountStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/accounts")
@Tag(name = "Account security administration")
public class AccountAdminController {

    private final AccountAdminService accountAdminService;
    private final ClientIpResolver clientIpResolver;

    public AccountAdminController(AccountAdminService accountAdminService, ClientIpResolver clientIpResolver) {
        this.accountAdminService = accountAdminService;
        this.clientIpResolver = clientIpResolver;
    }

    @GetMapping("/locked")
    @Operation(summary = "Currently locked accounts", description = "Soonest expiring lock first, with the remaining lock time.")
    public ResponseEntity<LockedAccountsResponse> lockedAccounts(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "10") int size,
            HttpServletRequest request
    ) {
        return ResponseEntity.ok(accountAdminService.lockedAccounts(
                SecurityUtils.getCurrentAccountId(), page, size, clientIpResolver.resolve(request)));
    }

    @PostMapping("/{accountId}/unlock")
    @Operation(summary = "Unlock an account", description = "Resets the failed-attempt counter and clears the lock.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Account unlocked"),
            @ApiResponse(responseCode = "403", description = "FORBIDDEN or ACCOUNT_NOT_VERIFIED"),
            @ApiResponse(responseCode = "404", description = "ACCOUNT_NOT_FOUND")
    })
    public ResponseEntity<AccountSecurityResponse> unlock(@PathVariable UUID accountId, HttpServletRequest request) {
        return ResponseEntity.ok(accountAdminService.unlock(
                SecurityUtils.getCurrentAccountId(), accountId, clientIpResolver.resolve(request)));
    }

    @PatchMapping("/{accountId}/status")
    @Operation(summary = "Activate or deactivate an account")
    public ResponseEntity<AccountSecurityResponse> updateStatus(
            @PathVariable UUID accountId,
            @Valid @RequestBody UpdateAccountStatusRequest body,
            HttpServletRequest request
    ) {
        return ResponseEntity.ok(accountAdminService.updateStatus(
                SecurityUtils.getCurrentAccountId(), accountId, body.active(), clientIpResolver.resolve(request)));
    }

    @GetMapping("/{accountId}/security")
    @Operation(summary = "Lockout and last-login snapshot of an account")
    public ResponseEntity<AccountSecurityResponse> security(@PathVariable UUID accountId, HttpServletRequest request) {
        return ResponseEntity.ok(accountAdminService.securitySnapshot(
                SecurityUtils.getCurrentAccountId(), accountId, clientIpResolver.resolve(request)));
    }
}
