package com.micronote.backend.modules.account.presentation;

import com.micronote.backend.global.security.SecurityUtils;
import com.micronote.backend.global.web.ApiResponse;
import com.micronote.backend.modules.account.application.AccountService;
import com.micronote.backend.modules.account.presentation.dto.AccountStatsResponse;
import com.micronote.backend.modules.account.presentation.dto.ChangePasswordRequest;
import com.micronote.backend.modules.account.presentation.dto.DeleteAccountRequest;
import com.micronote.backend.modules.account.presentation.dto.UpdateProfileRequest;
import com.micronote.backend.modules.auth.presentation.dto.AccountDetailResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Account")
@RestController
@RequestMapping("/api/users/me")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<AccountDetailResponse>> getProfile() {
        AccountDetailResponse body = new AccountDetailResponse(accountService.getProfile(SecurityUtils.getCurrentAccountId()));
        return ResponseEntity.ok(ApiResponse.ok(body));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<AccountDetailResponse>> updateProfile(@Valid @RequestBody UpdateProfileRequest request) {
        AccountDetailResponse body = new AccountDetailResponse(
                accountService.updateProfile(SecurityUtils.getCurrentAccountId(), request));
        return ResponseEntity.ok(ApiResponse.ok("Profile updated successfully", body));
    }

    @Operation(summary = "Change password", description = "400 `CURRENT_PASSWORD_MISMATCH`; the stored refresh token is revoked.")
    @PutMapping("/password")
    public ResponseEntity<ApiResponse<Void>> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        accountService.changePassword(SecurityUtils.getCurrentAccountId(), request);
        return ResponseEntity.ok(ApiResponse.ok("Password changed successfully"));
    }

    @Operation(summary = "Delete account", description = "Removes the account with its notes and todos and revokes the current tokens.")
    @DeleteMapping
    public ResponseEntity<ApiResponse<Void>> deleteAccount(@Valid @RequestBody DeleteAccountRequest request) {
        accountService.deleteAccount(SecurityUtils.getCurrentPrincipal(), SecurityUtils.getCurrentAccessToken(), request);
        return ResponseEntity.ok(ApiResponse.ok("Account deleted successfully"));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<AccountStatsResponse>> getStats() {
        return ResponseEntity.ok(ApiResponse.ok(accountService.getStats(SecurityUtils.getCurrentAccountId())));
    }
}
