package com.micronote.backend.modules.auth.presentation;

import com.micronote.backend.global.security.SecurityUtils;
import com.micronote.backend.global.web.ApiResponse;
import com.micronote.backend.modules.auth.application.AuthService;
import com.micronote.backend.modules.auth.presentation.dto.AccountDetailResponse;
import com.micronote.backend.modules.auth.presentation.dto.AuthResponse;
import com.micronote.backend.modules.auth.presentation.dto.LoginRequest;
import com.micronote.backend.modules.auth.presentation.dto.RefreshRequest;
import com.micronote.backend.modules.auth.presentation.dto.RegisterRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Auth")
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register a new account", description = "Returns 400 `EMAIL_ALREADY_EXISTS` or `USERNAME_ALREADY_EXISTS` on duplicates.")
    @PostMapping("/register")
    public ResponseEntity<ApiResponse<AuthResponse>> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("User registered successfully", authService.register(request)));
    }

    @Operation(summary = "Log in", description = "`username` accepts either the username or the email address.")
    @PostMapping("/login")
    public ResponseEntity<ApiResponse<AuthResponse>> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(ApiResponse.ok("Login successful", authService.login(request)));
    }

    @Operation(summary = "Log in to the demo account")
    @PostMapping("/demo")
    public ResponseEntity<ApiResponse<AuthResponse>> demo() {
        return ResponseEntity.ok(ApiResponse.ok("Demo login successful", authService.demoLogin()));
    }

    @Operation(summary = "Rotate the token pair", description = "The presented refresh token stops working once a new pair is issued.")
    @PostMapping("/refresh")
    public ResponseEntity<ApiResponse<AuthResponse>> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(ApiResponse.ok("Token refreshed successfully", authService.refresh(request)));
    }

    @Operation(summary = "Log out", description = "Revokes the bearer token and the account's refresh token.")
    @PostMapping("/logout")
    public ResponseEntity<ApiResponse<Void>> logout() {
        authService.logout(SecurityUtils.getCurrentPrincipal(), SecurityUtils.getCurrentAccessToken());
        return ResponseEntity.ok(ApiResponse.ok("Logout successful"));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<AccountDetailResponse>> me() {
        AccountDetailResponse body = new AccountDetailResponse(authService.loadAccount(SecurityUtils.getCurrentAccountId()));
        return ResponseEntity.ok(ApiResponse.ok(body));
    }
}
