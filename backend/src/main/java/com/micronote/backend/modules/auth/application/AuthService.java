package com.micronote.backend.modules.auth.application;

import java.time.Duration;
import java.util.Locale;
import java.util.UUID;

import com.micronote.backend.global.error.ApiException;
import com.micronote.backend.global.security.JwtAuthenticationPrincipal;
import com.micronote.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.micronote.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.micronote.backend.modules.auth.domain.Account;
import com.micronote.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.micronote.backend.modules.auth.infrastructure.session.RefreshTokenValidation;
import com.micronote.backend.modules.auth.infrastructure.session.SessionTokenStore;
import com.micronote.backend.modules.auth.infrastructure.session.TokenStoreUnavailableException;
import com.micronote.backend.modules.auth.presentation.dto.AccountResponse;
import com.micronote.backend.modules.auth.presentation.dto.AuthResponse;
import com.micronote.backend.modules.auth.presentation.dto.LoginRequest;
import com.micronote.backend.modules.auth.presentation.dto.RefreshRequest;
import com.micronote.backend.modules.auth.presentation.dto.RegisterRequest;
import com.micronote.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String DEMO_USERNAME = "demo";
    static final String DEMO_EMAIL = "demo@micronote.com";
    static final String DEMO_NAME = "Demo User";
    static final String DEMO_PASSWORD = "demo123";

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final SessionTokenStore sessionTokenStore;
    private final Duration refreshRotationWindow;

    public AuthService(
            AccountRepository accountRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            SessionTokenStore sessionTokenStore,
            @Value("${micronote.session.refresh-rotation-window:${jwt.refresh-expiration:604800000}}") long refreshRotationWindowMillis
    ) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.sessionTokenStore = sessionTokenStore;
        this.refreshRotationWindow = Duration.ofMillis(refreshRotationWindowMillis);
    }

    public AuthResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        String username = request.username().trim();

        if (accountRepository.existsByEmail(email)) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "EMAIL_ALREADY_EXISTS", "User with this email already exists");
        }
        if (accountRepository.existsByUsernameIgnoreCase(username)) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "USERNAME_ALREADY_EXISTS", "Username is already taken");
        }

        Account account = new Account();
        account.setName(request.name().trim());
        account.setEmail(email);
        account.setUsername(username);
        account.setPasswordHash(passwordEncoder.encode(request.password()));
        account = accountRepository.saveAndFlush(account);
        log.info("Registered account {}", account.getId());
        return new AuthResponse(AccountResponse.from(account), startSession(account));
    }

    public AuthResponse login(LoginRequest request) {
        Account account = accountRepository.findByUsernameOrEmail(request.username().trim())
                .orElseThrow(AuthService::invalidCredentials);
        if (!passwordEncoder.matches(request.password(), account.getPasswordHash())) {
            throw invalidCredentials();
        }
        return new AuthResponse(AccountResponse.from(account), startSession(account));
    }

    /**
     * Signs in to the shared demo account, creating it on first use.
     */
    public AuthResponse demoLogin() {
        Account account = accountRepository.findByUsernameIgnoreCase(DEMO_USERNAME)
                .orElseGet(this::createDemoAccount);
        return new AuthResponse(AccountResponse.from(account), startSession(account));
    }

    public AuthResponse refresh(RefreshRequest request) {
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parseRefreshToken(request.refreshToken());
        } catch (InvalidTokenException e) {
            throw invalidRefreshToken();
        }

        RefreshTokenValidation validation = sessionTokenStore.validateRefreshToken(parsed.accountId(), request.refreshToken());
        if (!validation.valid()) {
            throw invalidRefreshToken();
        }

        Account account = accountRepository.findById(parsed.accountId())
                .orElseThrow(AuthService::invalidRefreshToken);

        Duration remaining = validation.remainingTtl();
        if (remaining.compareTo(refreshRotationWindow) > 0) {
            return new AuthResponse(AccountResponse.from(account),
                    jwtTokenService.reissueAccessToken(account.getId(), request.refreshToken(), remaining));
        }

        // rotation: the presented refresh token is superseded by the new one
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(account.getId());
        sessionTokenStore.storeRefreshToken(account.getId(), tokens.refreshToken(), jwtTokenService.getRefreshTokenTtl());
        return new AuthResponse(AccountResponse.from(account), tokens);
    }

    /**
     * Revokes the presented access token and the account's refresh token. Both must succeed:
     * a logout that silently left the access token usable would be worse than a 503.
     */
    public void logout(JwtAuthenticationPrincipal principal, String accessToken) {
        sessionTokenStore.blacklistAccessToken(accessToken, principal.expiresAt());
        sessionTokenStore.revokeRefreshToken(principal.accountId());
        log.info("Account {} logged out", principal.accountId());
    }

    @Transactional(readOnly = true)
    public AccountResponse loadAccount(UUID accountId) {
        return accountRepository.findById(accountId)
                .map(AccountResponse::from)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private TokenPairResponse startSession(Account account) {
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(account.getId());
        try {
            sessionTokenStore.storeRefreshToken(account.getId(), tokens.refreshToken(), jwtTokenService.getRefreshTokenTtl());
        } catch (TokenStoreUnavailableException e) {
            // login still succeeds; the refresh token just won't be accepted later
            log.warn("Refresh token not stored for account {}: {}", account.getId(), e.getMessage());
        }
        return tokens;
    }

    private Account createDemoAccount() {
        Account account = new Account();
        account.setName(DEMO_NAME);
        account.setEmail(DEMO_EMAIL);
        account.setUsername(DEMO_USERNAME);
        account.setPasswordHash(passwordEncoder.encode(DEMO_PASSWORD));
        log.info("Creating demo account");
        return accountRepository.saveAndFlush(account);
    }

    private static ApiException invalidCredentials() {
        return new ApiException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid credentials");
    }

    private static ApiException invalidRefreshToken() {
        return new ApiException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN", "Invalid refresh token");
    }
}
