package com.micronote.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.micronote.backend.modules.auth.domain.Account;
import com.micronote.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.micronote.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.micronote.backend.modules.auth.infrastructure.session.RefreshTokenValidation;
import com.micronote.backend.modules.auth.infrastructure.session.SessionTokenStore;
import com.micronote.backend.modules.auth.presentation.dto.AuthResponse;
import com.micronote.backend.modules.auth.presentation.dto.RefreshRequest;
import com.micronote.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final UUID ACCOUNT_ID = UUID.fromString("33333333-3333-3333-3333-333333333333");
    private static final Duration REFRESH_TTL = Duration.ofDays(7);
    private static final Duration ROTATION_WINDOW = Duration.ofDays(1);

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T09:00:00Z"));
    private final JwtTokenService jwtTokenService = new JwtTokenService(
            new JwtTokenProvider("unit-test-secret-that-is-long-enough-for-hs256"),
            Duration.ofMinutes(15).toMillis(),
            REFRESH_TTL.toMillis(),
            clock
    );

    @Mock
    AccountRepository accountRepository;

    @Mock
    PasswordEncoder passwordEncoder;

    @Mock
    SessionTokenStore sessionTokenStore;

    private AuthService authService;
    private String refreshToken;

    @BeforeEach
    void setUp() {
        authService = new AuthService(
                accountRepository, passwordEncoder, jwtTokenService, sessionTokenStore, ROTATION_WINDOW.toMillis());
        refreshToken = jwtTokenService.issueTokenPair(ACCOUNT_ID).refreshToken();
    }

    @Test
    void refreshKeepsTokenWithPlentyOfLifetimeLeft() {
        Duration remaining = Duration.ofDays(5);
        givenStoredToken(remaining);

        AuthResponse response = authService.refresh(new RefreshRequest(refreshToken));

        assertThat(response.tokens().refreshToken()).isEqualTo(refreshToken);
        assertThat(response.tokens().refreshExpiresIn()).isEqualTo(remaining.toSeconds());
        assertThat(jwtTokenService.parseAccessToken(response.tokens().accessToken()).accountId()).isEqualTo(ACCOUNT_ID);
        verify(sessionTokenStore, never()).storeRefreshToken(any(), anyString(), any());
    }

    @Test
    void refreshRotatesTokenCloseToExpiry() {
        givenStoredToken(Duration.ofHours(6));

        AuthResponse response = authService.refresh(new RefreshRequest(refreshToken));

        String rotated = response.tokens().refreshToken();
        assertThat(rotated).isNotEqualTo(refreshToken);
        assertThat(response.tokens().refreshExpiresIn()).isEqualTo(REFRESH_TTL.toSeconds());
        verify(sessionTokenStore).storeRefreshToken(ACCOUNT_ID, rotated, REFRESH_TTL);
    }

    @Test
    void refreshWithSupersededTokenIsRejected() {
        when(sessionTokenStore.validateRefreshToken(ACCOUNT_ID, refreshToken)).thenReturn(RefreshTokenValidation.invalid());

        ResponseStatusException exception = assertThrows(
                ResponseStatusException.class,
                () -> authService.refresh(new RefreshRequest(refreshToken))
        );

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        verify(accountRepository, never()).findById(any());
    }

    private void givenStoredToken(Duration remaining) {
        Account account = mock(Account.class);
        when(account.getId()).thenReturn(ACCOUNT_ID);
        when(sessionTokenStore.validateRefreshToken(ACCOUNT_ID, refreshToken))
                .thenReturn(RefreshTokenValidation.valid(remaining));
        when(accountRepository.findById(eq(ACCOUNT_ID))).thenReturn(Optional.of(account));
    }
}
