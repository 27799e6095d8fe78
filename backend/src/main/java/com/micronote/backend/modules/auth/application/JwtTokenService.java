package com.micronote.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.micronote.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.micronote.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies the HS256 access/refresh token pair. Both tokens carry a random {@code jti}
 * so two tokens minted for the same account in the same second still differ, and a {@code typ}
 * claim so a refresh token is never accepted as an access token or the other way round.
 */
@Service
public class JwtTokenService {

    static final String TYPE_CLAIM = "typ";
    static final String ACCESS_TYPE = "access";
    static final String REFRESH_TYPE = "refresh";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public TokenPairResponse issueTokenPair(UUID accountId) {
        Instant now = clock.instant();
        SecretKey key = tokenProvider.getSecretKey();

        String accessToken = buildToken(accountId, ACCESS_TYPE, now, now.plusMillis(accessTokenTtlMillis), key);
        String refreshToken = buildToken(accountId, REFRESH_TYPE, now, now.plusMillis(refreshTokenTtlMillis), key);

        return new TokenPairResponse(
                accessToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                refreshToken,
                refreshTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    /**
     * New access token paired with an existing, still valid refresh token.
     */
    public TokenPairResponse reissueAccessToken(UUID accountId, String refreshToken, Duration refreshRemaining) {
        Instant now = clock.instant();
        String accessToken = buildToken(accountId, ACCESS_TYPE, now, now.plusMillis(accessTokenTtlMillis),
                tokenProvider.getSecretKey());

        return new TokenPairResponse(
                accessToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                refreshToken,
                refreshRemaining.toSeconds(),
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        return parse(token, ACCESS_TYPE);
    }

    public ParsedToken parseRefreshToken(String token) {
        return parse(token, REFRESH_TYPE);
    }

    public Duration getRefreshTokenTtl() {
        return Duration.ofMillis(refreshTokenTtlMillis);
    }

    private String buildToken(UUID accountId, String type, Instant issuedAt, Instant expiresAt, SecretKey key) {
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(accountId.toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .claim(TYPE_CLAIM, type)
                .signWith(key, SIG.HS256)
                .compact();
    }

    private ParsedToken parse(String token, String expectedType) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty", null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (!expectedType.equals(claims.get(TYPE_CLAIM, String.class))) {
                throw new InvalidTokenException("Unexpected token type", null);
            }
            UUID accountId = UUID.fromString(claims.getSubject());
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(accountId, claims.getId(), issuedAt, expiresAt);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid " + expectedType + " token", e);
        }
    }

    public record ParsedToken(UUID accountId, String tokenId, Instant issuedAt, Instant expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
