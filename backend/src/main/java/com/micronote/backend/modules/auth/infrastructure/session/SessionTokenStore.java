package com.micronote.backend.modules.auth.infrastructure.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.micronote.backend.global.redis.KeyValueStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Server side session state kept in the key-value store:
 * <ul>
 *     <li>{@code refresh:{accountId}} holds the hash of the single valid refresh token of an account.
 *     Storing a new one supersedes the previous token.</li>
 *     <li>{@code blacklist:{sha256(accessToken)}} marks a revoked access token until it would have
 *     expired anyway.</li>
 * </ul>
 * Store failures surface as {@link TokenStoreUnavailableException}; callers decide whether to fail
 * open or closed.
 */
@Component
public class SessionTokenStore {

    private static final Logger log = LoggerFactory.getLogger(SessionTokenStore.class);

    static final String REFRESH_PREFIX = "refresh:";
    static final String BLACKLIST_PREFIX = "blacklist:";
    private static final String REVOKED_MARKER = "revoked";

    private final KeyValueStore store;
    private final TokenHasher tokenHasher;
    private final Clock clock;

    public SessionTokenStore(KeyValueStore store, TokenHasher tokenHasher, Clock clock) {
        this.store = store;
        this.tokenHasher = tokenHasher;
        this.clock = clock;
    }

    public void storeRefreshToken(UUID accountId, String refreshToken, Duration ttl) {
        try {
            store.set(refreshKey(accountId), tokenHasher.sha256Hex(refreshToken), ttl);
        } catch (DataAccessException e) {
            throw unavailable("store refresh token", e);
        }
    }

    public RefreshTokenValidation validateRefreshToken(UUID accountId, String refreshToken) {
        String key = refreshKey(accountId);
        Optional<String> stored;
        try {
            stored = store.get(key);
        } catch (DataAccessException e) {
            throw unavailable("validate refresh token", e);
        }
        if (stored.isEmpty() || !constantTimeEquals(stored.get(), tokenHasher.sha256Hex(refreshToken))) {
            return RefreshTokenValidation.invalid();
        }
        try {
            return RefreshTokenValidation.valid(store.ttl(key).orElse(Duration.ZERO));
        } catch (DataAccessException e) {
            throw unavailable("read refresh token ttl", e);
        }
    }

    public void revokeRefreshToken(UUID accountId) {
        try {
            store.delete(refreshKey(accountId));
        } catch (DataAccessException e) {
            throw unavailable("revoke refresh token", e);
        }
    }

    /**
     * Marks an access token as revoked for the rest of its lifetime. The entry is never extended
     * past {@code expiresAt}; a token that has already expired is not recorded.
     */
    public void blacklistAccessToken(String accessToken, Instant expiresAt) {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        if (remaining.isZero() || remaining.isNegative()) {
            log.debug("Skipping blacklist for already expired token");
            return;
        }
        try {
            store.set(blacklistKey(accessToken), REVOKED_MARKER, remaining);
        } catch (DataAccessException e) {
            throw unavailable("blacklist access token", e);
        }
    }

    public boolean isBlacklisted(String accessToken) {
        try {
            return store.exists(blacklistKey(accessToken));
        } catch (DataAccessException e) {
            throw unavailable("check access token blacklist", e);
        }
    }

    String refreshKey(UUID accountId) {
        return REFRESH_PREFIX + accountId;
    }

    String blacklistKey(String accessToken) {
        return BLACKLIST_PREFIX + tokenHasher.sha256Hex(accessToken);
    }

    private static boolean constantTimeEquals(String left, String right) {
        return MessageDigest.isEqual(left.getBytes(StandardCharsets.UTF_8), right.getBytes(StandardCharsets.UTF_8));
    }

    private static TokenStoreUnavailableException unavailable(String operation, DataAccessException cause) {
        return new TokenStoreUnavailableException("Session store failed to " + operation, cause);
    }
}
