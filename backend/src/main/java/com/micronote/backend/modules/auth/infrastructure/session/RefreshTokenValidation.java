package com.micronote.backend.modules.auth.infrastructure.session;

import java.time.Duration;

/**
 * Outcome of a refresh token check; {@code remainingTtl} is only set for a valid token.
 */
public record RefreshTokenValidation(boolean valid, Duration remainingTtl) {

    public static RefreshTokenValidation invalid() {
        return new RefreshTokenValidation(false, null);
    }

    public static RefreshTokenValidation valid(Duration remainingTtl) {
        return new RefreshTokenValidation(true, remainingTtl);
    }
}
