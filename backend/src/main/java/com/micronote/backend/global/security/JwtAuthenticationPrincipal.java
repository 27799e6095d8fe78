package com.micronote.backend.global.security;

import java.time.Instant;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID accountId, String tokenId, Instant expiresAt) {
}
