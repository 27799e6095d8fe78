package com.micronote.backend.modules.auth.presentation.dto;

public record AuthResponse(AccountResponse user, TokenPairResponse tokens) {
}
