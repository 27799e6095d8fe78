package com.micronote.backend.modules.auth.presentation.dto;

public record AccountDetailResponse(AccountResponse user) {
}
