package com.micronote.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record DeleteAccountRequest(@NotBlank(message = "Password is required") String password) {
}
