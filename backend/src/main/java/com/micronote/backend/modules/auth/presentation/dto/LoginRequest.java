package com.micronote.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param username username or email address
 */
public record LoginRequest(
        @NotBlank(message = "Username or email is required") String username,
        @NotBlank(message = "Password is required") String password
) {
}
