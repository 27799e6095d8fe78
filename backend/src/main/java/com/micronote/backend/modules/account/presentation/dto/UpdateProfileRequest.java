package com.micronote.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial profile update; {@code null} fields are left unchanged.
 */
public record UpdateProfileRequest(
        @Size(min = 1, max = 50, message = "Name must be between 1 and 50 characters")
        @Pattern(regexp = "(?s).*\\S.*", message = "Name must not be blank")
        String name,
        @Email(message = "Please provide a valid email")
        @Size(max = 100, message = "Email must be less than 100 characters")
        String email,
        @Pattern(regexp = "^[A-Za-z0-9_]{3,20}$",
                message = "Username must be 3-20 characters and contain only letters, numbers, and underscores")
        String username
) {
}
