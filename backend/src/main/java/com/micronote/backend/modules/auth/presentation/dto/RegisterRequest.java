package com.micronote.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "Name is required")
        @Size(max = 50, message = "Name must be less than 50 characters")
        String name,
        @NotBlank(message = "Email is required")
        @Email(message = "Please provide a valid email")
        @Size(max = 100, message = "Email must be less than 100 characters")
        String email,
        @NotBlank(message = "Username is required")
        @Pattern(regexp = "^[A-Za-z0-9_]{3,20}$",
                message = "Username must be 3-20 characters and contain only letters, numbers, and underscores")
        String username,
        @NotBlank(message = "Password is required")
        @Size(min = 6, max = 128, message = "Password must be at least 6 characters long")
        String password
) {
}
