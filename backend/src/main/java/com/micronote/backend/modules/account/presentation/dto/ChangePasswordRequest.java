package com.micronote.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @NotBlank(message = "Current password is required") String currentPassword,
        @NotBlank(message = "New password is required")
        @Size(min = 6, max = 128, message = "New password must be at least 6 characters long")
        String newPassword
) {
}
