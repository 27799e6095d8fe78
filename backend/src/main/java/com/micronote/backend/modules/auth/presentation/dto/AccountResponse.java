package com.micronote.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.micronote.backend.modules.auth.domain.Account;

public record AccountResponse(
        UUID id,
        String name,
        String email,
        String username,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AccountResponse from(Account account) {
        return new AccountResponse(
                account.getId(),
                account.getName(),
                account.getEmail(),
                account.getUsername(),
                account.getCreatedAt(),
                account.getUpdatedAt()
        );
    }
}
