package com.micronote.backend.modules.account.presentation.dto;

import java.time.OffsetDateTime;

import com.micronote.backend.modules.auth.presentation.dto.AccountResponse;

public record AccountStatsResponse(
        AccountResponse user,
        long accountAgeDays,
        OffsetDateTime joinedAt,
        long noteCount,
        long todoCount
) {
}
