package com.micronote.backend.modules.todo.presentation.dto;

public record TodoStatsResponse(long total, long completed, long pending) {
}
