package com.micronote.backend.modules.todo.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateTodoRequest(
        @NotBlank(message = "Todo text is required")
        @Size(max = 200, message = "Todo text is required and must be less than 200 characters")
        String text,
        @Pattern(regexp = "low|medium|high", message = "Priority must be low, medium, or high")
        String priority,
        @Size(max = 30, message = "Category must be less than 30 characters")
        String category,
        OffsetDateTime dueDate
) {
}
