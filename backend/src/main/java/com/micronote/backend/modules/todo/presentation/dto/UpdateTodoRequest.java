package com.micronote.backend.modules.todo.presentation.dto;

import java.time.OffsetDateTime;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields are left unchanged and an empty {@code category} clears it.
 */
public record UpdateTodoRequest(
        @Size(min = 1, max = 200, message = "Todo text must be less than 200 characters")
        @Pattern(regexp = "(?s).*\\S.*", message = "Todo text must not be blank")
        String text,
        @Pattern(regexp = "low|medium|high", message = "Priority must be low, medium, or high")
        String priority,
        @Size(max = 30, message = "Category must be less than 30 characters")
        String category,
        OffsetDateTime dueDate,
        Boolean completed
) {
}
