package com.micronote.backend.modules.todo.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.micronote.backend.modules.todo.domain.Todo;
import com.micronote.backend.modules.todo.domain.TodoPriority;

public record TodoResponse(
        UUID id,
        String text,
        boolean completed,
        OffsetDateTime completedAt,
        TodoPriority priority,
        OffsetDateTime dueDate,
        String category,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static TodoResponse from(Todo todo) {
        return new TodoResponse(
                todo.getId(),
                todo.getText(),
                todo.isCompleted(),
                todo.getCompletedAt(),
                todo.getPriority(),
                todo.getDueDate(),
                todo.getCategory(),
                todo.getCreatedAt(),
                todo.getUpdatedAt()
        );
    }
}
