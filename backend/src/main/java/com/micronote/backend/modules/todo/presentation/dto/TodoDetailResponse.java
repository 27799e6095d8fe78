package com.micronote.backend.modules.todo.presentation.dto;

public record TodoDetailResponse(TodoResponse todo) {
}
