package com.micronote.backend.modules.todo.presentation.dto;

import java.util.List;

import com.micronote.backend.global.web.PaginationResponse;

public record TodoListResponse(List<TodoResponse> todos, TodoStatsResponse stats, PaginationResponse pagination) {
}
