package com.micronote.backend.modules.todo.presentation.dto;

import java.util.List;

import com.micronote.backend.modules.todo.domain.TodoPriority;

public record TodoSummaryResponse(
        TodoStatsResponse general,
        List<PriorityStat> byPriority,
        List<CategoryStat> byCategory
) {

    public record PriorityStat(TodoPriority priority, long count, long completed) {
    }

    public record CategoryStat(String category, long count, long completed) {
    }
}
