package com.micronote.backend.modules.todo.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.micronote.backend.global.error.ApiException;
import com.micronote.backend.global.web.PaginationResponse;
import com.micronote.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.micronote.backend.modules.todo.domain.Todo;
import com.micronote.backend.modules.todo.domain.TodoPriority;
import com.micronote.backend.modules.todo.infrastructure.persistence.TodoRepository;
import com.micronote.backend.modules.todo.presentation.dto.CreateTodoRequest;
import com.micronote.backend.modules.todo.presentation.dto.TodoListResponse;
import com.micronote.backend.modules.todo.presentation.dto.TodoResponse;
import com.micronote.backend.modules.todo.presentation.dto.TodoStatsResponse;
import com.micronote.backend.modules.todo.presentation.dto.TodoSummaryResponse;
import com.micronote.backend.modules.todo.presentation.dto.TodoSummaryResponse.CategoryStat;
import com.micronote.backend.modules.todo.presentation.dto.TodoSummaryResponse.PriorityStat;
import com.micronote.backend.modules.todo.presentation.dto.UpdateTodoRequest;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class TodoService {

    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 100;

    private final TodoRepository todoRepository;
    private final AccountRepository accountRepository;
    private final Clock clock;

    public TodoService(TodoRepository todoRepository, AccountRepository accountRepository, Clock clock) {
        this.todoRepository = todoRepository;
        this.accountRepository = accountRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public TodoListResponse listTodos(UUID accountId, int page, int limit, Boolean completed, String priority, String category) {
        int safePage = Math.max(page, 1);
        int safeLimit = limit < 1 ? DEFAULT_PAGE_SIZE : Math.min(limit, MAX_PAGE_SIZE);
        TodoPriority priorityFilter = StringUtils.hasText(priority) ? parsePriority(priority) : null;
        String categoryFilter = StringUtils.hasText(category) ? category.trim() : null;

        Page<Todo> result = todoRepository.findByFilters(
                accountId,
                completed,
                priorityFilter,
                categoryFilter,
                PageRequest.of(safePage - 1, safeLimit)
        );
        List<TodoResponse> todos = result.getContent().stream()
                .map(TodoResponse::from)
                .toList();
        return new TodoListResponse(todos, loadStats(accountId), PaginationResponse.from(result));
    }

    @Transactional(readOnly = true)
    public TodoSummaryResponse summarize(UUID accountId) {
        List<PriorityStat> byPriority = todoRepository.countByPriority(accountId).stream()
                .map(row -> new PriorityStat(row.getPriority(), row.getTotal(), row.getCompletedCount()))
                .toList();
        List<CategoryStat> byCategory = todoRepository.countByCategory(accountId).stream()
                .map(row -> new CategoryStat(row.getCategory(), row.getTotal(), row.getCompletedCount()))
                .toList();
        return new TodoSummaryResponse(loadStats(accountId), byPriority, byCategory);
    }

    @Transactional(readOnly = true)
    public TodoResponse getTodo(UUID accountId, UUID todoId) {
        return TodoResponse.from(loadOwnedTodo(accountId, todoId));
    }

    public TodoResponse createTodo(UUID accountId, CreateTodoRequest request) {
        Todo todo = new Todo();
        todo.setOwner(accountRepository.getReferenceById(accountId));
        todo.setText(request.text().trim());
        todo.setPriority(request.priority() != null ? parsePriority(request.priority()) : TodoPriority.MEDIUM);
        todo.setCategory(normalizeCategory(request.category()));
        todo.setDueDate(request.dueDate());
        return TodoResponse.from(todoRepository.saveAndFlush(todo));
    }

    public TodoResponse updateTodo(UUID accountId, UUID todoId, UpdateTodoRequest request) {
        Todo todo = loadOwnedTodo(accountId, todoId);

        if (request.text() != null) {
            todo.setText(request.text().trim());
        }
        if (request.priority() != null) {
            todo.setPriority(parsePriority(request.priority()));
        }
        if (request.category() != null) {
            todo.setCategory(normalizeCategory(request.category()));
        }
        if (request.dueDate() != null) {
            todo.setDueDate(request.dueDate());
        }
        if (request.completed() != null) {
            todo.markCompleted(request.completed(), OffsetDateTime.now(clock));
        }
        return TodoResponse.from(todoRepository.saveAndFlush(todo));
    }

    public TodoResponse toggleTodo(UUID accountId, UUID todoId) {
        Todo todo = loadOwnedTodo(accountId, todoId);
        todo.markCompleted(!todo.isCompleted(), OffsetDateTime.now(clock));
        return TodoResponse.from(todoRepository.saveAndFlush(todo));
    }

    public void deleteTodo(UUID accountId, UUID todoId) {
        todoRepository.delete(loadOwnedTodo(accountId, todoId));
    }

    private TodoStatsResponse loadStats(UUID accountId) {
        long total = todoRepository.countByOwnerId(accountId);
        long completed = todoRepository.countByOwnerIdAndCompleted(accountId, true);
        return new TodoStatsResponse(total, completed, total - completed);
    }

    private Todo loadOwnedTodo(UUID accountId, UUID todoId) {
        return todoRepository.findByIdAndOwnerId(todoId, accountId)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "TODO_NOT_FOUND", "Todo not found"));
    }

    private static TodoPriority parsePriority(String raw) {
        try {
            return TodoPriority.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "INVALID_PRIORITY", "Priority must be low, medium, or high");
        }
    }

    private static String normalizeCategory(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
