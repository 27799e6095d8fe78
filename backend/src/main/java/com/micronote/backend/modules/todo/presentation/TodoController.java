package com.micronote.backend.modules.todo.presentation;

import java.util.UUID;

import com.micronote.backend.global.security.SecurityUtils;
import com.micronote.backend.global.web.ApiResponse;
import com.micronote.backend.modules.todo.application.TodoService;
import com.micronote.backend.modules.todo.presentation.dto.CreateTodoRequest;
import com.micronote.backend.modules.todo.presentation.dto.TodoDetailResponse;
import com.micronote.backend.modules.todo.presentation.dto.TodoListResponse;
import com.micronote.backend.modules.todo.presentation.dto.TodoResponse;
import com.micronote.backend.modules.todo.presentation.dto.TodoSummaryResponse;
import com.micronote.backend.modules.todo.presentation.dto.UpdateTodoRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Todos")
@RestController
@RequestMapping("/api/todos")
public class TodoController {

    private final TodoService todoService;

    public TodoController(TodoService todoService) {
        this.todoService = todoService;
    }

    @Operation(summary = "List todos", description = "Open todos first, then newest first. `stats` always covers every todo of the account.")
    @GetMapping
    public ResponseEntity<ApiResponse<TodoListResponse>> listTodos(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "50") int limit,
            @RequestParam(name = "completed", required = false) Boolean completed,
            @RequestParam(name = "priority", required = false) String priority,
            @RequestParam(name = "category", required = false) String category
    ) {
        UUID accountId = SecurityUtils.getCurrentAccountId();
        return ResponseEntity.ok(ApiResponse.ok(todoService.listTodos(accountId, page, limit, completed, priority, category)));
    }

    @GetMapping("/stats/summary")
    public ResponseEntity<ApiResponse<TodoSummaryResponse>> summary() {
        return ResponseEntity.ok(ApiResponse.ok(todoService.summarize(SecurityUtils.getCurrentAccountId())));
    }

    @GetMapping("/{todoId}")
    public ResponseEntity<ApiResponse<TodoDetailResponse>> getTodo(@PathVariable("todoId") UUID todoId) {
        TodoResponse todo = todoService.getTodo(SecurityUtils.getCurrentAccountId(), todoId);
        return ResponseEntity.ok(ApiResponse.ok(new TodoDetailResponse(todo)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<TodoDetailResponse>> createTodo(@Valid @RequestBody CreateTodoRequest request) {
        TodoResponse todo = todoService.createTodo(SecurityUtils.getCurrentAccountId(), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("Todo created successfully", new TodoDetailResponse(todo)));
    }

    @PutMapping("/{todoId}")
    public ResponseEntity<ApiResponse<TodoDetailResponse>> updateTodo(
            @PathVariable("todoId") UUID todoId,
            @Valid @RequestBody UpdateTodoRequest request
    ) {
        TodoResponse todo = todoService.updateTodo(SecurityUtils.getCurrentAccountId(), todoId, request);
        return ResponseEntity.ok(ApiResponse.ok("Todo updated successfully", new TodoDetailResponse(todo)));
    }

    @PatchMapping("/{todoId}/toggle")
    public ResponseEntity<ApiResponse<TodoDetailResponse>> toggleTodo(@PathVariable("todoId") UUID todoId) {
        TodoResponse todo = todoService.toggleTodo(SecurityUtils.getCurrentAccountId(), todoId);
        String message = "Todo marked as " + (todo.completed() ? "completed" : "pending");
        return ResponseEntity.ok(ApiResponse.ok(message, new TodoDetailResponse(todo)));
    }

    @DeleteMapping("/{todoId}")
    public ResponseEntity<ApiResponse<Void>> deleteTodo(@PathVariable("todoId") UUID todoId) {
        todoService.deleteTodo(SecurityUtils.getCurrentAccountId(), todoId);
        return ResponseEntity.ok(ApiResponse.ok("Todo deleted successfully"));
    }
}
