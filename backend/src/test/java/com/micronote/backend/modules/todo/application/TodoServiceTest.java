package com.micronote.backend.modules.todo.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.micronote.backend.global.error.ApiException;
import com.micronote.backend.modules.auth.domain.Account;
import com.micronote.backend.modules.auth.infrastructure.persistence.AccountRepository;
import com.micronote.backend.modules.todo.domain.Todo;
import com.micronote.backend.modules.todo.domain.TodoPriority;
import com.micronote.backend.modules.todo.infrastructure.persistence.TodoRepository;
import com.micronote.backend.modules.todo.presentation.dto.CreateTodoRequest;
import com.micronote.backend.modules.todo.presentation.dto.TodoResponse;
import com.micronote.backend.modules.todo.presentation.dto.TodoSummaryResponse;
import com.micronote.backend.modules.todo.presentation.dto.UpdateTodoRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class TodoServiceTest {

    private static final UUID OWNER = UUID.randomUUID();
    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");

    @Mock
    TodoRepository todoRepository;

    @Mock
    AccountRepository accountRepository;

    TodoService todoService;

    @BeforeEach
    void setUp() {
        todoService = new TodoService(todoRepository, accountRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createDefaultsToMediumAndDropsEmptyCategory() {
        when(accountRepository.getReferenceById(OWNER)).thenReturn(new Account());
        when(todoRepository.saveAndFlush(any(Todo.class))).thenAnswer(invocation -> invocation.getArgument(0));

        TodoResponse response = todoService.createTodo(OWNER, new CreateTodoRequest("  buy milk ", null, "  ", null));

        assertThat(response.text()).isEqualTo("buy milk");
        assertThat(response.priority()).isEqualTo(TodoPriority.MEDIUM);
        assertThat(response.category()).isNull();
        assertThat(response.completed()).isFalse();
        assertThat(response.completedAt()).isNull();
    }

    @Test
    void completingThroughUpdateStampsCompletedAt() {
        Todo todo = existingTodo();
        when(todoRepository.findByIdAndOwnerId(any(), eq(OWNER))).thenReturn(Optional.of(todo));
        when(todoRepository.saveAndFlush(todo)).thenReturn(todo);

        TodoResponse response = todoService.updateTodo(
                OWNER, UUID.randomUUID(), new UpdateTodoRequest(null, "high", "", null, true));

        assertThat(response.completed()).isTrue();
        assertThat(response.completedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(response.priority()).isEqualTo(TodoPriority.HIGH);
        assertThat(response.category()).isNull();
        assertThat(response.text()).isEqualTo("water plants");
    }

    @Test
    void toggleTwiceReturnsToPending() {
        Todo todo = existingTodo();
        when(todoRepository.findByIdAndOwnerId(any(), eq(OWNER))).thenReturn(Optional.of(todo));
        when(todoRepository.saveAndFlush(todo)).thenReturn(todo);

        TodoResponse done = todoService.toggleTodo(OWNER, UUID.randomUUID());
        TodoResponse pending = todoService.toggleTodo(OWNER, UUID.randomUUID());

        assertThat(done.completed()).isTrue();
        assertThat(done.completedAt()).isNotNull();
        assertThat(pending.completed()).isFalse();
        assertThat(pending.completedAt()).isNull();
    }

    @Test
    void unknownPriorityFilterIsRejected() {
        ApiException exception = assertThrows(
                ApiException.class,
                () -> todoService.listTodos(OWNER, 1, 10, null, "urgent", null)
        );

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(exception.getCode()).isEqualTo("INVALID_PRIORITY");
        verifyNoInteractions(todoRepository);
    }

    @Test
    void missingTodoIsNotFound() {
        when(todoRepository.findByIdAndOwnerId(any(), eq(OWNER))).thenReturn(Optional.empty());

        ApiException exception = assertThrows(ApiException.class, () -> todoService.toggleTodo(OWNER, UUID.randomUUID()));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(exception.getCode()).isEqualTo("TODO_NOT_FOUND");
    }

    @Test
    void summaryCombinesTotalsAndGroups() {
        when(todoRepository.countByOwnerId(OWNER)).thenReturn(5L);
        when(todoRepository.countByOwnerIdAndCompleted(OWNER, true)).thenReturn(2L);
        when(todoRepository.countByPriority(OWNER)).thenReturn(List.of(priorityRow(TodoPriority.HIGH, 3, 1)));
        when(todoRepository.countByCategory(OWNER)).thenReturn(List.of(categoryRow("home", 2, 1)));

        TodoSummaryResponse summary = todoService.summarize(OWNER);

        assertThat(summary.general().total()).isEqualTo(5);
        assertThat(summary.general().completed()).isEqualTo(2);
        assertThat(summary.general().pending()).isEqualTo(3);
        assertThat(summary.byPriority()).singleElement()
                .satisfies(stat -> {
                    assertThat(stat.priority()).isEqualTo(TodoPriority.HIGH);
                    assertThat(stat.count()).isEqualTo(3);
                    assertThat(stat.completed()).isEqualTo(1);
                });
        assertThat(summary.byCategory()).singleElement()
                .satisfies(stat -> assertThat(stat.category()).isEqualTo("home"));
    }

    private static Todo existingTodo() {
        Todo todo = new Todo();
        todo.setText("water plants");
        todo.setCategory("home");
        return todo;
    }

    private static TodoRepository.PriorityCount priorityRow(TodoPriority priority, long total, long completed) {
        return new TodoRepository.PriorityCount() {
            @Override
            public TodoPriority getPriority() {
                return priority;
            }

            @Override
            public long getTotal() {
                return total;
            }

            @Override
            public long getCompletedCount() {
                return completed;
            }
        };
    }

    private static TodoRepository.CategoryCount categoryRow(String category, long total, long completed) {
        return new TodoRepository.CategoryCount() {
            @Override
            public String getCategory() {
                return category;
            }

            @Override
            public long getTotal() {
                return total;
            }

            @Override
            public long getCompletedCount() {
                return completed;
            }
        };
    }
}
