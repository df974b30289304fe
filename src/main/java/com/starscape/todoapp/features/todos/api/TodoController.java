package com.starscape.todoapp.features.todos.api;

import com.starscape.todoapp.common.domain.Outcome;
import com.starscape.todoapp.common.exception.OutcomeResponses;
import com.starscape.todoapp.common.security.UserPrincipal;
import com.starscape.todoapp.features.todos.api.dto.CreateTodoRequest;
import com.starscape.todoapp.features.todos.api.dto.TodoItemResponse;
import com.starscape.todoapp.features.todos.api.dto.UpdateTodoRequest;
import com.starscape.todoapp.features.todos.app.CompleteTodoHandler;
import com.starscape.todoapp.features.todos.app.CreateTodoHandler;
import com.starscape.todoapp.features.todos.app.DeleteTodoHandler;
import com.starscape.todoapp.features.todos.app.GetTodoHandler;
import com.starscape.todoapp.features.todos.app.ListTodosHandler;
import com.starscape.todoapp.features.todos.app.UpdateTodoHandler;
import com.starscape.todoapp.features.todos.domain.TodoItemPatch;
import com.starscape.todoapp.features.todos.domain.TodoItemStore;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.function.Function;

/**
 * Todo CRUD for the authenticated account.
 *
 * Also served under /api/{userId}/tasks for task-style clients. The userId path segment
 * is never read: the owner always comes from the verified principal. Item ids are
 * numeric and "todos" is never taken as a userId, so /api/todos/tasks names nothing.
 */
@RestController
@RequestMapping({"/api/todos", "/api/{userId:(?!todos$).+}/tasks"})
public class TodoController {

    private final CreateTodoHandler createTodoHandler;
    private final ListTodosHandler listTodosHandler;
    private final GetTodoHandler getTodoHandler;
    private final UpdateTodoHandler updateTodoHandler;
    private final CompleteTodoHandler completeTodoHandler;
    private final DeleteTodoHandler deleteTodoHandler;

    public TodoController(
            CreateTodoHandler createTodoHandler,
            ListTodosHandler listTodosHandler,
            GetTodoHandler getTodoHandler,
            UpdateTodoHandler updateTodoHandler,
            CompleteTodoHandler completeTodoHandler,
            DeleteTodoHandler deleteTodoHandler) {
        this.createTodoHandler = createTodoHandler;
        this.listTodosHandler = listTodosHandler;
        this.getTodoHandler = getTodoHandler;
        this.updateTodoHandler = updateTodoHandler;
        this.completeTodoHandler = completeTodoHandler;
        this.deleteTodoHandler = deleteTodoHandler;
    }

    /**
     * POST /api/todos
     */
    @PostMapping
    public ResponseEntity<?> create(
            @Valid @RequestBody CreateTodoRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {

        return OutcomeResponses.created(
                createTodoHandler.handle(principal.getAccountId(), request.title(), request.descriptionOrEmpty()),
                Function.identity());
    }

    /**
     * GET /api/todos
     */
    @GetMapping
    public ResponseEntity<List<TodoItemResponse>> list(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.ok(listTodosHandler.handle(principal.getAccountId()));
    }

    /**
     * GET /api/todos/{todoId}
     */
    @GetMapping("/{todoId:\\d+}")
    public ResponseEntity<?> get(
            @PathVariable long todoId,
            @AuthenticationPrincipal UserPrincipal principal) {

        return OutcomeResponses.ok(
                Outcome.fromOptional(getTodoHandler.handle(principal.getAccountId(), todoId), TodoItemStore.NOT_FOUND),
                Function.identity());
    }

    /**
     * PUT /api/todos/{todoId}
     */
    @PutMapping("/{todoId:\\d+}")
    public ResponseEntity<?> update(
            @PathVariable long todoId,
            @RequestBody UpdateTodoRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {

        TodoItemPatch patch = TodoItemPatch.of(request.title(), request.description());
        return OutcomeResponses.ok(
                updateTodoHandler.handle(principal.getAccountId(), todoId, patch),
                Function.identity());
    }

    /**
     * PATCH /api/todos/{todoId}/complete
     */
    @PatchMapping("/{todoId:\\d+}/complete")
    public ResponseEntity<?> complete(
            @PathVariable long todoId,
            @AuthenticationPrincipal UserPrincipal principal) {

        return OutcomeResponses.ok(
                completeTodoHandler.handle(principal.getAccountId(), todoId),
                Function.identity());
    }

    /**
     * DELETE /api/todos/{todoId}
     */
    @DeleteMapping("/{todoId:\\d+}")
    public ResponseEntity<?> delete(
            @PathVariable long todoId,
            @AuthenticationPrincipal UserPrincipal principal) {

        if (deleteTodoHandler.handle(principal.getAccountId(), todoId)) {
            return ResponseEntity.noContent().build();
        }
        return OutcomeResponses.notFound(TodoItemStore.NOT_FOUND);
    }
}
