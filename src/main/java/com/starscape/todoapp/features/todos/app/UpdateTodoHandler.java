package com.starscape.todoapp.features.todos.app;

import com.starscape.todoapp.common.domain.Outcome;
import com.starscape.todoapp.features.todos.api.dto.TodoItemResponse;
import com.starscape.todoapp.features.todos.domain.TodoItemPatch;
import com.starscape.todoapp.features.todos.domain.TodoItemStore;
import org.springframework.stereotype.Service;

/**
 * Handler for editing title and/or description of an owned todo.
 */
@Service
public class UpdateTodoHandler {

    private final TodoItemStore store;

    public UpdateTodoHandler(TodoItemStore store) {
        this.store = store;
    }

    public Outcome<TodoItemResponse> handle(long ownerId, long itemId, TodoItemPatch patch) {
        return store.update(ownerId, itemId, patch).map(TodoItemResponse::from);
    }
}
