package com.starscape.todoapp.features.todos.app;

import com.starscape.todoapp.common.domain.Outcome;
import com.starscape.todoapp.features.todos.api.dto.TodoItemResponse;
import com.starscape.todoapp.features.todos.domain.TodoItemStore;
import org.springframework.stereotype.Service;

/**
 * Handler for marking a todo complete. Completing an already complete todo succeeds
 * and returns it unchanged.
 */
@Service
public class CompleteTodoHandler {

    private final TodoItemStore store;

    public CompleteTodoHandler(TodoItemStore store) {
        this.store = store;
    }

    public Outcome<TodoItemResponse> handle(long ownerId, long itemId) {
        return store.markComplete(ownerId, itemId).map(TodoItemResponse::from);
    }
}
