package com.starscape.todoapp.features.todos.app;

import com.starscape.todoapp.features.todos.api.dto.TodoItemResponse;
import com.starscape.todoapp.features.todos.domain.TodoItemStore;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Handler for listing the authenticated account's todos, oldest first.
 */
@Service
public class ListTodosHandler {

    private final TodoItemStore store;

    public ListTodosHandler(TodoItemStore store) {
        this.store = store;
    }

    public List<TodoItemResponse> handle(long ownerId) {
        return store.list(ownerId).stream()
                .map(TodoItemResponse::from)
                .toList();
    }
}
