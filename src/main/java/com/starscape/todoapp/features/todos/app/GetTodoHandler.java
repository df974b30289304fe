package com.starscape.todoapp.features.todos.app;

import com.starscape.todoapp.features.todos.api.dto.TodoItemResponse;
import com.starscape.todoapp.features.todos.domain.TodoItemStore;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class GetTodoHandler {

    private final TodoItemStore store;

    public GetTodoHandler(TodoItemStore store) {
        this.store = store;
    }

    public Optional<TodoItemResponse> handle(long ownerId, long itemId) {
        return store.get(ownerId, itemId).map(TodoItemResponse::from);
    }
}
