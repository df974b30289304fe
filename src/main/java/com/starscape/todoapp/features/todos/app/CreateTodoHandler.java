package com.starscape.todoapp.features.todos.app;

import com.starscape.todoapp.common.domain.Outcome;
import com.starscape.todoapp.features.todos.api.dto.TodoItemResponse;
import com.starscape.todoapp.features.todos.domain.TodoItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handler for creating a todo owned by the authenticated account.
 */
@Service
public class CreateTodoHandler {

    private static final Logger log = LoggerFactory.getLogger(CreateTodoHandler.class);

    private final TodoItemStore store;

    public CreateTodoHandler(TodoItemStore store) {
        this.store = store;
    }

    public Outcome<TodoItemResponse> handle(long ownerId, String title, String description) {
        Outcome<TodoItemResponse> outcome = store.create(ownerId, title, description)
                .map(TodoItemResponse::from);
        if (outcome.isOk()) {
            log.info("Created todo id={} ownerId={}", outcome.value().id(), ownerId);
        }
        return outcome;
    }
}
