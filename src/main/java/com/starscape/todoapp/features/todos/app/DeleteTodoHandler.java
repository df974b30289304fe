package com.starscape.todoapp.features.todos.app;

import com.starscape.todoapp.features.todos.domain.TodoItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handler for hard-deleting an owned todo.
 */
@Service
public class DeleteTodoHandler {

    private static final Logger log = LoggerFactory.getLogger(DeleteTodoHandler.class);

    private final TodoItemStore store;

    public DeleteTodoHandler(TodoItemStore store) {
        this.store = store;
    }

    /**
     * @return false when nothing owned by the caller had that id
     */
    public boolean handle(long ownerId, long itemId) {
        boolean deleted = store.delete(ownerId, itemId);
        if (deleted) {
            log.info("Deleted todo id={} ownerId={}", itemId, ownerId);
        }
        return deleted;
    }
}
