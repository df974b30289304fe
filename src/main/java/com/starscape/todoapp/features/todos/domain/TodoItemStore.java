package com.starscape.todoapp.features.todos.domain;

import com.starscape.todoapp.common.domain.Outcome;

import java.util.List;
import java.util.Optional;

/**
 * Item storage where every operation is scoped to one owner. An item owned by someone
 * else is reported exactly like an item that does not exist.
 */
public interface TodoItemStore {

    String NOT_FOUND = "Todo not found";

    /**
     * Creates a PENDING item. INVALID when title or description break {@link TodoItemRules}.
     */
    Outcome<TodoItem> create(long ownerId, String title, String description);

    /**
     * The owner's items, oldest first. Empty when the owner has none.
     */
    List<TodoItem> list(long ownerId);

    Optional<TodoItem> get(long ownerId, long itemId);

    /**
     * NOT_FOUND when the item is absent or not owned; INVALID when a given field breaks
     * {@link TodoItemRules}. Absent patch fields keep their current value.
     */
    Outcome<TodoItem> update(long ownerId, long itemId, TodoItemPatch patch);

    /**
     * Idempotent; NOT_FOUND under the same masking rule as {@link #get(long, long)}.
     */
    Outcome<TodoItem> markComplete(long ownerId, long itemId);

    /**
     * @return true if an owned item was removed, false if there was nothing to remove
     */
    boolean delete(long ownerId, long itemId);
}
