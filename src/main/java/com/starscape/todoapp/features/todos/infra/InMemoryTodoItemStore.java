package com.starscape.todoapp.features.todos.infra;

import com.starscape.todoapp.common.domain.Outcome;
import com.starscape.todoapp.features.todos.domain.TodoItem;
import com.starscape.todoapp.features.todos.domain.TodoItemPatch;
import com.starscape.todoapp.features.todos.domain.TodoItemRules;
import com.starscape.todoapp.features.todos.domain.TodoItemStore;
import com.starscape.todoapp.features.todos.domain.TodoStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link TodoItemStore}. Stored items are never handed out directly;
 * callers get copies, and every write goes through a per-key atomic map operation.
 */
@Repository
@ConditionalOnProperty(name = "app.storage.backend", havingValue = "memory")
public class InMemoryTodoItemStore implements TodoItemStore {

    private static final Comparator<TodoItem> CREATION_ORDER =
            Comparator.comparing(TodoItem::getCreatedAt).thenComparing(TodoItem::getId);

    private final Map<Long, TodoItem> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryTodoItemStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Outcome<TodoItem> create(long ownerId, String title, String description) {
        Optional<String> problem = TodoItemRules.checkNew(title, description);
        if (problem.isPresent()) {
            return Outcome.invalid(problem.get());
        }
        long id = sequence.incrementAndGet();
        TodoItem item = new TodoItem(id, ownerId, TodoItemRules.normalizeTitle(title), description,
                TodoStatus.PENDING, clock.instant());
        storage.put(id, item);
        return Outcome.ok(item.copy());
    }

    @Override
    public List<TodoItem> list(long ownerId) {
        return storage.values().stream()
                .filter(item -> item.isOwnedBy(ownerId))
                .map(TodoItem::copy)
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public Optional<TodoItem> get(long ownerId, long itemId) {
        return Optional.ofNullable(storage.get(itemId))
                .filter(item -> item.isOwnedBy(ownerId))
                .map(TodoItem::copy);
    }

    @Override
    public Outcome<TodoItem> update(long ownerId, long itemId, TodoItemPatch patch) {
        if (get(ownerId, itemId).isEmpty()) {
            return Outcome.notFound(NOT_FOUND);
        }
        Optional<String> problem = TodoItemRules.checkPatch(patch);
        if (problem.isPresent()) {
            return Outcome.invalid(problem.get());
        }
        TodoItem updated = storage.computeIfPresent(itemId, (id, item) -> {
            if (!item.isOwnedBy(ownerId)) {
                return item;
            }
            TodoItem next = item.copy();
            next.apply(patch);
            return next;
        });
        return ownedCopy(updated, ownerId);
    }

    @Override
    public Outcome<TodoItem> markComplete(long ownerId, long itemId) {
        TodoItem updated = storage.computeIfPresent(itemId, (id, item) -> {
            if (!item.isOwnedBy(ownerId) || item.isComplete()) {
                return item;
            }
            TodoItem next = item.copy();
            next.markComplete();
            return next;
        });
        return ownedCopy(updated, ownerId);
    }

    @Override
    public boolean delete(long ownerId, long itemId) {
        TodoItem current = storage.get(itemId);
        return current != null && current.isOwnedBy(ownerId) && storage.remove(itemId, current);
    }

    private static Outcome<TodoItem> ownedCopy(TodoItem item, long ownerId) {
        if (item == null || !item.isOwnedBy(ownerId)) {
            return Outcome.notFound(NOT_FOUND);
        }
        return Outcome.ok(item.copy());
    }
}
