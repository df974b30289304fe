package com.starscape.todoapp.features.todos.infra;

import com.starscape.todoapp.common.domain.Outcome;
import com.starscape.todoapp.features.todos.domain.TodoItem;
import com.starscape.todoapp.features.todos.domain.TodoItemPatch;
import com.starscape.todoapp.features.todos.domain.TodoItemRules;
import com.starscape.todoapp.features.todos.domain.TodoItemStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed {@link TodoItemStore}. Ownership is part of every query, so rows
 * owned by someone else are never loaded.
 */
@Repository
@ConditionalOnProperty(name = "app.storage.backend", havingValue = "jpa", matchIfMissing = true)
public class JpaTodoItemStore implements TodoItemStore {

    private final SpringDataTodoItemRepository repository;
    private final Clock clock;

    public JpaTodoItemStore(SpringDataTodoItemRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Outcome<TodoItem> create(long ownerId, String title, String description) {
        Optional<String> problem = TodoItemRules.checkNew(title, description);
        if (problem.isPresent()) {
            return Outcome.invalid(problem.get());
        }
        TodoItem item = new TodoItem(ownerId, TodoItemRules.normalizeTitle(title), description, clock.instant());
        return Outcome.ok(repository.save(item));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TodoItem> list(long ownerId) {
        return repository.findByOwnerIdOrderByCreatedAtAscIdAsc(ownerId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TodoItem> get(long ownerId, long itemId) {
        return repository.findByIdAndOwnerId(itemId, ownerId);
    }

    @Override
    @Transactional
    public Outcome<TodoItem> update(long ownerId, long itemId, TodoItemPatch patch) {
        Optional<TodoItem> found = repository.findByIdAndOwnerId(itemId, ownerId);
        if (found.isEmpty()) {
            return Outcome.notFound(NOT_FOUND);
        }
        Optional<String> problem = TodoItemRules.checkPatch(patch);
        if (problem.isPresent()) {
            return Outcome.invalid(problem.get());
        }
        TodoItem item = found.get();
        item.apply(patch);
        return Outcome.ok(repository.save(item));
    }

    @Override
    @Transactional
    public Outcome<TodoItem> markComplete(long ownerId, long itemId) {
        Optional<TodoItem> found = repository.findByIdAndOwnerId(itemId, ownerId);
        if (found.isEmpty()) {
            return Outcome.notFound(NOT_FOUND);
        }
        TodoItem item = found.get();
        if (item.isComplete()) {
            return Outcome.ok(item);
        }
        item.markComplete();
        return Outcome.ok(repository.save(item));
    }

    @Override
    @Transactional
    public boolean delete(long ownerId, long itemId) {
        return repository.deleteOwned(itemId, ownerId) > 0;
    }
}
