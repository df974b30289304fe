package com.starscape.todoapp.features.todos.domain;

import com.starscape.todoapp.common.domain.Entity;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * A todo item. The owner is fixed at creation; only title, description and status change.
 */
@jakarta.persistence.Entity
@Table(name = "todo_items", indexes = {
    @Index(name = "idx_todo_items_owner_id", columnList = "owner_id")
})
public class TodoItem extends Entity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(nullable = false, length = TodoItemRules.MAX_TITLE_LENGTH)
    private String title;

    @Column(nullable = false, length = TodoItemRules.MAX_DESCRIPTION_LENGTH)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TodoStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected TodoItem() {
        // JPA constructor
    }

    /**
     * Creates a pending item. Callers validate fields through {@link TodoItemRules} first.
     */
    public TodoItem(long ownerId, String title, String description, Instant createdAt) {
        this(null, ownerId, title, description, TodoStatus.PENDING, createdAt);
    }

    public TodoItem(Long id, long ownerId, String title, String description, TodoStatus status, Instant createdAt) {
        this.id = id;
        this.ownerId = ownerId;
        this.title = Objects.requireNonNull(title);
        this.description = description == null ? "" : description;
        this.status = Objects.requireNonNull(status);
        this.createdAt = Objects.requireNonNull(createdAt);
    }

    @Override
    public Long getId() {
        return id;
    }

    public long getOwnerId() {
        return ownerId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public TodoStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isOwnedBy(long accountId) {
        return ownerId != null && ownerId == accountId;
    }

    public boolean isComplete() {
        return status == TodoStatus.COMPLETE;
    }

    /**
     * Applies the non-null fields of an already validated patch.
     */
    public void apply(TodoItemPatch patch) {
        if (patch.title() != null) {
            this.title = TodoItemRules.normalizeTitle(patch.title());
        }
        if (patch.description() != null) {
            this.description = patch.description();
        }
    }

    /**
     * Idempotent: completing a complete item changes nothing.
     */
    public void markComplete() {
        this.status = TodoStatus.COMPLETE;
    }

    public TodoItem copy() {
        return new TodoItem(id, ownerId, title, description, status, createdAt);
    }

    @Override
    public String toString() {
        return "TodoItem[id=" + id + ", ownerId=" + ownerId + ", status=" + status + "]";
    }
}
