package com.starscape.todoapp.features.todos.api.dto;

import com.starscape.todoapp.features.todos.domain.TodoItem;
import com.starscape.todoapp.features.todos.domain.TodoStatus;

import java.time.Instant;

public record TodoItemResponse(
    long id,
    String title,
    String description,
    TodoStatus status,
    Instant createdAt,
    long ownerId
) {
    public static TodoItemResponse from(TodoItem item) {
        return new TodoItemResponse(
            item.getId(),
            item.getTitle(),
            item.getDescription(),
            item.getStatus(),
            item.getCreatedAt(),
            item.getOwnerId()
        );
    }
}
