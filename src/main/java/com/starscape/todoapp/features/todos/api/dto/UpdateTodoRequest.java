package com.starscape.todoapp.features.todos.api.dto;

/**
 * Partial update; omitted fields stay as they are.
 */
public record UpdateTodoRequest(
    String title,
    String description
) {}
