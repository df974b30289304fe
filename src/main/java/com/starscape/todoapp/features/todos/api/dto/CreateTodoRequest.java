package com.starscape.todoapp.features.todos.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Request body for creating a todo. Length and blankness rules are enforced by the
 * store so both backends report them identically. Any owner id a client adds to the
 * body is not bound.
 */
public record CreateTodoRequest(
    @NotNull(message = "Title is required")
    String title,

    String description
) {
    public String descriptionOrEmpty() {
        return description == null ? "" : description;
    }
}
