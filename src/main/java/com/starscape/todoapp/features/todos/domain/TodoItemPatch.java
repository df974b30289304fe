package com.starscape.todoapp.features.todos.domain;

/**
 * Partial update of an item. A null field means "leave unchanged".
 */
public record TodoItemPatch(String title, String description) {

    public static TodoItemPatch of(String title, String description) {
        return new TodoItemPatch(title, description);
    }

    public boolean isEmpty() {
        return title == null && description == null;
    }
}
