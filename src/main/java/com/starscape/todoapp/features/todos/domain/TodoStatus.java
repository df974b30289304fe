package com.starscape.todoapp.features.todos.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TodoStatus {
    PENDING("pending"),
    COMPLETE("complete");

    private final String wireValue;

    TodoStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
