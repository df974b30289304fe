package com.starscape.todoapp.features.auth.api.dto;

import jakarta.validation.constraints.NotNull;

public record RegisterRequest(
    @NotNull(message = "Email is required")
    String email,

    @NotNull(message = "Password is required")
    String password
) {
    @Override
    public String toString() {
        return "RegisterRequest[email=" + email + "]";
    }
}
