package com.starscape.todoapp.features.auth.api.dto;

import jakarta.validation.constraints.NotNull;

public record LoginRequest(
    @NotNull(message = "Email is required")
    String email,

    @NotNull(message = "Password is required")
    String password
) {
    @Override
    public String toString() {
        return "LoginRequest[email=" + email + "]";
    }
}
