package com.starscape.todoapp.features.auth.api.dto;

public record LoginResponse(
    String accessToken,
    String tokenType,
    long expiresIn
) {
    /**
     * @param expiresInSeconds token lifetime in seconds
     */
    public static LoginResponse bearer(String token, long expiresInSeconds) {
        return new LoginResponse(token, "bearer", expiresInSeconds);
    }
}
